package cs1302.analyzer.slice;

import cs1302.analyzer.trace.SourceLocation;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The dynamic slice of one variable at one statement.
 *
 * @param targetStatement The statement the query named.
 * @param targetVariable The variable the query named.
 * @param found False if the variable was never observed at the statement; the slice is then empty.
 * @param relevantStatements Statements that may have influenced the variable.
 * @param dataDependencies For each relevant statement that wrote a variable of interest, the
 *     variables it read.
 * @param controlDependencies For each relevant statement, the earlier statements whose reads may
 *     have decided whether it ran.
 */
public record SliceResult(
    SourceLocation targetStatement,
    String targetVariable,
    boolean found,
    SortedSet<SourceLocation> relevantStatements,
    SortedMap<SourceLocation, SortedSet<String>> dataDependencies,
    SortedMap<SourceLocation, SortedSet<SourceLocation>> controlDependencies) {

  public SliceResult {
    relevantStatements = Collections.unmodifiableSortedSet(new TreeSet<>(relevantStatements));
    dataDependencies = freeze(dataDependencies);
    controlDependencies = freeze(controlDependencies);
  }

  /**
   * The result of a query whose variable was never observed at the statement.
   *
   * @param targetStatement The queried statement.
   * @param targetVariable The queried variable.
   * @return An empty result marked as not found.
   */
  public static SliceResult notFound(SourceLocation targetStatement, String targetVariable) {
    return new SliceResult(
        targetStatement, targetVariable, false, new TreeSet<>(), new TreeMap<>(), new TreeMap<>());
  }

  public boolean contains(SourceLocation statement) {
    return relevantStatements.contains(statement);
  }

  private static <K extends Comparable<K>, V extends Comparable<V>>
      SortedMap<K, SortedSet<V>> freeze(Map<K, ? extends Set<V>> source) {
    SortedMap<K, SortedSet<V>> copy = new TreeMap<>();
    source.forEach(
        (key, values) -> copy.put(key, Collections.unmodifiableSortedSet(new TreeSet<>(values))));
    return Collections.unmodifiableSortedMap(copy);
  }

  @Override
  public String toString() {
    return String.format(
        "SliceResult(target=%s@L%d, relevant_lines=%s)",
        targetVariable,
        targetStatement.line(),
        relevantStatements.stream().map(SourceLocation::line).toList());
  }
}
