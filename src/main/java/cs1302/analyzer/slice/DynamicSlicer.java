package cs1302.analyzer.slice;

import cs1302.analyzer.trace.EventKind;
import cs1302.analyzer.trace.SourceLocation;
import cs1302.analyzer.trace.Trace;
import cs1302.analyzer.trace.TraceEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes dynamic slices by walking a trace backwards from the query point.
 *
 * <p>Dependencies come from the access tags of each event, not from the source. A statement that
 * wrote a variable of interest is a data dependency, and everything it read becomes of interest. A
 * line whose reads touch a variable of interest is treated as controlling every relevant statement
 * after it. That control rule does not look at branch syntax and can link unrelated statements
 * that happen to share a variable name.
 */
public class DynamicSlicer {

  private static final Logger log = LoggerFactory.getLogger(DynamicSlicer.class);

  /** Names starting with this are synthetic and never become dependencies. */
  public static final String RESERVED_PREFIX = "$";

  /**
   * Compute the slice of a variable at a statement.
   *
   * @param trace The recorded trace.
   * @param targetStatement The statement of interest.
   * @param targetVariable The variable of interest.
   * @return The slice; {@link SliceResult#found()} is false if no event at the statement has the
   *     variable in scope.
   */
  public SliceResult computeSlice(
      Trace trace, SourceLocation targetStatement, String targetVariable) {
    return computeSlice(
        trace, targetStatement, targetVariable, location -> location.equals(targetStatement));
  }

  /**
   * Compute the slice of a variable at a line, in whatever source unit the line is executed.
   *
   * @param trace The recorded trace.
   * @param targetLine The line of interest.
   * @param targetVariable The variable of interest.
   * @return The slice; see {@link #computeSlice(Trace, SourceLocation, String)}.
   */
  public SliceResult computeSlice(Trace trace, int targetLine, String targetVariable) {
    int index = findTargetEvent(trace, location -> location.line() == targetLine, targetVariable);
    SourceLocation targetStatement =
        index < 0 ? new SourceLocation("", targetLine) : trace.get(index).location();
    return computeSlice(
        trace, targetStatement, targetVariable, location -> location.line() == targetLine);
  }

  private SliceResult computeSlice(
      Trace trace,
      SourceLocation targetStatement,
      String targetVariable,
      Predicate<SourceLocation> isTarget) {
    int targetIndex = findTargetEvent(trace, isTarget, targetVariable);
    if (targetIndex < 0) {
      log.warn(
          "Could not find target variable '{}' at line {}", targetVariable, targetStatement.line());
      return SliceResult.notFound(targetStatement, targetVariable);
    }

    Set<String> variablesOfInterest = new HashSet<>(Set.of(targetVariable));
    Set<SourceLocation> relevant = new TreeSet<>();
    SortedMap<SourceLocation, SortedSet<String>> dataDependencies = new TreeMap<>();
    SortedMap<SourceLocation, SortedSet<SourceLocation>> controlDependencies = new TreeMap<>();

    for (int i = targetIndex; i >= 0; i--) {
      TraceEvent event = trace.get(i);
      SourceLocation statement = event.location();

      for (String written : event.writes()) {
        if (!variablesOfInterest.contains(written)) {
          continue;
        }
        relevant.add(statement);
        Set<String> used = usedVariables(event, written);
        dataDependencies.computeIfAbsent(statement, s -> new TreeSet<>()).addAll(used);
        variablesOfInterest.addAll(used);
      } // for

      if (event.kind() == EventKind.LINE
          && !Collections.disjoint(event.reads(), variablesOfInterest)) {
        relevant.add(statement);
        for (SourceLocation later : new ArrayList<>(relevant)) {
          if (later.isAfter(statement)) {
            controlDependencies.computeIfAbsent(later, s -> new TreeSet<>()).add(statement);
          }
        }
      }
    } // for

    log.debug(
        "Slice of '{}' at {} has {} relevant statement(s)",
        targetVariable,
        targetStatement,
        relevant.size());
    return new SliceResult(
        targetStatement,
        targetVariable,
        true,
        new TreeSet<>(relevant),
        dataDependencies,
        controlDependencies);
  }

  /** Index of the last event at the target statement that has the variable in scope, or -1. */
  private static int findTargetEvent(
      Trace trace, Predicate<SourceLocation> isTarget, String targetVariable) {
    for (int i = trace.size() - 1; i >= 0; i--) {
      TraceEvent event = trace.get(i);
      if (isTarget.test(event.location()) && event.locals().containsKey(targetVariable)) {
        return i;
      }
    }
    return -1;
  }

  /** The variables in scope at the event that were read, other than the written one. */
  private static Set<String> usedVariables(TraceEvent event, String written) {
    Set<String> used = new LinkedHashSet<>();
    for (String name : event.locals().keySet()) {
      if (!name.equals(written) && !name.startsWith(RESERVED_PREFIX) && event.hasRead(name)) {
        used.add(name);
      }
    }
    return used;
  }
}
