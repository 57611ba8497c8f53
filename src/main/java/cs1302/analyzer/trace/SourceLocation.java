package cs1302.analyzer.trace;

import java.util.Comparator;
import java.util.Objects;

/**
 * A statement identifier: the source unit a statement belongs to and its line number.
 *
 * @param sourceUnit The name of the source unit (usually the source file name as recorded in the
 *     class file).
 * @param line The 1-based line number of the statement.
 */
public record SourceLocation(String sourceUnit, int line) implements Comparable<SourceLocation> {

  private static final Comparator<SourceLocation> ORDER =
      Comparator.comparing(SourceLocation::sourceUnit).thenComparingInt(SourceLocation::line);

  public SourceLocation {
    Objects.requireNonNull(sourceUnit, "sourceUnit");
  }

  /**
   * Check whether this statement textually comes after another one.
   *
   * @param other The statement to compare against.
   * @return True if both statements are in the same source unit and this one is on a later line.
   */
  public boolean isAfter(SourceLocation other) {
    return sourceUnit.equals(other.sourceUnit) && line > other.line;
  }

  @Override
  public int compareTo(SourceLocation other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return sourceUnit + ":" + line;
  }
}
