package cs1302.analyzer.localize;

import cs1302.analyzer.trace.SourceLocation;

/**
 * How suspicious one statement is, given which tests covered it.
 *
 * @param statement The statement.
 * @param tarantula The Tarantula score in [0, 1].
 * @param ochiai The Ochiai score in [0, 1].
 * @param failedCount Number of failing tests that covered the statement.
 * @param passedCount Number of passing tests that covered the statement.
 */
public record SuspiciousnessScore(
    SourceLocation statement, double tarantula, double ochiai, int failedCount, int passedCount) {

  @Override
  public String toString() {
    return String.format(
        "Line %d: Tarantula=%.3f, Ochiai=%.3f (failed=%d, passed=%d)",
        statement.line(), tarantula, ochiai, failedCount, passedCount);
  }
}
