package cs1302.analyzer.localize;

import cs1302.analyzer.trace.SourceLocation;
import cs1302.analyzer.trace.TraceValue;
import java.util.List;
import java.util.Optional;

/**
 * What one test execution produced.
 *
 * @param output The returned value, or a description of the raised exception.
 * @param covered The statements the execution reached.
 * @param failure A description of the exception the target raised, if it raised one.
 */
public record ExecutionOutcome(
    TraceValue output, List<SourceLocation> covered, Optional<String> failure) {

  public ExecutionOutcome {
    covered = List.copyOf(covered);
  }

  public static ExecutionOutcome returned(TraceValue output, List<SourceLocation> covered) {
    return new ExecutionOutcome(output, covered, Optional.empty());
  }

  /**
   * An execution that raised instead of returning.
   *
   * @param failure Description of the exception, usually {@code type: message}.
   * @param covered The statements reached before the exception.
   * @return The outcome; its output is the failure text.
   */
  public static ExecutionOutcome raised(String failure, List<SourceLocation> covered) {
    return new ExecutionOutcome(
        new TraceValue.Opaque("Exception: " + failure), covered, Optional.of(failure));
  }

  public boolean raised() {
    return failure.isPresent();
  }
}
