package cs1302.analyzer.localize;

import cs1302.analyzer.trace.TraceException;
import cs1302.analyzer.trace.TraceTarget;
import java.util.List;

/** Runs one test input against a target and reports its output and coverage. */
@FunctionalInterface
public interface TestExecutor {

  /**
   * Execute a target once. Implementations must not share recorder state between calls; the fault
   * localizer may call them from several threads.
   *
   * @param target The method under test.
   * @param arguments Its positional arguments.
   * @return The outcome. A target that raises is an outcome, not an exception.
   * @throws TraceException If the target could not be executed at all.
   */
  ExecutionOutcome execute(TraceTarget target, List<Object> arguments) throws TraceException;
}
