package cs1302.analyzer.localize;

import cs1302.analyzer.trace.SourceLocation;
import cs1302.analyzer.trace.TraceValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** A registered test input and, once executed, its result and coverage. */
public final class TestCase {

  private final String name;
  private final List<Object> inputArguments;
  private final TraceValue expectedOutput;

  private boolean executed;
  private TraceValue actualOutput;
  private boolean passed;
  private Set<SourceLocation> coveredStatements = Set.of();

  TestCase(String name, List<Object> inputArguments, TraceValue expectedOutput) {
    this.name = name;
    this.inputArguments = Collections.unmodifiableList(new ArrayList<>(inputArguments));
    this.expectedOutput = expectedOutput;
  }

  /**
   * Record the result of executing this test. A test is executed exactly once.
   *
   * @throws IllegalStateException If the result was already recorded.
   */
  void complete(TraceValue actualOutput, boolean passed, List<SourceLocation> covered) {
    if (executed) {
      throw new IllegalStateException("Test case " + name + " was already executed");
    }
    this.executed = true;
    this.actualOutput = actualOutput;
    this.passed = passed;
    this.coveredStatements = Collections.unmodifiableSet(new LinkedHashSet<>(covered));
  }

  public String name() {
    return name;
  }

  public List<Object> inputArguments() {
    return inputArguments;
  }

  public TraceValue expectedOutput() {
    return expectedOutput;
  }

  public boolean executed() {
    return executed;
  }

  /** The returned value, a description of the raised exception, or null before execution. */
  public TraceValue actualOutput() {
    return actualOutput;
  }

  public boolean passed() {
    return passed;
  }

  public Set<SourceLocation> coveredStatements() {
    return coveredStatements;
  }

  @Override
  public String toString() {
    String status = !executed ? "PENDING" : passed ? "PASS" : "FAIL";
    return String.format("%s | %s %s", status, name, inputArguments);
  }
}
