package cs1302.analyzer.localize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cs1302.analyzer.trace.SourceLocation;
import cs1302.analyzer.trace.TraceException;
import cs1302.analyzer.trace.TraceTarget;
import cs1302.analyzer.trace.TraceValue;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

/** Tests for {@link FaultLocalizer} with a scripted executor. */
public class FaultLocalizerTest {

  private static final TraceTarget TARGET = new TraceTarget("Max", "max");
  private static final double EPSILON = 1e-9;

  private static SourceLocation at(int line) {
    return new SourceLocation("Max.java", line);
  }

  /**
   * Outcomes keyed by the first argument. Line 4 only runs for inputs 2 and 4, and those return
   * the wrong value.
   */
  private static final Map<Integer, ExecutionOutcome> OUTCOMES =
      Map.of(
          1, ExecutionOutcome.returned(TraceValue.of(1), List.of(at(2), at(3))),
          2, ExecutionOutcome.returned(TraceValue.of(9), List.of(at(2), at(4))),
          3, ExecutionOutcome.returned(TraceValue.of(3), List.of(at(2), at(3))),
          4, ExecutionOutcome.raised("java.lang.ArithmeticException: / by zero",
              List.of(at(2), at(4))));

  private static ExecutionOutcome scripted(TraceTarget target, List<Object> arguments) {
    return OUTCOMES.get((Integer) arguments.get(0));
  }

  private static FaultLocalizer localizer(TestExecutor executor, int parallelism) {
    FaultLocalizer localizer = new FaultLocalizer(executor, parallelism);
    localizer.addTest("one", List.of(1), 1);
    localizer.addTest("two", List.of(2), 2);
    localizer.addTest("three", List.of(3), 3);
    localizer.addTest("four", List.of(4), 4);
    return localizer;
  }

  /** Ensure that tests pass or fail by comparing their outputs. */
  @Test
  public void testOutcomes() {
    FaultLocalizer localizer = localizer(FaultLocalizerTest::scripted, 1);
    localizer.run(TARGET);

    List<TestCase> tests = localizer.testCases();
    assertTrue(tests.get(0).passed());
    assertFalse(tests.get(1).passed());
    assertEquals(TraceValue.of(9), tests.get(1).actualOutput());
    assertFalse(tests.get(3).passed());
    assertEquals(
        new TraceValue.Opaque("Exception: java.lang.ArithmeticException: / by zero"),
        tests.get(3).actualOutput());
    assertEquals(new FaultLocalizer.Summary(4, 2, 2), localizer.summary());
  }

  /** Ensure that statements only failing tests cover rank first. */
  @Test
  public void testRanking() {
    FaultLocalizer localizer = localizer(FaultLocalizerTest::scripted, 1);
    localizer.run(TARGET);

    List<SuspiciousnessScore> scores = localizer.computeSuspiciousness();

    assertEquals(List.of(at(4), at(2), at(3)), scores.stream().map(s -> s.statement()).toList());
    SuspiciousnessScore top = scores.get(0);
    assertEquals(1.0, top.tarantula(), EPSILON);
    assertEquals(1.0, top.ochiai(), EPSILON);
    assertEquals(2, top.failedCount());
    assertEquals(0, top.passedCount());
    // covered by every test
    assertEquals(0.5, scores.get(1).tarantula(), EPSILON);
    assertEquals(2 / Math.sqrt(2 * 4), scores.get(1).ochiai(), EPSILON);
    assertEquals(0.0, scores.get(2).tarantula(), EPSILON);
    assertEquals(0.0, scores.get(2).ochiai(), EPSILON);
    assertEquals(at(4), localizer.mostSuspiciousStatement().get().statement());
  }

  /** Ensure that every score is within [0, 1] and scores are ordered. */
  @Test
  public void testScoresBounded() {
    FaultLocalizer localizer = localizer(FaultLocalizerTest::scripted, 1);
    localizer.run(TARGET);

    List<SuspiciousnessScore> scores = localizer.computeSuspiciousness();

    for (int i = 0; i < scores.size(); i++) {
      SuspiciousnessScore score = scores.get(i);
      assertTrue(score.tarantula() >= 0 && score.tarantula() <= 1);
      assertTrue(score.ochiai() >= 0 && score.ochiai() <= 1);
      if (i > 0) {
        assertTrue(scores.get(i - 1).tarantula() >= score.tarantula());
      }
    }
  }

  /** Ensure that parallel runs produce the same results in registration order. */
  @Test
  public void testParallelRun() {
    FaultLocalizer sequential = localizer(FaultLocalizerTest::scripted, 1);
    sequential.run(TARGET);
    FaultLocalizer parallel = localizer(FaultLocalizerTest::scripted, 3);
    parallel.run(TARGET);

    assertEquals(sequential.computeSuspiciousness(), parallel.computeSuspiciousness());
    assertEquals("two", parallel.testCases().get(1).name());
    assertFalse(parallel.testCases().get(1).passed());
  }

  /** Ensure that a test that cannot be executed fails without affecting the others. */
  @Test
  public void testExecutorFailureIsolated() {
    TestExecutor flaky =
        (target, arguments) -> {
          if (arguments.get(0).equals(2)) {
            throw new TraceException("VM could not start");
          }
          return scripted(target, arguments);
        };
    FaultLocalizer localizer = localizer(flaky, 1);
    localizer.run(TARGET);

    TestCase broken = localizer.testCases().get(1);
    assertFalse(broken.passed());
    assertTrue(broken.coveredStatements().isEmpty());
    assertTrue(broken.actualOutput().text().contains("VM could not start"));
    assertTrue(localizer.testCases().get(2).passed());
  }

  /** Ensure that nothing is localized when no test fails. */
  @Test
  public void testNoFailures() {
    FaultLocalizer localizer = new FaultLocalizer(FaultLocalizerTest::scripted);
    localizer.addTest("one", List.of(1), 1);
    localizer.addTest("three", List.of(3), 3.0);
    localizer.run(TARGET);

    assertTrue(localizer.computeSuspiciousness().isEmpty());
    assertTrue(localizer.mostSuspiciousStatement().isEmpty());
  }

  /** Ensure that a test is executed only once, even if the localizer runs again. */
  @Test
  public void testExecutedOnce() {
    AtomicInteger calls = new AtomicInteger();
    FaultLocalizer localizer =
        new FaultLocalizer(
            (target, arguments) -> {
              calls.incrementAndGet();
              return scripted(target, arguments);
            });
    localizer.addTest("one", List.of(1), 1);
    localizer.run(TARGET);
    localizer.run(TARGET);

    assertEquals(1, calls.get());
    assertThrows(
        IllegalStateException.class,
        () -> localizer.testCases().get(0).complete(TraceValue.of(1), true, List.of()));
  }

  /** Ensure that the formulas match their definitions, including zero denominators. */
  @Test
  public void testFormulas() {
    assertEquals(0.5, FaultLocalizer.tarantula(1, 1, 2, 2), EPSILON);
    assertEquals(1.0, FaultLocalizer.tarantula(1, 1, 0, 0), EPSILON);
    assertEquals(0.0, FaultLocalizer.tarantula(0, 0, 3, 3), EPSILON);
    assertEquals(0.0, FaultLocalizer.tarantula(0, 2, 0, 2), EPSILON);
    assertEquals(1.0, FaultLocalizer.ochiai(1, 1, 0), EPSILON);
    assertEquals(0.0, FaultLocalizer.ochiai(0, 1, 3), EPSILON);
    assertEquals(1 / Math.sqrt(2), FaultLocalizer.ochiai(1, 2, 0), EPSILON);
  }

  /** Ensure that parallelism must be positive. */
  @Test
  public void testParallelismValidated() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new FaultLocalizer(FaultLocalizerTest::scripted, 0));
  }
}
