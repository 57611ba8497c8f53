package cs1302.analyzer.localize;

import cs1302.analyzer.trace.SourceLocation;
import cs1302.analyzer.trace.TraceException;
import cs1302.analyzer.trace.TraceTarget;
import cs1302.analyzer.trace.TraceValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Spectrum-based fault localization. Tests are registered with their expected outputs, executed
 * once each, and every statement covered by some test is scored by how strongly its coverage
 * correlates with failing tests.
 */
public class FaultLocalizer {

  private static final Logger log = LoggerFactory.getLogger(FaultLocalizer.class);

  private final TestExecutor executor;
  private final int parallelism;
  private final List<TestCase> testCases = new ArrayList<>();

  /** A localizer that records every test with default recorder settings, one at a time. */
  public FaultLocalizer() {
    this(new RecordingTestExecutor());
  }

  public FaultLocalizer(TestExecutor executor) {
    this(executor, 1);
  }

  /**
   * Create a localizer.
   *
   * @param executor Executes single tests.
   * @param parallelism How many tests may execute at the same time.
   * @throws IllegalArgumentException If {@code parallelism} is less than 1.
   */
  public FaultLocalizer(TestExecutor executor, int parallelism) {
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be at least 1: " + parallelism);
    }
    this.executor = executor;
    this.parallelism = parallelism;
  }

  /**
   * Register a test case.
   *
   * @param name A name for reports.
   * @param inputArguments Positional arguments for the target.
   * @param expectedOutput The value the target should return.
   * @return The registered, not yet executed test case.
   */
  public TestCase addTest(String name, List<?> inputArguments, Object expectedOutput) {
    TestCase testCase =
        new TestCase(name, new ArrayList<>(inputArguments), TraceValue.of(expectedOutput));
    testCases.add(testCase);
    return testCase;
  }

  /**
   * Execute every registered test that has not been executed yet. One test's failure to execute
   * does not affect the others: it is recorded as a failing test.
   *
   * @param target The method under test.
   */
  public void run(TraceTarget target) {
    List<TestCase> pending = testCases.stream().filter(tc -> !tc.executed()).toList();
    log.info("Running {} test(s) against {}", pending.size(), target);
    if (parallelism == 1 || pending.size() < 2) {
      for (TestCase testCase : pending) {
        apply(testCase, execute(target, testCase));
      }
      return;
    }

    ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, pending.size()));
    try {
      List<Future<ExecutionOutcome>> futures = new ArrayList<>();
      for (TestCase testCase : pending) {
        futures.add(pool.submit(() -> execute(target, testCase)));
      }
      // results are applied in registration order regardless of completion order
      for (int i = 0; i < pending.size(); i++) {
        ExecutionOutcome outcome;
        try {
          outcome = futures.get(i).get();
        } catch (ExecutionException e) {
          outcome = ExecutionOutcome.raised(String.valueOf(e.getCause()), List.of());
        }
        apply(pending.get(i), outcome);
      } // for
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while running tests against " + target, e);
    } finally {
      pool.shutdownNow();
    }
  }

  private ExecutionOutcome execute(TraceTarget target, TestCase testCase) {
    try {
      return executor.execute(target, testCase.inputArguments());
    } catch (TraceException | RuntimeException e) {
      log.warn("Test {} could not be executed: {}", testCase.name(), e.getMessage());
      log.debug("Execution failure of test {}", testCase.name(), e);
      return ExecutionOutcome.raised(e.getClass().getName() + ": " + e.getMessage(), List.of());
    }
  }

  private void apply(TestCase testCase, ExecutionOutcome outcome) {
    boolean passed = !outcome.raised() && outcome.output().sameValue(testCase.expectedOutput());
    testCase.complete(outcome.output(), passed, outcome.covered());
    log.debug(
        "{} {}: expected {}, got {}",
        passed ? "PASS" : "FAIL",
        testCase.name(),
        testCase.expectedOutput().text(),
        outcome.output().text());
  }

  /**
   * Score every statement covered by an executed test.
   *
   * @return Scores ordered by descending Tarantula score; statements with equal scores stay in
   *     source order. Empty if no executed test failed.
   */
  public List<SuspiciousnessScore> computeSuspiciousness() {
    List<TestCase> executed = testCases.stream().filter(TestCase::executed).toList();
    int totalFailed = (int) executed.stream().filter(tc -> !tc.passed()).count();
    int totalPassed = executed.size() - totalFailed;
    if (totalFailed == 0) {
      log.info("No failing tests; nothing to localize");
      return List.of();
    }

    SortedSet<SourceLocation> statements = new TreeSet<>();
    executed.forEach(tc -> statements.addAll(tc.coveredStatements()));

    List<SuspiciousnessScore> scores = new ArrayList<>();
    for (SourceLocation statement : statements) {
      int failedCovering = 0;
      int passedCovering = 0;
      for (TestCase testCase : executed) {
        if (testCase.coveredStatements().contains(statement)) {
          if (testCase.passed()) {
            passedCovering++;
          } else {
            failedCovering++;
          }
        }
      } // for
      scores.add(
          new SuspiciousnessScore(
              statement,
              tarantula(failedCovering, totalFailed, passedCovering, totalPassed),
              ochiai(failedCovering, totalFailed, passedCovering),
              failedCovering,
              passedCovering));
    } // for

    // List.sort is stable
    scores.sort(Comparator.comparingDouble(SuspiciousnessScore::tarantula).reversed());
    return scores;
  }

  /**
   * The statement most likely to contain the fault.
   *
   * @return The top ranked statement, or empty if no test failed.
   */
  public Optional<SuspiciousnessScore> mostSuspiciousStatement() {
    List<SuspiciousnessScore> scores = computeSuspiciousness();
    return scores.isEmpty() ? Optional.empty() : Optional.of(scores.get(0));
  }

  public List<TestCase> testCases() {
    return Collections.unmodifiableList(testCases);
  }

  /** Counts of registered, passing and failing tests. */
  public Summary summary() {
    int passed = 0;
    int failed = 0;
    for (TestCase testCase : testCases) {
      if (!testCase.executed()) {
        continue;
      }
      if (testCase.passed()) {
        passed++;
      } else {
        failed++;
      }
    } // for
    return new Summary(testCases.size(), passed, failed);
  }

  /**
   * Tarantula: {@code (f/F) / (f/F + p/P)}, where a ratio with a zero denominator counts as 0.
   *
   * @param failedCovering Failing tests covering the statement.
   * @param totalFailed All failing tests.
   * @param passedCovering Passing tests covering the statement.
   * @param totalPassed All passing tests.
   * @return The score in [0, 1].
   */
  public static double tarantula(
      int failedCovering, int totalFailed, int passedCovering, int totalPassed) {
    if (totalFailed == 0) {
      return 0.0;
    }
    double failedRatio = (double) failedCovering / totalFailed;
    double passedRatio = totalPassed > 0 ? (double) passedCovering / totalPassed : 0.0;
    double denominator = failedRatio + passedRatio;
    return denominator == 0 ? 0.0 : failedRatio / denominator;
  }

  /**
   * Ochiai: {@code f / sqrt(F * (f + p))}.
   *
   * @param failedCovering Failing tests covering the statement.
   * @param totalFailed All failing tests.
   * @param passedCovering Passing tests covering the statement.
   * @return The score in [0, 1].
   */
  public static double ochiai(int failedCovering, int totalFailed, int passedCovering) {
    if (totalFailed == 0 || failedCovering == 0) {
      return 0.0;
    }
    double denominator = Math.sqrt((double) totalFailed * (failedCovering + passedCovering));
    return denominator == 0 ? 0.0 : failedCovering / denominator;
  }

  /**
   * Test counts.
   *
   * @param total Registered tests.
   * @param passed Executed tests whose output matched.
   * @param failed Executed tests that did not match or raised.
   */
  public record Summary(int total, int passed, int failed) {
    @Override
    public String toString() {
      return String.format("%d test(s): %d passed, %d failed", total, passed, failed);
    }
  }
}
