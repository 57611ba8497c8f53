package cs1302.analyzer.trace;

import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records the execution of a target method statement by statement.
 *
 * <p>A recorder owns at most one active {@link TraceSession} at a time and keeps the trace of the
 * last session it ended. Recorders are not thread-safe; give every concurrent trace its own
 * recorder.
 */
public class TraceRecorder {

  private static final Logger log = LoggerFactory.getLogger(TraceRecorder.class);

  private final RecorderConfig config;
  private TraceSession activeSession;
  private Trace trace = Trace.empty();

  public TraceRecorder() {
    this(RecorderConfig.defaults());
  }

  public TraceRecorder(RecorderConfig config) {
    this.config = config;
  }

  public RecorderConfig config() {
    return config;
  }

  /**
   * Install the step hook for a target and reset the trace storage.
   *
   * @param target The method to observe.
   * @param arguments Positional arguments for the method.
   * @return The session holding the hook. Run it with {@link TraceSession#await()} and release it
   *     with {@link #endSession()}.
   * @throws TraceException If the traced VM could not be launched.
   * @throws IllegalStateException If a session is already active.
   */
  public TraceSession beginSession(TraceTarget target, List<?> arguments) throws TraceException {
    if (activeSession != null) {
      throw new IllegalStateException(
          "A trace session for " + activeSession.target() + " is already active");
    }
    trace = Trace.empty();
    activeSession = TraceSession.launch(config, target, arguments);
    log.debug("Began trace session for {}", target);
    return activeSession;
  }

  /** Remove the step hook of the active session, if any, and keep what it recorded. */
  public void endSession() {
    if (activeSession == null) {
      return;
    }
    try {
      trace = activeSession.end();
    } finally {
      activeSession = null;
    }
  }

  public boolean isActive() {
    return activeSession != null;
  }

  /**
   * Run a target under observation. The hook is removed on every exit path, and the trace up to
   * the point of failure is kept when the target raises.
   *
   * @param target The method to run.
   * @param arguments Positional arguments for the method.
   * @return The method's return value.
   * @throws TargetRaisedException If the method raised an exception.
   * @throws TraceException If the method could not be traced.
   */
  public TraceValue run(TraceTarget target, Object... arguments)
      throws TraceException, TargetRaisedException {
    TraceSession session = beginSession(target, Arrays.asList(arguments));
    try {
      TraceValue result = session.await();
      log.debug("{} returned {}", target, result.text());
      return result;
    } finally {
      endSession();
    }
  }

  /** The trace of the last ended session; empty while a session is active. */
  public Trace trace() {
    return trace;
  }

  /**
   * The distinct statements executed during the last session.
   *
   * @return Executed statements in the order they were first reached.
   * @see Trace#executedStatements()
   */
  public List<SourceLocation> executedStatements() {
    return trace.executedStatements();
  }

  /**
   * The values a variable had during the last session.
   *
   * @param variableName The variable to look up.
   * @return Its observations in event order.
   * @see Trace#history(String)
   */
  public List<VariableObservation> history(String variableName) {
    return trace.history(variableName);
  }
}
