package cs1302.analyzer.localize;

import cs1302.analyzer.trace.RecorderConfig;
import cs1302.analyzer.trace.TargetRaisedException;
import cs1302.analyzer.trace.TraceException;
import cs1302.analyzer.trace.TraceRecorder;
import cs1302.analyzer.trace.TraceTarget;
import cs1302.analyzer.trace.TraceValue;
import java.util.List;

/** Executes every test under its own {@link TraceRecorder} and reports the executed statements. */
public class RecordingTestExecutor implements TestExecutor {

  private final RecorderConfig config;

  public RecordingTestExecutor() {
    this(RecorderConfig.defaults());
  }

  public RecordingTestExecutor(RecorderConfig config) {
    this.config = config;
  }

  @Override
  public ExecutionOutcome execute(TraceTarget target, List<Object> arguments)
      throws TraceException {
    TraceRecorder recorder = new TraceRecorder(config);
    try {
      TraceValue output = recorder.run(target, arguments.toArray());
      return ExecutionOutcome.returned(output, recorder.executedStatements());
    } catch (TargetRaisedException e) {
      // the partial trace still tells which statements ran before the exception
      return ExecutionOutcome.raised(e.getMessage(), recorder.executedStatements());
    }
  }
}
