package cs1302.analyzer.serialize;

import cs1302.analyzer.index.ExecutionPoint;
import cs1302.analyzer.index.IndexStatistics;
import cs1302.analyzer.index.IndexedTrace;
import cs1302.analyzer.localize.FaultLocalizer;
import cs1302.analyzer.localize.SuspiciousnessScore;
import cs1302.analyzer.localize.TestCase;
import cs1302.analyzer.slice.SliceResult;
import cs1302.analyzer.trace.Access;
import cs1302.analyzer.trace.SourceLocation;
import cs1302.analyzer.trace.Trace;
import cs1302.analyzer.trace.TraceEvent;
import cs1302.analyzer.trace.TraceValue;
import java.util.List;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Serializes analysis results into JSON reports.
 *
 * @param includeLocals True if every event should carry its full local variable snapshot. Without
 *     snapshots, events only list their accesses.
 */
public record ReportSerializer(boolean includeLocals) {

  /**
   * Serialize a recorded trace.
   *
   * @param target The traced method, as {@code Class.method}.
   * @param result The method's return value.
   * @param stdout What the method printed.
   * @param trace The trace.
   * @return The serialized trace.
   */
  public JSONObject serialize(String target, TraceValue result, String stdout, Trace trace) {
    JSONArray events = new JSONArray();
    trace.events().forEach(event -> events.put(serializeEvent(event)));
    return new JSONObject()
        .put("target", target)
        .put("result", serializeValue(result))
        .put("stdout", stdout)
        .put("executedLines", serializeLines(trace.executedStatements()))
        .put("events", events);
  }

  /**
   * Serialize an indexed trace: each event together with its execution point.
   *
   * @param indexed The indexed trace.
   * @return The serialized trace and its index statistics.
   */
  public JSONObject serialize(IndexedTrace indexed) {
    JSONArray events = new JSONArray();
    for (IndexedTrace.IndexedEvent entry : indexed.entries()) {
      events.put(serializeEvent(entry.event()).put("point", serializePoint(entry.point())));
    }
    IndexStatistics statistics = indexed.statistics();
    return new JSONObject()
        .put("events", events)
        .put(
            "statistics",
            new JSONObject()
                .put("totalPoints", statistics.totalPoints())
                .put("uniqueContexts", statistics.uniqueContexts())
                .put("uniqueStatements", statistics.uniqueStatements())
                .put("maxInstance", statistics.maxInstance())
                .put("contextDepth", statistics.contextDepth()));
  }

  /**
   * Serialize a slice.
   *
   * @param slice The slice.
   * @return The serialized slice. Dependencies are lists of {@code {line, file, ...}} objects so
   *     that statements from different source units stay distinct.
   */
  public JSONObject serialize(SliceResult slice) {
    JSONArray dataDependencies = new JSONArray();
    slice
        .dataDependencies()
        .forEach(
            (statement, variables) ->
                dataDependencies.put(
                    serializeLocation(statement).put("variables", new JSONArray(variables))));

    JSONArray controlDependencies = new JSONArray();
    slice
        .controlDependencies()
        .forEach(
            (statement, controllers) ->
                controlDependencies.put(
                    serializeLocation(statement)
                        .put("controlledBy", serializeLines(List.copyOf(controllers)))));

    return new JSONObject()
        .put("variable", slice.targetVariable())
        .put("line", slice.targetStatement().line())
        .put("file", slice.targetStatement().sourceUnit())
        .put("found", slice.found())
        .put("relevantLines", serializeLines(List.copyOf(slice.relevantStatements())))
        .put("dataDependencies", dataDependencies)
        .put("controlDependencies", controlDependencies);
  }

  /**
   * Serialize the outcome of a fault localization run.
   *
   * @param localizer A localizer whose tests have been run.
   * @return Test results and suspiciousness scores, most suspicious first.
   */
  public JSONObject serialize(FaultLocalizer localizer) {
    JSONArray tests = new JSONArray();
    for (TestCase testCase : localizer.testCases()) {
      JSONArray inputs = new JSONArray();
      testCase.inputArguments().forEach(arg -> inputs.put(serializeValue(TraceValue.of(arg))));
      JSONObject test =
          new JSONObject()
              .put("name", testCase.name())
              .put("inputs", inputs)
              .put("expected", serializeValue(testCase.expectedOutput()))
              .put("executed", testCase.executed());
      if (testCase.executed()) {
        test.put("actual", serializeValue(testCase.actualOutput()))
            .put("passed", testCase.passed())
            .put("coveredLines", serializeLines(List.copyOf(testCase.coveredStatements())));
      }
      tests.put(test);
    } // for

    JSONArray scores = new JSONArray();
    for (SuspiciousnessScore score : localizer.computeSuspiciousness()) {
      scores.put(
          serializeLocation(score.statement())
              .put("tarantula", score.tarantula())
              .put("ochiai", score.ochiai())
              .put("failed", score.failedCount())
              .put("passed", score.passedCount()));
    }

    FaultLocalizer.Summary summary = localizer.summary();
    return new JSONObject()
        .put(
            "summary",
            new JSONObject()
                .put("total", summary.total())
                .put("passed", summary.passed())
                .put("failed", summary.failed()))
        .put("tests", tests)
        .put("scores", scores);
  }

  private JSONObject serializeEvent(TraceEvent event) {
    JSONArray accesses = new JSONArray();
    for (Access access : event.accesses()) {
      accesses.put(
          new JSONObject()
              .put("mode", access.isWrite() ? "write" : "read")
              .put("name", access.name()));
    }
    JSONObject serialized =
        serializeLocation(event.location())
            .put("kind", event.kind().label())
            .put("function", event.function())
            .put("accesses", accesses);
    if (includeLocals) {
      JSONObject locals = new JSONObject();
      event.locals().forEach((name, value) -> locals.put(name, serializeValue(value)));
      serialized.put("locals", locals);
    }
    return serialized;
  }

  private static JSONObject serializePoint(ExecutionPoint point) {
    return new JSONObject()
        .put("context", new JSONArray(point.context()))
        .put("line", point.statement().line())
        .put("instance", point.instance())
        .put("label", point.toString());
  }

  private static JSONObject serializeLocation(SourceLocation location) {
    return new JSONObject().put("line", location.line()).put("file", location.sourceUnit());
  }

  private static JSONArray serializeLines(List<SourceLocation> statements) {
    return new JSONArray(statements.stream().map(SourceLocation::line).toList());
  }

  /**
   * Convert a captured value into a JSON value. Numbers and booleans stay numbers and booleans;
   * everything else, including non-finite floating point values, becomes its text.
   */
  static Object serializeValue(TraceValue value) {
    if (value instanceof TraceValue.SignedInteger si) {
      return si.value();
    } else if (value instanceof TraceValue.UnsignedInteger ui) {
      return ui.value();
    } else if (value instanceof TraceValue.FloatingPoint fp && Double.isFinite(fp.value())) {
      return fp.value();
    } else if (value instanceof TraceValue.Bool b) {
      return b.value();
    }
    return value.text();
  }
}
