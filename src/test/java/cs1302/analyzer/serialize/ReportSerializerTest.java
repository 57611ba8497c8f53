package cs1302.analyzer.serialize;

import static org.junit.jupiter.api.Assertions.assertEquals;

import cs1302.analyzer.index.IndexedTrace;
import cs1302.analyzer.localize.ExecutionOutcome;
import cs1302.analyzer.localize.FaultLocalizer;
import cs1302.analyzer.slice.DynamicSlicer;
import cs1302.analyzer.slice.SliceResult;
import cs1302.analyzer.trace.EventKind;
import cs1302.analyzer.trace.SourceLocation;
import cs1302.analyzer.trace.Trace;
import cs1302.analyzer.trace.TraceTarget;
import cs1302.analyzer.trace.TraceValue;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.skyscreamer.jsonassert.JSONAssert;
import org.skyscreamer.jsonassert.JSONCompareMode;

/** Tests for {@link ReportSerializer}. */
public class ReportSerializerTest {

  private static SourceLocation at(int line) {
    return new SourceLocation("Demo.java", line);
  }

  /** x = 1 at line 1, y = x + 1 at line 2, return at line 3. */
  private static Trace demo() {
    Map<String, TraceValue> locals = new LinkedHashMap<>();
    Trace.Builder builder = Trace.builder();
    builder.append(EventKind.CALL, at(1), "demo", locals);
    builder.append(EventKind.LINE, at(1), "demo", locals);
    locals.put("x", TraceValue.of(1));
    builder.append(EventKind.LINE, at(2), "demo", locals);
    locals.put("y", TraceValue.of(2));
    builder.append(EventKind.LINE, at(3), "demo", locals);
    return builder.build();
  }

  /** Ensure that traces are serialized with their events and accesses. */
  @Test
  public void testSerializeTrace() {
    String output =
        new ReportSerializer(true)
            .serialize("Demo.demo", TraceValue.of(2), "out\n", demo())
            .toString();

    String expectedOutput =
        """
        {
          "target": "Demo.demo",
          "result": 2,
          "stdout": "out\\n",
          "executedLines": [1, 2, 3],
          "events": [
            {"kind": "call", "line": 1, "file": "Demo.java", "function": "demo",
             "accesses": [], "locals": {}},
            {"kind": "line", "line": 1, "accesses": []},
            {"kind": "line", "line": 2, "accesses": [{"mode": "write", "name": "x"}],
             "locals": {"x": 1}},
            {"kind": "line", "line": 3,
             "accesses": [{"mode": "write", "name": "y"}, {"mode": "read", "name": "x"}],
             "locals": {"x": 1, "y": 2}}
          ]
        }
        """;

    JSONAssert.assertEquals(expectedOutput, output, JSONCompareMode.STRICT_ORDER);
  }

  /** Ensure that indexed traces carry their points and statistics. */
  @Test
  public void testSerializeIndexedTrace() {
    String output = new ReportSerializer(false).serialize(IndexedTrace.index(demo())).toString();

    String expectedOutput =
        """
        {
          "events": [
            {"kind": "call", "point": {"context": ["demo"], "line": 1, "instance": 1,
                                       "label": "<demo, L1, #1>"}},
            {"kind": "line", "point": {"instance": 2}},
            {"kind": "line", "point": {"label": "<demo, L2, #1>"}},
            {"kind": "line", "point": {"label": "<demo, L3, #1>"}}
          ],
          "statistics": {"totalPoints": 4, "uniqueContexts": 1, "uniqueStatements": 3,
                         "maxInstance": 2, "contextDepth": 1}
        }
        """;

    JSONAssert.assertEquals(expectedOutput, output, JSONCompareMode.STRICT_ORDER);
  }

  /** Ensure that slices are serialized with both dependency kinds. */
  @Test
  public void testSerializeSlice() {
    SliceResult slice = new DynamicSlicer().computeSlice(demo(), at(3), "y");

    String output = new ReportSerializer(false).serialize(slice).toString();

    String expectedOutput =
        """
        {
          "variable": "y",
          "line": 3,
          "file": "Demo.java",
          "found": true,
          "relevantLines": [2, 3],
          "dataDependencies": [
            {"line": 2, "variables": []},
            {"line": 3, "file": "Demo.java", "variables": ["x"]}
          ],
          "controlDependencies": []
        }
        """;

    JSONAssert.assertEquals(expectedOutput, output, JSONCompareMode.STRICT_ORDER);
  }

  /** Ensure that not found slices are reported as such. */
  @Test
  public void testSerializeSliceNotFound() {
    String output =
        new ReportSerializer(false).serialize(SliceResult.notFound(at(9), "z")).toString();

    JSONAssert.assertEquals(
        "{\"found\": false, \"relevantLines\": [], \"dataDependencies\": []}",
        output,
        JSONCompareMode.LENIENT);
  }

  /** Ensure that localization reports list tests and scores. */
  @Test
  public void testSerializeLocalization() {
    FaultLocalizer localizer =
        new FaultLocalizer(
            (target, arguments) ->
                arguments.get(0).equals(0)
                    ? ExecutionOutcome.returned(TraceValue.of(0), List.of(at(1)))
                    : ExecutionOutcome.returned(TraceValue.of(-1), List.of(at(1), at(2))));
    localizer.addTest("zero", List.of(0), 0);
    localizer.addTest("one", List.of(1), 1);
    localizer.run(new TraceTarget("Demo", "demo"));

    String output = new ReportSerializer(false).serialize(localizer).toString();

    String expectedOutput =
        """
        {
          "summary": {"total": 2, "passed": 1, "failed": 1},
          "tests": [
            {"name": "zero", "inputs": [0], "expected": 0, "actual": 0, "passed": true,
             "coveredLines": [1]},
            {"name": "one", "inputs": [1], "expected": 1, "actual": -1, "passed": false,
             "coveredLines": [1, 2]}
          ],
          "scores": [
            {"line": 2, "tarantula": 1.0, "ochiai": 1.0, "failed": 1, "passed": 0},
            {"line": 1, "tarantula": 0.5, "failed": 1, "passed": 1}
          ]
        }
        """;

    JSONAssert.assertEquals(expectedOutput, output, JSONCompareMode.STRICT_ORDER);
  }

  /** Ensure that values keep their JSON types where JSON has one. */
  @Test
  public void testSerializeValue() {
    assertEquals(3L, ReportSerializer.serializeValue(TraceValue.of(3)));
    assertEquals(true, ReportSerializer.serializeValue(TraceValue.of(true)));
    assertEquals("NaN", ReportSerializer.serializeValue(TraceValue.of(Double.NaN)));
    assertEquals("[1, 2]", ReportSerializer.serializeValue(TraceValue.of(new int[] {1, 2})));
  }
}
