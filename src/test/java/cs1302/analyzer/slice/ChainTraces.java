package cs1302.analyzer.slice;

import cs1302.analyzer.trace.EventKind;
import cs1302.analyzer.trace.SourceLocation;
import cs1302.analyzer.trace.Trace;
import cs1302.analyzer.trace.TraceValue;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hand-built traces shaped like the recorder's output for
 *
 * <pre>
 * 1 static int chain(int x, int y) {
 * 2   int a = x + 1;
 * 3   int b = y * 2;
 * 4   int c = a + b;
 * 5   int d = c * 2;
 * 6   return d;
 * 7 }
 * </pre>
 *
 * <p>A write shows up in the snapshot of the event after the assignment.
 */
final class ChainTraces {

  static final String UNIT = "Chain.java";

  private ChainTraces() {}

  static SourceLocation at(int line) {
    return new SourceLocation(UNIT, line);
  }

  static Trace chain() {
    Map<String, TraceValue> locals = new LinkedHashMap<>();
    locals.put("x", TraceValue.of(5));
    locals.put("y", TraceValue.of(3));

    Trace.Builder builder = Trace.builder();
    builder.append(EventKind.CALL, at(2), "chain", locals);
    builder.append(EventKind.LINE, at(2), "chain", locals);
    locals.put("a", TraceValue.of(6));
    builder.append(EventKind.LINE, at(3), "chain", locals);
    locals.put("b", TraceValue.of(6));
    builder.append(EventKind.LINE, at(4), "chain", locals);
    locals.put("c", TraceValue.of(12));
    builder.append(EventKind.LINE, at(5), "chain", locals);
    locals.put("d", TraceValue.of(24));
    builder.append(EventKind.LINE, at(6), "chain", locals);
    builder.append(EventKind.RETURN, at(6), "chain", locals);
    return builder.build();
  }
}
