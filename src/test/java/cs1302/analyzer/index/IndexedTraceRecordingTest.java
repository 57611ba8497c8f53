package cs1302.analyzer.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cs1302.analyzer.samples.TargetPrograms;
import cs1302.analyzer.trace.TraceRecorder;
import cs1302.analyzer.trace.TraceTarget;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link IndexedTrace} on a recorded recursive trace. */
public class IndexedTraceRecordingTest {

  /** Ensure that each recursion level gets its own context and every point is unique. */
  @Test
  public void testRecursionContexts() throws Exception {
    TraceRecorder recorder = new TraceRecorder();
    recorder.run(TraceTarget.of(TargetPrograms.class, "factorial"), 3);

    IndexedTrace indexed = IndexedTrace.index(recorder.trace());

    assertEquals(recorder.trace().size(), indexed.size());
    assertEquals(indexed.size(), indexed.points().stream().distinct().count());
    assertTrue(
        indexed.points().stream()
            .anyMatch(p -> p.context().equals(List.of("factorial", "factorial", "factorial"))));
    assertEquals(0, indexed.statistics().contextDepth());
  }
}
