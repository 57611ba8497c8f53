package cs1302.analyzer.index;

import cs1302.analyzer.trace.Trace;
import cs1302.analyzer.trace.TraceEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A trace whose events are paired with their execution points, one pair per event, in trace
 * order.
 */
public final class IndexedTrace {

  /**
   * A recorded event and its coordinate.
   *
   * @param event The event.
   * @param point The event's execution point.
   */
  public record IndexedEvent(TraceEvent event, ExecutionPoint point) {}

  private final List<IndexedEvent> entries;
  private final IndexStatistics statistics;

  private IndexedTrace(List<IndexedEvent> entries, IndexStatistics statistics) {
    this.entries = Collections.unmodifiableList(entries);
    this.statistics = statistics;
  }

  /**
   * Index a trace with a fresh indexer. Calls push their method before they are recorded and
   * returns pop it before, so a return is indexed in its caller's context.
   *
   * @param trace The recorded trace.
   * @return The indexed trace.
   */
  public static IndexedTrace index(Trace trace) {
    return index(trace, new ExecutionIndexer());
  }

  /**
   * Index a trace with the given indexer, which is reset first.
   *
   * @param trace The recorded trace.
   * @param indexer The indexer to drive.
   * @return The indexed trace.
   */
  public static IndexedTrace index(Trace trace, ExecutionIndexer indexer) {
    indexer.reset();
    List<IndexedEvent> entries = new ArrayList<>(trace.size());
    for (TraceEvent event : trace.events()) {
      switch (event.kind()) {
        case CALL -> indexer.enterFunction(event.function());
        case RETURN -> indexer.exitFunction();
        default -> {}
      }
      entries.add(new IndexedEvent(event, indexer.recordPoint(event.location())));
    }
    return new IndexedTrace(entries, indexer.statistics());
  }

  public List<IndexedEvent> entries() {
    return entries;
  }

  public int size() {
    return entries.size();
  }

  /** Project back to the recorded events, in order. */
  public List<TraceEvent> events() {
    return entries.stream().map(IndexedEvent::event).toList();
  }

  public List<ExecutionPoint> points() {
    return entries.stream().map(IndexedEvent::point).toList();
  }

  /** Statistics of the indexer right after the last event. */
  public IndexStatistics statistics() {
    return statistics;
  }

  /**
   * Render the points and their events.
   *
   * @param maxEvents The maximum number of entries to render.
   * @return The rendering.
   */
  public String render(int maxEvents) {
    StringBuilder sb = new StringBuilder();
    int shown = Math.min(maxEvents, entries.size());
    for (int i = 0; i < shown; i++) {
      IndexedEvent entry = entries.get(i);
      sb.append(String.format("[%3d] %s%n", i, entry.point()));
      sb.append(
          String.format(
              "      Event: %s at line %d%n",
              entry.event().kind().label(), entry.event().location().line()));
      sb.append(String.format("      Function: %s%n", entry.event().function()));
    }
    if (entries.size() > shown) {
      sb.append(String.format("... (%d more events)%n", entries.size() - shown));
    }
    return sb.toString();
  }
}
