package cs1302.analyzer.trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An ordered sequence of trace events produced by exactly one recorder session. A trace is
 * immutable; use a {@link Builder} to produce one.
 */
public final class Trace {

  private static final Trace EMPTY = new Trace(List.of());

  private final List<TraceEvent> events;

  private Trace(List<TraceEvent> events) {
    this.events = Collections.unmodifiableList(events);
  }

  public static Trace empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<TraceEvent> events() {
    return events;
  }

  public TraceEvent get(int index) {
    return events.get(index);
  }

  public int size() {
    return events.size();
  }

  public boolean isEmpty() {
    return events.isEmpty();
  }

  /**
   * Get the distinct statements that were executed, in the order they were first reached. Only
   * {@link EventKind#LINE} events count as executing a statement.
   *
   * @return The executed statements.
   */
  public List<SourceLocation> executedStatements() {
    Set<SourceLocation> statements = new LinkedHashSet<>();
    for (TraceEvent event : events) {
      if (event.kind() == EventKind.LINE) {
        statements.add(event.location());
      }
    }
    return List.copyOf(statements);
  }

  /**
   * Get the history of a variable's values throughout execution.
   *
   * @param variableName The name of the variable to track.
   * @return One observation for every event whose snapshot contains the variable, in event order.
   */
  public List<VariableObservation> history(String variableName) {
    List<VariableObservation> history = new ArrayList<>();
    for (TraceEvent event : events) {
      TraceValue value = event.locals().get(variableName);
      if (value != null) {
        history.add(new VariableObservation(event.location(), value));
      }
    }
    return history;
  }

  /**
   * Render the trace in a readable format.
   *
   * @param maxEvents The maximum number of events to render.
   * @return The rendered trace.
   */
  public String render(int maxEvents) {
    StringBuilder sb = new StringBuilder();
    int shown = Math.min(maxEvents, events.size());
    for (int i = 0; i < shown; i++) {
      TraceEvent event = events.get(i);
      sb.append(
          String.format(
              "[Event %d] %s at line %d%n",
              i + 1, event.kind().name(), event.location().line()));
      sb.append(String.format("  Function: %s%n", event.function()));
      sb.append(String.format("  File: %s%n", event.location().sourceUnit()));
      if (!event.locals().isEmpty()) {
        sb.append(String.format("  Local Variables:%n"));
        event
            .locals()
            .forEach((name, value) -> sb.append(String.format("    %s = %s%n", name, value.text())));
      }
      if (!event.accesses().isEmpty()) {
        List<String> accesses = event.accesses().stream().map(Access::toString).toList();
        sb.append(String.format("  Memory Access: %s%n", String.join(", ", accesses)));
      }
    }
    if (events.size() > shown) {
      sb.append(String.format("... (%d more events)%n", events.size() - shown));
    }
    sb.append(String.format("Total Events: %d%n", events.size()));
    return sb.toString();
  }

  @Override
  public String toString() {
    return "Trace(" + events.size() + " events)";
  }

  /**
   * Accumulates events for one session. Accesses are derived here: every event is compared with
   * the snapshot of the event appended immediately before it.
   */
  public static final class Builder {

    private final List<TraceEvent> events = new ArrayList<>();
    private Map<String, TraceValue> previousLocals = Map.of();

    private Builder() {}

    /**
     * Append an event.
     *
     * @param kind What was observed.
     * @param location The statement being executed.
     * @param function The enclosing method's name.
     * @param locals The captured local variables.
     * @return The appended event.
     */
    public TraceEvent append(
        EventKind kind, SourceLocation location, String function, Map<String, TraceValue> locals) {
      Map<String, TraceValue> snapshot = new LinkedHashMap<>(locals);
      TraceEvent event =
          new TraceEvent(kind, location, function, snapshot, inferAccesses(previousLocals, snapshot));
      events.add(event);
      previousLocals = snapshot;
      return event;
    }

    public int size() {
      return events.size();
    }

    public Trace build() {
      return new Trace(new ArrayList<>(events));
    }

    /**
     * Tag names as written when they are new or changed since the previous snapshot, and as read
     * when they are present in both snapshots with an equal value. A name that is unchanged but was
     * never referenced is indistinguishable from one that was read.
     */
    static List<Access> inferAccesses(
        Map<String, TraceValue> previous, Map<String, TraceValue> current) {
      List<Access> accesses = new ArrayList<>();
      current.forEach(
          (name, value) -> {
            if (!previous.containsKey(name) || !previous.get(name).equals(value)) {
              accesses.add(Access.write(name));
            }
          });
      previous.forEach(
          (name, value) -> {
            if (current.containsKey(name) && value.equals(current.get(name))) {
              accesses.add(Access.read(name));
            }
          });
      return accesses;
    }
  }
}
