package cs1302.analyzer.trace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One observed moment of execution.
 *
 * @param kind What was observed.
 * @param location The statement being executed.
 * @param function The name of the enclosing method.
 * @param locals A snapshot of the visible local variables, in declaration order. Values are
 *     copies taken at observation time.
 * @param accesses Reads and writes inferred from the previous event's snapshot in the same trace.
 *     Writes come first, in the order of {@code locals}.
 */
public record TraceEvent(
    EventKind kind,
    SourceLocation location,
    String function,
    Map<String, TraceValue> locals,
    List<Access> accesses) {

  public TraceEvent {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(location, "location");
    Objects.requireNonNull(function, "function");
    locals = Collections.unmodifiableMap(new LinkedHashMap<>(locals));
    accesses = List.copyOf(new LinkedHashSet<>(accesses));
  }

  /**
   * The names this event tagged as written.
   *
   * @return Written variable names, in access order.
   */
  public Set<String> writes() {
    Set<String> names = new LinkedHashSet<>();
    for (Access access : accesses) {
      if (access.isWrite()) {
        names.add(access.name());
      }
    }
    return names;
  }

  /**
   * The names this event tagged as read.
   *
   * @return Read variable names, in access order.
   */
  public Set<String> reads() {
    Set<String> names = new LinkedHashSet<>();
    for (Access access : accesses) {
      if (access.isRead()) {
        names.add(access.name());
      }
    }
    return names;
  }

  public boolean hasRead(String name) {
    return accesses.contains(Access.read(name));
  }

  public int line() {
    return location.line();
  }

  @Override
  public String toString() {
    return String.format(
        "TraceEvent(kind=%s, line=%d, function=%s, vars=%s)",
        kind.label(), location.line(), function, locals.keySet());
  }
}
