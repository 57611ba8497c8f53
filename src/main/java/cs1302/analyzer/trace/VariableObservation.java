package cs1302.analyzer.trace;

/**
 * A variable's value as seen by one event.
 *
 * @param location The statement the event was observed at.
 * @param value The captured value.
 */
public record VariableObservation(SourceLocation location, TraceValue value) {}
