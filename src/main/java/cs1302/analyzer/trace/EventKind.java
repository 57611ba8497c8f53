package cs1302.analyzer.trace;

/** The kind of moment a {@link TraceEvent} observed. */
public enum EventKind {
  /** A method was entered. */
  CALL,
  /** A new source line is about to execute. */
  LINE,
  /** A method is about to return to its caller. */
  RETURN,
  /** An exception was thrown at an observed location. */
  EXCEPTION;

  /**
   * The lower-case name used in reports.
   *
   * @return The kind's name in lower case.
   */
  public String label() {
    return name().toLowerCase(java.util.Locale.ROOT);
  }
}
