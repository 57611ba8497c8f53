package cs1302.analyzer.trace;

/** Thrown when a trace session could not be carried out: launching, connecting or timing out. */
public class TraceException extends Exception {

  private static final long serialVersionUID = 1L;

  public TraceException(String message) {
    super(message);
  }

  public TraceException(String message, Throwable cause) {
    super(message, cause);
  }
}
