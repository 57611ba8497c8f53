package cs1302.analyzer.trace;

/**
 * Thrown when the observed method raised an exception. By the time this reaches the caller, the
 * session's hook has been removed and the trace up to the exception has been retained.
 */
public class TargetRaisedException extends Exception {

  private static final long serialVersionUID = 1L;

  private final String exceptionType;
  private final String exceptionMessage;

  /**
   * Create a new exception describing the target's failure.
   *
   * @param exceptionType The binary name of the exception the target raised.
   * @param exceptionMessage The exception's message, or null if it had none.
   */
  public TargetRaisedException(String exceptionType, String exceptionMessage) {
    super(
        exceptionMessage == null
            ? exceptionType
            : String.format("%s: %s", exceptionType, exceptionMessage));
    this.exceptionType = exceptionType;
    this.exceptionMessage = exceptionMessage;
  }

  public String exceptionType() {
    return exceptionType;
  }

  public String exceptionMessage() {
    return exceptionMessage;
  }
}
