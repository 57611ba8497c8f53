package cs1302.analyzer.trace;

/**
 * A read or write of a named local variable, inferred by comparing consecutive scope snapshots.
 *
 * @param mode Whether the variable was read or written.
 * @param name The variable name.
 */
public record Access(Mode mode, String name) {

  /** Access direction. */
  public enum Mode {
    READ,
    WRITE
  }

  public static Access read(String name) {
    return new Access(Mode.READ, name);
  }

  public static Access write(String name) {
    return new Access(Mode.WRITE, name);
  }

  public boolean isRead() {
    return mode == Mode.READ;
  }

  public boolean isWrite() {
    return mode == Mode.WRITE;
  }

  @Override
  public String toString() {
    return (isRead() ? "read:" : "write:") + name;
  }
}
