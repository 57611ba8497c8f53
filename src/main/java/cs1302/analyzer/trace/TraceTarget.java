package cs1302.analyzer.trace;

import java.util.Objects;

/**
 * A static method to run under observation.
 *
 * @param className The binary name of the declaring class.
 * @param methodName The method's name. Overloads are told apart by the number of arguments.
 */
public record TraceTarget(String className, String methodName) {

  public TraceTarget {
    Objects.requireNonNull(className, "className");
    Objects.requireNonNull(methodName, "methodName");
  }

  public static TraceTarget of(Class<?> type, String methodName) {
    return new TraceTarget(type.getName(), methodName);
  }

  @Override
  public String toString() {
    return className + "." + methodName;
  }
}
