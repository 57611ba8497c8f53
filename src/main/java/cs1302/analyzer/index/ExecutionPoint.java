package cs1302.analyzer.index;

import cs1302.analyzer.trace.SourceLocation;
import java.util.List;
import java.util.Objects;

/**
 * A unique coordinate of one execution of a statement.
 *
 * @param context The call stack of method names when the statement ran, outermost first.
 * @param statement The statement.
 * @param instance How many times the statement has run in this exact context, counting this one.
 */
public record ExecutionPoint(List<String> context, SourceLocation statement, int instance) {

  public ExecutionPoint {
    context = List.copyOf(context);
    Objects.requireNonNull(statement, "statement");
    if (instance < 1) {
      throw new IllegalArgumentException("instance must be positive: " + instance);
    }
  }

  @Override
  public String toString() {
    String contextText = context.isEmpty() ? "main" : String.join("->", context);
    return String.format("<%s, L%d, #%d>", contextText, statement.line(), instance);
  }
}
