package cs1302.analyzer.index;

import cs1302.analyzer.trace.SourceLocation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Assigns every execution of a statement a unique {@link ExecutionPoint}. The instance counter is
 * kept per (call context, statement) pair, so the third iteration of a loop body and the first
 * line of a recursive call at depth 2 get distinct coordinates.
 *
 * <p>Each indexer owns its own stack and counters; create one per indexing session or call {@link
 * #reset()} in between.
 */
public class ExecutionIndexer {

  /** Counter key. The context is an immutable snapshot of the stack. */
  private record CounterKey(List<String> context, SourceLocation statement) {}

  private final List<String> contextStack = new ArrayList<>();
  private final Map<CounterKey, Integer> instanceCounters = new HashMap<>();
  private final List<ExecutionPoint> history = new ArrayList<>();

  /**
   * Push a method onto the calling context.
   *
   * @param functionName The name of the method being entered.
   */
  public void enterFunction(String functionName) {
    contextStack.add(functionName);
  }

  /** Pop the innermost method. Popping an empty context is a no-op. */
  public void exitFunction() {
    if (!contextStack.isEmpty()) {
      contextStack.remove(contextStack.size() - 1);
    }
  }

  public List<String> currentContext() {
    return List.copyOf(contextStack);
  }

  /**
   * Record one execution of a statement in the current context.
   *
   * @param statement The statement that ran.
   * @return Its execution point; the n-th call for the same context and statement has instance n.
   */
  public ExecutionPoint recordPoint(SourceLocation statement) {
    List<String> context = currentContext();
    int instance = instanceCounters.merge(new CounterKey(context, statement), 1, Integer::sum);
    ExecutionPoint point = new ExecutionPoint(context, statement, instance);
    history.add(point);
    return point;
  }

  /** Forget the context, all counters and the history. */
  public void reset() {
    contextStack.clear();
    instanceCounters.clear();
    history.clear();
  }

  public List<ExecutionPoint> history() {
    return Collections.unmodifiableList(history);
  }

  /**
   * Find every position in the history where a point was recorded.
   *
   * @param point The point to look for.
   * @return The matching indices, in ascending order.
   */
  public List<Integer> findMatchingPoints(ExecutionPoint point) {
    List<Integer> matches = new ArrayList<>();
    for (int i = 0; i < history.size(); i++) {
      if (history.get(i).equals(point)) {
        matches.add(i);
      }
    }
    return matches;
  }

  public Optional<ExecutionPoint> pointAt(int index) {
    if (index < 0 || index >= history.size()) {
      return Optional.empty();
    }
    return Optional.of(history.get(index));
  }

  /**
   * Summarize the history.
   *
   * @return Counts over the recorded points and the current stack depth.
   */
  public IndexStatistics statistics() {
    Set<List<String>> contexts = new HashSet<>();
    Set<SourceLocation> statements = new HashSet<>();
    int maxInstance = 0;
    for (ExecutionPoint point : history) {
      contexts.add(point.context());
      statements.add(point.statement());
      maxInstance = Math.max(maxInstance, point.instance());
    }
    return new IndexStatistics(
        history.size(), contexts.size(), statements.size(), maxInstance, contextStack.size());
  }
}
