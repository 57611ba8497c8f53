package cs1302.analyzer.index;

/**
 * Summary of an indexer's history.
 *
 * @param totalPoints Number of recorded points.
 * @param uniqueContexts Number of distinct call contexts among them.
 * @param uniqueStatements Number of distinct statements among them.
 * @param maxInstance The largest instance number, 0 if nothing was recorded.
 * @param contextDepth The current call stack depth.
 */
public record IndexStatistics(
    int totalPoints, int uniqueContexts, int uniqueStatements, int maxInstance, int contextDepth) {}
