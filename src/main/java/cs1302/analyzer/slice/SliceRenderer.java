package cs1302.analyzer.slice;

import cs1302.analyzer.trace.SourceLocation;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.stream.Collectors;
import org.fusesource.jansi.Ansi;

/**
 * Renders a {@link SliceResult} for people: the relevant lines, both dependency maps and, if the
 * source is known, the listing with relevant lines marked.
 *
 * @param colored True to highlight relevant source lines with ANSI escape codes.
 */
public record SliceRenderer(boolean colored) {

  /** Marker in front of relevant source lines. */
  public static final String RELEVANT_MARK = "✓";

  /**
   * Render a slice.
   *
   * @param slice The slice to render.
   * @param sourceLines The lines of the target statement's source unit, or an empty list.
   * @return The rendering.
   */
  public String render(SliceResult slice, List<String> sourceLines) {
    StringBuilder sb = new StringBuilder();
    sb.append(
        String.format(
            "DYNAMIC SLICE: %s @ Line %d%n",
            slice.targetVariable(), slice.targetStatement().line()));

    if (!slice.found()) {
      sb.append(
          String.format(
              "%nVariable '%s' was never observed at line %d.%n",
              slice.targetVariable(), slice.targetStatement().line()));
      return sb.toString();
    }

    sb.append(String.format("%nRelevant Lines: %s%n", lines(slice.relevantStatements())));

    if (!slice.dataDependencies().isEmpty()) {
      sb.append(String.format("%nData Dependencies:%n"));
      for (Map.Entry<SourceLocation, SortedSet<String>> entry :
          slice.dataDependencies().entrySet()) {
        sb.append(
            String.format(
                "  Line %d depends on variables: %s%n", entry.getKey().line(), entry.getValue()));
      }
    }

    if (!slice.controlDependencies().isEmpty()) {
      sb.append(String.format("%nControl Dependencies:%n"));
      for (Map.Entry<SourceLocation, SortedSet<SourceLocation>> entry :
          slice.controlDependencies().entrySet()) {
        sb.append(
            String.format(
                "  Line %d controlled by lines: %s%n",
                entry.getKey().line(), lines(entry.getValue())));
      }
    }

    if (!sourceLines.isEmpty()) {
      sb.append(String.format("%nSliced Code:%n"));
      String unit = slice.targetStatement().sourceUnit();
      int digitLength = ((int) Math.log10(sourceLines.size())) + 1;
      for (int i = 0; i < sourceLines.size(); i++) {
        int lineNumber = i + 1;
        boolean relevant = slice.contains(new SourceLocation(unit, lineNumber));
        String prefix =
            String.format(
                "  %" + digitLength + "d %s ", lineNumber, relevant ? RELEVANT_MARK : " ");
        if (relevant && colored) {
          sb.append(Ansi.ansi().fgGreen().a(prefix + sourceLines.get(i)).reset());
        } else {
          sb.append(prefix).append(sourceLines.get(i));
        }
        sb.append(System.lineSeparator());
      } // for
    }
    return sb.toString();
  }

  private static String lines(SortedSet<SourceLocation> statements) {
    return statements.stream()
        .map(statement -> Integer.toString(statement.line()))
        .collect(Collectors.joining(", ", "[", "]"));
  }
}
