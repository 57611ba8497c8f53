package cs1302.analyzer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cs1302.analyzer.App.CommandBase;
import cs1302.analyzer.slice.SliceRenderer;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Optional;
import java.util.function.Supplier;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.skyscreamer.jsonassert.JSONAssert;
import org.skyscreamer.jsonassert.JSONCompareMode;
import picocli.CommandLine;

/** Tests for code-analyzer. */
public class AppTest {

  private static final String CHAIN_PROGRAM =
      """
      public class Chain {
        public static int chain(int x, int y) {
          int a = x + 1;
          int b = y * 2;
          int c = a + b;
          int d = c * 2;
          return d;
        }
      }
      """;

  private static final String MAX_PROGRAM =
      """
      public class Max {
        public static int max(int a, int b) {
          int result = a;
          if (b > a) {
            result = a;
          }
          return result;
        }
      }
      """;

  /**
   * Execute an analyzer command with a program input and command-line arguments, and get the
   * command's standard output.
   *
   * @param commandSupplier A supplier for the command you want to run.
   * @param testProgram A string containing the Java input you want to give to the command.
   * @param options The command-line arguments you want to pass to the command. Do not include
   *     -i/--input.
   * @return The standard output of the command, or empty if command execution failed.
   */
  static <T extends CommandBase> Optional<String> executeCommand(
      Supplier<T> commandSupplier, String testProgram, String... options) {
    File tempFile = null;
    try {
      tempFile = File.createTempFile("code-analyzer", ".java");
      tempFile.deleteOnExit();
      Files.writeString(tempFile.toPath(), testProgram);

      T app = commandSupplier.get();
      CommandLine cmd = new CommandLine(app);

      ArrayList<String> args = new ArrayList<>();
      args.add("--input=" + tempFile.getCanonicalPath());
      args.addAll(Arrays.asList(options));

      // picocli's setOut only redirects usage and version help, so the JVM's stdout is replaced.
      // This requires that tests run sequentially, which is the default for junit.
      PrintStream originalOut = System.out;
      ByteArrayOutputStream baos = new ByteArrayOutputStream();
      boolean ranSuccessfully = false;
      try {
        System.setOut(new PrintStream(baos, true, StandardCharsets.UTF_8));
        ranSuccessfully = cmd.execute(args.toArray(String[]::new)) == 0;
      } finally {
        System.setOut(originalOut);
      }

      if (ranSuccessfully) {
        return Optional.of(baos.toString(StandardCharsets.UTF_8));
      } else {
        return Optional.empty();
      }
    } catch (IOException e) {
      return Optional.empty();
    } finally {
      if (tempFile != null) {
        tempFile.delete();
      }
    }
  }

  /** Ensure that a trace reports the result and the executed lines. */
  @Test
  public void testTrace() {
    String output =
        executeCommand(App.TraceCommand::new, CHAIN_PROGRAM, "--method=chain", "2", "3").get();

    JSONAssert.assertEquals(
        "{\"target\": \"Chain.chain\", \"result\": 18, \"executedLines\": [3, 4, 5, 6, 7]}",
        output,
        JSONCompareMode.LENIENT);
  }

  /** Ensure that locals are only included on request. */
  @Test
  public void testTraceLocals() {
    JSONObject withLocals =
        new JSONObject(
            executeCommand(
                    App.TraceCommand::new, CHAIN_PROGRAM, "--method=chain", "--locals", "2", "3")
                .get());
    JSONObject withoutLocals =
        new JSONObject(
            executeCommand(App.TraceCommand::new, CHAIN_PROGRAM, "--method=chain", "2", "3").get());

    assertTrue(withLocals.getJSONArray("events").getJSONObject(0).has("locals"));
    assertTrue(!withoutLocals.getJSONArray("events").getJSONObject(0).has("locals"));
  }

  /** Ensure that an indexed trace carries statistics. */
  @Test
  public void testIndex() {
    String output =
        executeCommand(App.IndexCommand::new, CHAIN_PROGRAM, "--method=chain", "2", "3").get();

    JSONAssert.assertEquals(
        "{\"statistics\": {\"uniqueContexts\": 2, \"uniqueStatements\": 5,"
            + " \"contextDepth\": 0}}",
        output,
        JSONCompareMode.LENIENT);
  }

  /** Ensure that a slice is rendered with the relevant lines. */
  @Test
  public void testSlice() {
    String output =
        executeCommand(
                App.SliceCommand::new,
                CHAIN_PROGRAM,
                "--method=chain",
                "--line=7",
                "--variable=d",
                "2",
                "3")
            .get();

    assertTrue(output.startsWith("DYNAMIC SLICE: d @ Line 7"));
    assertTrue(output.contains("Relevant Lines: [3, 4, 5, 6, 7]"));
    assertTrue(output.contains("7 " + SliceRenderer.RELEVANT_MARK + "     return d;"));
  }

  /** Ensure that a slice can be output as JSON. */
  @Test
  public void testSliceJson() {
    String output =
        executeCommand(
                App.SliceCommand::new,
                CHAIN_PROGRAM,
                "--method=chain",
                "--line=7",
                "--variable=d",
                "--json",
                "2",
                "3")
            .get();

    JSONAssert.assertEquals(
        "{\"variable\": \"d\", \"line\": 7, \"file\": \"Chain.java\", \"found\": true,"
            + " \"relevantLines\": [3, 4, 5, 6, 7]}",
        output,
        JSONCompareMode.LENIENT);
  }

  /** Ensure that fault localization ranks the faulty line first. */
  @Test
  public void testLocalize() {
    String output =
        executeCommand(
                App.LocalizeCommand::new,
                MAX_PROGRAM,
                "--method=max",
                "--case=3 5=5",
                "--case=5 3=5",
                "--case=4 4=4",
                "--case=1 2=2")
            .get();

    JSONObject report = new JSONObject(output);
    JSONAssert.assertEquals(
        "{\"total\": 4, \"passed\": 2, \"failed\": 2}",
        report.getJSONObject("summary"),
        JSONCompareMode.STRICT);
    assertEquals(5, report.getJSONArray("scores").getJSONObject(0).getInt("line"));
  }

  /** Ensure that a program that does not compile fails the command. */
  @Test
  public void testCompilationFailure() {
    String brokenProgram =
        """
        public class Broken {
          public static int f() {
            return "not an int";
          }
        }
        """;

    assertTrue(executeCommand(App.TraceCommand::new, brokenProgram, "--method=f").isEmpty());
  }

  /** Ensure that a missing method fails the command. */
  @Test
  public void testMissingMethod() {
    assertTrue(
        executeCommand(App.TraceCommand::new, CHAIN_PROGRAM, "--method=nope", "1").isEmpty());
  }
}
