package cs1302.analyzer;

import com.github.javaparser.ParseProblemException;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ParserConfiguration.LanguageLevel;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import cs1302.analyzer.CompilationHelper.CompilationResult;
import cs1302.analyzer.index.IndexedTrace;
import cs1302.analyzer.localize.FaultLocalizer;
import cs1302.analyzer.localize.RecordingTestExecutor;
import cs1302.analyzer.serialize.ReportSerializer;
import cs1302.analyzer.slice.DynamicSlicer;
import cs1302.analyzer.slice.SliceRenderer;
import cs1302.analyzer.slice.SliceResult;
import cs1302.analyzer.trace.RecorderConfig;
import cs1302.analyzer.trace.SourceLocation;
import cs1302.analyzer.trace.TargetRaisedException;
import cs1302.analyzer.trace.Trace;
import cs1302.analyzer.trace.TraceException;
import cs1302.analyzer.trace.TraceRecorder;
import cs1302.analyzer.trace.TraceSession;
import cs1302.analyzer.trace.TraceValue;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Scanner;
import java.util.concurrent.Callable;
import org.fusesource.jansi.AnsiConsole;
import org.json.JSONObject;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/** Entry point for the analyzer program. */
@Command(name = "code-analyzer")
public class App {

  public static void main(String[] args) throws Exception {
    int exitCode =
        new CommandLine(new App())
            .addSubcommand(new TraceCommand())
            .addSubcommand(new IndexCommand())
            .addSubcommand(new SliceCommand())
            .addSubcommand(new LocalizeCommand())
            .execute(args);

    System.exit(exitCode);
  } // main

  /** Base class that holds common CLI parameters. */
  @Command
  abstract static class CommandBase implements Callable<Integer> {
    @Option(
        names = {"--verbose", "-v"},
        description = "Output messages about what the analyzer is doing.")
    boolean verbose = false;

    @Option(
        names = {"--input", "-i"},
        description = "Input path to Java source file (defaults to stdin if omitted).")
    File input = null;

    @Option(
        names = {"--method", "-m"},
        required = true,
        description = "Name of the static method to analyze.")
    String methodName;

    @Option(
        names = {"--timeout"},
        description = "Seconds a single traced execution may take; 0 for no limit (default 60).")
    long timeoutSeconds = RecorderConfig.DEFAULT_TIMEOUT.toSeconds();

    @Option(
        names = {"--jvm-option"},
        description = "Extra option for the traced VM. May be repeated.")
    List<String> jvmOptions = new ArrayList<>();

    String source;
    CompilationResult compilationResult;

    /**
     * Read, parse and compile the input, run the analysis and report failures on stderr.
     *
     * @return The exit code: 0 on success, 1 if the analysis failed.
     */
    @Override
    public Integer call() {
      if (verbose) {
        // must happen before the first logger is created
        System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
      }
      try {
        source = readInputFile();
        CompilationUnit cu = parseSource(source);
        compilationResult = CompilationHelper.compile(source, cu, methodName);
        analyze();
        return 0;
      } catch (Throwable cause) {
        System.err.println("Unable to " + action() + ": " + cause.getMessage());
        if (verbose) {
          cause.printStackTrace();
        } // if
        return 1;
      } // try
    }

    /** Run this command's analysis on the compiled input and print the report. */
    abstract void analyze() throws Exception;

    /** What the command does, for error messages. */
    abstract String action();

    /**
     * Read the entirety of {@code input} into a string. If {@code input} is null, it reads and
     * returns the content of stdin.
     *
     * @return The read contents of the file.
     * @throws IOException if the file could not be read
     */
    protected String readInputFile() throws IOException {
      if (input == null) {
        // read stdin
        StringBuilder sb = new StringBuilder();
        try (Scanner scan = new Scanner(System.in)) {
          while (scan.hasNextLine()) {
            sb.append(scan.nextLine()).append("\n");
          } // while
        } // try
        return sb.toString();
      }
      return Files.readString(input.toPath());
    } // readInputFile

    /**
     * Parse the given Java source code string.
     *
     * @param source The Java source code to parse.
     * @return The parsed Java source code.
     * @throws ParseProblemException If parsing failed.
     */
    protected CompilationUnit parseSource(String source) {
      StaticJavaParser.setConfiguration(
          new ParserConfiguration().setLanguageLevel(LanguageLevel.JAVA_17));
      return StaticJavaParser.parse(source);
    }

    /** Recorder settings for the compiled input. */
    protected RecorderConfig recorderConfig() {
      return compilationResult
          .recorderConfig(RecorderConfig.defaults())
          .withJvmOptions(jvmOptions)
          .withTimeout(Duration.ofSeconds(timeoutSeconds));
    }

    protected SourceLocation statement(int line) {
      return new SourceLocation(compilationResult.sourceFileName(), line);
    }
  }

  /** Base class for commands that trace a single execution. */
  abstract static class SingleExecutionCommand extends CommandBase {
    @Parameters(description = "Arguments passed to the analyzed method.")
    List<String> arguments = new ArrayList<>();

    TraceValue result;
    String stdout;

    /**
     * Run the target once under observation.
     *
     * @return The recorded trace.
     */
    protected Trace record() throws TraceException, TargetRaisedException {
      TraceRecorder recorder = new TraceRecorder(recorderConfig());
      TraceSession session = recorder.beginSession(compilationResult.target(), arguments);
      try {
        result = session.await();
      } finally {
        stdout = session.stdout();
        recorder.endSession();
      }
      return recorder.trace();
    }
  }

  /** Record a trace. */
  @Command(
      name = "trace",
      description = "Record an execution trace of a static method.",
      mixinStandardHelpOptions = true)
  static class TraceCommand extends SingleExecutionCommand {
    @Option(
        names = {"--locals", "-l"},
        description = "Include each event's local variable snapshot in the output.")
    boolean includeLocals = false;

    @Override
    void analyze() throws Exception {
      Trace trace = record();
      JSONObject report =
          new ReportSerializer(includeLocals)
              .serialize(compilationResult.target().toString(), result, stdout, trace);
      System.out.println(report);
    }

    @Override
    String action() {
      return "generate trace";
    }
  }

  /** Record and index a trace. */
  @Command(
      name = "index",
      description = "Record an execution trace and label every event with its execution point.",
      mixinStandardHelpOptions = true)
  static class IndexCommand extends SingleExecutionCommand {
    @Override
    void analyze() throws Exception {
      IndexedTrace indexed = IndexedTrace.index(record());
      System.out.println(new ReportSerializer(false).serialize(indexed));
    }

    @Override
    String action() {
      return "index trace";
    }
  }

  /** Compute a dynamic slice. */
  @Command(
      name = "slice",
      description = "Compute the dynamic slice of a variable at a line.",
      mixinStandardHelpOptions = true)
  static class SliceCommand extends SingleExecutionCommand {
    @Option(
        names = {"--line"},
        required = true,
        description = "Line of the statement of interest.")
    int line;

    @Option(
        names = {"--variable"},
        required = true,
        description = "Variable of interest.")
    String variable;

    @Option(
        names = {"--json", "-j"},
        description = "Output the slice in JSON format.")
    boolean outputJson = false;

    @Override
    void analyze() throws Exception {
      SliceResult slice = new DynamicSlicer().computeSlice(record(), statement(line), variable);
      if (outputJson) {
        System.out.println(new ReportSerializer(false).serialize(slice));
        return;
      }
      List<String> sourceLines = Arrays.asList(source.split("\n"));
      boolean colored = System.console() != null;
      if (colored) {
        AnsiConsole.systemInstall();
      }
      try {
        System.out.print(new SliceRenderer(colored).render(slice, sourceLines));
      } finally {
        if (colored) {
          AnsiConsole.systemUninstall();
        }
      }
    }

    @Override
    String action() {
      return "compute slice";
    }
  }

  /** Localize a fault with a test suite. */
  @Command(
      name = "localize",
      description = "Run test cases against a static method and rank statements by suspiciousness.",
      mixinStandardHelpOptions = true)
  static class LocalizeCommand extends CommandBase {
    @Option(
        names = {"--case", "-c"},
        required = true,
        description =
            "A test case written as \"<arguments>=<expected>\", with whitespace separated "
                + "arguments, e.g. \"3 5=5\". May be repeated.")
    List<String> cases = new ArrayList<>();

    @Option(
        names = {"--parallelism", "-p"},
        description = "How many test cases may run at the same time (default 1).")
    int parallelism = 1;

    @Override
    void analyze() {
      FaultLocalizer localizer =
          new FaultLocalizer(new RecordingTestExecutor(recorderConfig()), parallelism);
      for (int i = 0; i < cases.size(); i++) {
        String testCase = cases.get(i);
        int separator = testCase.lastIndexOf('=');
        if (separator < 0) {
          throw new IllegalArgumentException("Test case has no expected output: " + testCase);
        }
        String argumentText = testCase.substring(0, separator).trim();
        List<String> arguments =
            argumentText.isEmpty() ? List.of() : Arrays.asList(argumentText.split("\\s+"));
        TraceValue expected = TraceValue.parse(testCase.substring(separator + 1));
        localizer.addTest("test" + (i + 1), arguments, expected);
      } // for

      localizer.run(compilationResult.target());
      System.out.println(new ReportSerializer(false).serialize(localizer));
    }

    @Override
    String action() {
      return "localize fault";
    }
  }
}
