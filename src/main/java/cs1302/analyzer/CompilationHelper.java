package cs1302.analyzer;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.nodeTypes.modifiers.NodeWithPublicModifier;
import cs1302.analyzer.trace.RecorderConfig;
import cs1302.analyzer.trace.TraceTarget;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.tools.DiagnosticCollector;
import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileManager;
import javax.tools.JavaFileObject;
import javax.tools.JavaFileObject.Kind;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A collection of methods that are used to compile a Java program for analysis. */
public class CompilationHelper {

  private static final Logger log = LoggerFactory.getLogger(CompilationHelper.class);

  private CompilationHelper() {}

  /**
   * Compile a Java program with full debug information and locate a static method in it.
   *
   * @param javaSource The Java program to compile.
   * @param compilationUnit The parsed program.
   * @param methodName The name of the static method that will be analyzed.
   * @return The CompilationResult for this compilation.
   * @throws IllegalArgumentException If the Java program failed to compile or the method could not
   *     be located.
   * @throws IOException If the working directory could not be written.
   */
  public static CompilationResult compile(
      String javaSource, CompilationUnit compilationUnit, String methodName) throws IOException {
    String targetClass = findTargetClass(compilationUnit, methodName);

    // create a working directory tree for compilation
    Path workingDir = createWorkingDir();
    String[] topLevelClassBinaryName =
        findTopLevelDeclarationBinaryName(compilationUnit).split("\\.");

    Path inputSourceDirectory;
    if (topLevelClassBinaryName.length == 1) {
      inputSourceDirectory = workingDir;
    } else {
      inputSourceDirectory =
          Files.createDirectories(
              Paths.get(
                  workingDir.toString(),
                  Arrays.copyOf(topLevelClassBinaryName, topLevelClassBinaryName.length - 1)));
    }
    String sourceFileName =
        topLevelClassBinaryName[topLevelClassBinaryName.length - 1] + Kind.SOURCE.extension;
    Path inputSourceFile = inputSourceDirectory.resolve(sourceFileName);
    Files.writeString(inputSourceFile, javaSource);

    Set<String> compiledClassNames = new TreeSet<>();
    JavaCompiler javaCompiler =
        Objects.requireNonNull(ToolProvider.getSystemJavaCompiler(), "Could not get Java compiler");
    DiagnosticCollector<JavaFileObject> diagnosticCollector = new DiagnosticCollector<>();
    StandardJavaFileManager standardFileManager =
        javaCompiler.getStandardFileManager(diagnosticCollector, null, null);
    // records which classes were produced; only those are observed by the recorder
    JavaFileManager forwardingFileManager =
        new ForwardingJavaFileManager<StandardJavaFileManager>(standardFileManager) {
          @Override
          public JavaFileObject getJavaFileForOutput(
              Location location, String className, Kind kind, FileObject sibling)
              throws IOException {
            compiledClassNames.add(className);
            return super.getJavaFileForOutput(location, className, kind, sibling);
          }
        };
    Iterable<? extends JavaFileObject> sources =
        standardFileManager.getJavaFileObjects(inputSourceFile);

    boolean compilationSuccess =
        javaCompiler
            .getTask(
                null,
                forwardingFileManager,
                diagnosticCollector,
                List.of("-g", "-d", workingDir.toString()),
                null,
                sources)
            .call();

    if (!compilationSuccess) {
      StringBuilder message = new StringBuilder("Compilation of provided Java source code failed");
      if (diagnosticCollector.getDiagnostics().isEmpty()) {
        message.append('.');
      } else {
        message.append(" with the following messages:\n");
        message.append(
            diagnosticCollector.getDiagnostics().stream()
                .map(Object::toString)
                .collect(Collectors.joining("\n")));
      }
      throw new IllegalArgumentException(message.toString());
    }

    log.debug("Compiled {} into {}", compiledClassNames, workingDir);
    return new CompilationResult(
        workingDir, compiledClassNames, new TraceTarget(targetClass, methodName), sourceFileName);
  }

  /**
   * Create a temporary working directory that will be removed at JVM exit.
   *
   * @return The path to the created temporary working directory.
   */
  private static Path createWorkingDir() throws IOException {
    Path workingDir = Files.createTempDirectory("code-analyzer");
    Thread workingDirCleanupHook =
        new Thread(
            () -> {
              try (Stream<Path> paths = Files.walk(workingDir)) {
                paths.sorted(Comparator.reverseOrder()).map(Path::toFile).forEach(File::delete);
              } catch (IOException e) {
                log.debug("Unable to remove working directory {}", workingDir, e);
              }
            });
    Runtime.getRuntime().addShutdownHook(workingDirCleanupHook);
    return workingDir;
  }

  /**
   * Find the binary name of the single public top-level declaration in a compilation unit.
   *
   * @param compilationUnit The compilation unit to search in.
   * @return The binary name of the compilation unit's top-level declaration.
   * @throws IllegalArgumentException If the compilation unit doesn't contain exactly one public
   *     top-level declaration.
   */
  static String findTopLevelDeclarationBinaryName(CompilationUnit compilationUnit) {
    List<Node> topLevelNodes = new ArrayList<>();
    new Node.DirectChildrenIterator(compilationUnit).forEachRemaining(topLevelNodes::add);
    List<TypeDeclaration<?>> topLevelPublicDeclarations =
        topLevelNodes.stream()
            .filter(n -> n instanceof TypeDeclaration)
            .map(n -> (TypeDeclaration<?>) n)
            .filter(NodeWithPublicModifier::isPublic)
            .collect(Collectors.toList());

    if (topLevelPublicDeclarations.size() != 1) {
      throw new IllegalArgumentException(
          String.format(
              "Java source code must have exactly one public top-level type declaration. "
                  + "Found %d such declarations on lines %s.",
              topLevelPublicDeclarations.size(), beginLines(topLevelPublicDeclarations)));
    }

    return binaryName(compilationUnit, topLevelPublicDeclarations.get(0));
  }

  /**
   * Find the class declaring the static method to analyze. Overloads within one class are allowed;
   * the launcher picks the overload that accepts the arguments.
   *
   * @param compilationUnit The parsed program.
   * @param methodName The method's simple name.
   * @return The binary name of the declaring class.
   * @throws IllegalArgumentException If no class, or more than one class, declares such a method.
   */
  static String findTargetClass(CompilationUnit compilationUnit, String methodName) {
    List<MethodDeclaration> candidates =
        compilationUnit.findAll(
            MethodDeclaration.class,
            m -> m.isStatic() && m.getNameAsString().equals(methodName) && m.getBody().isPresent());

    Set<String> declaringClasses = new TreeSet<>();
    for (MethodDeclaration candidate : candidates) {
      candidate
          .findAncestor(TypeDeclaration.class)
          .ifPresent(type -> declaringClasses.add(binaryName(compilationUnit, type)));
    }

    if (declaringClasses.size() != 1) {
      throw new IllegalArgumentException(
          String.format(
              "Java source code must declare static method %s in exactly one class. "
                  + "Found it on lines %s.",
              methodName, beginLines(candidates)));
    }
    return declaringClasses.iterator().next();
  }

  /**
   * Get the binary name of a type declaration: its package, then the names of the enclosing types
   * separated by {@code $}.
   *
   * <p>For example, given the following compilation unit, the binary name of {@code Inner} is
   * {@code test.example.Outer$Inner}.
   *
   * <pre>
   * <code>
   * package test.example;
   * public class Outer {
   *   public static class Inner {
   *   }
   * }
   * </code>
   * </pre>
   */
  private static String binaryName(CompilationUnit compilationUnit, TypeDeclaration<?> type) {
    List<String> typeNames = new ArrayList<>();
    typeNames.add(type.getNameAsString());
    Iterator<Node> parents = new Node.ParentsVisitor(type);
    while (parents.hasNext()) {
      Node parent = parents.next();
      if (parent instanceof TypeDeclaration<?> parentDecl) {
        typeNames.add(0, parentDecl.getNameAsString());
      }
    } // while

    String simpleBinaryName = String.join("$", typeNames);
    return compilationUnit
        .getPackageDeclaration()
        .map(p -> p.getNameAsString() + "." + simpleBinaryName)
        .orElse(simpleBinaryName);
  }

  private static String beginLines(List<? extends Node> nodes) {
    return nodes.stream()
        .filter(n -> n.getBegin().isPresent())
        .map(n -> String.valueOf(n.getBegin().get().line))
        .collect(Collectors.joining(", ", "[", "]"));
  }

  /**
   * A collection of information from the successful compilation of a Java program.
   *
   * @param classPath Root of the class path where compiled classes were output.
   * @param compiledClassNames Binary names of the classes that were compiled.
   * @param target The static method to analyze.
   * @param sourceFileName The name of the compiled source file, as recorded in the class files.
   */
  public record CompilationResult(
      Path classPath, Set<String> compiledClassNames, TraceTarget target, String sourceFileName) {

    /**
     * Configure a recorder to run and observe the compiled classes.
     *
     * @param base The settings to start from.
     * @return {@code base} with the compiled classes on its class path and observed.
     */
    public RecorderConfig recorderConfig(RecorderConfig base) {
      return base.withClassPathEntry(classPath.toString())
          .withObservedClasses(List.copyOf(compiledClassNames));
    }
  }
}
