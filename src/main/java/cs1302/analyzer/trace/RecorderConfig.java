package cs1302.analyzer.trace;

import java.io.File;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Settings for trace sessions.
 *
 * @param classPath The class path of the traced VM. It must contain {@link TargetLauncher} and
 *     the target classes.
 * @param observedClasses JDI class filter patterns (binary names, optionally with a leading or
 *     trailing {@code *}) of the classes whose execution is recorded. When empty, the target's
 *     class and its nested classes are observed.
 * @param jvmOptions Extra options for the traced VM, such as {@code -Xmx64m}.
 * @param timeout Wall-clock limit of one session; {@link Duration#ZERO} disables the limit.
 */
public record RecorderConfig(
    String classPath, List<String> observedClasses, List<String> jvmOptions, Duration timeout) {

  /** Default wall-clock limit of a session. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

  public RecorderConfig {
    Objects.requireNonNull(classPath, "classPath");
    observedClasses = List.copyOf(observedClasses);
    jvmOptions = List.copyOf(jvmOptions);
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must not be negative: " + timeout);
    }
  }

  /**
   * A configuration that traces classes visible to the current process.
   *
   * @return The default configuration.
   */
  public static RecorderConfig defaults() {
    return new RecorderConfig(
        System.getProperty("java.class.path"), List.of(), List.of(), DEFAULT_TIMEOUT);
  }

  public RecorderConfig withClassPath(String classPath) {
    return new RecorderConfig(classPath, observedClasses, jvmOptions, timeout);
  }

  /**
   * Prepend entries to the class path.
   *
   * @param entry The entry to put in front of the current class path.
   * @return A copy of this configuration with the extended class path.
   */
  public RecorderConfig withClassPathEntry(String entry) {
    return withClassPath(classPath.isEmpty() ? entry : entry + File.pathSeparator + classPath);
  }

  public RecorderConfig withObservedClasses(List<String> observedClasses) {
    return new RecorderConfig(classPath, observedClasses, jvmOptions, timeout);
  }

  public RecorderConfig withJvmOptions(List<String> jvmOptions) {
    return new RecorderConfig(classPath, observedClasses, jvmOptions, timeout);
  }

  public RecorderConfig withTimeout(Duration timeout) {
    return new RecorderConfig(classPath, observedClasses, jvmOptions, timeout);
  }

  /**
   * The class filters in effect for a target.
   *
   * @param target The traced method.
   * @return {@link #observedClasses()}, or the target's class and its nested classes if none were
   *     configured.
   */
  public List<String> observedClassesFor(TraceTarget target) {
    if (!observedClasses.isEmpty()) {
      return observedClasses;
    }
    return List.of(target.className(), target.className() + "$*");
  }
}
