package cs1302.analyzer.trace;

import com.sun.jdi.AbsentInformationException;
import com.sun.jdi.Bootstrap;
import com.sun.jdi.IncompatibleThreadStateException;
import com.sun.jdi.InvalidStackFrameException;
import com.sun.jdi.LocalVariable;
import com.sun.jdi.Location;
import com.sun.jdi.ObjectCollectedException;
import com.sun.jdi.ObjectReference;
import com.sun.jdi.StackFrame;
import com.sun.jdi.ThreadReference;
import com.sun.jdi.VMDisconnectedException;
import com.sun.jdi.Value;
import com.sun.jdi.VirtualMachine;
import com.sun.jdi.connect.Connector;
import com.sun.jdi.connect.IllegalConnectorArgumentsException;
import com.sun.jdi.connect.LaunchingConnector;
import com.sun.jdi.connect.VMStartException;
import com.sun.jdi.event.Event;
import com.sun.jdi.event.EventQueue;
import com.sun.jdi.event.EventSet;
import com.sun.jdi.event.ExceptionEvent;
import com.sun.jdi.event.LocatableEvent;
import com.sun.jdi.event.MethodEntryEvent;
import com.sun.jdi.event.MethodExitEvent;
import com.sun.jdi.event.VMDeathEvent;
import com.sun.jdi.event.VMDisconnectEvent;
import com.sun.jdi.request.EventRequest;
import com.sun.jdi.request.EventRequestManager;
import com.sun.jdi.request.ExceptionRequest;
import com.sun.jdi.request.MethodEntryRequest;
import com.sun.jdi.request.MethodExitRequest;
import com.sun.jdi.request.StepRequest;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One observation of a target method running in its own VM. The session holds the step hook: the
 * JDI requests that report every method entry, line, exception and method exit in the observed
 * classes. Ending the session removes the hook and disposes the VM.
 *
 * <p>Sessions are created by {@link TraceRecorder#beginSession(TraceTarget, List)}.
 */
public final class TraceSession implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(TraceSession.class);

  /** Packages the hook never reports, in addition to the launcher itself. */
  private static final List<String> UNOBSERVED_PACKAGES =
      List.of("java.*", "javax.*", "jdk.*", "sun.*", "com.sun.*");

  /** How long to wait for the traced VM's process after the VM has died. */
  private static final long EXIT_GRACE_SECONDS = 10;

  private final TraceTarget target;
  private final RecorderConfig config;
  private final List<String> observedClasses;
  private final VirtualMachine vm;
  private final List<EventRequest> hookRequests = new ArrayList<>();
  private final Trace.Builder builder = Trace.builder();
  private final ByteArrayOutputStream vmOutSink = new ByteArrayOutputStream();
  private final ByteArrayOutputStream vmErrSink = new ByteArrayOutputStream();
  private final List<Thread> pumps = new ArrayList<>();

  private StepRequest stepRequest;
  private int depth;
  private TraceValue result;
  private boolean finished;
  private boolean awaited;
  private Trace trace;

  private TraceSession(TraceTarget target, RecorderConfig config, VirtualMachine vm) {
    this.target = target;
    this.config = config;
    this.observedClasses = config.observedClassesFor(target);
    this.vm = vm;
  }

  /**
   * Launch a VM that will run the target and install the hook. The VM stays suspended until
   * {@link #await()} is called.
   */
  static TraceSession launch(RecorderConfig config, TraceTarget target, List<?> arguments)
      throws TraceException {
    LaunchingConnector launchingConnector = Bootstrap.virtualMachineManager().defaultConnector();
    Map<String, Connector.Argument> env = launchingConnector.defaultArguments();

    StringBuilder main =
        new StringBuilder(TargetLauncher.class.getName())
            .append(' ')
            .append(target.className())
            .append(' ')
            .append(target.methodName());
    for (Object argument : arguments) {
      main.append(' ').append(ArgumentCodec.encode(argument));
    }

    StringBuilder options = new StringBuilder("-classpath \"" + config.classPath() + "\"");
    for (String option : config.jvmOptions()) {
      options.append(' ').append(option);
    }

    env.get("main").setValue(main.toString());
    env.get("options").setValue(options.toString());

    VirtualMachine vm;
    try {
      vm = launchingConnector.launch(env);
    } catch (IOException | IllegalConnectorArgumentsException | VMStartException e) {
      throw new TraceException("Unable to launch a VM for " + target, e);
    }
    log.debug(
        "Launched traced VM {} for {} with {} argument(s)", vm.name(), target, arguments.size());

    return observe(vm, config, target);
  }

  /**
   * Start copying a launched VM's output and install the hook. If that fails, the VM is disposed
   * and its process destroyed before the failure is reported.
   *
   * @throws TraceException If the VM could not be observed.
   */
  static TraceSession observe(VirtualMachine vm, RecorderConfig config, TraceTarget target)
      throws TraceException {
    TraceSession session = new TraceSession(target, config, vm);
    try {
      session.startPump(vm.process().getInputStream(), session.vmOutSink, "stdout");
      session.startPump(vm.process().getErrorStream(), session.vmErrSink, "stderr");
      session.installHook();
    } catch (RuntimeException e) {
      session.end();
      throw new TraceException("Unable to observe the VM launched for " + target, e);
    }
    return session;
  }

  public TraceTarget target() {
    return target;
  }

  /**
   * Run the target to completion while recording.
   *
   * @return The value returned by the outermost invocation of the target method.
   * @throws TargetRaisedException If the target raised an exception.
   * @throws TraceException If the session timed out or the VM could not run the target.
   * @throws IllegalStateException If this session has already been awaited or closed.
   */
  public TraceValue await() throws TraceException, TargetRaisedException {
    if (awaited || trace != null) {
      throw new IllegalStateException("A trace session can only be awaited once, before it ends");
    }
    awaited = true;

    long timeoutMillis = config.timeout().toMillis();
    long deadline = System.currentTimeMillis() + timeoutMillis;
    EventQueue queue = vm.eventQueue();
    try {
      while (!finished) {
        EventSet events;
        if (timeoutMillis == 0) {
          events = queue.remove();
        } else {
          long remaining = deadline - System.currentTimeMillis();
          if (remaining <= 0) {
            terminate();
            throw new TraceException(
                String.format("Tracing %s timed out after %s", target, config.timeout()));
          }
          events = queue.remove(remaining);
          if (events == null) {
            continue;
          }
        }

        dispatch(events);
        resume(events);
      } // while
    } catch (VMDisconnectedException e) {
      log.debug("Traced VM disconnected", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TraceException("Interrupted while tracing " + target, e);
    }

    int status = awaitExit();
    if (status == TargetLauncher.EXIT_TARGET_RAISED) {
      throw targetFailure();
    } else if (status != 0) {
      throw new TraceException(
          String.format("Unable to run %s (exit status %d): %s", target, status, stderr().trim()));
    } else if (result == null) {
      throw new TraceException(
          String.format(
              "%s returned but was never observed; check the observed classes %s",
              target, observedClasses));
    }
    return result;
  }

  /**
   * Remove the hook, dispose the VM and freeze the recorded events. Ending twice returns the same
   * trace.
   *
   * @return Everything recorded up to now.
   */
  public Trace end() {
    if (trace != null) {
      return trace;
    }
    try {
      vm.eventRequestManager().deleteEventRequests(hookRequests);
      if (stepRequest != null) {
        vm.eventRequestManager().deleteEventRequest(stepRequest);
      }
      vm.dispose();
    } catch (VMDisconnectedException e) {
      log.debug("Traced VM for {} was already gone when closing the session", target);
    }
    Process process = vm.process();
    if (process != null && process.isAlive()) {
      process.destroyForcibly();
    }
    hookRequests.clear();
    stepRequest = null;
    trace = builder.build();
    log.debug("Closed trace session for {} with {} event(s)", target, trace.size());
    return trace;
  }

  /** Same as {@link #end()}. */
  @Override
  public void close() {
    end();
  }

  /** Everything the traced program wrote to standard output so far. */
  public String stdout() {
    synchronized (vmOutSink) {
      return vmOutSink.toString(StandardCharsets.UTF_8);
    }
  }

  /** Everything the traced program wrote to standard error so far. */
  public String stderr() {
    synchronized (vmErrSink) {
      return vmErrSink.toString(StandardCharsets.UTF_8);
    }
  }

  /**
   * Check whether a class is observed by a set of JDI class filter patterns.
   *
   * @param typeName A binary class name.
   * @param patterns Exact names, or patterns with a leading or trailing {@code *}.
   * @return True if any pattern matches.
   */
  static boolean isObserved(String typeName, List<String> patterns) {
    for (String pattern : patterns) {
      if (pattern.startsWith("*") && typeName.endsWith(pattern.substring(1))) {
        return true;
      } else if (pattern.endsWith("*")
          && typeName.startsWith(pattern.substring(0, pattern.length() - 1))) {
        return true;
      } else if (pattern.equals(typeName)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Create one request per event kind. Class filters on one request must all match, so the
   * observed patterns are checked when events arrive instead; that way overlapping patterns cannot
   * report an event twice.
   */
  private void installHook() {
    EventRequestManager erm = vm.eventRequestManager();
    MethodEntryRequest entryRequest = erm.createMethodEntryRequest();
    MethodExitRequest exitRequest = erm.createMethodExitRequest();
    ExceptionRequest exceptionRequest = erm.createExceptionRequest(null, true, true);
    hookRequests.addAll(List.of(entryRequest, exitRequest, exceptionRequest));
    for (String excluded : unobservedClassPatterns()) {
      entryRequest.addClassExclusionFilter(excluded);
      exitRequest.addClassExclusionFilter(excluded);
      exceptionRequest.addClassExclusionFilter(excluded);
    }
    hookRequests.forEach(EventRequest::enable);
  }

  private static List<String> unobservedClassPatterns() {
    List<String> patterns = new ArrayList<>(UNOBSERVED_PACKAGES);
    patterns.add(TargetLauncher.class.getName());
    return patterns;
  }

  private boolean isObserved(Location location) {
    return isObserved(location.declaringType().name(), observedClasses);
  }

  private void dispatch(EventSet events) {
    List<Event> ordered = new ArrayList<>(events);
    ordered.sort(Comparator.comparingInt(TraceSession::rank));
    for (Event event : ordered) {
      if (event instanceof VMDeathEvent || event instanceof VMDisconnectEvent) {
        finished = true;
      } else if (!(event instanceof LocatableEvent le) || !isObserved(le.location())) {
        continue;
      } else if (event instanceof MethodEntryEvent mee) {
        onMethodEntry(mee);
      } else if (event instanceof com.sun.jdi.event.StepEvent se) {
        record(EventKind.LINE, se.thread(), se.location());
      } else if (event instanceof ExceptionEvent ee) {
        log.debug("{} thrown at {}", ee.exception().referenceType().name(), ee.location());
        record(EventKind.EXCEPTION, ee.thread(), ee.location());
      } else if (event instanceof MethodExitEvent mee) {
        onMethodExit(mee);
      }
    } // for
  }

  /** Events delivered together are handled entry, step, exception, exit. */
  private static int rank(Event event) {
    if (event instanceof MethodEntryEvent) {
      return 0;
    } else if (event instanceof com.sun.jdi.event.StepEvent) {
      return 1;
    } else if (event instanceof ExceptionEvent) {
      return 2;
    } else if (event instanceof MethodExitEvent) {
      return 3;
    }
    return 4;
  }

  private void onMethodEntry(MethodEntryEvent event) {
    record(EventKind.CALL, event.thread(), event.location());
    if (stepRequest == null) {
      stepRequest =
          vm.eventRequestManager()
              .createStepRequest(event.thread(), StepRequest.STEP_LINE, StepRequest.STEP_INTO);
      unobservedClassPatterns().forEach(stepRequest::addClassExclusionFilter);
      stepRequest.enable();
      // stepping starts from here, so the entry line would otherwise never be reported
      record(EventKind.LINE, event.thread(), event.location());
    }
    depth++;
  }

  private void onMethodExit(MethodExitEvent event) {
    record(EventKind.RETURN, event.thread(), event.location());
    depth = Math.max(0, depth - 1);
    if (depth > 0) {
      return;
    }
    if (event.method().name().equals(target.methodName())) {
      result =
          vm.canGetMethodReturnValues()
              ? capture(event.thread(), Collections.singletonList(event.returnValue())).get(0)
              : new TraceValue.Opaque("unavailable");
    }
    // back in unobserved code; stop stepping until observed code is entered again
    if (stepRequest != null) {
      vm.eventRequestManager().deleteEventRequest(stepRequest);
      stepRequest = null;
    }
  }

  private void record(EventKind kind, ThreadReference thread, Location location) {
    SourceLocation where = new SourceLocation(sourceUnit(location), location.lineNumber());
    builder.append(kind, where, location.method().name(), snapshotLocals(thread));
  }

  private static String sourceUnit(Location location) {
    try {
      return location.sourceName();
    } catch (AbsentInformationException e) {
      return location.declaringType().name();
    }
  }

  /** Copy the visible locals of the thread's top frame. Unreadable frames yield no locals. */
  private Map<String, TraceValue> snapshotLocals(ThreadReference thread) {
    Map<String, TraceValue> locals = new LinkedHashMap<>();
    try {
      StackFrame frame = thread.frame(0);
      List<LocalVariable> variables = frame.visibleVariables();
      // read every value first: invoking methods during the capture invalidates the frame
      Map<LocalVariable, Value> values = frame.getValues(variables);
      List<Value> ordered = new ArrayList<>();
      variables.forEach(variable -> ordered.add(values.get(variable)));
      List<TraceValue> captured = capture(thread, ordered);
      for (int i = 0; i < variables.size(); i++) {
        locals.put(variables.get(i).name(), captured.get(i));
      }
    } catch (AbsentInformationException e) {
      log.debug("No local variable information at {}; was it compiled with -g?", thread.name());
    } catch (IncompatibleThreadStateException | InvalidStackFrameException e) {
      log.debug("Unable to read the top frame of {}", thread.name(), e);
    }
    return locals;
  }

  /**
   * Copy values read from a suspended thread. Copying JDK collections runs their accessors in the
   * traced VM, so the hook is paused meanwhile: an event raised by code those accessors reach
   * would otherwise stop the thread while this session waits for the invocation to return.
   */
  private List<TraceValue> capture(ThreadReference thread, List<Value> values) {
    boolean invokes = values.stream().anyMatch(TraceValue::mayInvoke);
    List<ObjectReference> pinned = new ArrayList<>();
    if (invokes) {
      setHookEnabled(false);
      // a return value is no longer reachable in the traced VM once the VM runs
      for (Value value : values) {
        if (value instanceof ObjectReference object) {
          pin(object, pinned);
        }
      }
    }
    try {
      List<TraceValue> captured = new ArrayList<>();
      for (Value value : values) {
        captured.add(TraceValue.fromJdiValue(thread, value));
      }
      return captured;
    } finally {
      if (invokes) {
        pinned.forEach(ObjectReference::enableCollection);
        setHookEnabled(true);
      }
    }
  }

  private static void pin(ObjectReference object, List<ObjectReference> pinned) {
    try {
      object.disableCollection();
      pinned.add(object);
    } catch (ObjectCollectedException e) {
      log.debug("Object {} was collected before it could be captured", object.uniqueID());
    }
  }

  private void setHookEnabled(boolean enabled) {
    hookRequests.forEach(request -> request.setEnabled(enabled));
    if (stepRequest != null) {
      stepRequest.setEnabled(enabled);
    }
  }

  private void terminate() {
    try {
      vm.exit(1);
    } catch (VMDisconnectedException e) {
      log.debug("Traced VM for {} ended before it could be terminated", target);
    }
  }

  private void resume(EventSet events) {
    if (finished) {
      return;
    }
    try {
      events.resume();
    } catch (VMDisconnectedException e) {
      log.debug("Traced VM disconnected while resuming");
      finished = true;
    }
  }

  private int awaitExit() throws TraceException {
    Process process = vm.process();
    try {
      if (!process.waitFor(EXIT_GRACE_SECONDS, TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new TraceException("Traced VM for " + target + " did not exit");
      }
      for (Thread pump : pumps) {
        pump.join(TimeUnit.SECONDS.toMillis(EXIT_GRACE_SECONDS));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TraceException("Interrupted while waiting for the traced VM to exit", e);
    }
    log.debug("Traced VM for {} exited with status {}", target, process.exitValue());
    return process.exitValue();
  }

  private TargetRaisedException targetFailure() {
    List<String> markers =
        stderr()
            .lines()
            .filter(line -> line.startsWith(TargetLauncher.FAILURE_MARKER))
            .collect(Collectors.toList());
    if (markers.isEmpty()) {
      return new TargetRaisedException(Throwable.class.getName(), stderr().trim());
    }
    String[] parts =
        markers.get(markers.size() - 1).substring(TargetLauncher.FAILURE_MARKER.length()).split(" ");
    String message = parts.length > 1 ? ArgumentCodec.decode(parts[1]) : null;
    return new TargetRaisedException(parts[0], message);
  }

  private void startPump(InputStream source, ByteArrayOutputStream sink, String name) {
    Thread pump =
        new Thread(
            () -> {
              byte[] buffer = new byte[4096];
              try {
                int read;
                while ((read = source.read(buffer)) != -1) {
                  synchronized (sink) {
                    sink.write(buffer, 0, read);
                  }
                }
              } catch (IOException ioe) {
                log.debug("Stopped reading traced VM {}", name, ioe);
              }
            },
            "trace-" + name);
    pump.setDaemon(true);
    pump.start();
    pumps.add(pump);
  }
}
