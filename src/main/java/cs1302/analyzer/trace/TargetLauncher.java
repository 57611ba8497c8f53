package cs1302.analyzer.trace;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Entry point of the traced VM. Usage: {@code TargetLauncher <class> <method> <token>...} where
 * each token was produced by {@link ArgumentCodec#encode(Object)}.
 *
 * <p>This class is never observed by the recorder.
 */
public final class TargetLauncher {

  /** Exit status when the target could not be resolved or its arguments could not be converted. */
  public static final int EXIT_LAUNCH_FAILED = 2;

  /** Exit status when the target raised an exception. */
  public static final int EXIT_TARGET_RAISED = 3;

  /** Prefix of the stderr line describing a failure: {@code <prefix><type> <message token>}. */
  public static final String FAILURE_MARKER = "##target-failure ";

  private TargetLauncher() {}

  public static void main(String[] args) {
    if (args.length < 2) {
      fail(EXIT_LAUNCH_FAILED, IllegalArgumentException.class.getName(),
          "usage: TargetLauncher <class> <method> <argument>...");
      return;
    }

    List<String> tokens = Arrays.stream(args).skip(2).toList();
    Object[] converted = null;
    Method target = null;
    try {
      Class<?> type = Class.forName(args[0]);
      for (Method candidate : type.getDeclaredMethods()) {
        if (!candidate.getName().equals(args[1])
            || !Modifier.isStatic(candidate.getModifiers())
            || candidate.getParameterCount() != tokens.size()) {
          continue;
        }
        try {
          converted = decodeAll(tokens, candidate.getParameterTypes());
          target = candidate;
          break;
        } catch (IllegalArgumentException e) {
          // try the next overload
          converted = null;
        }
      }
      if (target == null) {
        fail(EXIT_LAUNCH_FAILED, NoSuchMethodException.class.getName(),
            String.format(
                "no static method %s.%s accepting %d argument(s) %s",
                args[0], args[1], tokens.size(), describe(tokens)));
        return;
      }
      target.setAccessible(true);
    } catch (ClassNotFoundException | RuntimeException e) {
      fail(EXIT_LAUNCH_FAILED, e.getClass().getName(), e.getMessage());
      return;
    }

    try {
      target.invoke(null, converted);
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause();
      fail(EXIT_TARGET_RAISED, cause.getClass().getName(), cause.getMessage());
    } catch (IllegalAccessException e) {
      fail(EXIT_LAUNCH_FAILED, e.getClass().getName(), e.getMessage());
    }
  }

  private static Object[] decodeAll(List<String> tokens, Class<?>[] parameterTypes) {
    Object[] converted = new Object[tokens.size()];
    for (int i = 0; i < converted.length; i++) {
      converted[i] = ArgumentCodec.decode(tokens.get(i), parameterTypes[i]);
    }
    return converted;
  }

  /** Render arguments for a failure message. */
  private static List<String> describe(List<String> tokens) {
    List<String> described = new ArrayList<>();
    for (String token : tokens) {
      if (token.startsWith(ArgumentCodec.ARRAY_PREFIX)) {
        described.add("<array>");
        continue;
      }
      try {
        described.add(String.valueOf(ArgumentCodec.decode(token)));
      } catch (IllegalArgumentException e) {
        described.add(token);
      }
    }
    return described;
  }

  private static void fail(int status, String exceptionType, String message) {
    System.out.flush();
    System.err.println(FAILURE_MARKER + exceptionType + " " + ArgumentCodec.encode(message));
    System.err.flush();
    System.exit(status);
  }
}
