package cs1302.analyzer.trace;

import com.sun.jdi.ArrayReference;
import com.sun.jdi.ArrayType;
import com.sun.jdi.BooleanValue;
import com.sun.jdi.CharValue;
import com.sun.jdi.ClassNotLoadedException;
import com.sun.jdi.ClassType;
import com.sun.jdi.DoubleValue;
import com.sun.jdi.Field;
import com.sun.jdi.FloatValue;
import com.sun.jdi.IncompatibleThreadStateException;
import com.sun.jdi.InterfaceType;
import com.sun.jdi.InvalidTypeException;
import com.sun.jdi.InvocationException;
import com.sun.jdi.Method;
import com.sun.jdi.ObjectReference;
import com.sun.jdi.PrimitiveValue;
import com.sun.jdi.StringReference;
import com.sun.jdi.ThreadReference;
import com.sun.jdi.Value;
import com.sun.jdi.VoidValue;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A captured value. Values are owned by the analyzing JVM; they never refer back into the traced
 * program, so later mutation there cannot change an earlier snapshot.
 */
public sealed interface TraceValue {

  /** Elements rendered for an array before the rest is elided. */
  int MAX_ARRAY_ELEMENTS = 64;

  /** How deep nested objects and arrays are rendered. */
  int MAX_DEPTH = 3;

  /**
   * The value rendered as text.
   *
   * @return A human readable rendering of the value.
   */
  String text();

  /**
   * Compare two captured values. Unlike {@link Object#equals(Object)}, integral and floating point
   * values are compared by numeric value, so {@code 2} and {@code 2.0} are the same value.
   *
   * @param other The value to compare against.
   * @return True if both values denote the same value.
   */
  default boolean sameValue(TraceValue other) {
    if (other == null) {
      return false;
    }
    if (this instanceof FloatingPoint || other instanceof FloatingPoint) {
      if (isNumeric(this) && isNumeric(other)) {
        return Double.compare(asDouble(this), asDouble(other)) == 0;
      }
    } else if (isNumeric(this) && isNumeric(other)) {
      return asLong(this) == asLong(other);
    }
    return equals(other);
  }

  /**
   * Convert a JDI value mirror into a TraceValue that is owned by our JVM. Conversion never fails:
   * a value that cannot be read is captured through its textual form.
   *
   * <p>With a thread, the contents of JDK collections, maps and a few value types (such as {@code
   * StringBuilder}) are copied by invoking their accessors on that thread, which must be suspended
   * by an event. Invoking lets the traced VM run, so callers should make sure no event request can
   * stop the thread meanwhile. See {@link #mayInvoke(Value)}.
   *
   * @param thread The thread the value was read from, or null to never invoke methods.
   * @param value The mirrored value, possibly null.
   * @return A copy of the value.
   */
  static TraceValue fromJdiValue(ThreadReference thread, Value value) {
    try {
      return convert(value, thread, 0);
    } catch (RuntimeException e) {
      // collected objects and similar races with the target VM
      return new Opaque(String.valueOf(value));
    }
  }

  /**
   * Check whether converting a value with a thread may invoke methods in the traced VM. Objects
   * and arrays of references may: they can hold JDK collections.
   *
   * @param value The mirrored value, possibly null.
   * @return True unless the value is null, a primitive, a string, a primitive wrapper or an array
   *     of primitives.
   */
  static boolean mayInvoke(Value value) {
    if (!(value instanceof ObjectReference or) || value instanceof StringReference) {
      return false;
    }
    if (or.referenceType() instanceof ArrayType arrayType) {
      String component = arrayType.componentSignature();
      return component.startsWith("L") || component.startsWith("[");
    }
    return !Literals.WRAPPERS.contains(or.referenceType().name());
  }

  /**
   * Capture a value of the analyzing JVM, for instance an expected test output.
   *
   * @param value The value to capture, possibly null.
   * @return The captured value, rendered the same way a JDI mirror of an equal value would be.
   */
  static TraceValue of(Object value) {
    if (value == null) {
      return new Opaque("null");
    } else if (value instanceof TraceValue tv) {
      return tv;
    } else if (value instanceof Boolean b) {
      return new Bool(b);
    } else if (value instanceof Character c) {
      return new UnsignedInteger(c);
    } else if (value instanceof Float || value instanceof Double) {
      return new FloatingPoint(((Number) value).doubleValue());
    } else if (value instanceof Byte
        || value instanceof Short
        || value instanceof Integer
        || value instanceof Long) {
      return new SignedInteger(((Number) value).longValue());
    } else if (value instanceof String s) {
      return new Text(s);
    } else if (value.getClass().isArray()) {
      List<String> elements = new ArrayList<>();
      int length = Array.getLength(value);
      for (int i = 0; i < Math.min(length, MAX_ARRAY_ELEMENTS); i++) {
        elements.add(of(Array.get(value, i)).text());
      }
      return new Opaque(renderElements(elements, length));
    } else if (value instanceof Collection<?> collection) {
      List<String> elements = new ArrayList<>();
      for (Object element : collection) {
        if (elements.size() == MAX_ARRAY_ELEMENTS) {
          break;
        }
        elements.add(of(element).text());
      }
      return new Opaque(renderElements(elements, collection.size()));
    } else if (value instanceof Map<?, ?> map) {
      List<String> entries = new ArrayList<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (entries.size() == MAX_ARRAY_ELEMENTS) {
          break;
        }
        entries.add(of(entry.getKey()).text() + "=" + of(entry.getValue()).text());
      }
      return new Opaque(renderEntries(entries, map.size()));
    }
    return new Opaque(String.valueOf(value));
  }

  /**
   * Interpret a literal typed by a user (for example an expected output on the command line).
   *
   * @param literal The literal text.
   * @return A boolean, integer or floating point value if the literal looks like one; an opaque
   *     value for {@code null} and array renderings; text otherwise.
   */
  static TraceValue parse(String literal) {
    String trimmed = literal.trim();
    if (trimmed.equals("true") || trimmed.equals("false")) {
      return new Bool(Boolean.parseBoolean(trimmed));
    }
    if (Literals.INTEGER.matcher(trimmed).matches()) {
      try {
        return new SignedInteger(Long.parseLong(trimmed));
      } catch (NumberFormatException e) {
        return new Text(trimmed);
      }
    }
    if (Literals.DECIMAL.matcher(trimmed).matches()) {
      return new FloatingPoint(Double.parseDouble(trimmed));
    }
    if (trimmed.equals("null") || (trimmed.startsWith("[") && trimmed.endsWith("]"))) {
      return new Opaque(trimmed);
    }
    if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
      return new Text(trimmed.substring(1, trimmed.length() - 1));
    }
    return new Text(literal);
  }

  private static TraceValue convert(Value value, ThreadReference thread, int depth) {
    if (value == null) {
      return new Opaque("null");
    } else if (value instanceof BooleanValue bv) {
      return new Bool(bv.value());
    } else if (value instanceof CharValue cv) {
      return new UnsignedInteger(cv.value());
    } else if (value instanceof FloatValue || value instanceof DoubleValue) {
      return new FloatingPoint(((PrimitiveValue) value).doubleValue());
    } else if (value instanceof PrimitiveValue pv) {
      return new SignedInteger(pv.longValue());
    } else if (value instanceof VoidValue) {
      return new Opaque("void");
    } else if (value instanceof StringReference sr) {
      return new Text(sr.value());
    } else if (value instanceof ArrayReference ar) {
      return new Opaque(renderArray(ar, thread, depth));
    } else if (value instanceof ObjectReference or) {
      String typeName = or.referenceType().name();
      if (Literals.WRAPPERS.contains(typeName)) {
        Field wrapped = or.referenceType().fieldByName("value");
        return convert(or.getValue(wrapped), thread, depth);
      }
      return new Opaque(renderObject(or, thread, depth));
    }
    return new Opaque(value.toString());
  }

  private static String renderArray(ArrayReference array, ThreadReference thread, int depth) {
    if (depth >= MAX_DEPTH) {
      return array.referenceType().name() + "@" + array.uniqueID();
    }
    int length = array.length();
    List<String> elements = new ArrayList<>();
    if (length > 0) {
      for (Value element : array.getValues(0, Math.min(length, MAX_ARRAY_ELEMENTS))) {
        elements.add(convert(element, thread, depth + 1).text());
      }
    }
    return renderElements(elements, length);
  }

  private static String renderObject(ObjectReference object, ThreadReference thread, int depth) {
    String typeName = object.referenceType().name();
    String identity = typeName + "@" + object.uniqueID();
    if (depth >= MAX_DEPTH || !(object.referenceType() instanceof ClassType type)) {
      return identity;
    }
    if (Literals.BUILT_IN_PACKAGES.stream().anyMatch(typeName::startsWith)) {
      return renderBuiltIn(object, type, thread, depth).orElse(identity);
    }

    // only instance state belongs to the value
    List<String> fields = new ArrayList<>();
    for (Field field : type.allFields()) {
      if (field.isStatic()) {
        continue;
      }
      fields.add(field.name() + "=" + convert(object.getValue(field), thread, depth + 1).text());
    }
    return typeName + "{" + String.join(", ", fields) + "}";
  }

  /**
   * Render the contents of a JDK object through its own accessors: the elements of a collection,
   * the entries of a map, or the text of a value type whose {@code toString} only reads its state.
   *
   * @return The rendering, or empty if the object is of another type, there is no thread to invoke
   *     on, or an invocation failed.
   */
  private static Optional<String> renderBuiltIn(
      ObjectReference object, ClassType type, ThreadReference thread, int depth) {
    if (thread == null) {
      return Optional.empty();
    }
    try {
      if (implementsInterface(type, "java.util.Collection")) {
        ArrayReference elements =
            (ArrayReference) invoke(thread, object, "toArray", Literals.TO_ARRAY);
        elements.disableCollection();
        try {
          return Optional.of(renderArray(elements, thread, depth));
        } finally {
          elements.enableCollection();
        }
      } else if (implementsInterface(type, "java.util.Map")) {
        ObjectReference entrySet =
            (ObjectReference) invoke(thread, object, "entrySet", "()Ljava/util/Set;");
        ArrayReference entries =
            (ArrayReference) invoke(thread, entrySet, "toArray", Literals.TO_ARRAY);
        entries.disableCollection();
        try {
          return Optional.of(renderMapEntries(entries, thread, depth));
        } finally {
          entries.enableCollection();
        }
      } else if (Literals.TEXTUAL_TYPES.contains(type.name())) {
        StringReference text =
            (StringReference) invoke(thread, object, "toString", "()Ljava/lang/String;");
        return Optional.of(text.value());
      }
    } catch (InvocationException
        | InvalidTypeException
        | ClassNotLoadedException
        | IncompatibleThreadStateException
        | IllegalArgumentException
        | ClassCastException e) {
      // the object could not be examined; its identity stands in for it
      return Optional.empty();
    }
    return Optional.empty();
  }

  private static String renderMapEntries(
      ArrayReference entries, ThreadReference thread, int depth)
      throws InvocationException, InvalidTypeException, ClassNotLoadedException,
          IncompatibleThreadStateException {
    int length = entries.length();
    List<String> rendered = new ArrayList<>();
    if (length > 0) {
      for (Value value : entries.getValues(0, Math.min(length, MAX_ARRAY_ELEMENTS))) {
        ObjectReference entry = (ObjectReference) value;
        Value key = invoke(thread, entry, "getKey", "()Ljava/lang/Object;");
        Value mapped = invoke(thread, entry, "getValue", "()Ljava/lang/Object;");
        String keyText = convert(key, thread, depth + 1).text();
        rendered.add(keyText + "=" + convert(mapped, thread, depth + 1).text());
      }
    }
    return renderEntries(rendered, length);
  }

  private static Value invoke(
      ThreadReference thread, ObjectReference object, String name, String signature)
      throws InvocationException, InvalidTypeException, ClassNotLoadedException,
          IncompatibleThreadStateException {
    Method method = ((ClassType) object.referenceType()).concreteMethodByName(name, signature);
    if (method == null) {
      throw new IllegalArgumentException(object.referenceType().name() + " has no " + name);
    }
    return object.invokeMethod(thread, method, List.of(), 0);
  }

  private static boolean implementsInterface(ClassType type, String interfaceName) {
    for (InterfaceType implemented : type.allInterfaces()) {
      if (implemented.name().equals(interfaceName)) {
        return true;
      }
    }
    return false;
  }

  private static String renderElements(List<String> elements, int length) {
    StringBuilder sb = new StringBuilder("[");
    sb.append(String.join(", ", elements));
    if (length > elements.size()) {
      sb.append(", ... (").append(length - elements.size()).append(" more)");
    }
    return sb.append(']').toString();
  }

  private static String renderEntries(List<String> entries, int size) {
    String elements = renderElements(entries, size);
    return "{" + elements.substring(1, elements.length() - 1) + "}";
  }

  private static boolean isNumeric(TraceValue value) {
    return value instanceof SignedInteger
        || value instanceof UnsignedInteger
        || value instanceof FloatingPoint;
  }

  private static long asLong(TraceValue value) {
    if (value instanceof SignedInteger si) {
      return si.value();
    } else if (value instanceof UnsignedInteger ui) {
      return ui.value();
    }
    return (long) ((FloatingPoint) value).value();
  }

  private static double asDouble(TraceValue value) {
    if (value instanceof FloatingPoint fp) {
      return fp.value();
    }
    return asLong(value);
  }

  /** A {@code byte}, {@code short}, {@code int} or {@code long}. */
  record SignedInteger(long value) implements TraceValue {
    @Override
    public String text() {
      return Long.toString(value);
    }
  }

  /** An unsigned integral value; Java's only unsigned primitive is {@code char}. */
  record UnsignedInteger(long value) implements TraceValue {
    public UnsignedInteger {
      if (value < 0) {
        throw new IllegalArgumentException("unsigned value must not be negative: " + value);
      }
    }

    @Override
    public String text() {
      return Long.toString(value);
    }
  }

  /** A {@code float} or {@code double}. */
  record FloatingPoint(double value) implements TraceValue {
    @Override
    public String text() {
      return Double.toString(value);
    }
  }

  /** A {@code boolean}. */
  record Bool(boolean value) implements TraceValue {
    @Override
    public String text() {
      return Boolean.toString(value);
    }
  }

  /** A string. */
  record Text(String value) implements TraceValue {
    @Override
    public String text() {
      return value;
    }
  }

  /** Anything else, captured through its textual form: null, void, arrays and objects. */
  record Opaque(String text) implements TraceValue {
  }

  /** Constants that interfaces cannot hold privately. */
  final class Literals {
    static final String TO_ARRAY = "()[Ljava/lang/Object;";

    static final Pattern INTEGER = Pattern.compile("-?\\d+");
    static final Pattern DECIMAL = Pattern.compile("-?(\\d+\\.\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    static final Set<String> WRAPPERS =
        Set.of(
            "java.lang.Boolean",
            "java.lang.Byte",
            "java.lang.Character",
            "java.lang.Short",
            "java.lang.Integer",
            "java.lang.Long",
            "java.lang.Float",
            "java.lang.Double");

    // Java builtin types are never rendered by their fields; those are implementation details
    static final List<String> BUILT_IN_PACKAGES =
        List.of("com.sun.", "java.", "javax.", "jdk.", "sun.");

    // types whose toString reads nothing but their own state
    static final Set<String> TEXTUAL_TYPES =
        Set.of(
            "java.lang.StringBuilder",
            "java.lang.StringBuffer",
            "java.math.BigInteger",
            "java.math.BigDecimal",
            "java.util.concurrent.atomic.AtomicBoolean",
            "java.util.concurrent.atomic.AtomicInteger",
            "java.util.concurrent.atomic.AtomicLong");

    private Literals() {}
  }
}
