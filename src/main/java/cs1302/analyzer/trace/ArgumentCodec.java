package cs1302.analyzer.trace;

import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Transports positional arguments to the traced VM. Each argument travels as a single command-line
 * token and is converted back to the declared parameter type on the other side.
 *
 * <p>There are three kinds of tokens: {@value #NULL_TOKEN} for null, {@value #TOKEN_PREFIX}
 * followed by the Base64 of a value's text, and {@value #ARRAY_PREFIX} followed by the Base64 of
 * an array's element tokens. Element tokens are encoded the same way, so nested arrays, nulls and
 * elements containing any character survive the trip.
 */
public final class ArgumentCodec {

  /** Every text token starts with this, so an empty argument still produces a token. */
  static final String TOKEN_PREFIX = "_";

  /** Every array token starts with this. */
  static final String ARRAY_PREFIX = "@";

  /** Token standing in for a null argument. */
  static final String NULL_TOKEN = "-";

  /** Separates element tokens of an array; tokens never contain it. */
  private static final String ELEMENT_SEPARATOR = ",";

  private ArgumentCodec() {}

  /**
   * Encode an argument as a command-line token.
   *
   * @param argument The argument to encode, possibly null.
   * @return A token without whitespace.
   */
  public static String encode(Object argument) {
    if (argument == null) {
      return NULL_TOKEN;
    }
    if (argument.getClass().isArray()) {
      List<String> elements = new ArrayList<>();
      for (int i = 0; i < Array.getLength(argument); i++) {
        elements.add(encode(Array.get(argument, i)));
      }
      return ARRAY_PREFIX + base64(String.join(ELEMENT_SEPARATOR, elements));
    }
    return TOKEN_PREFIX + base64(String.valueOf(argument));
  }

  /**
   * Decode a text token produced by {@link #encode(Object)}.
   *
   * @param token The token.
   * @return The argument's text, or null for the null token.
   * @throws IllegalArgumentException If the token is malformed or an array token.
   */
  public static String decode(String token) {
    if (token.equals(NULL_TOKEN)) {
      return null;
    }
    if (!token.startsWith(TOKEN_PREFIX)) {
      throw new IllegalArgumentException("Malformed argument token: " + token);
    }
    return unbase64(token.substring(TOKEN_PREFIX.length()));
  }

  /**
   * Decode any token produced by {@link #encode(Object)} into a value of a parameter type.
   *
   * @param token The token.
   * @param type The declared parameter type.
   * @return A value assignable to {@code type}.
   * @throws IllegalArgumentException If the token is malformed, or does not denote a value of that
   *     type.
   */
  public static Object decode(String token, Class<?> type) {
    if (!token.startsWith(ARRAY_PREFIX)) {
      return convert(decode(token), type);
    }
    if (!type.isArray()) {
      throw new IllegalArgumentException("An array is not a valid " + type.getName());
    }
    String elements = unbase64(token.substring(ARRAY_PREFIX.length()));
    String[] tokens = elements.isEmpty() ? new String[0] : elements.split(ELEMENT_SEPARATOR, -1);
    Class<?> componentType = type.getComponentType();
    Object array = Array.newInstance(componentType, tokens.length);
    for (int i = 0; i < tokens.length; i++) {
      Array.set(array, i, decode(tokens[i], componentType));
    }
    return array;
  }

  /**
   * Convert an argument's text to a parameter type. Text for an array type is a comma separated
   * list of elements, which is how arrays are typed on the command line.
   *
   * @param text The decoded text, possibly null.
   * @param type The declared parameter type.
   * @return A value assignable to {@code type}.
   * @throws IllegalArgumentException If the text does not denote a value of that type or the type
   *     is not supported.
   */
  public static Object convert(String text, Class<?> type) {
    if (text == null) {
      if (type.isPrimitive()) {
        throw new IllegalArgumentException("null is not a valid " + type.getName());
      }
      return null;
    }
    if (type.isArray()) {
      Class<?> componentType = type.getComponentType();
      String[] parts = text.isEmpty() ? new String[0] : text.split(",", -1);
      Object array = Array.newInstance(componentType, parts.length);
      for (int i = 0; i < parts.length; i++) {
        Array.set(array, i, convert(parts[i], componentType));
      }
      return array;
    }

    String trimmed = text.trim();
    if (type == String.class || type == Object.class || type == CharSequence.class) {
      return text;
    } else if (type == int.class || type == Integer.class) {
      return Integer.parseInt(trimmed);
    } else if (type == long.class || type == Long.class) {
      return Long.parseLong(trimmed);
    } else if (type == double.class || type == Double.class) {
      return Double.parseDouble(trimmed);
    } else if (type == float.class || type == Float.class) {
      return Float.parseFloat(trimmed);
    } else if (type == short.class || type == Short.class) {
      return Short.parseShort(trimmed);
    } else if (type == byte.class || type == Byte.class) {
      return Byte.parseByte(trimmed);
    } else if (type == boolean.class || type == Boolean.class) {
      if (!trimmed.equalsIgnoreCase("true") && !trimmed.equalsIgnoreCase("false")) {
        throw new IllegalArgumentException("Not a boolean: " + text);
      }
      return Boolean.parseBoolean(trimmed);
    } else if (type == char.class || type == Character.class) {
      if (text.length() != 1) {
        throw new IllegalArgumentException("Not a single character: " + text);
      }
      return text.charAt(0);
    }
    throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
  }

  private static String base64(String text) {
    return Base64.getUrlEncoder()
        .withoutPadding()
        .encodeToString(text.getBytes(StandardCharsets.UTF_8));
  }

  private static String unbase64(String encoded) {
    return new String(Base64.getUrlDecoder().decode(encoded), StandardCharsets.UTF_8);
  }
}
