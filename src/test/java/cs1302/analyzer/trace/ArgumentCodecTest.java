package cs1302.analyzer.trace;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link ArgumentCodec}. */
public class ArgumentCodecTest {

  /** Ensure that tokens survive a command line: no whitespace, quotes or padding. */
  @Test
  public void testTokensAreCommandLineSafe() {
    String token = ArgumentCodec.encode("two words \"quoted\"\n");

    assertTrue(token.matches("_[A-Za-z0-9_-]*"));
    assertEquals("two words \"quoted\"\n", ArgumentCodec.decode(token));
  }

  /** Ensure that null has its own token. */
  @Test
  public void testNull() {
    assertEquals("-", ArgumentCodec.encode(null));
    assertNull(ArgumentCodec.decode("-"));
    assertNull(ArgumentCodec.decode("-", Integer.class));
    assertNull(ArgumentCodec.convert(null, String.class));
    assertThrows(IllegalArgumentException.class, () -> ArgumentCodec.convert(null, int.class));
  }

  /** Ensure that malformed tokens are rejected. */
  @Test
  public void testMalformedToken() {
    assertThrows(IllegalArgumentException.class, () -> ArgumentCodec.decode("abc"));
  }

  /** Ensure that arrays travel as their own token kind, element by element. */
  @Test
  public void testArrays() {
    String token = ArgumentCodec.encode(new int[] {3, 1, 2});

    assertTrue(token.matches("@[A-Za-z0-9_-]*"));
    assertArrayEquals(new int[] {3, 1, 2}, (int[]) ArgumentCodec.decode(token, int[].class));
    String empty = ArgumentCodec.encode(new String[0]);
    assertArrayEquals(new String[0], (String[]) ArgumentCodec.decode(empty, String[].class));
    assertThrows(IllegalArgumentException.class, () -> ArgumentCodec.decode(token));
    assertThrows(IllegalArgumentException.class, () -> ArgumentCodec.decode(token, int.class));
  }

  /** Ensure that array elements keep separators, empty strings and nulls. */
  @Test
  public void testStringArrayElements() {
    String[] elements = {"a,b", "", null, "c"};

    Object decoded = ArgumentCodec.decode(ArgumentCodec.encode(elements), String[].class);

    assertArrayEquals(elements, (String[]) decoded);
  }

  /** Ensure that nested arrays are passed element by element as well. */
  @Test
  public void testNestedArrays() {
    int[][] grid = {{1, 2}, {}, {3}};

    Object decoded = ArgumentCodec.decode(ArgumentCodec.encode(grid), int[][].class);

    assertArrayEquals(grid, (int[][]) decoded);
  }

  /** Ensure that array text typed on the command line is split at commas. */
  @Test
  public void testCommandLineArrays() {
    Object decoded = ArgumentCodec.decode(ArgumentCodec.encode("4,5,6"), int[].class);

    assertArrayEquals(new int[] {4, 5, 6}, (int[]) decoded);
    assertArrayEquals(new String[0], (String[]) ArgumentCodec.convert("", String[].class));
  }

  /** Ensure that text is converted to the declared parameter types. */
  @Test
  public void testConvert() {
    assertEquals(7, ArgumentCodec.convert(" 7", int.class));
    assertEquals(7L, ArgumentCodec.convert("7", Long.class));
    assertEquals(2.5, ArgumentCodec.convert("2.5", double.class));
    assertEquals(true, ArgumentCodec.convert("TRUE", boolean.class));
    assertEquals('x', ArgumentCodec.convert("x", char.class));
    assertEquals(" padded ", ArgumentCodec.convert(" padded ", String.class));
  }

  /** Ensure that unconvertible text and unsupported types are rejected. */
  @Test
  public void testConvertRejects() {
    assertThrows(NumberFormatException.class, () -> ArgumentCodec.convert("x", int.class));
    assertThrows(IllegalArgumentException.class, () -> ArgumentCodec.convert("yes", boolean.class));
    assertThrows(IllegalArgumentException.class, () -> ArgumentCodec.convert("ab", char.class));
    assertThrows(IllegalArgumentException.class, () -> ArgumentCodec.convert("1", List.class));
  }
}
