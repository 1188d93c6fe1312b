package ca.gc.cra.tracing.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;

/**
 * <strong>What:</strong> Helpers that keep trace arguments readable and bounded in operator logs.
 * <p><strong>Why:</strong> Trace arguments are caller-supplied objects of any size; dumping them verbatim would flood
 * logs.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** Default byte budget for argument dumps. */
  public static final int DEFAULT_MAX_BYTES = 256;

  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String fallback = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return fallback + "... (truncated)";
    }
  }

  /**
   * Renders trace arguments as {@code name=value} pairs, each value truncated to {@code maxBytes}.
   *
   * @param args arguments; {@code null} or empty renders {@code "{}"}
   * @param maxBytes byte budget per value
   * @return printable form
   */
  public static String formatArgs(Map<String, ?> args, int maxBytes) {
    if (args == null || args.isEmpty()) {
      return "{}";
    }
    StringJoiner joiner = new StringJoiner(", ", "{", "}");
    for (Map.Entry<String, ?> entry : args.entrySet()) {
      joiner.add(entry.getKey() + "=" + truncate(String.valueOf(entry.getValue()), maxBytes));
    }
    return joiner.toString();
  }
}
