package ca.gc.cra.tracing.domain.category;

import java.util.StringJoiner;

/**
 * Bit flags stored per category in the enablement table.
 *
 * <p>The two bits are independent: {@link #RECORDING} is set by explicit configuration or an operator, and
 * {@link #LISTENING} tracks whether at least one in-process listener is subscribed. A category is enabled when
 * either bit is set.</p>
 *
 * @since 0.1.0
 */
public final class CategoryFlags {
  /** Flags value for a category with no bits set. */
  public static final int NONE = 0;
  /** Unconditional capture by the recorder. */
  public static final int RECORDING = 1;
  /** At least one in-process listener exists. */
  public static final int LISTENING = 4;

  private CategoryFlags() {
    // Constants
  }

  public static boolean isEnabled(int flags) {
    return (flags & (RECORDING | LISTENING)) != 0;
  }

  public static boolean isRecording(int flags) {
    return (flags & RECORDING) != 0;
  }

  public static boolean isListening(int flags) {
    return (flags & LISTENING) != 0;
  }

  /**
   * Renders flags for log output, e.g. {@code RECORDING|LISTENING}.
   *
   * @param flags bit set
   * @return readable form; {@code NONE} when no bits are set
   */
  public static String describe(int flags) {
    StringJoiner joiner = new StringJoiner("|");
    if (isRecording(flags)) {
      joiner.add("RECORDING");
    }
    if (isListening(flags)) {
      joiner.add("LISTENING");
    }
    return joiner.length() == 0 ? "NONE" : joiner.toString();
  }
}
