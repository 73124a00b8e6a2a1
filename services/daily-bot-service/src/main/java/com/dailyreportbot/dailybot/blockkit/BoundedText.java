package com.dailyreportbot.dailybot.blockkit;

import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException.Violation;

/**
 * Text object of the block kit: a string tagged with its display kind and the limit it was
 * validated against.
 *
 * <p>{@code emoji} is only meaningful for plain text, {@code verbatim} only for markdown; either
 * flag on the wrong kind is rejected. Consumers re-check the text against their own field limit,
 * so a text built with the default limit can still be refused by a tighter field.
 */
public record BoundedText(
    TextKind kind, String text, int maxLength, Boolean emoji, Boolean verbatim) {

  public static final int DEFAULT_MAX_LENGTH = 3000;
  public static final String ELLIPSIS = "...";

  public BoundedText {
    BlockKitConstraints.required("type", kind);
    BlockKitConstraints.required("text", text);
    if (maxLength < 1) {
      throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
    }
    BlockKitConstraints.length("text", text, maxLength);
    if (emoji != null && kind != TextKind.PLAIN) {
      throw new BlockKitValidationException(
          Violation.KIND_MISMATCH,
          "emoji",
          "emoji field can only be used with " + TextKind.PLAIN.wireValue() + " text");
    }
    if (verbatim != null && kind != TextKind.MARKDOWN) {
      throw new BlockKitValidationException(
          Violation.KIND_MISMATCH,
          "verbatim",
          "verbatim field can only be used with " + TextKind.MARKDOWN.wireValue() + " text");
    }
  }

  public static BoundedText of(TextKind kind, String text, int maxLength, LengthPolicy policy) {
    return of(kind, text, maxLength, policy, null);
  }

  public static BoundedText of(
      TextKind kind, String text, int maxLength, LengthPolicy policy, TextKind restrictKind) {
    if (restrictKind != null && kind != restrictKind) {
      String actual = kind == null ? null : kind.wireValue();
      throw new BlockKitValidationException(
          Violation.KIND_MISMATCH,
          "type",
          "must be " + restrictKind.wireValue() + ", got " + actual);
    }
    String value = policy == LengthPolicy.TRUNCATE ? truncate(text, maxLength) : text;
    return new BoundedText(kind, value, maxLength, null, null);
  }

  public static BoundedText plain(String text) {
    return new BoundedText(TextKind.PLAIN, text, DEFAULT_MAX_LENGTH, null, null);
  }

  public static BoundedText plain(String text, boolean emoji) {
    return new BoundedText(TextKind.PLAIN, text, DEFAULT_MAX_LENGTH, emoji, null);
  }

  public static BoundedText markdown(String text) {
    return new BoundedText(TextKind.MARKDOWN, text, DEFAULT_MAX_LENGTH, null, null);
  }

  public static BoundedText markdown(String text, boolean verbatim) {
    return new BoundedText(TextKind.MARKDOWN, text, DEFAULT_MAX_LENGTH, null, verbatim);
  }

  /**
   * Keeps the first {@code maxLength - 3} characters and appends {@link #ELLIPSIS}. A surrogate
   * pair cut in half is dropped whole, so the result may be one character shorter.
   */
  public static String truncate(String text, int maxLength) {
    if (text == null || text.length() <= maxLength) {
      return text;
    }
    if (maxLength < ELLIPSIS.length()) {
      throw new BlockKitValidationException(
          Violation.LENGTH_EXCEEDED,
          "text",
          "text of " + text.length() + " characters cannot be truncated to " + maxLength);
    }
    int cut = maxLength - ELLIPSIS.length();
    if (cut > 0 && Character.isHighSurrogate(text.charAt(cut - 1))) {
      cut--;
    }
    return text.substring(0, cut) + ELLIPSIS;
  }
}
