package com.dailyreportbot.dailybot.blockkit;

/**
 * A selectable choice. {@code value} is what the platform sends back when the option is picked.
 *
 * <p>{@code url} is only honoured by overflow menus.
 */
public record Option(BoundedText text, String value, BoundedText description, String url)
    implements Choice {

  public static final int MAX_TEXT_LENGTH = 75;
  public static final int MAX_VALUE_LENGTH = 75;
  public static final int MAX_URL_LENGTH = 3000;

  public Option {
    BlockKitConstraints.requiredText("text", text, MAX_TEXT_LENGTH, null);
    BlockKitConstraints.requiredLength("value", value, MAX_VALUE_LENGTH);
    if (value.isEmpty()) {
      throw new BlockKitValidationException(
          BlockKitValidationException.Violation.MISSING_REQUIRED_FIELD,
          "value",
          "value must not be empty");
    }
    BlockKitConstraints.text("description", description, MAX_TEXT_LENGTH, TextKind.PLAIN);
    BlockKitConstraints.length("url", url, MAX_URL_LENGTH);
  }

  public static Option of(String text, String value) {
    return new Option(BoundedText.plain(text), value, null, null);
  }

  /** Option whose label and value are the same string. */
  public static Option of(String label) {
    return of(label, label);
  }
}
