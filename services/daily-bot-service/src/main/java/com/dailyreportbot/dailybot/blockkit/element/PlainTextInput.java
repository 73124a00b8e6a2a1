package com.dailyreportbot.dailybot.blockkit.element;

import com.dailyreportbot.dailybot.blockkit.BlockKitConstraints;
import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException;
import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException.Violation;
import com.dailyreportbot.dailybot.blockkit.BoundedText;
import com.dailyreportbot.dailybot.blockkit.TextKind;

public record PlainTextInput(
    String actionId,
    BoundedText placeholder,
    String initialValue,
    Boolean multiline,
    Integer minLength,
    Integer maxLength,
    DispatchActionConfig dispatchActionConfig)
    implements BlockElement {

  public static final int MAX_PLACEHOLDER_LENGTH = 150;
  public static final int MAX_INPUT_LENGTH = 3000;

  public PlainTextInput {
    BlockKitConstraints.length("action_id", actionId, MAX_ACTION_ID_LENGTH);
    BlockKitConstraints.text("placeholder", placeholder, MAX_PLACEHOLDER_LENGTH, TextKind.PLAIN);
    BlockKitConstraints.range(
        "min_length", minLength, 0, MAX_INPUT_LENGTH - 1, Violation.LENGTH_EXCEEDED);
    BlockKitConstraints.range(
        "max_length", maxLength, 1, MAX_INPUT_LENGTH, Violation.LENGTH_EXCEEDED);
    if (minLength != null && maxLength != null && minLength > maxLength) {
      throw new BlockKitValidationException(
          Violation.LENGTH_EXCEEDED,
          "min_length",
          "min_length " + minLength + " is greater than max_length " + maxLength);
    }
    BlockKitConstraints.length(
        "initial_value", initialValue, maxLength == null ? MAX_INPUT_LENGTH : maxLength);
  }

  public static PlainTextInput of(String actionId) {
    return new PlainTextInput(actionId, null, null, null, null, null, null);
  }

  public static PlainTextInput multiline(String actionId) {
    return new PlainTextInput(actionId, null, null, true, null, null, null);
  }

  @Override
  public ElementType type() {
    return ElementType.PLAIN_TEXT_INPUT;
  }
}
