package com.dailyreportbot.dailybot.blockkit.element;

import com.dailyreportbot.dailybot.blockkit.BlockKitConstraints;
import com.dailyreportbot.dailybot.blockkit.BoundedText;
import com.dailyreportbot.dailybot.blockkit.TextKind;

public record Button(
    String actionId,
    BoundedText text,
    String url,
    String value,
    ButtonStyle style,
    String accessibilityLabel)
    implements BlockElement {

  public static final int MAX_TEXT_LENGTH = 75;
  public static final int MAX_URL_LENGTH = 3000;
  public static final int MAX_VALUE_LENGTH = 2000;
  public static final int MAX_ACCESSIBILITY_LABEL_LENGTH = 75;

  public Button {
    BlockKitConstraints.length("action_id", actionId, MAX_ACTION_ID_LENGTH);
    BlockKitConstraints.requiredText("text", text, MAX_TEXT_LENGTH, TextKind.PLAIN);
    BlockKitConstraints.length("url", url, MAX_URL_LENGTH);
    BlockKitConstraints.length("value", value, MAX_VALUE_LENGTH);
    BlockKitConstraints.length(
        "accessibility_label", accessibilityLabel, MAX_ACCESSIBILITY_LABEL_LENGTH);
  }

  public static Button of(String actionId, String label, String value) {
    return new Button(actionId, BoundedText.plain(label), null, value, null, null);
  }

  public static Button link(String actionId, String label, String value, String url) {
    return new Button(actionId, BoundedText.plain(label), url, value, null, null);
  }

  @Override
  public ElementType type() {
    return ElementType.BUTTON;
  }
}
