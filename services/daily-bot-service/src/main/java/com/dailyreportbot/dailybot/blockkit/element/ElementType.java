package com.dailyreportbot.dailybot.blockkit.element;

public enum ElementType {
  BUTTON("button"),
  STATIC_SELECT("static_select"),
  MULTI_STATIC_SELECT("multi_static_select"),
  CHECKBOXES("checkboxes"),
  RADIO_BUTTONS("radio_buttons"),
  PLAIN_TEXT_INPUT("plain_text_input");

  private final String wireValue;

  ElementType(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }
}
