package com.dailyreportbot.dailybot.blockkit.element;

public enum ButtonStyle {
  PRIMARY("primary"),
  DANGER("danger");

  private final String wireValue;

  ButtonStyle(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }
}
