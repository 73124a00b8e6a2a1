package com.dailyreportbot.dailybot.blockkit.element;

public enum TriggerAction {
  ON_ENTER_PRESSED("on_enter_pressed"),
  ON_CHARACTER_ENTERED("on_character_entered");

  private final String wireValue;

  TriggerAction(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }
}
