package com.dailyreportbot.dailybot.blockkit;

public enum TextKind {
  PLAIN("plain_text"),
  MARKDOWN("mrkdwn");

  private final String wireValue;

  TextKind(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }
}
