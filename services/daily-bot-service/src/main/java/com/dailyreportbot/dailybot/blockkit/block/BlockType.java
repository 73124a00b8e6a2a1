package com.dailyreportbot.dailybot.blockkit.block;

public enum BlockType {
  ACTIONS("actions"),
  INPUT("input"),
  DIVIDER("divider"),
  HEADER("header"),
  CONTEXT("context"),
  SECTION("section");

  private final String wireValue;

  BlockType(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }
}
