package com.dailyreportbot.dailybot.domain;

import java.util.Arrays;
import java.util.Optional;

public enum JiraHostType {
  CLOUD("Cloud"),
  LOCAL("Local");

  private final String label;

  JiraHostType(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public static Optional<JiraHostType> fromLabel(String label) {
    return Arrays.stream(values()).filter(t -> t.label.equals(label)).findFirst();
  }
}
