package com.dailyreportbot.dailybot.blockkit;

import java.util.List;

public record OptionGroup(BoundedText label, List<Option> options) implements Choice {

  public static final int MAX_LABEL_LENGTH = 75;
  public static final int MAX_OPTIONS = 100;

  public OptionGroup {
    BlockKitConstraints.requiredText("label", label, MAX_LABEL_LENGTH, TextKind.PLAIN);
    options = BlockKitConstraints.requiredCount("options", options, 1, MAX_OPTIONS);
  }

  /** Member values in sorted order; two groups select the same thing when these are equal. */
  public List<String> sortedValues() {
    return options.stream().map(Option::value).sorted().toList();
  }
}
