package com.dailyreportbot.dailybot.blockkit.element;

import com.dailyreportbot.dailybot.blockkit.BlockKitConstraints;
import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException;
import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException.Violation;
import com.dailyreportbot.dailybot.blockkit.Choice;
import com.dailyreportbot.dailybot.blockkit.Option;
import com.dailyreportbot.dailybot.blockkit.OptionGroup;
import java.util.List;

/** Reference checks between a select menu's declared options and its initial selection. */
final class OptionSources {

  static final int MAX_OPTIONS = 100;

  private OptionSources() {}

  /**
   * Validates the flat/grouped option lists of a select menu. Counts are checked before
   * exclusivity so an empty list is reported as a cardinality problem.
   */
  static void requireOneSource(List<Option> options, List<OptionGroup> optionGroups) {
    BlockKitConstraints.exactlyOne("options", options, "option_groups", optionGroups);
  }

  /**
   * An option must match a declared option by value (inside the groups when the menu is grouped).
   * A group must match a declared group by its sorted member values.
   */
  static void requireDeclared(
      String field, Choice choice, List<Option> options, List<OptionGroup> optionGroups) {
    if (choice instanceof Option option) {
      if (!declaredOptions(options, optionGroups).stream()
          .anyMatch(o -> o.value().equals(option.value()))) {
        throw new BlockKitValidationException(
            Violation.REFERENCE_INTEGRITY_VIOLATION,
            field,
            "option `" + option.value() + "` is not one of the declared options");
      }
      return;
    }
    if (choice instanceof OptionGroup group) {
      List<String> values = group.sortedValues();
      boolean declared =
          optionGroups != null
              && optionGroups.stream().anyMatch(g -> g.sortedValues().equals(values));
      if (!declared) {
        throw new BlockKitValidationException(
            Violation.REFERENCE_INTEGRITY_VIOLATION,
            field,
            "group " + values + " is not one of the declared option groups");
      }
    }
  }

  private static List<Option> declaredOptions(
      List<Option> options, List<OptionGroup> optionGroups) {
    if (options != null) {
      return options;
    }
    if (optionGroups == null) {
      return List.of();
    }
    return optionGroups.stream().flatMap(g -> g.options().stream()).toList();
  }
}
