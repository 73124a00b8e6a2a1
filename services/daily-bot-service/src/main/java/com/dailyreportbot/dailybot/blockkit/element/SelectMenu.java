package com.dailyreportbot.dailybot.blockkit.element;

import com.dailyreportbot.dailybot.blockkit.BlockKitConstraints;
import com.dailyreportbot.dailybot.blockkit.BoundedText;
import com.dailyreportbot.dailybot.blockkit.Choice;
import com.dailyreportbot.dailybot.blockkit.Option;
import com.dailyreportbot.dailybot.blockkit.OptionGroup;
import com.dailyreportbot.dailybot.blockkit.TextKind;
import java.util.List;

/**
 * Single static select. Exactly one of {@code options} / {@code optionGroups} is set; {@code
 * initialOption} has to point at something declared in it.
 */
public record SelectMenu(
    String actionId,
    BoundedText placeholder,
    List<Option> options,
    List<OptionGroup> optionGroups,
    Choice initialOption)
    implements BlockElement {

  public static final int MAX_PLACEHOLDER_LENGTH = 150;

  public SelectMenu {
    BlockKitConstraints.length("action_id", actionId, MAX_ACTION_ID_LENGTH);
    BlockKitConstraints.requiredText(
        "placeholder", placeholder, MAX_PLACEHOLDER_LENGTH, TextKind.PLAIN);
    options = BlockKitConstraints.count("options", options, 1, OptionSources.MAX_OPTIONS);
    optionGroups =
        BlockKitConstraints.count("option_groups", optionGroups, 1, OptionSources.MAX_OPTIONS);
    OptionSources.requireOneSource(options, optionGroups);
    if (initialOption != null) {
      OptionSources.requireDeclared("initial_option", initialOption, options, optionGroups);
    }
  }

  public static SelectMenu of(
      String actionId, String placeholder, List<Option> options, Option initialOption) {
    return new SelectMenu(
        actionId, BoundedText.plain(placeholder), options, null, initialOption);
  }

  @Override
  public ElementType type() {
    return ElementType.STATIC_SELECT;
  }
}
