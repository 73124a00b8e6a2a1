package com.dailyreportbot.dailybot.blockkit.element;

import com.dailyreportbot.dailybot.blockkit.BlockKitConstraints;
import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException;
import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException.Violation;
import com.dailyreportbot.dailybot.blockkit.BoundedText;
import com.dailyreportbot.dailybot.blockkit.Choice;
import com.dailyreportbot.dailybot.blockkit.Option;
import com.dailyreportbot.dailybot.blockkit.OptionGroup;
import com.dailyreportbot.dailybot.blockkit.TextKind;
import java.util.List;

/** Multi static select. Same option rules as {@link SelectMenu}, for every initial choice. */
public record MultiSelectMenu(
    String actionId,
    BoundedText placeholder,
    List<Option> options,
    List<OptionGroup> optionGroups,
    List<Choice> initialOptions,
    Integer maxSelectedItems)
    implements BlockElement {

  public MultiSelectMenu {
    BlockKitConstraints.length("action_id", actionId, MAX_ACTION_ID_LENGTH);
    BlockKitConstraints.requiredText(
        "placeholder", placeholder, SelectMenu.MAX_PLACEHOLDER_LENGTH, TextKind.PLAIN);
    options = BlockKitConstraints.count("options", options, 1, OptionSources.MAX_OPTIONS);
    optionGroups =
        BlockKitConstraints.count("option_groups", optionGroups, 1, OptionSources.MAX_OPTIONS);
    OptionSources.requireOneSource(options, optionGroups);
    BlockKitConstraints.range(
        "max_selected_items",
        maxSelectedItems,
        1,
        Integer.MAX_VALUE,
        Violation.CARDINALITY_VIOLATION);
    initialOptions =
        BlockKitConstraints.count(
            "initial_options", initialOptions, 1, OptionSources.MAX_OPTIONS);
    if (initialOptions != null) {
      if (maxSelectedItems != null && initialOptions.size() > maxSelectedItems) {
        throw new BlockKitValidationException(
            Violation.CARDINALITY_VIOLATION,
            "initial_options",
            initialOptions.size()
                + " initial options exceed max_selected_items "
                + maxSelectedItems);
      }
      for (int i = 0; i < initialOptions.size(); i++) {
        OptionSources.requireDeclared(
            "initial_options[" + i + "]", initialOptions.get(i), options, optionGroups);
      }
    }
  }

  public static MultiSelectMenu of(String actionId, String placeholder, List<Option> options) {
    return new MultiSelectMenu(
        actionId, BoundedText.plain(placeholder), options, null, null, null);
  }

  @Override
  public ElementType type() {
    return ElementType.MULTI_STATIC_SELECT;
  }
}
