package com.dailyreportbot.dailybot.blockkit.element;

import com.dailyreportbot.dailybot.blockkit.BlockKitConstraints;
import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException;
import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException.Violation;
import com.dailyreportbot.dailybot.blockkit.Option;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/** Checkbox group or radio button group. Radio buttons start with at most one selection. */
public record Selector(
    ElementType type, String actionId, List<Option> options, List<Option> initialOptions)
    implements BlockElement {

  public static final int MAX_OPTIONS = 10;

  public Selector {
    BlockKitConstraints.required("type", type);
    if (type != ElementType.CHECKBOXES && type != ElementType.RADIO_BUTTONS) {
      throw new BlockKitValidationException(
          Violation.KIND_MISMATCH, "type", "selector cannot be a " + type.wireValue());
    }
    BlockKitConstraints.length("action_id", actionId, MAX_ACTION_ID_LENGTH);
    options = BlockKitConstraints.requiredCount("options", options, 1, MAX_OPTIONS);
    int maxInitial = type == ElementType.RADIO_BUTTONS ? 1 : MAX_OPTIONS;
    initialOptions =
        BlockKitConstraints.count("initial_options", initialOptions, 1, maxInitial);
    if (initialOptions != null) {
      Set<String> declared = options.stream().map(Option::value).collect(Collectors.toSet());
      for (Option initial : initialOptions) {
        if (!declared.contains(initial.value())) {
          throw new BlockKitValidationException(
              Violation.REFERENCE_INTEGRITY_VIOLATION,
              "initial_options",
              "option `" + initial.value() + "` is not one of the declared options");
        }
      }
    }
  }

  public static Selector checkboxes(String actionId, List<Option> options) {
    return new Selector(ElementType.CHECKBOXES, actionId, options, null);
  }

  public static Selector radioButtons(String actionId, List<Option> options, Option initial) {
    return new Selector(
        ElementType.RADIO_BUTTONS, actionId, options, initial == null ? null : List.of(initial));
  }
}
