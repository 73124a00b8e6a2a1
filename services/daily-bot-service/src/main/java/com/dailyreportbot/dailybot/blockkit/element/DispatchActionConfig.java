package com.dailyreportbot.dailybot.blockkit.element;

import com.dailyreportbot.dailybot.blockkit.BlockKitConstraints;
import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException;
import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException.Violation;
import java.util.HashSet;
import java.util.List;

/** When a text input should emit a block action instead of waiting for the form submit. */
public record DispatchActionConfig(List<TriggerAction> triggerActionsOn) {

  public DispatchActionConfig {
    triggerActionsOn =
        BlockKitConstraints.requiredCount(
            "trigger_actions_on", triggerActionsOn, 1, TriggerAction.values().length);
    if (new HashSet<>(triggerActionsOn).size() != triggerActionsOn.size()) {
      throw new BlockKitValidationException(
          Violation.CARDINALITY_VIOLATION, "trigger_actions_on", "duplicate trigger");
    }
  }

  public static DispatchActionConfig of(TriggerAction... triggers) {
    return new DispatchActionConfig(List.of(triggers));
  }
}
