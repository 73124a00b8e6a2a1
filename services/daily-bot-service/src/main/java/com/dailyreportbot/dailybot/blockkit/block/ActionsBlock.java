package com.dailyreportbot.dailybot.blockkit.block;

import com.dailyreportbot.dailybot.blockkit.BlockKitConstraints;
import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException;
import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException.Violation;
import com.dailyreportbot.dailybot.blockkit.element.BlockElement;
import com.dailyreportbot.dailybot.blockkit.element.PlainTextInput;
import java.util.List;

/** A row of interactive elements. Text inputs belong in an {@link InputBlock} instead. */
public record ActionsBlock(String blockId, List<BlockElement> elements) implements LayoutBlock {

  public static final int MAX_ELEMENTS = 25;

  public ActionsBlock {
    BlockKitConstraints.length("block_id", blockId, MAX_BLOCK_ID_LENGTH);
    elements = BlockKitConstraints.requiredCount("elements", elements, 1, MAX_ELEMENTS);
    for (int i = 0; i < elements.size(); i++) {
      if (elements.get(i) instanceof PlainTextInput) {
        throw new BlockKitValidationException(
            Violation.KIND_MISMATCH,
            "elements[" + i + "]",
            "actions block cannot hold a " + elements.get(i).type().wireValue());
      }
    }
  }

  public static ActionsBlock of(BlockElement... elements) {
    return new ActionsBlock(null, List.of(elements));
  }

  @Override
  public BlockType type() {
    return BlockType.ACTIONS;
  }
}
