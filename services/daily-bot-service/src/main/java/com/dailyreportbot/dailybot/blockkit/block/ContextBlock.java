package com.dailyreportbot.dailybot.blockkit.block;

import com.dailyreportbot.dailybot.blockkit.BlockKitConstraints;
import com.dailyreportbot.dailybot.blockkit.BoundedText;
import java.util.List;

/** Small secondary text under other content. */
public record ContextBlock(String blockId, List<BoundedText> elements) implements LayoutBlock {

  public static final int MAX_ELEMENTS = 10;

  public ContextBlock {
    BlockKitConstraints.length("block_id", blockId, MAX_BLOCK_ID_LENGTH);
    elements = BlockKitConstraints.requiredCount("elements", elements, 1, MAX_ELEMENTS);
    for (int i = 0; i < elements.size(); i++) {
      BlockKitConstraints.text(
          "elements[" + i + "]", elements.get(i), BoundedText.DEFAULT_MAX_LENGTH, null);
    }
  }

  public static ContextBlock of(BoundedText... elements) {
    return new ContextBlock(null, List.of(elements));
  }

  @Override
  public BlockType type() {
    return BlockType.CONTEXT;
  }
}
