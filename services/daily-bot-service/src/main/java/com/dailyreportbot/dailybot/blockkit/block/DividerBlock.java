package com.dailyreportbot.dailybot.blockkit.block;

import com.dailyreportbot.dailybot.blockkit.BlockKitConstraints;

public record DividerBlock(String blockId) implements LayoutBlock {

  public DividerBlock {
    BlockKitConstraints.length("block_id", blockId, MAX_BLOCK_ID_LENGTH);
  }

  public DividerBlock() {
    this(null);
  }

  @Override
  public BlockType type() {
    return BlockType.DIVIDER;
  }
}
