package com.dailyreportbot.dailybot.blockkit.block;

import com.dailyreportbot.dailybot.blockkit.BlockKitConstraints;
import com.dailyreportbot.dailybot.blockkit.BoundedText;
import com.dailyreportbot.dailybot.blockkit.TextKind;

public record HeaderBlock(String blockId, BoundedText text) implements LayoutBlock {

  public static final int MAX_TEXT_LENGTH = 150;

  public HeaderBlock {
    BlockKitConstraints.length("block_id", blockId, MAX_BLOCK_ID_LENGTH);
    BlockKitConstraints.requiredText("text", text, MAX_TEXT_LENGTH, TextKind.PLAIN);
  }

  public HeaderBlock(BoundedText text) {
    this(null, text);
  }

  public static HeaderBlock of(String text) {
    return new HeaderBlock(BoundedText.plain(text));
  }

  @Override
  public BlockType type() {
    return BlockType.HEADER;
  }
}
