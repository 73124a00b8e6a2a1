package com.dailyreportbot.dailybot.blockkit.view;

import com.dailyreportbot.dailybot.blockkit.BlockKitConstraints;
import com.dailyreportbot.dailybot.blockkit.block.LayoutBlock;
import java.util.List;

/** Blocks of a chat message; serialized as a bare array. */
public record MessageLayout(List<LayoutBlock> blocks) {

  public static final int MAX_BLOCKS = 50;

  public MessageLayout {
    blocks = BlockKitConstraints.requiredCount("blocks", blocks, 1, MAX_BLOCKS);
  }
}
