package com.dailyreportbot.dailybot.blockkit.view;

import com.dailyreportbot.dailybot.blockkit.BlockKitConstraints;
import com.dailyreportbot.dailybot.blockkit.block.LayoutBlock;
import java.util.List;

public record HomeTabView(List<LayoutBlock> blocks) {

  public static final int MAX_BLOCKS = 100;

  public HomeTabView {
    blocks = BlockKitConstraints.requiredCount("blocks", blocks, 1, MAX_BLOCKS);
  }
}
