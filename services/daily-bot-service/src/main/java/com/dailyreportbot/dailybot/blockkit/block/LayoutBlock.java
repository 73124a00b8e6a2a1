package com.dailyreportbot.dailybot.blockkit.block;

/** Top-level layout unit of a document. The set of variants is closed. */
public sealed interface LayoutBlock
    permits ActionsBlock, InputBlock, DividerBlock, HeaderBlock, ContextBlock, SectionBlock {

  int MAX_BLOCK_ID_LENGTH = 255;

  BlockType type();

  String blockId();
}
