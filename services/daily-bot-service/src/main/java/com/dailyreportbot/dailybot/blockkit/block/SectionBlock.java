package com.dailyreportbot.dailybot.blockkit.block;

import com.dailyreportbot.dailybot.blockkit.BlockKitConstraints;
import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException;
import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException.Violation;
import com.dailyreportbot.dailybot.blockkit.BoundedText;
import com.dailyreportbot.dailybot.blockkit.element.BlockElement;
import com.dailyreportbot.dailybot.blockkit.element.PlainTextInput;
import java.util.List;

/**
 * Text, a two-column list of fields, or both, with an optional accessory element on the right.
 */
public record SectionBlock(
    String blockId, BoundedText text, List<BoundedText> fields, BlockElement accessory)
    implements LayoutBlock {

  public static final int MAX_TEXT_LENGTH = 3000;
  public static final int MAX_FIELDS = 10;
  public static final int MAX_FIELD_LENGTH = 2000;

  public SectionBlock {
    BlockKitConstraints.length("block_id", blockId, MAX_BLOCK_ID_LENGTH);
    if (text == null && fields == null) {
      throw new BlockKitValidationException(
          Violation.MISSING_REQUIRED_FIELD, "text", "section needs `text` or `fields`");
    }
    BlockKitConstraints.text("text", text, MAX_TEXT_LENGTH, null);
    fields = BlockKitConstraints.count("fields", fields, 1, MAX_FIELDS);
    if (fields != null) {
      for (int i = 0; i < fields.size(); i++) {
        BlockKitConstraints.text("fields[" + i + "]", fields.get(i), MAX_FIELD_LENGTH, null);
      }
    }
    if (accessory instanceof PlainTextInput) {
      throw new BlockKitValidationException(
          Violation.KIND_MISMATCH, "accessory", "section accessory cannot be a text input");
    }
  }

  public static SectionBlock of(BoundedText text) {
    return new SectionBlock(null, text, null, null);
  }

  @Override
  public BlockType type() {
    return BlockType.SECTION;
  }
}
