package com.dailyreportbot.dailybot.blockkit.block;

import com.dailyreportbot.dailybot.blockkit.BlockKitConstraints;
import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException;
import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException.Violation;
import com.dailyreportbot.dailybot.blockkit.BoundedText;
import com.dailyreportbot.dailybot.blockkit.TextKind;
import com.dailyreportbot.dailybot.blockkit.element.BlockElement;
import com.dailyreportbot.dailybot.blockkit.element.Button;

/** A labelled form field. Its value arrives in the view state on submission. */
public record InputBlock(
    String blockId,
    BoundedText label,
    BlockElement element,
    BoundedText hint,
    Boolean optional,
    Boolean dispatchAction)
    implements LayoutBlock {

  public static final int MAX_LABEL_LENGTH = 2000;
  public static final int MAX_HINT_LENGTH = 2000;

  public InputBlock {
    BlockKitConstraints.length("block_id", blockId, MAX_BLOCK_ID_LENGTH);
    BlockKitConstraints.requiredText("label", label, MAX_LABEL_LENGTH, TextKind.PLAIN);
    BlockKitConstraints.required("element", element);
    if (element instanceof Button) {
      throw new BlockKitValidationException(
          Violation.KIND_MISMATCH, "element", "input block cannot hold a button");
    }
    BlockKitConstraints.text("hint", hint, MAX_HINT_LENGTH, TextKind.PLAIN);
  }

  public static InputBlock of(String blockId, String label, BlockElement element) {
    return new InputBlock(blockId, BoundedText.plain(label), element, null, null, null);
  }

  public static InputBlock optional(String blockId, String label, BlockElement element) {
    return new InputBlock(blockId, BoundedText.plain(label), element, null, true, null);
  }

  @Override
  public BlockType type() {
    return BlockType.INPUT;
  }
}
