package com.dailyreportbot.dailybot.blockkit.view;

import com.dailyreportbot.dailybot.blockkit.BlockKitConstraints;
import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException;
import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException.Violation;
import com.dailyreportbot.dailybot.blockkit.BoundedText;
import com.dailyreportbot.dailybot.blockkit.TextKind;
import com.dailyreportbot.dailybot.blockkit.block.InputBlock;
import com.dailyreportbot.dailybot.blockkit.block.LayoutBlock;
import java.util.List;

/** Modal dialog. A modal that collects input has to offer a submit button. */
public record ModalView(
    String callbackId,
    BoundedText title,
    BoundedText submit,
    BoundedText close,
    List<LayoutBlock> blocks) {

  public static final int MAX_TITLE_LENGTH = 24;
  public static final int MAX_CALLBACK_ID_LENGTH = 255;
  public static final int MAX_BLOCKS = 100;

  public ModalView {
    BlockKitConstraints.length("callback_id", callbackId, MAX_CALLBACK_ID_LENGTH);
    BlockKitConstraints.requiredText("title", title, MAX_TITLE_LENGTH, TextKind.PLAIN);
    BlockKitConstraints.text("submit", submit, MAX_TITLE_LENGTH, TextKind.PLAIN);
    BlockKitConstraints.text("close", close, MAX_TITLE_LENGTH, TextKind.PLAIN);
    blocks = BlockKitConstraints.requiredCount("blocks", blocks, 1, MAX_BLOCKS);
    if (submit == null && blocks.stream().anyMatch(InputBlock.class::isInstance)) {
      throw new BlockKitValidationException(
          Violation.MISSING_REQUIRED_FIELD, "submit", "a modal with input blocks needs submit");
    }
  }
}
