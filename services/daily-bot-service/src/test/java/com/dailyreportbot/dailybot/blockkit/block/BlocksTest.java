package com.dailyreportbot.dailybot.blockkit.block;

import static com.dailyreportbot.dailybot.blockkit.BlockKitAssertions.assertViolation;
import static org.assertj.core.api.Assertions.assertThat;

import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException.Violation;
import com.dailyreportbot.dailybot.blockkit.BoundedText;
import com.dailyreportbot.dailybot.blockkit.element.BlockElement;
import com.dailyreportbot.dailybot.blockkit.element.Button;
import com.dailyreportbot.dailybot.blockkit.element.PlainTextInput;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class BlocksTest {

  @Test
  void actions_twentySixButtons_isCardinalityViolation() {
    assertViolation(
        () -> new ActionsBlock(null, buttons(26)), Violation.CARDINALITY_VIOLATION, "elements");
  }

  @Test
  void actions_twentyFiveButtons_isAccepted() {
    assertThat(new ActionsBlock("row", buttons(25)).elements()).hasSize(25);
  }

  @Test
  void actions_textInput_isKindMismatch() {
    assertViolation(
        () -> ActionsBlock.of(Button.of("b", "ok", "v"), PlainTextInput.of("t")),
        Violation.KIND_MISMATCH,
        "elements[1]");
  }

  @Test
  void input_requiresPlainLabelAndElement() {
    assertViolation(
        () ->
            new InputBlock(
                "i", BoundedText.markdown("*x*"), PlainTextInput.of("t"), null, null, null),
        Violation.KIND_MISMATCH,
        "label");
    assertViolation(
        () -> new InputBlock("i", BoundedText.plain("x"), null, null, null, null),
        Violation.MISSING_REQUIRED_FIELD,
        "element");
  }

  @Test
  void input_button_isKindMismatch() {
    assertViolation(
        () -> InputBlock.of("i", "label", Button.of("b", "ok", "v")),
        Violation.KIND_MISMATCH,
        "element");
  }

  @Test
  void header_plainOnlyUpTo150() {
    assertThat(HeaderBlock.of("h".repeat(150)).text().text()).hasSize(150);

    assertViolation(() -> HeaderBlock.of("h".repeat(151)), Violation.LENGTH_EXCEEDED, "text");
    assertViolation(
        () -> new HeaderBlock(BoundedText.markdown("*h*")), Violation.KIND_MISMATCH, "text");
  }

  @Test
  void context_oneToTenElements() {
    List<BoundedText> eleven = new ArrayList<>();
    for (int i = 0; i < 11; i++) {
      eleven.add(BoundedText.plain("c" + i));
    }

    assertViolation(
        () -> new ContextBlock(null, eleven), Violation.CARDINALITY_VIOLATION, "elements");
    assertViolation(
        () -> new ContextBlock(null, List.of()), Violation.CARDINALITY_VIOLATION, "elements");
  }

  @Test
  void section_needsTextOrFields() {
    assertViolation(
        () -> new SectionBlock(null, null, null, null), Violation.MISSING_REQUIRED_FIELD, "text");

    SectionBlock fieldsOnly =
        new SectionBlock(null, null, List.of(BoundedText.plain("a"), BoundedText.plain("b")), null);
    assertThat(fieldsOnly.fields()).hasSize(2);
  }

  @Test
  void section_fieldLimits() {
    assertViolation(
        () -> new SectionBlock(null, null, List.of(BoundedText.plain("f".repeat(2001))), null),
        Violation.LENGTH_EXCEEDED,
        "fields[0]");
  }

  @Test
  void section_textInputAccessory_isKindMismatch() {
    assertViolation(
        () -> new SectionBlock(null, BoundedText.plain("x"), null, PlainTextInput.of("t")),
        Violation.KIND_MISMATCH,
        "accessory");
  }

  @Test
  void blockId_longerThan255_isRejected() {
    assertViolation(
        () -> new DividerBlock("d".repeat(256)), Violation.LENGTH_EXCEEDED, "block_id");
  }

  @Test
  void blocks_copyTheirLists() {
    List<BlockElement> elements = new ArrayList<>(buttons(1));
    ActionsBlock block = new ActionsBlock(null, elements);

    elements.add(Button.of("late", "late", "late"));

    assertThat(block.elements()).hasSize(1);
  }

  private static List<BlockElement> buttons(int count) {
    List<BlockElement> out = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      out.add(Button.of("button-" + i, "Button " + i, "v" + i));
    }
    return out;
  }
}
