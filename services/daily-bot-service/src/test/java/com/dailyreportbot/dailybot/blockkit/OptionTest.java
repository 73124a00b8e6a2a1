package com.dailyreportbot.dailybot.blockkit;

import static com.dailyreportbot.dailybot.blockkit.BlockKitAssertions.assertViolation;
import static org.assertj.core.api.Assertions.assertThat;

import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException.Violation;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class OptionTest {

  @Test
  void option_labelAndValue() {
    Option option = Option.of("In Progress");

    assertThat(option.text().text()).isEqualTo("In Progress");
    assertThat(option.value()).isEqualTo("In Progress");
    assertThat(option.description()).isNull();
  }

  @Test
  void option_textLongerThan75_isRejected() {
    assertViolation(
        () -> Option.of("t".repeat(76), "v"), Violation.LENGTH_EXCEEDED, "text");
  }

  @Test
  void option_emptyOrMissingValue_isRejected() {
    assertViolation(() -> Option.of("label", ""), Violation.MISSING_REQUIRED_FIELD, "value");
    assertViolation(() -> Option.of("label", null), Violation.MISSING_REQUIRED_FIELD, "value");
  }

  @Test
  void option_markdownDescription_isKindMismatch() {
    assertViolation(
        () -> new Option(BoundedText.plain("a"), "a", BoundedText.markdown("*d*"), null),
        Violation.KIND_MISMATCH,
        "description");
  }

  @Test
  void group_needsOneToHundredOptions() {
    assertViolation(
        () -> new OptionGroup(BoundedText.plain("empty"), List.of()),
        Violation.CARDINALITY_VIOLATION,
        "options");
    assertViolation(
        () -> new OptionGroup(BoundedText.plain("big"), options(101)),
        Violation.CARDINALITY_VIOLATION,
        "options");

    assertThat(new OptionGroup(BoundedText.plain("ok"), options(100)).options()).hasSize(100);
  }

  @Test
  void group_labelMustBePlain() {
    assertViolation(
        () -> new OptionGroup(BoundedText.markdown("*g*"), options(1)),
        Violation.KIND_MISMATCH,
        "label");
  }

  @Test
  void group_copiesOptions() {
    List<Option> source = new ArrayList<>(options(2));
    OptionGroup group = new OptionGroup(BoundedText.plain("g"), source);

    source.add(Option.of("late"));

    assertThat(group.options()).hasSize(2);
  }

  @Test
  void group_sortedValues_ignoresDeclarationOrder() {
    OptionGroup group =
        new OptionGroup(BoundedText.plain("g"), List.of(Option.of("b"), Option.of("a")));

    assertThat(group.sortedValues()).containsExactly("a", "b");
  }

  static List<Option> options(int count) {
    List<Option> out = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      out.add(Option.of("option " + i, "v" + i));
    }
    return out;
  }
}
