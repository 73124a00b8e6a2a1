package com.dailyreportbot.dailybot.gui;

import static org.assertj.core.api.Assertions.assertThat;

import com.dailyreportbot.dailybot.blockkit.BlockKitSerializer;
import com.dailyreportbot.dailybot.blockkit.TextKind;
import com.dailyreportbot.dailybot.blockkit.block.ContextBlock;
import com.dailyreportbot.dailybot.blockkit.block.HeaderBlock;
import com.dailyreportbot.dailybot.blockkit.block.SectionBlock;
import com.dailyreportbot.dailybot.blockkit.element.Button;
import com.dailyreportbot.dailybot.blockkit.view.MessageLayout;
import com.dailyreportbot.dailybot.domain.DailyDocument;
import com.dailyreportbot.dailybot.domain.DailyIssueReport;
import com.dailyreportbot.dailybot.domain.DailyReport;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DailyMessageBuilderTest {

  private static final LocalDate DATE = LocalDate.of(2024, 5, 1);

  private final DailyMessageBuilder builder = new DailyMessageBuilder();

  @Test
  void header_and_hint_lead_every_message() {
    DailyDocument daily = daily(1);

    MessageLayout message = builder.build(daily, true);

    assertThat(BlockKitSerializer.block(message.blocks().get(0)))
        .isEqualTo(
            Map.of(
                "type",
                "header",
                "text",
                Map.of("type", "plain_text", "text", "Daily Report for 2024-05-01")));
    assertThat(message.blocks().get(1)).isInstanceOf(ContextBlock.class);
    assertThat(builder.title(daily)).isEqualTo("Daily Report for 2024-05-01");
  }

  @Test
  void rich_oneIssue_sectionFieldsDetailsDivider() {
    MessageLayout message = builder.build(daily(1), true);

    // header, context, summary, fields, details, divider
    assertThat(message.blocks()).hasSize(6);
    SectionBlock summary = (SectionBlock) message.blocks().get(2);
    assertThat(summary.text().text()).isEqualTo("EDGE-0 - Issue 0");
    SectionBlock fields = (SectionBlock) message.blocks().get(3);
    assertThat(fields.fields()).extracting(t -> t.text()).containsExactly("Done", "*<@U1>*");
    Button open = (Button) fields.accessory();
    assertThat(open.actionId()).isEqualTo(ActionIds.OPEN_IN_JIRA);
    assertThat(open.url()).isEqualTo("https://jira/EDGE-0");
    SectionBlock details = (SectionBlock) message.blocks().get(4);
    assertThat(details.text().text()).isEqualTo(":speech_balloon: worked on 0");
    assertThat(details.text().emoji()).isTrue();
  }

  @Test
  void rich_generalComments_getTheirOwnHeader() {
    DailyDocument daily =
        new DailyDocument("core", DATE)
            .withReport("U2", new DailyReport(List.of(), "on call tomorrow"));

    MessageLayout message = builder.build(daily, true);

    assertThat(((HeaderBlock) message.blocks().get(2)).text().text())
        .isEqualTo("General Comments");
    assertThat(((ContextBlock) message.blocks().get(3)).elements().get(0).text())
        .isEqualTo("<@U2>");
  }

  @Test
  void rich_missingStatus_isShownAsUnknown() {
    DailyDocument daily =
        new DailyDocument("core", DATE)
            .withReport(
                "U1",
                new DailyReport(
                    List.of(
                        new DailyIssueReport("EDGE-9", null, null, "https://jira/EDGE-9", "s")),
                    null));

    MessageLayout message = builder.build(daily, true);

    SectionBlock fields = (SectionBlock) message.blocks().get(3);
    assertThat(fields.fields().get(0).text()).isEqualTo("Unknown");
    // no details section
    assertThat(message.blocks()).hasSize(5);
  }

  @Test
  void plain_rendersOneMarkdownSection() {
    MessageLayout message = builder.build(daily(2), false);

    assertThat(message.blocks()).hasSize(3);
    SectionBlock section = (SectionBlock) message.blocks().get(2);
    assertThat(section.text().kind()).isEqualTo(TextKind.MARKDOWN);
    assertThat(section.text().text())
        .isEqualTo(
            "<@U1>:\n"
                + " - <https://jira/EDGE-0|Issue 0> - Done - worked on 0\n"
                + " - <https://jira/EDGE-1|Issue 1> - Done - worked on 1");
  }

  @Test
  void rich_overFiftyBlocks_fallsBackToPlainSection() {
    MessageLayout message = builder.build(daily(13), true);

    assertThat(message.blocks()).hasSize(3);
    assertThat(((SectionBlock) message.blocks().get(2)).text().kind())
        .isEqualTo(TextKind.MARKDOWN);
  }

  @Test
  void plain_longReport_isTruncated() {
    DailyDocument daily =
        new DailyDocument("core", DATE)
            .withReport("U1", new DailyReport(List.of(), "c".repeat(5000)));

    MessageLayout message = builder.build(daily, false);

    String text = ((SectionBlock) message.blocks().get(2)).text().text();
    assertThat(text).hasSize(SectionBlock.MAX_TEXT_LENGTH).endsWith("...");
  }

  @Test
  void noReports_onlyHeaderAndHint() {
    MessageLayout message = builder.build(new DailyDocument("core", DATE), false);

    assertThat(message.blocks()).hasSize(2);
  }

  private static DailyDocument daily(int issues) {
    List<DailyIssueReport> reports = new ArrayList<>();
    for (int i = 0; i < issues; i++) {
      reports.add(
          new DailyIssueReport(
              "EDGE-" + i, "Done", "worked on " + i, "https://jira/EDGE-" + i, "Issue " + i));
    }
    DailyDocument daily =
        new DailyDocument("core", DATE)
            .withReport("U1", new DailyReport(reports, null));
    return daily;
  }
}
