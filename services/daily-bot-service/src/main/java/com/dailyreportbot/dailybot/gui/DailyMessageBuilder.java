package com.dailyreportbot.dailybot.gui;

import com.dailyreportbot.dailybot.blockkit.BoundedText;
import com.dailyreportbot.dailybot.blockkit.LengthPolicy;
import com.dailyreportbot.dailybot.blockkit.TextKind;
import com.dailyreportbot.dailybot.blockkit.block.ContextBlock;
import com.dailyreportbot.dailybot.blockkit.block.DividerBlock;
import com.dailyreportbot.dailybot.blockkit.block.HeaderBlock;
import com.dailyreportbot.dailybot.blockkit.block.LayoutBlock;
import com.dailyreportbot.dailybot.blockkit.block.SectionBlock;
import com.dailyreportbot.dailybot.blockkit.element.Button;
import com.dailyreportbot.dailybot.blockkit.view.MessageLayout;
import com.dailyreportbot.dailybot.domain.DailyDocument;
import com.dailyreportbot.dailybot.domain.DailyIssueReport;
import com.dailyreportbot.dailybot.domain.DailyReport;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** The team's daily report as posted to its channel. */
@Component
@Slf4j
public class DailyMessageBuilder {

  private static final String UNKNOWN_STATUS = "Unknown";

  public String title(DailyDocument daily) {
    return "Daily Report for " + daily.getDate();
  }

  /**
   * @param rich one section per issue with an "Open in Jira" button; falls back to the plain
   *     rendition when that would not fit into one message
   */
  public MessageLayout build(DailyDocument daily, boolean rich) {
    List<LayoutBlock> blocks = new ArrayList<>();
    blocks.add(HeaderBlock.of(title(daily)));
    blocks.add(
        ContextBlock.of(BoundedText.plain("Feel free to extend and comment in the thread.")));

    List<LayoutBlock> body = rich ? richBody(daily) : plainBody(daily);
    if (rich && blocks.size() + body.size() > MessageLayout.MAX_BLOCKS) {
      log.warn(
          "Daily {} needs {} blocks, more than a message holds; posting it as text",
          daily.getId(),
          blocks.size() + body.size());
      body = plainBody(daily);
    }
    blocks.addAll(body);
    return new MessageLayout(blocks);
  }

  /** One markdown line per issue, grouped by user. */
  public String plainText(DailyDocument daily) {
    List<String> users = new ArrayList<>();
    for (Map.Entry<String, DailyReport> entry : daily.getReports().entrySet()) {
      StringBuilder sb = new StringBuilder();
      sb.append("<@").append(entry.getKey()).append(">:");
      DailyReport report = entry.getValue();
      for (DailyIssueReport issue : report.issueReports()) {
        sb.append("\n - <")
            .append(issue.link())
            .append("|")
            .append(issue.summary())
            .append("> - ")
            .append(statusOf(issue));
        if (hasText(issue.details())) {
          sb.append(" - ").append(issue.details());
        }
      }
      if (report.hasGeneralComments()) {
        sb.append("\n - ").append(report.generalComments());
      }
      users.add(sb.toString());
    }
    return String.join("\n", users);
  }

  private List<LayoutBlock> plainBody(DailyDocument daily) {
    String text = plainText(daily);
    if (text.isEmpty()) {
      return List.of();
    }
    return List.of(
        SectionBlock.of(
            BoundedText.of(
                TextKind.MARKDOWN, text, SectionBlock.MAX_TEXT_LENGTH, LengthPolicy.TRUNCATE)));
  }

  private List<LayoutBlock> richBody(DailyDocument daily) {
    List<LayoutBlock> blocks = new ArrayList<>();
    for (Map.Entry<String, DailyReport> entry : daily.getReports().entrySet()) {
      String userId = entry.getKey();
      DailyReport report = entry.getValue();
      for (DailyIssueReport issue : report.issueReports()) {
        blocks.addAll(issueBlocks(userId, issue));
      }
      if (report.hasGeneralComments()) {
        blocks.add(HeaderBlock.of("General Comments"));
        blocks.add(ContextBlock.of(BoundedText.markdown("<@" + userId + ">")));
        blocks.add(SectionBlock.of(sectionText(TextKind.MARKDOWN, report.generalComments())));
        blocks.add(new DividerBlock());
      }
    }
    return blocks;
  }

  private static List<LayoutBlock> issueBlocks(String userId, DailyIssueReport issue) {
    List<LayoutBlock> blocks = new ArrayList<>();
    blocks.add(
        SectionBlock.of(sectionText(TextKind.PLAIN, issue.key() + " - " + issue.summary())));
    blocks.add(
        new SectionBlock(
            null,
            null,
            List.of(
                BoundedText.of(
                    TextKind.PLAIN,
                    statusOf(issue),
                    SectionBlock.MAX_FIELD_LENGTH,
                    LengthPolicy.TRUNCATE),
                BoundedText.markdown("*<@" + userId + ">*")),
            Button.link(
                ActionIds.OPEN_IN_JIRA, "Open in Jira", ActionIds.OPEN_IN_JIRA, issue.link())));
    if (hasText(issue.details())) {
      blocks.add(
          SectionBlock.of(
              new BoundedText(
                  TextKind.PLAIN,
                  BoundedText.truncate(
                      ":speech_balloon: " + issue.details(), SectionBlock.MAX_TEXT_LENGTH),
                  SectionBlock.MAX_TEXT_LENGTH,
                  true,
                  null)));
    }
    blocks.add(new DividerBlock());
    return blocks;
  }

  private static BoundedText sectionText(TextKind kind, String text) {
    return BoundedText.of(kind, text, SectionBlock.MAX_TEXT_LENGTH, LengthPolicy.TRUNCATE);
  }

  private static String statusOf(DailyIssueReport issue) {
    return hasText(issue.status()) ? issue.status() : UNKNOWN_STATUS;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
