package com.dailyreportbot.dailybot.gui;

import com.dailyreportbot.dailybot.blockkit.BoundedText;
import com.dailyreportbot.dailybot.blockkit.LengthPolicy;
import com.dailyreportbot.dailybot.blockkit.Option;
import com.dailyreportbot.dailybot.blockkit.TextKind;
import com.dailyreportbot.dailybot.blockkit.block.ActionsBlock;
import com.dailyreportbot.dailybot.blockkit.block.ContextBlock;
import com.dailyreportbot.dailybot.blockkit.block.DividerBlock;
import com.dailyreportbot.dailybot.blockkit.block.HeaderBlock;
import com.dailyreportbot.dailybot.blockkit.block.InputBlock;
import com.dailyreportbot.dailybot.blockkit.block.LayoutBlock;
import com.dailyreportbot.dailybot.blockkit.block.SectionBlock;
import com.dailyreportbot.dailybot.blockkit.element.Button;
import com.dailyreportbot.dailybot.blockkit.element.PlainTextInput;
import com.dailyreportbot.dailybot.blockkit.element.SelectMenu;
import com.dailyreportbot.dailybot.blockkit.element.Selector;
import com.dailyreportbot.dailybot.blockkit.view.ModalView;
import com.dailyreportbot.dailybot.domain.DailyIssueReport;
import com.dailyreportbot.dailybot.domain.DailyReport;
import com.dailyreportbot.dailybot.domain.UserDocument;
import com.dailyreportbot.dailybot.issuetracker.IssueTrackerClient;
import com.dailyreportbot.dailybot.issuetracker.TrackedIssue;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * The daily report form and the modal shown to users who have not configured the bot.
 *
 * <p>Issues that no longer fit into the modal's block limit are left out of the form, and a
 * context block says how many.
 */
@Component
@Slf4j
public class DailyFormModalBuilder {

  private static final String TITLE = "Daily Report";

  private final IssueTrackerClient tracker;

  public DailyFormModalBuilder(IssueTrackerClient tracker) {
    this.tracker = tracker;
  }

  /**
   * @param stored what the user already submitted today, used to show "Stored data" hints; may be
   *     null
   */
  public ModalView dailyForm(UserDocument user, List<TrackedIssue> issues, DailyReport stored) {
    List<LayoutBlock> blocks = new ArrayList<>();
    blocks.add(
        SectionBlock.of(
            BoundedText.markdown(
                "*Hi <@"
                    + user.getId()
                    + ">!* Please change the statuses of the following issues to the updated"
                    + " status, and add comments of the progress of the issues. if you re-fill"
                    + " this form, copy the stored data to the input box")));

    List<DailyIssueReport> storedIssues = stored == null ? List.of() : stored.issueReports();
    int tail = stored != null && stored.hasGeneralComments() ? 2 : 1;
    int shown = 0;
    for (TrackedIssue issue : issues) {
      List<LayoutBlock> group = issueBlocks(user, issue, findStored(storedIssues, issue.key()));
      int notice = shown + 1 < issues.size() ? 1 : 0;
      if (blocks.size() + group.size() + notice + tail > ModalView.MAX_BLOCKS) {
        break;
      }
      blocks.addAll(group);
      shown++;
    }
    if (shown < issues.size()) {
      int omitted = issues.size() - shown;
      log.warn("Daily form of {} shows {} of {} issues", user.getId(), shown, issues.size());
      blocks.add(
          ContextBlock.of(
              BoundedText.plain(
                  omitted
                      + " more issues do not fit into this form. Mention them in the comments"
                      + " below.")));
    }

    blocks.add(
        InputBlock.optional(
            ActionIds.GENERAL_COMMENTS_ACTION,
            "Other comments / blockers",
            PlainTextInput.multiline(ActionIds.GENERAL_COMMENTS_ACTION)));
    if (stored != null && stored.hasGeneralComments()) {
      blocks.add(storedData(stored.generalComments()));
    }

    return new ModalView(
        ActionIds.DAILY_MODAL_SUBMISSION,
        BoundedText.plain(TITLE),
        BoundedText.plain("Submit"),
        BoundedText.plain("Cancel"),
        blocks);
  }

  public ModalView userNotRegistered() {
    return new ModalView(
        null,
        BoundedText.plain(TITLE),
        null,
        null,
        List.of(
            HeaderBlock.of("Your user is not defined!"),
            SectionBlock.of(
                BoundedText.markdown(
                    "Press the `Add apps` button in the bottom left corner (bottom of the users"
                        + " list) and add the `DailyBot` app, all the configurations are in the"
                        + " home tab. It might not work the first time so please try again :P"))));
  }

  private List<LayoutBlock> issueBlocks(
      UserDocument user, TrackedIssue issue, DailyIssueReport stored) {
    Option current = statusOption(issue.status());
    List<Option> statuses = new ArrayList<>();
    statuses.add(current);
    for (String status : tracker.optionalStatuses(user, issue.key())) {
      if (statuses.size() >= ActionIds.MAX_SELECTOR_OPTIONS) {
        break;
      }
      if (!status.equals(issue.status())) {
        statuses.add(statusOption(status));
      }
    }

    List<LayoutBlock> blocks = new ArrayList<>();
    blocks.add(
        new HeaderBlock(
            BoundedText.of(
                TextKind.PLAIN,
                issue.key() + ": " + issue.summary(),
                HeaderBlock.MAX_TEXT_LENGTH,
                LengthPolicy.TRUNCATE)));
    blocks.add(
        new ActionsBlock(
            ActionIds.issueBlockId(issue.key(), ActionIds.ACTIONS_ISSUE_DAILY_FORM),
            List.of(
                Selector.checkboxes(
                    ActionIds.IGNORE_ISSUE_IN_DAILY_FORM,
                    List.of(
                        new Option(
                            BoundedText.markdown("Ignore this issue"),
                            ActionIds.IGNORE_ISSUE_VALUE,
                            null,
                            null))),
                SelectMenu.of(
                    ActionIds.SELECT_STATUS_ISSUE_DAILY_FORM,
                    "Select current status",
                    statuses,
                    current),
                Button.link(
                    ActionIds.ISSUE_LINK_ACTION,
                    "Open in Jira",
                    "link-issue-" + issue.key(),
                    issue.permalink()))));
    blocks.add(
        InputBlock.optional(
            ActionIds.issueBlockId(issue.key(), ActionIds.ISSUE_SUMMERY_ACTION),
            "Progress details",
            PlainTextInput.of(ActionIds.ISSUE_SUMMERY_ACTION)));
    if (stored != null && stored.details() != null && !stored.details().isBlank()) {
      blocks.add(storedData(stored.details()));
    }
    blocks.add(new DividerBlock());
    return blocks;
  }

  private static Option statusOption(String status) {
    return new Option(
        BoundedText.of(TextKind.PLAIN, status, Option.MAX_TEXT_LENGTH, LengthPolicy.TRUNCATE),
        status,
        null,
        null);
  }

  private static ContextBlock storedData(String text) {
    return ContextBlock.of(
        BoundedText.of(
            TextKind.PLAIN,
            "Stored data: " + text,
            BoundedText.DEFAULT_MAX_LENGTH,
            LengthPolicy.TRUNCATE));
  }

  private static DailyIssueReport findStored(List<DailyIssueReport> stored, String key) {
    for (DailyIssueReport report : stored) {
      if (key.equals(report.key())) {
        return report;
      }
    }
    return null;
  }
}
