package com.dailyreportbot.dailybot.gui.submission;

import com.dailyreportbot.dailybot.domain.DailyIssueReport;
import com.dailyreportbot.dailybot.domain.DailyReport;
import com.dailyreportbot.dailybot.gui.ActionIds;
import com.dailyreportbot.dailybot.issuetracker.TrackedIssue;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Reads the answers of a submitted daily form. {@code issues} are the issues the form was built
 * for; issues the user checked as ignored are left out of the report.
 */
@Component
public class DailyFormSubmissionParser {

  public DailyReport parse(JsonNode payload, List<TrackedIssue> issues) {
    ViewStateValues values = ViewStateValues.of(payload);
    List<DailyIssueReport> reports = new ArrayList<>();

    for (TrackedIssue issue : issues) {
      String actions = ActionIds.issueBlockId(issue.key(), ActionIds.ACTIONS_ISSUE_DAILY_FORM);
      if (!values.hasBlock(actions)) {
        // added to the tracker after the form was opened
        continue;
      }
      if (values
          .selectedValues(actions, ActionIds.IGNORE_ISSUE_IN_DAILY_FORM)
          .contains(ActionIds.IGNORE_ISSUE_VALUE)) {
        continue;
      }
      String status =
          values
              .selectedValue(actions, ActionIds.SELECT_STATUS_ISSUE_DAILY_FORM)
              .orElse(issue.status());
      String details =
          values
              .text(
                  ActionIds.issueBlockId(issue.key(), ActionIds.ISSUE_SUMMERY_ACTION),
                  ActionIds.ISSUE_SUMMERY_ACTION)
              .orElse(null);
      reports.add(
          new DailyIssueReport(issue.key(), status, details, issue.permalink(), issue.summary()));
    }

    String comments =
        values
            .text(ActionIds.GENERAL_COMMENTS_ACTION, ActionIds.GENERAL_COMMENTS_ACTION)
            .orElse(null);
    return new DailyReport(reports, comments);
  }
}
