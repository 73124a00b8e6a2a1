package com.dailyreportbot.dailybot.gui.submission;

import static org.assertj.core.api.Assertions.assertThat;

import com.dailyreportbot.dailybot.domain.DailyIssueReport;
import com.dailyreportbot.dailybot.domain.DailyReport;
import com.dailyreportbot.dailybot.issuetracker.TrackedIssue;
import java.util.List;
import org.junit.jupiter.api.Test;

class DailyFormSubmissionParserTest {

  private final DailyFormSubmissionParser parser = new DailyFormSubmissionParser();

  private final List<TrackedIssue> issues =
      List.of(
          new TrackedIssue("EDGE-1", "Fix login", "In Progress", "https://jira/EDGE-1"),
          new TrackedIssue("EDGE-2", "Old spike", "Open", "https://jira/EDGE-2"),
          new TrackedIssue("EDGE-3", "Docs", "In Review", "https://jira/EDGE-3"),
          new TrackedIssue("EDGE-4", "Created after opening", "Open", "https://jira/EDGE-4"));

  @Test
  void parse_skipsIgnoredAndUnknownIssues() {
    DailyReport report = parser.parse(PayloadFixtures.load("daily-form.json"), issues);

    assertThat(report.issueReports())
        .extracting(DailyIssueReport::key)
        .containsExactly("EDGE-1", "EDGE-3");
  }

  @Test
  void parse_readsStatusDetailsAndComments() {
    DailyReport report = parser.parse(PayloadFixtures.load("daily-form.json"), issues);

    assertThat(report.issueReports().get(0))
        .isEqualTo(
            new DailyIssueReport(
                "EDGE-1", "Done", "merged the fix", "https://jira/EDGE-1", "Fix login"));
    assertThat(report.generalComments()).isEqualTo("pairing with ops");
  }

  @Test
  void parse_unchangedStatus_keepsTrackerStatus_blankDetailsAreNull() {
    DailyReport report = parser.parse(PayloadFixtures.load("daily-form.json"), issues);

    DailyIssueReport docs = report.issueReports().get(1);
    assertThat(docs.status()).isEqualTo("In Review");
    assertThat(docs.details()).isNull();
  }
}
