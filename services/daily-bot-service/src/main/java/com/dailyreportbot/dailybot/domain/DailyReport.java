package com.dailyreportbot.dailybot.domain;

import java.util.List;

public record DailyReport(List<DailyIssueReport> issueReports, String generalComments) {

  public DailyReport {
    issueReports = issueReports == null ? List.of() : List.copyOf(issueReports);
  }

  public boolean hasGeneralComments() {
    return generalComments != null && !generalComments.isBlank();
  }
}
