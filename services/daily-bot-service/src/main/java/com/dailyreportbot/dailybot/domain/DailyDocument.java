package com.dailyreportbot.dailybot.domain;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/** All reports of one team for one day, keyed by the reporting user's id. */
@Document(collection = "dailys")
public class DailyDocument {

  @Id private String id;
  private String team;
  private LocalDate date;
  private Map<String, DailyReport> reports = new LinkedHashMap<>();

  protected DailyDocument() {
    // for Spring Data
  }

  public DailyDocument(String team, LocalDate date) {
    this.team = team;
    this.date = date == null ? LocalDate.now() : date;
    this.id = formatId(this.date, team);
  }

  public static String formatId(LocalDate date, String team) {
    return date + "|" + team;
  }

  public String getId() {
    return id;
  }

  public String getTeam() {
    return team;
  }

  public LocalDate getDate() {
    return date;
  }

  public Map<String, DailyReport> getReports() {
    return Collections.unmodifiableMap(reports);
  }

  public DailyReport reportOf(String userId) {
    return reports.get(userId);
  }

  /** A copy of this daily with the user's report added or replaced; this one is left as is. */
  public DailyDocument withReport(String userId, DailyReport report) {
    DailyDocument copy = new DailyDocument(team, date);
    copy.reports.putAll(reports);
    copy.reports.put(userId, report);
    return copy;
  }
}
