package com.dailyreportbot.dailybot.service;

import com.dailyreportbot.dailybot.cache.DocumentCache;
import com.dailyreportbot.dailybot.domain.DailyDocument;
import com.dailyreportbot.dailybot.domain.DailyReport;
import com.dailyreportbot.dailybot.repository.DailyRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class DailyService {

  private final DailyRepository dailies;
  private final Clock clock;
  private final DocumentCache<DailyDocument> cache = new DocumentCache<>("dailys");

  public DailyService(DailyRepository dailies, Clock clock) {
    this.dailies = dailies;
    this.clock = clock;
  }

  public void warmUp() {
    cache.reload(
        dailies.findAll().stream()
            .collect(Collectors.toMap(DailyDocument::getId, Function.identity())));
    log.info("Loaded {} dailies into cache", cache.size());
  }

  public LocalDate today() {
    return LocalDate.now(clock);
  }

  /** Today's daily of the team; a fresh, unsaved one when nobody reported yet. */
  public DailyDocument today(String team) {
    LocalDate date = today();
    return cache
        .get(DailyDocument.formatId(date, team))
        .orElseGet(() -> new DailyDocument(team, date));
  }

  /**
   * Adds the report to a copy of today's daily and caches the copy once it is stored. Reports of
   * one team are saved one at a time so none of them is lost.
   */
  public DailyDocument saveReport(String team, String userId, DailyReport report) {
    LocalDate date = today();
    DailyDocument saved =
        cache.compute(
            DailyDocument.formatId(date, team),
            current -> {
              DailyDocument daily = current == null ? new DailyDocument(team, date) : current;
              return dailies.save(daily.withReport(userId, report));
            });
    log.info(
        "Stored daily report of {} for {} ({} issues)",
        userId,
        saved.getId(),
        report.issueReports().size());
    return saved;
  }
}
