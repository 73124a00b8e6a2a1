package com.dailyreportbot.dailybot.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.dailyreportbot.dailybot.domain.DailyDocument;
import com.dailyreportbot.dailybot.domain.DailyReport;
import com.dailyreportbot.dailybot.repository.DailyRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DailyServiceTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-05-01T09:30:00Z"), ZoneOffset.UTC);

  @Mock private DailyRepository repository;

  private DailyService service;

  @BeforeEach
  void setUp() {
    service = new DailyService(repository, CLOCK);
  }

  @Test
  void today_withoutReports_isFreshAndUnsaved() {
    DailyDocument daily = service.today("core");

    assertThat(daily.getId()).isEqualTo("2024-05-01|core");
    assertThat(daily.getDate()).isEqualTo(LocalDate.of(2024, 5, 1));
    assertThat(daily.getReports()).isEmpty();
    verifyNoInteractions(repository);
  }

  @Test
  void saveReport_addsToTodaysDaily() {
    when(repository.save(any(DailyDocument.class))).thenAnswer(inv -> inv.getArgument(0));

    service.saveReport("core", "U1", new DailyReport(List.of(), "first"));
    DailyDocument saved = service.saveReport("core", "U2", new DailyReport(List.of(), "second"));

    assertThat(saved.getReports()).containsOnlyKeys("U1", "U2");
    assertThat(service.today("core")).isSameAs(saved);
  }

  @Test
  void saveReport_sameUserTwice_replacesReport() {
    when(repository.save(any(DailyDocument.class))).thenAnswer(inv -> inv.getArgument(0));

    service.saveReport("core", "U1", new DailyReport(List.of(), "draft"));
    DailyDocument saved = service.saveReport("core", "U1", new DailyReport(List.of(), "final"));

    assertThat(saved.reportOf("U1").generalComments()).isEqualTo("final");
  }

  @Test
  void saveReport_storeFails_cacheKeepsLastSavedDaily() {
    when(repository.save(any(DailyDocument.class)))
        .thenAnswer(inv -> inv.getArgument(0))
        .thenThrow(new IllegalStateException("db down"));
    DailyDocument first = service.saveReport("core", "U1", new DailyReport(List.of(), "first"));

    assertThatThrownBy(
            () -> service.saveReport("core", "U2", new DailyReport(List.of(), "second")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("db down");

    assertThat(service.today("core")).isSameAs(first);
    assertThat(service.today("core").getReports()).containsOnlyKeys("U1");
  }

  @Test
  void saveReport_concurrentUsers_noReportIsLost() throws Exception {
    when(repository.save(any(DailyDocument.class))).thenAnswer(inv -> inv.getArgument(0));
    List<Callable<DailyDocument>> submissions = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      String userId = "U" + i;
      submissions.add(
          () -> service.saveReport("core", userId, new DailyReport(List.of(), userId)));
    }

    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      for (Future<DailyDocument> result : pool.invokeAll(submissions)) {
        result.get();
      }
    } finally {
      pool.shutdown();
    }

    assertThat(service.today("core").getReports()).hasSize(20);
  }

  @Test
  void today_reportsAreReadOnly() {
    DailyDocument daily = service.today("core");

    assertThatThrownBy(() -> daily.getReports().put("U1", new DailyReport(List.of(), null)))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void warmUp_picksUpStoredDaily() {
    DailyDocument stored =
        new DailyDocument("core", LocalDate.of(2024, 5, 1))
            .withReport("U1", new DailyReport(List.of(), "from store"));
    when(repository.findAll()).thenReturn(List.of(stored));

    service.warmUp();

    assertThat(service.today("core")).isSameAs(stored);
  }
}
