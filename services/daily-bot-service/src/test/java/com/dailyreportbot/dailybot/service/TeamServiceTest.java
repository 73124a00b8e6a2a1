package com.dailyreportbot.dailybot.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.dailyreportbot.dailybot.domain.TeamDocument;
import com.dailyreportbot.dailybot.repository.TeamRepository;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TeamServiceTest {

  @Mock private TeamRepository repository;

  private TeamService service;

  @BeforeEach
  void setUp() {
    service = new TeamService(repository);
  }

  @Test
  void all_isSortedByName() {
    when(repository.findAll())
        .thenReturn(List.of(new TeamDocument("web", "C3"), new TeamDocument("core", "C1")));
    service.warmUp();

    assertThat(service.all()).extracting(TeamDocument::getName).containsExactly("core", "web");
  }

  @Test
  void save_writesThroughToCache() {
    TeamDocument team = new TeamDocument("core", "C1");
    when(repository.save(any(TeamDocument.class))).thenReturn(team);

    service.save(team);

    verify(repository).save(team);
    assertThat(service.find("core")).containsSame(team);
  }

  @Test
  void save_storeFails_cacheKeepsPreviousTeam() {
    TeamDocument core = new TeamDocument("core", "C1");
    when(repository.findAll()).thenReturn(List.of(core));
    service.warmUp();
    when(repository.save(any(TeamDocument.class))).thenThrow(new IllegalStateException("db down"));

    assertThatThrownBy(() -> service.save(core.withDailyChannel("C2")))
        .isInstanceOf(IllegalStateException.class);

    assertThat(service.find("core")).map(TeamDocument::getDailyChannel).contains("C1");
  }
}
