package com.dailyreportbot.dailybot.service;

import com.dailyreportbot.dailybot.cache.DocumentCache;
import com.dailyreportbot.dailybot.domain.TeamDocument;
import com.dailyreportbot.dailybot.repository.TeamRepository;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class TeamService {

  private final TeamRepository teams;
  private final DocumentCache<TeamDocument> cache = new DocumentCache<>("teams");

  public TeamService(TeamRepository teams) {
    this.teams = teams;
  }

  public void warmUp() {
    cache.reload(
        teams.findAll().stream()
            .collect(Collectors.toMap(TeamDocument::getId, Function.identity())));
    log.info("Loaded {} teams into cache", cache.size());
  }

  public Optional<TeamDocument> find(String name) {
    return cache.get(name);
  }

  public List<TeamDocument> all() {
    return cache.values().stream()
        .sorted(Comparator.comparing(TeamDocument::getName))
        .collect(Collectors.toList());
  }

  public TeamDocument save(TeamDocument team) {
    TeamDocument saved = cache.compute(team.getId(), current -> teams.save(team));
    log.info("Saved team {} (daily channel {})", saved.getName(), saved.getDailyChannel());
    return saved;
  }
}
