package com.dailyreportbot.dailybot.service;

import com.dailyreportbot.dailybot.cache.DocumentCache;
import com.dailyreportbot.dailybot.domain.UserDocument;
import com.dailyreportbot.dailybot.repository.UserRepository;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class UserService {

  private final UserRepository users;
  private final DocumentCache<UserDocument> cache = new DocumentCache<>("users");

  public UserService(UserRepository users) {
    this.users = users;
  }

  public void warmUp() {
    cache.reload(
        users.findAll().stream()
            .collect(Collectors.toMap(UserDocument::getId, Function.identity())));
    log.info("Loaded {} users into cache", cache.size());
  }

  public Optional<UserDocument> find(String userId) {
    return cache.get(userId);
  }

  public List<UserDocument> inTeam(String team) {
    return cache.values().stream()
        .filter(u -> team != null && team.equals(u.getTeam()))
        .collect(Collectors.toList());
  }

  /** Saves the configuration form; boards picked earlier survive a re-save. */
  public UserDocument save(UserDocument user) {
    UserDocument saved =
        cache.compute(
            user.getId(),
            current -> {
              user.copyJiraKeysFrom(current);
              return users.save(user);
            });
    log.info("Saved user {} in team {}", saved.getId(), saved.getTeam());
    return saved;
  }

  public UserDocument updateJiraKeys(String userId, List<String> jiraKeys) {
    UserDocument saved =
        cache.compute(
            userId,
            current -> {
              if (current == null) {
                throw new IllegalArgumentException("Unknown user " + userId);
              }
              return users.save(current.withJiraKeys(jiraKeys));
            });
    log.info("User {} now follows boards {}", userId, saved.getJiraKeys());
    return saved;
  }
}
