package com.dailyreportbot.dailybot.cache;

import com.dailyreportbot.dailybot.service.DailyService;
import com.dailyreportbot.dailybot.service.TeamService;
import com.dailyreportbot.dailybot.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Fills the document caches from the store once the application is up. */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentCacheBootstrapper implements ApplicationRunner {

  private final TeamService teams;
  private final UserService users;
  private final DailyService dailies;

  @Value("${dailybot.cache.warm-up:true}")
  private boolean enabled;

  @Override
  public void run(ApplicationArguments args) {
    if (!enabled) {
      log.info("Cache warm-up is disabled; caches start empty");
      return;
    }
    teams.warmUp();
    users.warmUp();
    dailies.warmUp();
  }
}
