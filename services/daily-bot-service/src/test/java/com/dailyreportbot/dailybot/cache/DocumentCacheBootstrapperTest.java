package com.dailyreportbot.dailybot.cache;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.dailyreportbot.dailybot.service.DailyService;
import com.dailyreportbot.dailybot.service.TeamService;
import com.dailyreportbot.dailybot.service.UserService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class DocumentCacheBootstrapperTest {

  @Mock private TeamService teams;
  @Mock private UserService users;
  @Mock private DailyService dailies;

  @Test
  void run_warmsAllCaches() {
    DocumentCacheBootstrapper bootstrapper = new DocumentCacheBootstrapper(teams, users, dailies);
    ReflectionTestUtils.setField(bootstrapper, "enabled", true);

    bootstrapper.run(new DefaultApplicationArguments());

    verify(teams).warmUp();
    verify(users).warmUp();
    verify(dailies).warmUp();
  }

  @Test
  void run_disabled_leavesCachesEmpty() {
    DocumentCacheBootstrapper bootstrapper = new DocumentCacheBootstrapper(teams, users, dailies);

    bootstrapper.run(new DefaultApplicationArguments());

    verifyNoInteractions(teams, users, dailies);
  }
}
