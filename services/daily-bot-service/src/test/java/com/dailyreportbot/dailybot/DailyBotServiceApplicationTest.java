package com.dailyreportbot.dailybot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.dailyreportbot.dailybot.blockkit.BlockKitJson;
import com.dailyreportbot.dailybot.blockkit.block.HeaderBlock;
import com.dailyreportbot.dailybot.blockkit.view.MessageLayout;
import com.dailyreportbot.dailybot.command.DailyBotCommandHandler;
import com.dailyreportbot.dailybot.domain.TeamDocument;
import com.dailyreportbot.dailybot.repository.DailyRepository;
import com.dailyreportbot.dailybot.repository.TeamRepository;
import com.dailyreportbot.dailybot.repository.UserRepository;
import com.mongodb.client.MongoClient;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

@SpringBootTest(
    properties = {
      "dailybot.mongodb.username=bot",
      "dailybot.mongodb.password=secret",
      "dailybot.mongodb.cluster-name=cluster0",
      "dailybot.mongodb.database=daily-test",
      "dailybot.cache.warm-up=false"
    })
class DailyBotServiceApplicationTest {

  @MockBean MongoClient mongoClient;
  @MockBean TeamRepository teamRepository;
  @MockBean UserRepository userRepository;
  @MockBean DailyRepository dailyRepository;

  @Autowired DailyBotCommandHandler handler;
  @Autowired BlockKitJson json;

  @Test
  void context_wiresFlows_addTeamWritesThrough() {
    TeamDocument core = new TeamDocument("core", "C1");
    when(teamRepository.save(any(TeamDocument.class))).thenReturn(core);

    handler.addTeam("core <#C1|daily-core>");
    handler.showHome("U1");

    verify(teamRepository).save(any(TeamDocument.class));
  }

  @Test
  void applicationObjectMapper_writesDocuments() {
    String out = json.write(new MessageLayout(List.of(HeaderBlock.of("Daily"))));

    assertThat(out)
        .isEqualTo(
            "[{\"type\":\"header\",\"text\":{\"type\":\"plain_text\",\"text\":\"Daily\"}}]");
  }
}
