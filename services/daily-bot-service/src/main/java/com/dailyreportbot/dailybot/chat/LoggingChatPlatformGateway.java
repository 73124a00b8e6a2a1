package com.dailyreportbot.dailybot.chat;

import com.dailyreportbot.dailybot.blockkit.BlockKitJson;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default gateway: writes every outgoing document to the log instead of calling the platform.
 *
 * <p>Handy for trying the screens locally; replace the bean to talk to a real workspace.
 */
@Component
@Slf4j
public class LoggingChatPlatformGateway implements ChatPlatformGateway {

  private final BlockKitJson json;

  public LoggingChatPlatformGateway(BlockKitJson json) {
    this.json = json;
  }

  @Override
  public void openModal(String triggerId, Map<String, Object> view) {
    log.info("views.open trigger={} view={}", triggerId, json.write(view));
  }

  @Override
  public void publishHomeView(String userId, Map<String, Object> view) {
    log.info("views.publish user={} view={}", userId, json.write(view));
  }

  @Override
  public void postMessage(String channel, String fallbackText, List<Map<String, Object>> blocks) {
    log.info(
        "chat.postMessage channel={} text={} blocks={}",
        channel,
        fallbackText,
        json.write(blocks));
  }
}
