package com.dailyreportbot.dailybot.chat;

import java.util.List;
import java.util.Map;

/** Outbound side of the chat platform. Arguments are already serialized block-kit documents. */
public interface ChatPlatformGateway {

  void openModal(String triggerId, Map<String, Object> view);

  void publishHomeView(String userId, Map<String, Object> view);

  /** {@code fallbackText} is shown in notifications and by clients that cannot render blocks. */
  void postMessage(String channel, String fallbackText, List<Map<String, Object>> blocks);
}
