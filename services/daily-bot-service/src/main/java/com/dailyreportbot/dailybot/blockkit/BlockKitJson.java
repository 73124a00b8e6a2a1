package com.dailyreportbot.dailybot.blockkit;

import com.dailyreportbot.dailybot.blockkit.view.HomeTabView;
import com.dailyreportbot.dailybot.blockkit.view.MessageLayout;
import com.dailyreportbot.dailybot.blockkit.view.ModalView;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/** JSON text of serialized documents, written with the application's {@link ObjectMapper}. */
@Component
public class BlockKitJson {

  private final ObjectMapper objectMapper;

  public BlockKitJson(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String write(ModalView view) {
    return write((Object) BlockKitSerializer.modal(view));
  }

  public String write(HomeTabView view) {
    return write((Object) BlockKitSerializer.homeTab(view));
  }

  public String write(MessageLayout message) {
    return write((Object) BlockKitSerializer.message(message));
  }

  public String write(Object serialized) {
    try {
      return objectMapper.writeValueAsString(serialized);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to write block-kit document", e);
    }
  }
}
