package com.dailyreportbot.dailybot.gui.submission;

import com.dailyreportbot.dailybot.gui.ActionIds;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Board keys from the board selection view: the multi-select when the projects were offered, the
 * comma separated text input otherwise.
 */
@Component
public class BoardSelectionParser {

  public List<String> parse(JsonNode payload) {
    ViewStateValues values = ViewStateValues.of(payload);
    String block = ActionIds.TYPE_OR_SELECT_USER_BOARD;
    if (!values.hasBlock(block)) {
      throw new IllegalArgumentException("payload has no block " + block);
    }

    List<String> selected = values.selectedValues(block, ActionIds.SELECT_USER_BOARD);
    if (!selected.isEmpty()) {
      return selected;
    }
    return values
        .text(block, ActionIds.TYPE_USER_BOARD)
        .map(BoardSelectionParser::split)
        .orElse(List.of());
  }

  static List<String> split(String typed) {
    List<String> keys = new ArrayList<>();
    for (String part : typed.split(",")) {
      String key = part.trim();
      if (!key.isEmpty() && !keys.contains(key)) {
        keys.add(key);
      }
    }
    return keys;
  }
}
