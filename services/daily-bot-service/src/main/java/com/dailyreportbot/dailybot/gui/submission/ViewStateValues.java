package com.dailyreportbot.dailybot.gui.submission;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Read access to {@code view.state.values} of an interaction payload. */
public final class ViewStateValues {

  private final JsonNode values;

  private ViewStateValues(JsonNode values) {
    this.values = values;
  }

  public static ViewStateValues of(JsonNode payload) {
    if (payload == null) {
      throw new IllegalArgumentException("payload is missing");
    }
    JsonNode values = payload.path("view").path("state").path("values");
    if (!values.isObject()) {
      throw new IllegalArgumentException("payload has no view.state.values");
    }
    return new ViewStateValues(values);
  }

  public boolean hasBlock(String blockId) {
    return values.has(blockId);
  }

  /** Typed value of a text input; empty when the block is absent or left blank. */
  public Optional<String> text(String blockId, String actionId) {
    JsonNode value = action(blockId, actionId).path("value");
    if (!value.isTextual() || value.asText().isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.asText());
  }

  public String requiredText(String blockId, String actionId) {
    return text(blockId, actionId).orElseThrow(() -> missing(blockId, actionId));
  }

  public Optional<String> selectedValue(String blockId, String actionId) {
    JsonNode value = action(blockId, actionId).path("selected_option").path("value");
    return value.isTextual() ? Optional.of(value.asText()) : Optional.empty();
  }

  public String requiredSelectedValue(String blockId, String actionId) {
    return selectedValue(blockId, actionId).orElseThrow(() -> missing(blockId, actionId));
  }

  /** Values of {@code selected_options}; empty when nothing is checked. */
  public List<String> selectedValues(String blockId, String actionId) {
    List<String> out = new ArrayList<>();
    for (JsonNode option : action(blockId, actionId).path("selected_options")) {
      JsonNode value = option.path("value");
      if (value.isTextual()) {
        out.add(value.asText());
      }
    }
    return out;
  }

  private JsonNode action(String blockId, String actionId) {
    return values.path(blockId).path(actionId);
  }

  private static IllegalArgumentException missing(String blockId, String actionId) {
    return new IllegalArgumentException(
        "No value submitted for block " + blockId + " (action " + actionId + ")");
  }
}
