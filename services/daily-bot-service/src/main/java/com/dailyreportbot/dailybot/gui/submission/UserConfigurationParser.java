package com.dailyreportbot.dailybot.gui.submission;

import com.dailyreportbot.dailybot.domain.JiraHostType;
import com.dailyreportbot.dailybot.domain.SlackUserData;
import com.dailyreportbot.dailybot.domain.UserDocument;
import com.dailyreportbot.dailybot.gui.ActionIds;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

/** Turns a submitted home tab configuration form into a user document. */
@Component
public class UserConfigurationParser {

  public UserDocument parse(JsonNode payload) {
    ViewStateValues values = ViewStateValues.of(payload);
    String hostType =
        values.requiredSelectedValue(ActionIds.JIRA_HOST_TYPE, ActionIds.JIRA_HOST_TYPE);

    return new UserDocument(
        values.requiredSelectedValue(ActionIds.SELECT_USER_TEAM, ActionIds.SELECT_USER_TEAM),
        values.requiredText(ActionIds.JIRA_SERVER_ACTION, ActionIds.JIRA_SERVER_ACTION),
        values.requiredText(ActionIds.JIRA_API_TOKEN_ACTION, ActionIds.JIRA_API_TOKEN_ACTION),
        values.requiredText(ActionIds.JIRA_EMAIL_ACTION, ActionIds.JIRA_EMAIL_ACTION),
        JiraHostType.fromLabel(hostType)
            .orElseThrow(() -> new IllegalArgumentException("Unknown Jira host type " + hostType)),
        slackData(payload));
  }

  private static SlackUserData slackData(JsonNode payload) {
    JsonNode team = payload.path("team");
    JsonNode user = payload.path("user");
    return new SlackUserData(
        required(team, "id", "team"),
        required(team, "domain", "team"),
        required(user, "id", "user"),
        required(user, "name", "user"));
  }

  private static String required(JsonNode node, String field, String parent) {
    JsonNode value = node.path(field);
    if (!value.isTextual() || value.asText().isBlank()) {
      throw new IllegalArgumentException("payload has no " + parent + "." + field);
    }
    return value.asText();
  }
}
