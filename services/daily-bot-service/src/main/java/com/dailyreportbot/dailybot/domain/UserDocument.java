package com.dailyreportbot.dailybot.domain;

import java.util.ArrayList;
import java.util.List;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/** A configured bot user, keyed by the chat platform user id. */
@Document(collection = "users")
public class UserDocument {

  @Id private String id;
  private String team;
  private String jiraServerUrl;
  private String jiraApiToken;
  private String jiraEmail;
  private SlackUserData slackData;
  private List<String> jiraKeys = new ArrayList<>();
  private JiraHostType jiraHostType = JiraHostType.CLOUD;

  protected UserDocument() {
    // for Spring Data
  }

  public UserDocument(
      String team,
      String jiraServerUrl,
      String jiraApiToken,
      String jiraEmail,
      JiraHostType jiraHostType,
      SlackUserData slackData) {
    this.id = slackData.userId();
    this.team = team;
    this.jiraServerUrl = jiraServerUrl;
    this.jiraApiToken = jiraApiToken;
    this.jiraEmail = jiraEmail;
    this.jiraHostType = jiraHostType == null ? JiraHostType.CLOUD : jiraHostType;
    this.slackData = slackData;
  }

  public String getId() {
    return id;
  }

  public String getTeam() {
    return team;
  }

  public void setTeam(String team) {
    this.team = team;
  }

  public String getJiraServerUrl() {
    return jiraServerUrl;
  }

  public String getJiraApiToken() {
    return jiraApiToken;
  }

  public String getJiraEmail() {
    return jiraEmail;
  }

  public SlackUserData getSlackData() {
    return slackData;
  }

  public List<String> getJiraKeys() {
    return jiraKeys;
  }

  public void setJiraKeys(List<String> jiraKeys) {
    this.jiraKeys = jiraKeys == null ? new ArrayList<>() : new ArrayList<>(jiraKeys);
  }

  public JiraHostType getJiraHostType() {
    return jiraHostType;
  }

  public UserDocument withJiraKeys(List<String> jiraKeys) {
    UserDocument copy =
        new UserDocument(team, jiraServerUrl, jiraApiToken, jiraEmail, jiraHostType, slackData);
    copy.setJiraKeys(jiraKeys);
    return copy;
  }

  /** Keeps the boards chosen earlier when the configuration form is saved again. */
  public void copyJiraKeysFrom(UserDocument previous) {
    if (previous != null) {
      setJiraKeys(previous.getJiraKeys());
    }
  }
}
