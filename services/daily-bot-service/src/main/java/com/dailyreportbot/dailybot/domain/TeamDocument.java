package com.dailyreportbot.dailybot.domain;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/** A team and the channel its daily report is posted to. The team name is the id. */
@Document(collection = "teams")
public class TeamDocument {

  @Id private String id;
  private String name;
  private String dailyChannel;

  protected TeamDocument() {
    // for Spring Data
  }

  public TeamDocument(String name, String dailyChannel) {
    this.id = name;
    this.name = name;
    this.dailyChannel = dailyChannel;
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getDailyChannel() {
    return dailyChannel;
  }

  public TeamDocument withDailyChannel(String dailyChannel) {
    return new TeamDocument(name, dailyChannel);
  }
}
