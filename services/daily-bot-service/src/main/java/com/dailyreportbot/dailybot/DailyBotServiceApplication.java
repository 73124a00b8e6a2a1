package com.dailyreportbot.dailybot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DailyBotServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(DailyBotServiceApplication.class, args);
  }
}
