package com.dailyreportbot.dailybot.config;

import jakarta.validation.constraints.NotBlank;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Atlas credentials, normally taken from MONGODB_USERNAME / MONGODB_PASSWORD / CLUSTER_NAME. */
@Validated
@ConfigurationProperties(prefix = "dailybot.mongodb")
public record DocumentStoreProperties(
    @NotBlank String username,
    @NotBlank String password,
    @NotBlank String clusterName,
    @NotBlank String database) {

  public String connectionString() {
    return "mongodb+srv://"
        + encode(username)
        + ":"
        + encode(password)
        + "@"
        + clusterName
        + ".mongodb.net/?retryWrites=true&w=majority";
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
