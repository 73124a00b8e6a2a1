package com.dailyreportbot.dailybot.config;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.SimpleMongoClientDatabaseFactory;

@Configuration
public class DocumentStoreConfig {

  @Bean
  public MongoClient mongoClient(DocumentStoreProperties properties) {
    return MongoClients.create(properties.connectionString());
  }

  @Bean
  public MongoDatabaseFactory mongoDatabaseFactory(
      MongoClient mongoClient, DocumentStoreProperties properties) {
    return new SimpleMongoClientDatabaseFactory(mongoClient, properties.database());
  }
}
