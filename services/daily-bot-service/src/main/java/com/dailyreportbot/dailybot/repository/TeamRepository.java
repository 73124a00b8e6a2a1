package com.dailyreportbot.dailybot.repository;

import com.dailyreportbot.dailybot.domain.TeamDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface TeamRepository extends MongoRepository<TeamDocument, String> {}
