package com.dailyreportbot.dailybot.repository;

import com.dailyreportbot.dailybot.domain.DailyDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface DailyRepository extends MongoRepository<DailyDocument, String> {}
