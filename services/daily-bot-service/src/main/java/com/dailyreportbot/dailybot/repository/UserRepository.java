package com.dailyreportbot.dailybot.repository;

import com.dailyreportbot.dailybot.domain.UserDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface UserRepository extends MongoRepository<UserDocument, String> {}
