package com.dailyreportbot.dailybot.domain;

public record SlackUserData(String teamId, String teamDomain, String userId, String userName) {}
