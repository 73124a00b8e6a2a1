package com.dailyreportbot.dailybot.issuetracker;

public record TrackerProject(String key, String name) {}
