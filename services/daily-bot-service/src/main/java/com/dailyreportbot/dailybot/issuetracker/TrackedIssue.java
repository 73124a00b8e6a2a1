package com.dailyreportbot.dailybot.issuetracker;

public record TrackedIssue(String key, String summary, String status, String permalink) {}
