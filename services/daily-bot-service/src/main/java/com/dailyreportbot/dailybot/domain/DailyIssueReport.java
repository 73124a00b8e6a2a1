package com.dailyreportbot.dailybot.domain;

/** One issue as reported by one user: the status they picked and what they wrote about it. */
public record DailyIssueReport(
    String key, String status, String details, String link, String summary) {}
