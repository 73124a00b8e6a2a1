package com.dailyreportbot.dailybot.blockkit;

/** Something a select menu can start out with: a single option or a whole group. */
public sealed interface Choice permits Option, OptionGroup {}
