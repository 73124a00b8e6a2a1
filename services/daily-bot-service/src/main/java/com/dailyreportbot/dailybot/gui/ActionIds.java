package com.dailyreportbot.dailybot.gui;

/** Block and action identifiers shared by the screens and the submission parsers. */
public final class ActionIds {

  public static final String DAILY_MODAL_SUBMISSION = "daily-modal-submission";
  public static final String ACTIONS_ISSUE_DAILY_FORM = "actions-issue-daily-form";
  public static final String IGNORE_ISSUE_IN_DAILY_FORM = "ignore-issue-in-daily-form";
  public static final String SELECT_STATUS_ISSUE_DAILY_FORM = "select-status-issue-daily-form";
  public static final String ISSUE_LINK_ACTION = "issue-link";
  public static final String ISSUE_SUMMERY_ACTION = "issue-summery";
  public static final String GENERAL_COMMENTS_ACTION = "general-comments";
  public static final String IGNORE_ISSUE_VALUE = "ignore-issue";

  public static final String JIRA_SERVER_ACTION = "jira-server";
  public static final String JIRA_HOST_TYPE = "jira-host-type";
  public static final String JIRA_EMAIL_ACTION = "jira-email";
  public static final String JIRA_API_TOKEN_ACTION = "jira-api-token";
  public static final String SELECT_USER_TEAM = "select-user-team";
  public static final String SAVE_USER_CONFIGURATIONS = "save-user-configurations";

  public static final String TYPE_OR_SELECT_USER_BOARD = "type-or-select-user-board";
  public static final String SELECT_USER_BOARD = "select-user-board";
  public static final String TYPE_USER_BOARD = "type-user-board";
  public static final String SAVE_USER_BOARD = "save-user-board";

  public static final String OPEN_IN_JIRA = "open-in-jira";
  public static final String ADD_TEAM = "/add-team";

  /** Select menus hold at most this many options; larger project lists are typed instead. */
  public static final int MAX_SELECTOR_OPTIONS = 100;

  private ActionIds() {}

  /** Block id of a per-issue block in the daily form, e.g. {@code EDGE-12|issue-summery}. */
  public static String issueBlockId(String issueKey, String action) {
    return issueKey + "|" + action;
  }
}
