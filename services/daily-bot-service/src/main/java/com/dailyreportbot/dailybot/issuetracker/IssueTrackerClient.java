package com.dailyreportbot.dailybot.issuetracker;

import com.dailyreportbot.dailybot.domain.UserDocument;
import java.util.List;

/**
 * Read access to the issue tracker on behalf of a configured user (server, e-mail and API token
 * come from the user document).
 */
public interface IssueTrackerClient {

  /** Issues of the user's boards that belong in today's report. */
  List<TrackedIssue> openIssues(UserDocument user);

  /** Statuses the issue can move to, as display names. */
  List<String> optionalStatuses(UserDocument user, String issueKey);

  List<TrackerProject> projects(UserDocument user);
}
