package com.dailyreportbot.dailybot.issuetracker;

import com.dailyreportbot.dailybot.domain.UserDocument;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Default client until a real tracker integration is wired in: knows no issues or projects. */
@Component
@Slf4j
public class NoopIssueTrackerClient implements IssueTrackerClient {

  @Override
  public List<TrackedIssue> openIssues(UserDocument user) {
    log.warn("Issue tracker is not configured; no issues for user {}", user.getId());
    return List.of();
  }

  @Override
  public List<String> optionalStatuses(UserDocument user, String issueKey) {
    log.warn("Issue tracker is not configured; no statuses for {}", issueKey);
    return List.of();
  }

  @Override
  public List<TrackerProject> projects(UserDocument user) {
    log.warn("Issue tracker is not configured; no projects for user {}", user.getId());
    return List.of();
  }
}
