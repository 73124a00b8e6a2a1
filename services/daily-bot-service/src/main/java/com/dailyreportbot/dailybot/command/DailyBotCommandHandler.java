package com.dailyreportbot.dailybot.command;

import com.dailyreportbot.dailybot.blockkit.BlockKitSerializer;
import com.dailyreportbot.dailybot.blockkit.Option;
import com.dailyreportbot.dailybot.blockkit.view.HomeTabView;
import com.dailyreportbot.dailybot.blockkit.view.MessageLayout;
import com.dailyreportbot.dailybot.blockkit.view.ModalView;
import com.dailyreportbot.dailybot.chat.ChatPlatformGateway;
import com.dailyreportbot.dailybot.domain.DailyDocument;
import com.dailyreportbot.dailybot.domain.DailyReport;
import com.dailyreportbot.dailybot.domain.TeamDocument;
import com.dailyreportbot.dailybot.domain.UserDocument;
import com.dailyreportbot.dailybot.gui.DailyFormModalBuilder;
import com.dailyreportbot.dailybot.gui.DailyMessageBuilder;
import com.dailyreportbot.dailybot.gui.HomeTabViewBuilder;
import com.dailyreportbot.dailybot.gui.submission.BoardSelectionParser;
import com.dailyreportbot.dailybot.gui.submission.DailyFormSubmissionParser;
import com.dailyreportbot.dailybot.gui.submission.UserConfigurationParser;
import com.dailyreportbot.dailybot.issuetracker.IssueTrackerClient;
import com.dailyreportbot.dailybot.issuetracker.TrackedIssue;
import com.dailyreportbot.dailybot.service.DailyService;
import com.dailyreportbot.dailybot.service.TeamService;
import com.dailyreportbot.dailybot.service.UserService;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Ties the bot flows together: looks up the documents, builds the screen for the situation and
 * hands the serialized result to the chat platform.
 */
@Service
@Slf4j
public class DailyBotCommandHandler {

  /** {@code <name> <#C0123|channel-name>}, the way the platform expands a channel mention. */
  private static final Pattern ADD_TEAM =
      Pattern.compile("^\\s*(\\S+)\\s+<#([A-Z0-9]+)(?:\\|[^>]*)?>\\s*$");

  private final UserService users;
  private final TeamService teams;
  private final DailyService dailies;
  private final IssueTrackerClient tracker;
  private final ChatPlatformGateway chat;
  private final HomeTabViewBuilder homeTab;
  private final DailyFormModalBuilder dailyForm;
  private final DailyMessageBuilder dailyMessage;
  private final UserConfigurationParser configurationParser;
  private final BoardSelectionParser boardParser;
  private final DailyFormSubmissionParser dailyFormParser;
  private final boolean richMessage;

  public DailyBotCommandHandler(
      UserService users,
      TeamService teams,
      DailyService dailies,
      IssueTrackerClient tracker,
      ChatPlatformGateway chat,
      HomeTabViewBuilder homeTab,
      DailyFormModalBuilder dailyForm,
      DailyMessageBuilder dailyMessage,
      UserConfigurationParser configurationParser,
      BoardSelectionParser boardParser,
      DailyFormSubmissionParser dailyFormParser,
      @Value("${dailybot.report.rich-message:true}") boolean richMessage) {
    this.users = users;
    this.teams = teams;
    this.dailies = dailies;
    this.tracker = tracker;
    this.chat = chat;
    this.homeTab = homeTab;
    this.dailyForm = dailyForm;
    this.dailyMessage = dailyMessage;
    this.configurationParser = configurationParser;
    this.boardParser = boardParser;
    this.dailyFormParser = dailyFormParser;
    this.richMessage = richMessage;
  }

  /** Home tab opened: configuration form, board selection or "all set", by how far the user got. */
  public void showHome(String userId) {
    Optional<UserDocument> user = users.find(userId);
    HomeTabView view;
    if (user.isEmpty()) {
      view = homeTab.configuration(teams.all());
    } else if (user.get().getJiraKeys().isEmpty()) {
      view = homeTab.boardSelection(user.get());
    } else {
      view = homeTab.configured();
    }
    chat.publishHomeView(userId, BlockKitSerializer.homeTab(view));
  }

  public UserDocument saveUserConfiguration(JsonNode payload) {
    UserDocument saved = users.save(configurationParser.parse(payload));
    chat.publishHomeView(saved.getId(), BlockKitSerializer.homeTab(homeTab.boardSelection(saved)));
    return saved;
  }

  public UserDocument saveUserBoards(JsonNode payload) {
    String userId = userId(payload);
    List<String> keys = boardParser.parse(payload);
    if (keys.isEmpty()) {
      log.info("User {} submitted no boards; keeping board selection open", userId);
      UserDocument user = requireUser(userId);
      chat.publishHomeView(userId, BlockKitSerializer.homeTab(homeTab.boardSelection(user)));
      return user;
    }
    UserDocument saved = users.updateJiraKeys(userId, keys);
    chat.publishHomeView(userId, BlockKitSerializer.homeTab(homeTab.configured()));
    return saved;
  }

  public void openDailyForm(String userId, String triggerId) {
    Optional<UserDocument> user = users.find(userId);
    ModalView modal;
    if (user.isEmpty()) {
      log.info("Daily form requested by unknown user {}", userId);
      modal = dailyForm.userNotRegistered();
    } else {
      List<TrackedIssue> issues = tracker.openIssues(user.get());
      DailyReport stored = dailies.today(user.get().getTeam()).reportOf(userId);
      modal = dailyForm.dailyForm(user.get(), issues, stored);
    }
    chat.openModal(triggerId, BlockKitSerializer.modal(modal));
  }

  public DailyDocument submitDailyForm(JsonNode payload) {
    UserDocument user = requireUser(userId(payload));
    DailyReport report = dailyFormParser.parse(payload, tracker.openIssues(user));
    return dailies.saveReport(user.getTeam(), user.getId(), report);
  }

  /** Handles {@code /add-team <name> <#channel>}; an existing team only moves its channel. */
  public TeamDocument addTeam(String commandText) {
    Matcher m = ADD_TEAM.matcher(commandText == null ? "" : commandText);
    if (!m.matches()) {
      throw new IllegalArgumentException(
          "Usage: /add-team <team-name> <#daily-channel>, got: " + commandText);
    }
    String name = m.group(1);
    String channel = m.group(2);
    // the name is shown as a select option on the home tab
    if (name.length() > Option.MAX_VALUE_LENGTH) {
      throw new IllegalArgumentException(
          "Team name must be at most " + Option.MAX_VALUE_LENGTH + " characters, got: " + name);
    }
    TeamDocument team =
        teams
            .find(name)
            .map(existing -> existing.withDailyChannel(channel))
            .orElseGet(() -> new TeamDocument(name, channel));
    return teams.save(team);
  }

  /** Posts today's daily of the team to its channel; nothing is posted when nobody reported. */
  public boolean postDaily(String teamName) {
    TeamDocument team =
        teams
            .find(teamName)
            .orElseThrow(() -> new IllegalArgumentException("Unknown team " + teamName));
    DailyDocument daily = dailies.today(team.getName());
    if (daily.getReports().isEmpty()) {
      log.info("No reports for {} yet; skipping post", daily.getId());
      return false;
    }
    MessageLayout layout = dailyMessage.build(daily, richMessage);
    chat.postMessage(
        team.getDailyChannel(), dailyMessage.title(daily), BlockKitSerializer.message(layout));
    log.info("Posted daily {} to {}", daily.getId(), team.getDailyChannel());
    return true;
  }

  private UserDocument requireUser(String userId) {
    return users
        .find(userId)
        .orElseThrow(() -> new IllegalArgumentException("Unknown user " + userId));
  }

  private static String userId(JsonNode payload) {
    JsonNode id = payload == null ? null : payload.path("user").path("id");
    if (id == null || !id.isTextual()) {
      throw new IllegalArgumentException("payload has no user.id");
    }
    return id.asText();
  }
}
