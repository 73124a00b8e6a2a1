package com.dailyreportbot.dailybot.gui;

import com.dailyreportbot.dailybot.blockkit.BoundedText;
import com.dailyreportbot.dailybot.blockkit.Option;
import com.dailyreportbot.dailybot.blockkit.block.ActionsBlock;
import com.dailyreportbot.dailybot.blockkit.block.ContextBlock;
import com.dailyreportbot.dailybot.blockkit.block.DividerBlock;
import com.dailyreportbot.dailybot.blockkit.block.HeaderBlock;
import com.dailyreportbot.dailybot.blockkit.block.InputBlock;
import com.dailyreportbot.dailybot.blockkit.block.LayoutBlock;
import com.dailyreportbot.dailybot.blockkit.block.SectionBlock;
import com.dailyreportbot.dailybot.blockkit.element.Button;
import com.dailyreportbot.dailybot.blockkit.element.MultiSelectMenu;
import com.dailyreportbot.dailybot.blockkit.element.PlainTextInput;
import com.dailyreportbot.dailybot.blockkit.element.SelectMenu;
import com.dailyreportbot.dailybot.blockkit.view.HomeTabView;
import com.dailyreportbot.dailybot.domain.JiraHostType;
import com.dailyreportbot.dailybot.domain.TeamDocument;
import com.dailyreportbot.dailybot.domain.UserDocument;
import com.dailyreportbot.dailybot.issuetracker.IssueTrackerClient;
import com.dailyreportbot.dailybot.issuetracker.TrackerProject;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Home tab screens, in the order a new user sees them: configuration form, board selection,
 * "all set".
 */
@Component
public class HomeTabViewBuilder {

  private final IssueTrackerClient tracker;

  public HomeTabViewBuilder(IssueTrackerClient tracker) {
    this.tracker = tracker;
  }

  public HomeTabView configuration(List<TeamDocument> teams) {
    List<LayoutBlock> blocks = new ArrayList<>();
    blocks.add(SectionBlock.of(BoundedText.markdown("*Hey there! im DailyBot :smile:*")));
    blocks.add(new DividerBlock());
    blocks.add(
        SectionBlock.of(
            BoundedText.markdown(
                "I was created to bring happiness to the agile world by skipping dailys and not"
                    + " wasting time each day, and just move this dailys into writing.")));
    blocks.add(SectionBlock.of(BoundedText.markdown("Lets configure your profile :gear:")));
    blocks.add(new DividerBlock());
    blocks.add(
        new InputBlock(
            ActionIds.JIRA_SERVER_ACTION,
            BoundedText.plain("Jira server url"),
            PlainTextInput.of(ActionIds.JIRA_SERVER_ACTION),
            BoundedText.plain(
                "https://<your-domain>.atlassian.net/ (if using cloud)  *<!> Dont forget the"
                    + " 'https://'*",
                false),
            null,
            null));
    blocks.add(
        InputBlock.of(
            ActionIds.JIRA_HOST_TYPE,
            "Select your Jira host type",
            SelectMenu.of(
                ActionIds.JIRA_HOST_TYPE,
                "Select options",
                List.of(hostTypeOption(JiraHostType.CLOUD), hostTypeOption(JiraHostType.LOCAL)),
                hostTypeOption(JiraHostType.CLOUD))));
    blocks.add(
        InputBlock.of(
            ActionIds.JIRA_EMAIL_ACTION,
            "Jira E-Mail",
            PlainTextInput.of(ActionIds.JIRA_EMAIL_ACTION)));
    blocks.add(new DividerBlock());
    blocks.add(
        InputBlock.of(
            ActionIds.JIRA_API_TOKEN_ACTION,
            "Jira API Token",
            PlainTextInput.of(ActionIds.JIRA_API_TOKEN_ACTION)));
    blocks.add(
        ContextBlock.of(
            BoundedText.markdown(
                "To generate Jira API Token go to"
                    + " https://id.atlassian.com/manage-profile/security/api-tokens")));
    blocks.add(new DividerBlock());
    blocks.add(teamSection(teams));
    blocks.add(
        ActionsBlock.of(
            Button.of(
                ActionIds.SAVE_USER_CONFIGURATIONS,
                "Save",
                ActionIds.SAVE_USER_CONFIGURATIONS)));
    return new HomeTabView(blocks);
  }

  /** Few enough projects are offered in a multi-select; otherwise the keys are typed. */
  public HomeTabView boardSelection(UserDocument user) {
    List<TrackerProject> projects = tracker.projects(user);
    List<LayoutBlock> blocks = new ArrayList<>();
    blocks.add(HeaderBlock.of("Configurations is set"));

    if (projects.size() < ActionIds.MAX_SELECTOR_OPTIONS) {
      if (projects.isEmpty()) {
        blocks.add(SectionBlock.of(BoundedText.markdown("*No jira projects available*")));
      } else {
        List<Option> options = new ArrayList<>();
        for (TrackerProject project : projects) {
          options.add(Option.of(project.key()));
        }
        blocks.add(
            new SectionBlock(
                ActionIds.TYPE_OR_SELECT_USER_BOARD,
                BoundedText.markdown("*Select your Jira boards from the select options*"),
                null,
                MultiSelectMenu.of(ActionIds.SELECT_USER_BOARD, "Select options", options)));
      }
    } else {
      blocks.add(
          InputBlock.of(
              ActionIds.TYPE_OR_SELECT_USER_BOARD,
              "Please write you issue keys:",
              PlainTextInput.of(ActionIds.TYPE_USER_BOARD)));
      blocks.add(
          ContextBlock.of(
              BoundedText.plain(
                  "Please write the keys in a list like so: `EDGE,ULT` with , and no spaces")));
      blocks.add(
          ActionsBlock.of(
              Button.of(ActionIds.SAVE_USER_BOARD, "Submit", ActionIds.SAVE_USER_BOARD)));
    }
    return new HomeTabView(blocks);
  }

  public HomeTabView configured() {
    return new HomeTabView(
        List.of(
            HeaderBlock.of("Well done! Every thing is configured!"),
            SectionBlock.of(
                BoundedText.markdown(
                    "Click the + button in the text area and write `daily`. click `daily with"
                        + " Daily Bot` to fill out daily form.")),
            ContextBlock.of(BoundedText.plain("Other capabilities will come soon.."))));
  }

  private static SectionBlock teamSection(List<TeamDocument> teams) {
    if (teams.isEmpty()) {
      return SectionBlock.of(
          BoundedText.markdown(
              "*No teams available, use `" + ActionIds.ADD_TEAM + "` command to create one*"));
    }
    List<Option> options = new ArrayList<>();
    for (TeamDocument team : teams) {
      if (options.size() >= ActionIds.MAX_SELECTOR_OPTIONS) {
        break;
      }
      options.add(Option.of(team.getName()));
    }
    return new SectionBlock(
        ActionIds.SELECT_USER_TEAM,
        BoundedText.markdown("*Select your team*"),
        null,
        SelectMenu.of(ActionIds.SELECT_USER_TEAM, "Teams", options, null));
  }

  private static Option hostTypeOption(JiraHostType type) {
    return Option.of(type.label());
  }
}
