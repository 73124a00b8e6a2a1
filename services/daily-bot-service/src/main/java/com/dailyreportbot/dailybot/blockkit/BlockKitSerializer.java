package com.dailyreportbot.dailybot.blockkit;

import com.dailyreportbot.dailybot.blockkit.block.ActionsBlock;
import com.dailyreportbot.dailybot.blockkit.block.ContextBlock;
import com.dailyreportbot.dailybot.blockkit.block.DividerBlock;
import com.dailyreportbot.dailybot.blockkit.block.HeaderBlock;
import com.dailyreportbot.dailybot.blockkit.block.InputBlock;
import com.dailyreportbot.dailybot.blockkit.block.LayoutBlock;
import com.dailyreportbot.dailybot.blockkit.block.SectionBlock;
import com.dailyreportbot.dailybot.blockkit.element.BlockElement;
import com.dailyreportbot.dailybot.blockkit.element.Button;
import com.dailyreportbot.dailybot.blockkit.element.DispatchActionConfig;
import com.dailyreportbot.dailybot.blockkit.element.ElementType;
import com.dailyreportbot.dailybot.blockkit.element.MultiSelectMenu;
import com.dailyreportbot.dailybot.blockkit.element.PlainTextInput;
import com.dailyreportbot.dailybot.blockkit.element.SelectMenu;
import com.dailyreportbot.dailybot.blockkit.element.Selector;
import com.dailyreportbot.dailybot.blockkit.element.TriggerAction;
import com.dailyreportbot.dailybot.blockkit.view.HomeTabView;
import com.dailyreportbot.dailybot.blockkit.view.MessageLayout;
import com.dailyreportbot.dailybot.blockkit.view.ModalView;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Turns a validated block-kit tree into the nested maps the platform API expects.
 *
 * <p>Depth-first, insertion-ordered, no side effects. Unset optional fields are left out instead
 * of being written as {@code null}; enums are written as their wire tokens.
 */
public final class BlockKitSerializer {

  private BlockKitSerializer() {}

  public static Map<String, Object> modal(ModalView view) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("type", "modal");
    putIfPresent(out, "callback_id", view.callbackId());
    out.put("title", text(view.title()));
    putIfPresent(out, "submit", text(view.submit()));
    putIfPresent(out, "close", text(view.close()));
    out.put("blocks", blocks(view.blocks()));
    return out;
  }

  public static Map<String, Object> homeTab(HomeTabView view) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("type", "home");
    out.put("blocks", blocks(view.blocks()));
    return out;
  }

  public static List<Map<String, Object>> message(MessageLayout message) {
    return blocks(message.blocks());
  }

  public static List<Map<String, Object>> blocks(List<LayoutBlock> blocks) {
    return mapAll(blocks, BlockKitSerializer::block);
  }

  public static Map<String, Object> block(LayoutBlock block) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("type", block.type().wireValue());
    putIfPresent(out, "block_id", block.blockId());

    if (block instanceof ActionsBlock actions) {
      out.put("elements", mapAll(actions.elements(), BlockKitSerializer::element));
    } else if (block instanceof InputBlock input) {
      out.put("label", text(input.label()));
      out.put("element", element(input.element()));
      putIfPresent(out, "hint", text(input.hint()));
      putIfPresent(out, "optional", input.optional());
      putIfPresent(out, "dispatch_action", input.dispatchAction());
    } else if (block instanceof HeaderBlock header) {
      out.put("text", text(header.text()));
    } else if (block instanceof ContextBlock context) {
      out.put("elements", mapAll(context.elements(), BlockKitSerializer::text));
    } else if (block instanceof SectionBlock section) {
      putIfPresent(out, "text", text(section.text()));
      putIfPresent(out, "fields", mapAll(section.fields(), BlockKitSerializer::text));
      putIfPresent(out, "accessory", element(section.accessory()));
    } else if (!(block instanceof DividerBlock)) {
      throw new IllegalStateException("Unsupported block: " + block.getClass().getName());
    }
    return out;
  }

  public static Map<String, Object> element(BlockElement element) {
    if (element == null) {
      return null;
    }
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("type", element.type().wireValue());
    putIfPresent(out, "action_id", element.actionId());

    if (element instanceof SelectMenu select) {
      out.put("placeholder", text(select.placeholder()));
      putIfPresent(out, "options", mapAll(select.options(), BlockKitSerializer::option));
      putIfPresent(
          out, "option_groups", mapAll(select.optionGroups(), BlockKitSerializer::optionGroup));
      putIfPresent(out, "initial_option", choice(select.initialOption()));
    } else if (element instanceof MultiSelectMenu multi) {
      out.put("placeholder", text(multi.placeholder()));
      putIfPresent(out, "options", mapAll(multi.options(), BlockKitSerializer::option));
      putIfPresent(
          out, "option_groups", mapAll(multi.optionGroups(), BlockKitSerializer::optionGroup));
      putIfPresent(
          out, "initial_options", mapAll(multi.initialOptions(), BlockKitSerializer::choice));
      putIfPresent(out, "max_selected_items", multi.maxSelectedItems());
    } else if (element instanceof Selector selector) {
      out.put("options", mapAll(selector.options(), BlockKitSerializer::option));
      if (selector.initialOptions() != null) {
        if (selector.type() == ElementType.RADIO_BUTTONS) {
          out.put("initial_option", option(selector.initialOptions().get(0)));
        } else {
          out.put(
              "initial_options", mapAll(selector.initialOptions(), BlockKitSerializer::option));
        }
      }
    } else if (element instanceof Button button) {
      out.put("text", text(button.text()));
      putIfPresent(out, "url", button.url());
      putIfPresent(out, "value", button.value());
      putIfPresent(out, "style", button.style() == null ? null : button.style().wireValue());
      putIfPresent(out, "accessibility_label", button.accessibilityLabel());
    } else if (element instanceof PlainTextInput input) {
      putIfPresent(out, "placeholder", text(input.placeholder()));
      putIfPresent(out, "initial_value", input.initialValue());
      putIfPresent(out, "multiline", input.multiline());
      putIfPresent(out, "min_length", input.minLength());
      putIfPresent(out, "max_length", input.maxLength());
      putIfPresent(out, "dispatch_action_config", dispatchConfig(input.dispatchActionConfig()));
    } else {
      throw new IllegalStateException("Unsupported element: " + element.getClass().getName());
    }
    return out;
  }

  public static Map<String, Object> text(BoundedText text) {
    if (text == null) {
      return null;
    }
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("type", text.kind().wireValue());
    out.put("text", text.text());
    putIfPresent(out, "emoji", text.emoji());
    putIfPresent(out, "verbatim", text.verbatim());
    return out;
  }

  public static Map<String, Object> option(Option option) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("text", text(option.text()));
    out.put("value", option.value());
    putIfPresent(out, "description", text(option.description()));
    putIfPresent(out, "url", option.url());
    return out;
  }

  public static Map<String, Object> optionGroup(OptionGroup group) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("label", text(group.label()));
    out.put("options", mapAll(group.options(), BlockKitSerializer::option));
    return out;
  }

  private static Map<String, Object> choice(Choice choice) {
    if (choice instanceof Option option) {
      return option(option);
    }
    if (choice instanceof OptionGroup group) {
      return optionGroup(group);
    }
    return null;
  }

  private static Map<String, Object> dispatchConfig(DispatchActionConfig config) {
    if (config == null) {
      return null;
    }
    List<String> triggers = new ArrayList<>();
    for (TriggerAction trigger : config.triggerActionsOn()) {
      triggers.add(trigger.wireValue());
    }
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("trigger_actions_on", triggers);
    return out;
  }

  private static <T> List<Map<String, Object>> mapAll(
      List<T> values, Function<T, Map<String, Object>> mapper) {
    if (values == null) {
      return null;
    }
    List<Map<String, Object>> out = new ArrayList<>(values.size());
    for (T value : values) {
      out.add(mapper.apply(value));
    }
    return out;
  }

  private static void putIfPresent(Map<String, Object> out, String key, Object value) {
    if (value != null) {
      out.put(key, value);
    }
  }
}
