package com.dailyreportbot.dailybot.blockkit.element;

/** Interactive control nested in a block. The set of variants is closed. */
public sealed interface BlockElement
    permits SelectMenu, MultiSelectMenu, Selector, Button, PlainTextInput {

  int MAX_ACTION_ID_LENGTH = 255;

  ElementType type();

  /** Identifies the source of an interaction payload; unique within the containing block. */
  String actionId();
}
