package com.dailyreportbot.dailybot.blockkit;

/**
 * What happens to text longer than its limit.
 *
 * <p>{@link #REJECT} is for operator input, where the error has to reach whoever typed it. {@link
 * #TRUNCATE} is for informational strings coming from the platform or the issue tracker.
 */
public enum LengthPolicy {
  REJECT,
  TRUNCATE
}
