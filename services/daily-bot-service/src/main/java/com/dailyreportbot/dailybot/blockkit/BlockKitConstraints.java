package com.dailyreportbot.dailybot.blockkit;

import com.dailyreportbot.dailybot.blockkit.BlockKitValidationException.Violation;
import java.util.List;

/** Validation helpers shared by the block-kit records. Each check throws on the first failure. */
public final class BlockKitConstraints {

  private BlockKitConstraints() {}

  public static <T> T required(String field, T value) {
    if (value == null) {
      throw new BlockKitValidationException(
          Violation.MISSING_REQUIRED_FIELD, field, "field is required");
    }
    return value;
  }

  /** Null passes; a present string must not exceed {@code max} characters. */
  public static String length(String field, String value, int max) {
    if (value != null && value.length() > max) {
      throw new BlockKitValidationException(
          Violation.LENGTH_EXCEEDED,
          field,
          "length " + value.length() + " exceeds max size " + max);
    }
    return value;
  }

  public static String requiredLength(String field, String value, int max) {
    return length(field, required(field, value), max);
  }

  /**
   * Null passes; a present text is checked against this field's own limit (reject policy) and,
   * when {@code restrictKind} is given, against the allowed kind.
   */
  public static BoundedText text(
      String field, BoundedText value, int max, TextKind restrictKind) {
    if (value == null) {
      return null;
    }
    if (restrictKind != null && value.kind() != restrictKind) {
      throw new BlockKitValidationException(
          Violation.KIND_MISMATCH,
          field,
          "must be a " + restrictKind.wireValue() + " text, got " + value.kind().wireValue());
    }
    length(field, value.text(), max);
    return value;
  }

  public static BoundedText requiredText(
      String field, BoundedText value, int max, TextKind restrictKind) {
    return text(field, required(field, value), max, restrictKind);
  }

  /** Null passes; a present list must hold between {@code min} and {@code max} non-null entries. */
  public static <T> List<T> count(String field, List<T> values, int min, int max) {
    if (values == null) {
      return null;
    }
    if (values.size() < min || values.size() > max) {
      throw new BlockKitValidationException(
          Violation.CARDINALITY_VIOLATION,
          field,
          "expected " + min + ".." + max + " entries, got " + values.size());
    }
    for (int i = 0; i < values.size(); i++) {
      if (values.get(i) == null) {
        throw new BlockKitValidationException(
            Violation.MISSING_REQUIRED_FIELD, field + "[" + i + "]", "entry is null");
      }
    }
    return List.copyOf(values);
  }

  public static <T> List<T> requiredCount(String field, List<T> values, int min, int max) {
    return count(field, required(field, values), min, max);
  }

  /** Null passes; a present number must lie within {@code [min, max]}. */
  public static Integer range(
      String field, Integer value, int min, int max, Violation violation) {
    if (value != null && (value < min || value > max)) {
      throw new BlockKitValidationException(
          violation, field, "value " + value + " is outside " + min + ".." + max);
    }
    return value;
  }

  public static void exclusive(String first, Object a, String second, Object b) {
    if (a != null && b != null) {
      throw new BlockKitValidationException(
          Violation.MUTUAL_EXCLUSION_VIOLATION,
          first,
          "if `" + second + "` is specified, `" + first + "` should not be");
    }
  }

  /** Exactly one of the two must be present. */
  public static void exactlyOne(String first, Object a, String second, Object b) {
    exclusive(first, a, second, b);
    if (a == null && b == null) {
      throw new BlockKitValidationException(
          Violation.MUTUAL_EXCLUSION_VIOLATION,
          first,
          "one of `" + first + "` or `" + second + "` is required");
    }
  }
}
