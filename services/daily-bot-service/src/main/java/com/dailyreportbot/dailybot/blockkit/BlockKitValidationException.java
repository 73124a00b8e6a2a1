package com.dailyreportbot.dailybot.blockkit;

/**
 * A block-kit node could not be constructed because one of its constraints was violated.
 *
 * <p>Thrown synchronously from the node's constructor; the node never exists in a partially valid
 * state.
 */
public class BlockKitValidationException extends RuntimeException {

  public enum Violation {
    LENGTH_EXCEEDED,
    KIND_MISMATCH,
    MUTUAL_EXCLUSION_VIOLATION,
    CARDINALITY_VIOLATION,
    REFERENCE_INTEGRITY_VIOLATION,
    MISSING_REQUIRED_FIELD
  }

  private final Violation violation;
  private final String field;

  public BlockKitValidationException(Violation violation, String field, String message) {
    super(field + ": " + message);
    this.violation = violation;
    this.field = field;
  }

  public Violation getViolation() {
    return violation;
  }

  public String getField() {
    return field;
  }
}
