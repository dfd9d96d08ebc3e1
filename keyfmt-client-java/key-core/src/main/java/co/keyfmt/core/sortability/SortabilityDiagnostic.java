package co.keyfmt.core.sortability;

/**
 * Advisory finding that a field reference in sort-key position does not collate correctly as a
 * string. Never fatal; callers decide whether to print, log or ignore it.
 *
 * @param entityLabel the entity the key belongs to
 * @param fieldPath   the offending field reference
 * @param condition   what was detected
 * @param cause       one-line explanation
 * @param suggestion  one-line fix
 */
public record SortabilityDiagnostic(
  String entityLabel,
  String fieldPath,
  UnsafeCondition condition,
  String cause,
  String suggestion
) {

  public enum UnsafeCondition {
    /** Integer without zero padding: "9" sorts after "10". */
    UNPADDED_INTEGER,
    /** Floating point without a total-width spec. */
    UNPADDED_FLOAT,
    /** Epoch counter without zero padding: digit count grows over time. */
    UNPADDED_EPOCH,
    /** Date-time text whose length varies. */
    VARIABLE_WIDTH_TIMESTAMP,
    /** Date-time text that keeps the caller's offset, so instants in different zones misorder. */
    TIMEZONE_DEPENDENT_TIMESTAMP
  }

  /** Human-readable two-line message. */
  public String message() {
    return entityLabel + " sort key field " + fieldPath + ": " + cause + "\n  fix: " + suggestion;
  }

  @Override
  public String toString() {
    return message();
  }
}
