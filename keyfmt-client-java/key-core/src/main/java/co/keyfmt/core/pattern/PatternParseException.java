package co.keyfmt.core.pattern;

/**
 * Thrown when a key pattern string is malformed.
 *
 * <p>{@link #offset()} is the character offset in the raw pattern where the problem was found.
 */
public class PatternParseException extends IllegalArgumentException {

  public enum Reason {
    EMPTY_PATTERN,
    EMPTY_FIELD_REFERENCE,
    INVALID_FIELD_PATH,
    EMPTY_MODIFIER,
    UNBALANCED_BRACE
  }

  private final Reason reason;
  private final String pattern;
  private final int offset;

  public PatternParseException(Reason reason, String pattern, int offset, String message) {
    super(message);
    this.reason = reason;
    this.pattern = pattern;
    this.offset = offset;
  }

  public Reason reason() {
    return reason;
  }

  public String pattern() {
    return pattern;
  }

  public int offset() {
    return offset;
  }
}
