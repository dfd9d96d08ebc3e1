package co.keyfmt.core.conversion;

/**
 * Thrown when a field reference cannot be converted for its semantic type.
 *
 * <p>These are programmer errors in a key definition; they are raised when the definition is
 * compiled, not when keys are built.
 */
public class ConversionException extends IllegalArgumentException {

  public enum Reason {
    MISSING_FLOAT_FORMAT,
    MISSING_TEMPORAL_FORMAT,
    INVALID_WIDTH_SPEC,
    INVALID_TEMPORAL_LAYOUT,
    UNKNOWN_MODIFIER,
    UNKNOWN_FIELD
  }

  private final Reason reason;
  private final String fieldPath;

  public ConversionException(Reason reason, String fieldPath, String message) {
    super(message);
    this.reason = reason;
    this.fieldPath = fieldPath;
  }

  public ConversionException(Reason reason, String fieldPath, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.fieldPath = fieldPath;
  }

  public Reason reason() {
    return reason;
  }

  public String fieldPath() {
    return fieldPath;
  }
}
