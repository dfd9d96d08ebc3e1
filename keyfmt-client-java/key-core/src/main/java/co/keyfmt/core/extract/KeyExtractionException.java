package co.keyfmt.core.extract;

/**
 * Thrown when a key attribute cannot be derived from a stored item.
 *
 * <p>{@link Reason#FIELD_NOT_FOUND} is expected for sparse secondary indexes and is recovered from
 * there; for a primary key every reason is a hard failure.
 */
public class KeyExtractionException extends RuntimeException {

  public enum Reason {
    FIELD_NOT_FOUND,
    INCOMPATIBLE_BINARY_VALUE,
    INCOMPATIBLE_NUMBER_VALUE,
    UNSUPPORTED_ATTRIBUTE_TYPE
  }

  private final Reason reason;
  private final String fieldPath;

  public KeyExtractionException(Reason reason, String fieldPath, String message) {
    super(message);
    this.reason = reason;
    this.fieldPath = fieldPath;
  }

  public Reason reason() {
    return reason;
  }

  /** Dotted path of the field involved, or {@code null} when no field is involved. */
  public String fieldPath() {
    return fieldPath;
  }

  public boolean isFieldNotFound() {
    return reason == Reason.FIELD_NOT_FOUND;
  }
}
