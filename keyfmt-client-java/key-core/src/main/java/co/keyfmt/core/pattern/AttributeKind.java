package co.keyfmt.core.pattern;

/**
 * Storage attribute type a key value is encoded as.
 *
 * <p>The single-letter codes match the DynamoDB attribute type descriptors
 * ({@code S}, {@code N}, {@code B}).
 */
public enum AttributeKind {
  STRING("S"),
  NUMBER("N"),
  BINARY("B");

  private final String code;

  AttributeKind(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /**
   * Resolve a kind from its attribute code ({@code "S"}) or its name ({@code "string"}).
   * A {@code null} or empty value resolves to {@link #STRING}.
   *
   * @param value the code or name
   * @return the matching kind
   * @throws IllegalArgumentException if the value names no kind
   */
  public static AttributeKind fromCode(String value) {
    if (value == null || value.isEmpty()) return STRING;
    for (AttributeKind kind : values()) {
      if (kind.code.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("unsupported attribute kind: " + value);
  }
}
