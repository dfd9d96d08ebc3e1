package co.keyfmt.core.index;

import co.keyfmt.core.pattern.AttributeKind;

import java.util.Objects;

/**
 * A key attribute of a table or index: its attribute name and stored type.
 */
public record KeyDef(String attributeName, AttributeKind kind) {

  public KeyDef {
    Objects.requireNonNull(kind, "kind");
    if (attributeName == null || attributeName.isBlank()) {
      throw new IllegalArgumentException("key attribute name is required");
    }
  }

  public static KeyDef string(String attributeName) {
    return new KeyDef(attributeName, AttributeKind.STRING);
  }

  public static KeyDef number(String attributeName) {
    return new KeyDef(attributeName, AttributeKind.NUMBER);
  }

  public static KeyDef binary(String attributeName) {
    return new KeyDef(attributeName, AttributeKind.BINARY);
  }
}
