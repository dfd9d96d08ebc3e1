package co.keyfmt.core.index;

import co.keyfmt.core.extract.ExtractionNode;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.Map;
import java.util.Objects;

/**
 * A key attribute together with the definition of its value.
 *
 * <p>The extraction tree is built once, on construction.
 */
public final class KeyValueDef {

  private final KeyDef key;
  private final ValueDef value;
  private final ExtractionNode node;

  public KeyValueDef(KeyDef key, ValueDef value) {
    this.key = Objects.requireNonNull(key, "key");
    this.value = Objects.requireNonNull(value, "value");
    this.node = value.toExtractionNode();
  }

  public static KeyValueDef of(KeyDef key, ValueDef value) {
    return new KeyValueDef(key, value);
  }

  public KeyDef key() {
    return key;
  }

  public ValueDef value() {
    return value;
  }

  public ExtractionNode node() {
    return node;
  }

  public String attributeName() {
    return key.attributeName();
  }

  /**
   * Derive this key's attribute value from a stored item.
   *
   * @throws co.keyfmt.core.extract.KeyExtractionException if the item lacks a referenced field or
   *                                                        holds an incompatible value
   */
  public AttributeValue extract(Map<String, AttributeValue> item) {
    return node.apply(item, key.kind());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof KeyValueDef other)) return false;
    return key.equals(other.key) && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, value);
  }

  @Override
  public String toString() {
    return key.attributeName() + "=" + value;
  }
}
