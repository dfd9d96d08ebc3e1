package co.keyfmt.core.index;

import co.keyfmt.core.extract.KeyExtractionException;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A secondary index: its name and how to derive its partition and optional sort key.
 *
 * <p>Secondary indexes are sparse. An item lacking a field the index keys reference is simply not
 * in the index.
 */
public final class SecondaryIndex {

  private final String name;
  private final KeyValueDef partitionKey;
  private final KeyValueDef sortKey;

  public SecondaryIndex(String name, KeyValueDef partitionKey, KeyValueDef sortKey) {
    this.name = name;
    this.partitionKey = partitionKey;
    this.sortKey = sortKey;
  }

  public SecondaryIndex(String name, KeyValueDef partitionKey) {
    this(name, partitionKey, null);
  }

  public String name() {
    return name;
  }

  public KeyValueDef partitionKey() {
    return partitionKey;
  }

  public Optional<KeyValueDef> sortKey() {
    return Optional.ofNullable(sortKey);
  }

  /**
   * @throws IllegalArgumentException if the index has no name or no partition key
   */
  public void validate() {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("secondary index name is required");
    }
    if (partitionKey == null) {
      throw new IllegalArgumentException("partition key is required for secondary index \"" + name + "\"");
    }
  }

  /**
   * Derive this index's key attributes from an item.
   *
   * @return the key attributes, or empty when the item lacks a referenced field and so does not
   *     participate in this index
   * @throws KeyExtractionException for any failure other than a missing field
   */
  public Optional<Map<String, AttributeValue>> keyFor(Map<String, AttributeValue> item) {
    Map<String, AttributeValue> key = new LinkedHashMap<>();
    try {
      key.put(partitionKey.attributeName(), partitionKey.extract(item));
      if (sortKey != null) {
        key.put(sortKey.attributeName(), sortKey.extract(item));
      }
    } catch (KeyExtractionException e) {
      if (e.isFieldNotFound()) {
        return Optional.empty();
      }
      throw e;
    }
    return Optional.of(key);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SecondaryIndex other)) return false;
    return Objects.equals(name, other.name)
      && Objects.equals(partitionKey, other.partitionKey)
      && Objects.equals(sortKey, other.sortKey);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, partitionKey, sortKey);
  }

  @Override
  public String toString() {
    return "SecondaryIndex{" + name + "}";
  }
}
