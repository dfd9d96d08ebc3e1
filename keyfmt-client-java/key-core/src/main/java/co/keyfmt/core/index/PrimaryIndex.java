package co.keyfmt.core.index;

import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The main index of a table: table name, partition key, optional sort key, and the secondary
 * indexes maintained alongside it.
 */
public final class PrimaryIndex {

  private final String tableName;
  private final KeyValueDef partitionKey;
  private final KeyValueDef sortKey;
  private final List<SecondaryIndex> secondaryIndexes;

  public PrimaryIndex(String tableName, KeyValueDef partitionKey, KeyValueDef sortKey, List<SecondaryIndex> secondaryIndexes) {
    this.tableName = tableName;
    this.partitionKey = partitionKey;
    this.sortKey = sortKey;
    this.secondaryIndexes = secondaryIndexes == null ? List.of() : List.copyOf(secondaryIndexes);
  }

  public PrimaryIndex(String tableName, KeyValueDef partitionKey, KeyValueDef sortKey) {
    this(tableName, partitionKey, sortKey, List.of());
  }

  public String tableName() {
    return tableName;
  }

  public KeyValueDef partitionKey() {
    return partitionKey;
  }

  public Optional<KeyValueDef> sortKey() {
    return Optional.ofNullable(sortKey);
  }

  public List<SecondaryIndex> secondaryIndexes() {
    return secondaryIndexes;
  }

  /**
   * Check the index is fully configured.
   *
   * @throws IllegalArgumentException naming the first problem found
   */
  public void validate() {
    if (tableName == null || tableName.isBlank()) {
      throw new IllegalArgumentException("table name is required");
    }
    if (partitionKey == null) {
      throw new IllegalArgumentException(tableName + ": partition key is required");
    }
    Set<String> names = new HashSet<>();
    for (SecondaryIndex gsi : secondaryIndexes) {
      try {
        gsi.validate();
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(tableName + ": secondary index \"" + gsi.name() + "\": " + e.getMessage(), e);
      }
      if (!names.add(gsi.name())) {
        throw new IllegalArgumentException(tableName + ": duplicate secondary index name \"" + gsi.name() + "\"");
      }
    }
  }

  /**
   * Derive the primary key attributes of an item. Every referenced field must be present.
   *
   * @throws co.keyfmt.core.extract.KeyExtractionException if a key cannot be derived
   */
  public Map<String, AttributeValue> primaryKey(Map<String, AttributeValue> item) {
    Map<String, AttributeValue> key = new LinkedHashMap<>();
    key.put(partitionKey.attributeName(), partitionKey.extract(item));
    if (sortKey != null) {
      key.put(sortKey.attributeName(), sortKey.extract(item));
    }
    return key;
  }

  /**
   * Key attributes of every secondary index the item participates in, keyed by index name, in
   * declaration order. Indexes the item does not participate in are absent.
   */
  public Map<String, Map<String, AttributeValue>> secondaryKeys(Map<String, AttributeValue> item) {
    Map<String, Map<String, AttributeValue>> keys = new LinkedHashMap<>();
    for (SecondaryIndex gsi : secondaryIndexes) {
      gsi.keyFor(item).ifPresent(key -> keys.put(gsi.name(), key));
    }
    return keys;
  }

  /**
   * The item with its primary and participating secondary key attributes written into it, as it
   * would be stored. The input map is not modified.
   */
  public Map<String, AttributeValue> withKeys(Map<String, AttributeValue> item) {
    Map<String, AttributeValue> stored = new LinkedHashMap<>(item);
    stored.putAll(primaryKey(item));
    for (Map<String, AttributeValue> key : secondaryKeys(item).values()) {
      stored.putAll(key);
    }
    return stored;
  }

  public Optional<SecondaryIndex> secondaryIndex(String name) {
    return secondaryIndexes.stream().filter(gsi -> Objects.equals(gsi.name(), name)).findFirst();
  }

  @Override
  public String toString() {
    return "PrimaryIndex{" + tableName + "}";
  }
}
