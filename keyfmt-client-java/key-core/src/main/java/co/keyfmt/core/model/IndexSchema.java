package co.keyfmt.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * JSON description of one entity's table keys.
 *
 * <pre>
 * {
 *   "schemaVersion": "1.0",
 *   "entityName": "Order",
 *   "entityClass": "com.example.Order",
 *   "tableName": "orders",
 *   "fields": [
 *     { "name": "tenant", "type": "string" },
 *     { "name": "createdAt", "type": "Instant" },
 *     { "name": "customer", "type": "map", "fields": [ { "name": "id", "type": "string" } ] }
 *   ],
 *   "partitionKey": { "attribute": "pk", "format": "TENANT#{tenant}" },
 *   "sortKey": { "attribute": "sk", "format": "ORDER#{createdAt:utc:rfc3339fixed}" },
 *   "secondaryIndexes": [
 *     { "name": "byCustomer",
 *       "partitionKey": { "attribute": "gsi1pk", "format": "CUSTOMER#{customer.id}" },
 *       "sortKey": { "attribute": "gsi1sk", "fromField": "tenant" } }
 *   ]
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IndexSchema {
  public String schemaVersion;
  public String entityName;
  /** Fully qualified class of the entity; when set, emitters add entity-based key builders. */
  public String entityClass;
  public String description;
  public String tableName;
  public List<Field> fields;
  public Key partitionKey;
  public Key sortKey;
  @JsonAlias({"gsis", "secondary"})
  public List<SecondaryIndex> secondaryIndexes;

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Field {
    public String name;
    /**
     * Semantic type name, see {@link co.keyfmt.core.FieldType}. The type {@code "map"} declares
     * nested {@link #fields}, addressed in patterns with dot paths such as {@code customer.id}.
     */
    public String type;
    public String description;
    /** Nested field definitions when type is {@code map}. */
    public List<Field> fields;
  }

  /**
   * One key attribute. Exactly one of {@code format}, {@code fromField}, {@code constant} and
   * {@code bytes} is set.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Key {
    @JsonAlias({"name", "attributeName"})
    public String attribute;
    /** {@code S} (default), {@code N} or {@code B}. */
    public String kind;
    @JsonAlias("pattern")
    public String format;
    public String fromField;
    /** String or number constant. */
    @JsonAlias("const")
    public Object constant;
    /** Base64 binary constant. */
    public String bytes;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class SecondaryIndex {
    public String name;
    public Key partitionKey;
    public Key sortKey;
  }
}
