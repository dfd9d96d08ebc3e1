package co.keyfmt.core.model;

import co.keyfmt.core.FieldTypeResolver;
import co.keyfmt.core.index.KeyDef;
import co.keyfmt.core.index.KeyValueDef;
import co.keyfmt.core.index.PrimaryIndex;
import co.keyfmt.core.index.SecondaryIndex;
import co.keyfmt.core.index.ValueDef;
import co.keyfmt.core.pattern.AttributeKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a validated {@link IndexSchema} into the index model and field type table.
 */
public final class IndexSchemaBinder {

  /** The result of binding one schema. */
  public record BoundSchema(
    String entityName,
    String entityClass,
    PrimaryIndex index,
    Map<String, String> fieldTypes
  ) {
    public FieldTypeResolver types() {
      return FieldTypeResolver.of(fieldTypes);
    }
  }

  private IndexSchemaBinder() {}

  public static BoundSchema bind(IndexSchema s) {
    IndexSchemaValidator.validate(s);

    Map<String, String> fieldTypes = new LinkedHashMap<>();
    flatten("", s.fields, fieldTypes);

    List<SecondaryIndex> gsis = new ArrayList<>();
    if (s.secondaryIndexes != null) {
      for (IndexSchema.SecondaryIndex gsi : s.secondaryIndexes) {
        gsis.add(new SecondaryIndex(gsi.name, keyValue(gsi.partitionKey), keyValue(gsi.sortKey)));
      }
    }
    PrimaryIndex index = new PrimaryIndex(s.tableName, keyValue(s.partitionKey), keyValue(s.sortKey), gsis);
    index.validate();
    return new BoundSchema(s.entityName, s.entityClass, index, fieldTypes);
  }

  /** Field paths in declaration order; map fields contribute their nested paths. */
  static void flatten(String prefix, List<IndexSchema.Field> fields, Map<String, String> out) {
    for (IndexSchema.Field f : fields) {
      String path = prefix + f.name;
      out.put(path, f.type);
      if (f.fields != null) {
        flatten(path + ".", f.fields, out);
      }
    }
  }

  private static KeyValueDef keyValue(IndexSchema.Key key) {
    if (key == null) return null;
    AttributeKind kind = AttributeKind.fromCode(key.kind);
    return KeyValueDef.of(new KeyDef(key.attribute, kind), valueDef(key, kind));
  }

  private static ValueDef valueDef(IndexSchema.Key key, AttributeKind kind) {
    if (key.format != null) return ValueDef.format(key.format, kind);
    if (key.fromField != null) return ValueDef.fromField(key.fromField);
    if (key.bytes != null) return ValueDef.bytes(key.bytes);
    if (key.constant instanceof Number n) return ValueDef.constant(n);
    return ValueDef.constant(String.valueOf(key.constant));
  }
}
