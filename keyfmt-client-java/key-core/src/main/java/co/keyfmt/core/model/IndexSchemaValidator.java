package co.keyfmt.core.model;

import co.keyfmt.core.pattern.AttributeKind;
import co.keyfmt.core.pattern.PatternParseException;
import co.keyfmt.core.pattern.PatternSpec;

import java.util.Base64;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class IndexSchemaValidator {

  static final String MAP_TYPE = "map";

  private IndexSchemaValidator() {}

  public static void validate(IndexSchema s) {
    if (isBlank(s.entityName)) fail("entityName required");
    if (isBlank(s.tableName)) fail(s.entityName + ": tableName required");
    if (s.fields == null || s.fields.isEmpty()) fail("fields must have at least one field for " + s.entityName);

    validateFields(s.entityName, "", s.fields);

    if (s.partitionKey == null) fail(s.entityName + ": partitionKey required");
    validateKey(s.entityName + ".partitionKey", s.partitionKey);
    if (s.sortKey != null) validateKey(s.entityName + ".sortKey", s.sortKey);

    if (s.secondaryIndexes != null) {
      Set<String> names = new HashSet<>();
      for (IndexSchema.SecondaryIndex gsi : s.secondaryIndexes) {
        if (isBlank(gsi.name)) fail(s.entityName + ": secondary index name required");
        if (!names.add(gsi.name)) fail(s.entityName + ": duplicate secondary index " + gsi.name);
        String where = s.entityName + ".secondaryIndexes." + gsi.name;
        if (gsi.partitionKey == null) fail(where + ": partitionKey required");
        validateKey(where + ".partitionKey", gsi.partitionKey);
        if (gsi.sortKey != null) validateKey(where + ".sortKey", gsi.sortKey);
      }
    }
  }

  private static void validateFields(String entity, String prefix, List<IndexSchema.Field> fields) {
    Set<String> fieldNames = new HashSet<>();
    for (IndexSchema.Field f : fields) {
      if (isBlank(f.name)) fail(entity + ": field.name required");
      String path = prefix + f.name;
      if (f.name.contains(".")) fail(entity + "." + path + ": field names cannot contain '.'; nest a map field instead");
      if (!fieldNames.add(f.name)) fail(entity + ": duplicate field " + path);
      if (isBlank(f.type)) fail(entity + "." + path + ": type required");
      if (MAP_TYPE.equals(f.type)) {
        if (f.fields == null || f.fields.isEmpty()) fail(entity + "." + path + ": map fields must declare nested fields");
        validateFields(entity, path + ".", f.fields);
      }
    }
  }

  private static void validateKey(String where, IndexSchema.Key key) {
    if (isBlank(key.attribute)) fail(where + ": attribute required");

    AttributeKind kind = null;
    try {
      kind = AttributeKind.fromCode(key.kind);
    } catch (IllegalArgumentException e) {
      fail(where + ": " + e.getMessage());
    }

    int sources = 0;
    if (key.format != null) sources++;
    if (key.fromField != null) sources++;
    if (key.constant != null) sources++;
    if (key.bytes != null) sources++;
    if (sources != 1) {
      fail(where + ": exactly one of format, fromField, constant, bytes is required (found " + sources + ")");
    }

    if (key.format != null) {
      try {
        PatternSpec.parse(key.format, kind);
      } catch (PatternParseException e) {
        fail(where + ": " + e.getMessage());
      }
    }
    if (key.fromField != null && (key.fromField.isEmpty() || List.of(key.fromField.split("\\.", -1)).contains(""))) {
      fail(where + ": invalid fromField \"" + key.fromField + "\"");
    }
    if (key.constant != null && !(key.constant instanceof String) && !(key.constant instanceof Number)) {
      fail(where + ": constant must be a string or a number");
    }
    if (key.bytes != null) {
      try {
        Base64.getDecoder().decode(key.bytes);
      } catch (IllegalArgumentException e) {
        fail(where + ": invalid base64 bytes: " + e.getMessage());
      }
    }
  }

  private static boolean isBlank(String s) { return s == null || s.isEmpty(); }
  private static void fail(String msg) { throw new IllegalArgumentException(msg); }
}
