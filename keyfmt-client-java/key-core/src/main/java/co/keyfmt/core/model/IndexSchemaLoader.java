package co.keyfmt.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@link IndexSchema} documents from JSON text. Callers do their own I/O.
 */
public final class IndexSchemaLoader {
  private static final ObjectMapper JSON = new ObjectMapper();

  private IndexSchemaLoader() {}

  /**
   * Parse and validate a single schema object.
   *
   * @throws JsonProcessingException  if the text is not valid JSON for the model
   * @throws IllegalArgumentException if the schema does not validate
   */
  public static IndexSchema parse(String json) throws JsonProcessingException {
    IndexSchema s = JSON.readValue(json, IndexSchema.class);
    IndexSchemaValidator.validate(s);
    return s;
  }

  /**
   * Parse either one schema object or an array of them, validating each.
   */
  public static List<IndexSchema> parseAll(String json) throws JsonProcessingException {
    JsonNode root = JSON.readTree(json);
    List<IndexSchema> schemas = new ArrayList<>();
    if (root != null && root.isArray()) {
      for (JsonNode node : root) {
        schemas.add(JSON.treeToValue(node, IndexSchema.class));
      }
    } else if (root != null && root.isObject()) {
      schemas.add(JSON.treeToValue(root, IndexSchema.class));
    } else {
      throw new IllegalArgumentException("expected a schema object or an array of schema objects");
    }
    for (IndexSchema s : schemas) {
      IndexSchemaValidator.validate(s);
    }
    return schemas;
  }
}
