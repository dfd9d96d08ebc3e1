package co.keyfmt.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Field path to semantic type lookup, supplied by a schema provider.
 *
 * <p>Paths use the same dot notation as key patterns ({@code "user.id"}).
 */
@FunctionalInterface
public interface FieldTypeResolver {

  Optional<FieldType> resolve(String fieldPath);

  /**
   * Build a resolver over a fixed path → type name table.
   */
  static FieldTypeResolver of(Map<String, String> typeNames) {
    Map<String, FieldType> types = new LinkedHashMap<>();
    typeNames.forEach((path, typeName) -> types.put(path, FieldType.of(typeName)));
    Map<String, FieldType> snapshot = Map.copyOf(types);
    return path -> Optional.ofNullable(snapshot.get(path));
  }
}
