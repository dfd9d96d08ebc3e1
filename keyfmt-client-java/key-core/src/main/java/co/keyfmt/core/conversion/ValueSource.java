package co.keyfmt.core.conversion;

import java.util.List;
import java.util.Objects;

/**
 * Where a conversion reads its input from.
 *
 * <p>The same field reference is converted once for callers holding a loose value (a named
 * {@link Parameter}) and once for callers holding a whole record (a {@link FieldAccess} path).
 */
public sealed interface ValueSource permits ValueSource.Parameter, ValueSource.FieldAccess {

  record Parameter(String name) implements ValueSource {
    public Parameter {
      Objects.requireNonNull(name, "name");
    }
  }

  record FieldAccess(List<String> path) implements ValueSource {
    public FieldAccess {
      path = List.copyOf(path);
      if (path.isEmpty()) throw new IllegalArgumentException("field access path cannot be empty");
    }
  }

  static Parameter parameter(String name) {
    return new Parameter(name);
  }

  static FieldAccess field(List<String> path) {
    return new FieldAccess(path);
  }
}
