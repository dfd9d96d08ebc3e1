package co.keyfmt.core.pattern;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One piece of a parsed key pattern: either literal text or a field reference.
 */
public sealed interface Segment permits Segment.Literal, Segment.FieldRef {

  boolean isLiteral();

  /**
   * Literal text copied verbatim into the key.
   */
  record Literal(String value) implements Segment {
    public Literal {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean isLiteral() {
      return true;
    }
  }

  /**
   * A {@code {path:modifier...:%spec}} reference to a field of the record.
   *
   * @param path       dot-separated field path, e.g. {@code user.id}
   * @param modifiers  ordered modifier chain; the last entry is the primary format
   * @param widthSpec  printf-style width/precision directive, or {@code null}
   */
  record FieldRef(String path, List<String> modifiers, String widthSpec) implements Segment {
    public FieldRef {
      Objects.requireNonNull(path, "path");
      modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
    }

    public static FieldRef of(String path) {
      return new FieldRef(path, List.of(), null);
    }

    @Override
    public boolean isLiteral() {
      return false;
    }

    /** Path components, e.g. {@code ["user", "id"]} for {@code user.id}. */
    public List<String> pathComponents() {
      return Arrays.asList(path.split("\\.", -1));
    }

    /**
     * Identifier used for a generated parameter: the last path component.
     */
    public String parameterName() {
      List<String> parts = pathComponents();
      return parts.get(parts.size() - 1);
    }

    public boolean hasWidthSpec() {
      return widthSpec != null && !widthSpec.isEmpty();
    }

    /**
     * The primary encoding format (last modifier), or {@code null} when there are no modifiers.
     */
    public String primaryFormat() {
      return modifiers.isEmpty() ? null : modifiers.get(modifiers.size() - 1);
    }

    public boolean hasModifier(String modifier) {
      return modifiers.contains(modifier);
    }
  }
}
