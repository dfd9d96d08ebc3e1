package co.keyfmt.core.pattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A parsed key pattern.
 *
 * <p>Patterns mix literal text with {@code {field}} references:
 * <pre>
 *   "PROFILE"                     constant
 *   "USER#{id}"                   literal prefix + field
 *   "ORDER#{tenant}#{id}"         several fields, order preserved
 *   "{user.id}"                   nested field
 *   "{createdAt:utc:rfc3339fixed}" temporal field with modifiers
 *   "{seq:%020d}"                 zero-padded integer
 * </pre>
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class PatternSpec {

  private final String raw;
  private final AttributeKind kind;
  private final List<Segment> segments;

  PatternSpec(String raw, AttributeKind kind, List<Segment> segments) {
    if (segments == null || segments.isEmpty()) {
      throw new IllegalArgumentException("pattern must have at least one segment");
    }
    this.raw = Objects.requireNonNull(raw, "raw");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.segments = List.copyOf(segments);
  }

  /** Parse a string-kind pattern. */
  public static PatternSpec parse(String raw) {
    return PatternParser.parse(raw);
  }

  public static PatternSpec parse(String raw, AttributeKind kind) {
    return PatternParser.parse(raw, kind);
  }

  public String raw() {
    return raw;
  }

  public AttributeKind kind() {
    return kind;
  }

  public List<Segment> segments() {
    return segments;
  }

  /** True when the pattern has no field references. */
  public boolean isConstant() {
    return segments.size() == 1 && segments.get(0).isLiteral();
  }

  /**
   * Literal text before the first field reference; empty when the pattern starts with a field.
   * For "ORDER#{id}" this is "ORDER#". A constant pattern returns its whole text.
   */
  public String leadingLiteralPrefix() {
    Segment first = segments.get(0);
    if (first instanceof Segment.Literal literal) {
      return literal.value();
    }
    return "";
  }

  /** Field references in pattern order. */
  public List<Segment.FieldRef> fieldRefs() {
    List<Segment.FieldRef> refs = new ArrayList<>();
    for (Segment segment : segments) {
      if (segment instanceof Segment.FieldRef ref) {
        refs.add(ref);
      }
    }
    return refs;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof PatternSpec other)) return false;
    return raw.equals(other.raw) && kind == other.kind && segments.equals(other.segments);
  }

  @Override
  public int hashCode() {
    return Objects.hash(raw, kind, segments);
  }

  @Override
  public String toString() {
    return raw;
  }
}
