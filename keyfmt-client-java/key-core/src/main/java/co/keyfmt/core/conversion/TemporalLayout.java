package co.keyfmt.core.conversion;

import java.time.DateTimeException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * A date-time string layout.
 *
 * <p>Built-in layouts:
 * <pre>
 *   rfc3339       2024-03-05T09:15:00+01:00            second precision, offset preserved
 *   rfc3339fixed  2024-03-05T09:15:00.120000000Z       nine fraction digits, constant length in UTC
 *   rfc3339nano   2024-03-05T09:15:00.12Z              trailing fraction zeros stripped
 * </pre>
 * Any other layout is a {@link DateTimeFormatter} pattern.
 */
public final class TemporalLayout {

  public static final TemporalLayout RFC3339 =
    new TemporalLayout("rfc3339", "uuuu-MM-dd'T'HH:mm:ssXXX");
  public static final TemporalLayout RFC3339_FIXED =
    new TemporalLayout("rfc3339fixed", "uuuu-MM-dd'T'HH:mm:ss.SSSSSSSSSXXX");
  public static final TemporalLayout RFC3339_NANO =
    new TemporalLayout("rfc3339nano", null);

  private static final OffsetDateTime SAMPLE = OffsetDateTime.of(2001, 9, 9, 1, 46, 40, 0, ZoneOffset.UTC);

  private final String name;
  private final String pattern;
  private final DateTimeFormatter formatter;

  private TemporalLayout(String name, String pattern) {
    this.name = name;
    this.pattern = pattern;
    this.formatter = pattern == null ? DateTimeFormatter.ISO_OFFSET_DATE_TIME : DateTimeFormatter.ofPattern(pattern);
  }

  /**
   * Resolve a format modifier to a layout: one of the built-in names, otherwise a custom
   * {@link DateTimeFormatter} pattern.
   *
   * @throws IllegalArgumentException if a custom pattern is invalid, contains no pattern letters,
   *                                  or cannot format an offset date-time
   */
  public static TemporalLayout forModifier(String modifier) {
    Objects.requireNonNull(modifier, "modifier");
    switch (modifier) {
      case "rfc3339":
        return RFC3339;
      case "rfc3339fixed":
        return RFC3339_FIXED;
      case "rfc3339nano":
        return RFC3339_NANO;
      default:
        return custom(modifier);
    }
  }

  public static TemporalLayout custom(String pattern) {
    if (pattern.chars().noneMatch(Character::isLetter)) {
      throw new IllegalArgumentException("layout \"" + pattern + "\" has no date-time fields");
    }
    TemporalLayout layout = new TemporalLayout(pattern, pattern);
    try {
      layout.formatter.format(SAMPLE);
    } catch (DateTimeException e) {
      throw new IllegalArgumentException("layout \"" + pattern + "\" cannot format a date-time: " + e.getMessage(), e);
    }
    return layout;
  }

  /** Modifier name; for custom layouts this is the pattern itself. */
  public String name() {
    return name;
  }

  /**
   * {@link DateTimeFormatter} pattern, or {@code null} for {@link #RFC3339_NANO}, which uses
   * {@link DateTimeFormatter#ISO_OFFSET_DATE_TIME}.
   */
  public String pattern() {
    return pattern;
  }

  public DateTimeFormatter formatter() {
    return formatter;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TemporalLayout other)) return false;
    return name.equals(other.name) && Objects.equals(pattern, other.pattern);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, pattern);
  }

  @Override
  public String toString() {
    return name;
  }
}
