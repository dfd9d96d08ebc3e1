package co.keyfmt.core;

import java.util.Objects;
import java.util.Set;

/**
 * Semantic type of a record field, as named by a schema provider.
 *
 * <p>The conversion engine only cares about the category; the original type name is kept so that
 * emitters can pick a matching target-language type.
 *
 * <h3>Recognised names</h3>
 * <pre>
 *   text              string, String, text, CharSequence
 *   signed integer    number, number.int, number.long, timestamp.epoch,
 *                     int, long, short, byte, Integer, Long, Short, Byte, BigInteger,
 *                     int8, int16, int32, int64
 *   unsigned integer  uint, uint8, uint16, uint32, uint64
 *   floating point    number.float, number.double, number.decimal,
 *                     float, double, Float, Double, BigDecimal, float32, float64
 *   temporal          timestamp, Instant, OffsetDateTime, ZonedDateTime, time.Time, Time
 * </pre>
 *
 * <p>Any other name is {@link Category#OTHER} and falls back to a best-effort string encoding.
 */
public record FieldType(String name, Category category) {

  public enum Category {
    TEXT, SIGNED_INTEGER, UNSIGNED_INTEGER, FLOATING_POINT, TEMPORAL, OTHER
  }

  private static final Set<String> TEXT_NAMES = Set.of("string", "String", "text", "CharSequence");

  private static final Set<String> SIGNED_INTEGER_NAMES = Set.of(
    "number", "number.int", "number.long", "timestamp.epoch",
    "int", "long", "short", "byte", "Integer", "Long", "Short", "Byte", "BigInteger",
    "int8", "int16", "int32", "int64"
  );

  private static final Set<String> UNSIGNED_INTEGER_NAMES = Set.of("uint", "uint8", "uint16", "uint32", "uint64");

  private static final Set<String> FLOATING_POINT_NAMES = Set.of(
    "number.float", "number.double", "number.decimal",
    "float", "double", "Float", "Double", "BigDecimal", "float32", "float64"
  );

  private static final Set<String> TEMPORAL_NAMES = Set.of(
    "timestamp", "Instant", "OffsetDateTime", "ZonedDateTime", "time.Time", "Time"
  );

  public FieldType {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(category, "category");
  }

  /**
   * Classify a type name. Never fails: unknown names map to {@link Category#OTHER}.
   *
   * @param name the type name from the schema provider
   * @return the classified type
   */
  public static FieldType of(String name) {
    Objects.requireNonNull(name, "name");
    return new FieldType(name, categorize(name));
  }

  private static Category categorize(String name) {
    if (TEXT_NAMES.contains(name)) return Category.TEXT;
    if (SIGNED_INTEGER_NAMES.contains(name)) return Category.SIGNED_INTEGER;
    if (UNSIGNED_INTEGER_NAMES.contains(name)) return Category.UNSIGNED_INTEGER;
    if (FLOATING_POINT_NAMES.contains(name)) return Category.FLOATING_POINT;
    if (TEMPORAL_NAMES.contains(name)) return Category.TEMPORAL;
    return Category.OTHER;
  }

  public boolean isText() {
    return category == Category.TEXT;
  }

  public boolean isInteger() {
    return category == Category.SIGNED_INTEGER || category == Category.UNSIGNED_INTEGER;
  }

  public boolean isUnsigned() {
    return category == Category.UNSIGNED_INTEGER;
  }

  public boolean isFloatingPoint() {
    return category == Category.FLOATING_POINT;
  }

  public boolean isTemporal() {
    return category == Category.TEMPORAL;
  }

  @Override
  public String toString() {
    return name;
  }
}
