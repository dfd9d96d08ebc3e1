package co.keyfmt.core.conversion;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

final class ValueCoercions {

  private ValueCoercions() {}

  static OffsetDateTime toOffsetDateTime(Object value) {
    if (value instanceof OffsetDateTime odt) return odt;
    if (value instanceof ZonedDateTime zdt) return zdt.toOffsetDateTime();
    if (value instanceof Instant instant) return instant.atOffset(ZoneOffset.UTC);
    throw new IllegalArgumentException("expected a date-time value, got " + describe(value));
  }

  static Instant toInstant(Object value) {
    if (value instanceof Instant instant) return instant;
    return toOffsetDateTime(value).toInstant();
  }

  static String decimalString(Object value, boolean unsigned) {
    if (value instanceof Long l) {
      return unsigned ? Long.toUnsignedString(l) : Long.toString(l);
    }
    if (value instanceof Integer i) {
      return unsigned ? Integer.toUnsignedString(i) : Integer.toString(i);
    }
    if (value instanceof Short || value instanceof Byte || value instanceof BigInteger) {
      return value.toString();
    }
    if (value instanceof BigDecimal bd) {
      return bd.toBigIntegerExact().toString();
    }
    throw new IllegalArgumentException("expected an integer value, got " + describe(value));
  }

  /** Widen a {@code long} or {@code int} holding an unsigned value to its {@link BigInteger}. */
  static Object toUnsigned(Object value) {
    if (value instanceof Long l) {
      return l < 0 ? new BigInteger(Long.toUnsignedString(l)) : BigInteger.valueOf(l);
    }
    if (value instanceof Integer i) {
      return BigInteger.valueOf(Integer.toUnsignedLong(i));
    }
    return value;
  }

  /**
   * Adjust integral and decimal inputs so that {@link java.util.Formatter} accepts them for the
   * spec's conversion character.
   */
  static Object coerceForSpec(String spec, Object value) {
    char conversion = Character.toLowerCase(spec.charAt(spec.length() - 1));
    switch (conversion) {
      case 'f', 'e', 'g' -> {
        if (value instanceof BigInteger bi) return new BigDecimal(bi);
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
          return BigDecimal.valueOf(((Number) value).longValue());
        }
      }
      case 'd', 'x', 'o' -> {
        if (value instanceof BigDecimal bd) return bd.toBigIntegerExact();
      }
      default -> {
        // passed through unchanged
      }
    }
    return value;
  }

  private static String describe(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }
}
