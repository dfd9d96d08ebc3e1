package co.keyfmt.core.conversion;

import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Objects;

/**
 * Abstract expression describing how a field value becomes its encoded key text.
 *
 * <p>Expressions form a chain that bottoms out in a {@link Source}. Emitters walk the chain to
 * produce target-language code; {@link #evaluate(Object)} applies it in-process.
 */
public sealed interface ConversionExpr permits ConversionExpr.Source, ConversionExpr.ToUtc,
  ConversionExpr.EpochCount, ConversionExpr.PrintfFormat, ConversionExpr.DecimalString,
  ConversionExpr.TemporalFormat, ConversionExpr.Stringify {

  /** The wrapped expression, or {@code null} for a {@link Source}. */
  ConversionExpr operand();

  /**
   * Apply this expression to the raw input value.
   *
   * @throws IllegalArgumentException if the value's Java type does not fit the expression
   */
  Object evaluate(Object input);

  /** The value source at the bottom of the chain. */
  default ValueSource source() {
    ConversionExpr e = this;
    while (!(e instanceof Source)) {
      e = e.operand();
    }
    return ((Source) e).valueSource();
  }

  /** The raw value, unchanged. */
  record Source(ValueSource valueSource) implements ConversionExpr {
    public Source {
      Objects.requireNonNull(valueSource, "valueSource");
    }

    @Override
    public ConversionExpr operand() {
      return null;
    }

    @Override
    public Object evaluate(Object input) {
      return input;
    }
  }

  /** Normalizes a date-time to UTC before it is formatted. */
  record ToUtc(ConversionExpr operand) implements ConversionExpr {
    @Override
    public Object evaluate(Object input) {
      return ValueCoercions.toOffsetDateTime(operand.evaluate(input)).withOffsetSameInstant(ZoneOffset.UTC);
    }
  }

  /** Date-time to an integer count since the epoch. */
  record EpochCount(ConversionExpr operand, EpochUnit unit) implements ConversionExpr {
    @Override
    public Object evaluate(Object input) {
      return unit.count(ValueCoercions.toInstant(operand.evaluate(input)));
    }
  }

  /**
   * printf-style formatting with {@link Locale#ROOT}. With {@code unsigned} set, {@code long} and
   * {@code int} operands are read as unsigned before formatting.
   */
  record PrintfFormat(String spec, ConversionExpr operand, boolean unsigned) implements ConversionExpr {
    @Override
    public Object evaluate(Object input) {
      Object value = operand.evaluate(input);
      if (unsigned) {
        value = ValueCoercions.toUnsigned(value);
      }
      return String.format(Locale.ROOT, spec, ValueCoercions.coerceForSpec(spec, value));
    }
  }

  /** Canonical unpadded base-10 text of an integer. */
  record DecimalString(ConversionExpr operand, boolean unsigned) implements ConversionExpr {
    @Override
    public Object evaluate(Object input) {
      return ValueCoercions.decimalString(operand.evaluate(input), unsigned);
    }
  }

  record TemporalFormat(ConversionExpr operand, TemporalLayout layout) implements ConversionExpr {
    @Override
    public Object evaluate(Object input) {
      return layout.formatter().format(ValueCoercions.toOffsetDateTime(operand.evaluate(input)));
    }
  }

  /** Best-effort {@link String#valueOf(Object)} for types without a dedicated encoding. */
  record Stringify(ConversionExpr operand) implements ConversionExpr {
    @Override
    public Object evaluate(Object input) {
      return String.valueOf(operand.evaluate(input));
    }
  }
}
