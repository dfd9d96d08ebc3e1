package co.keyfmt.core.conversion;

import java.util.Objects;

/**
 * Result of converting one field reference against one semantic type.
 *
 * @param expression              how the value becomes key text
 * @param requiresNumericLibrary  the expression applies a printf spec
 * @param requiresTemporalLibrary the expression formats or re-zones date-times
 */
public record ConversionDescriptor(
  ConversionExpr expression,
  boolean requiresNumericLibrary,
  boolean requiresTemporalLibrary
) {

  public ConversionDescriptor {
    Objects.requireNonNull(expression, "expression");
  }

  /**
   * Describe an expression, deriving the capability flags from the nodes it contains.
   */
  public static ConversionDescriptor of(ConversionExpr expression) {
    boolean numeric = false;
    boolean temporal = false;
    for (ConversionExpr e = expression; e != null; e = e.operand()) {
      if (e instanceof ConversionExpr.PrintfFormat) {
        numeric = true;
      }
      if (e instanceof ConversionExpr.TemporalFormat || e instanceof ConversionExpr.ToUtc) {
        temporal = true;
      }
    }
    return new ConversionDescriptor(expression, numeric, temporal);
  }

  /** True when the value is copied into the key as-is. */
  public boolean isDirectCopy() {
    return expression instanceof ConversionExpr.Source;
  }

  public ValueSource source() {
    return expression.source();
  }

  /**
   * Encode a value in-process.
   *
   * @param value the field value (String, Number, or a java.time date-time)
   * @return the encoded key text
   * @throws IllegalArgumentException if the value's type does not fit this conversion
   */
  public String encode(Object value) {
    Objects.requireNonNull(value, "value");
    return String.valueOf(expression.evaluate(value));
  }
}
