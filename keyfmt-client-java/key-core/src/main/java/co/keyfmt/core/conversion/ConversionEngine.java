package co.keyfmt.core.conversion;

import co.keyfmt.core.FieldType;
import co.keyfmt.core.conversion.ConversionException.Reason;
import co.keyfmt.core.pattern.Segment;

import java.util.IllegalFormatException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Chooses the canonical encoding of a field reference from its semantic type.
 *
 * <p>Dispatch is on the type category, with the width spec acting as an override:
 * <ul>
 *   <li>text: the width spec applied to the text, otherwise the text unchanged</li>
 *   <li>integers: the width spec, otherwise unpadded base-10</li>
 *   <li>floating point: the width spec, or the last modifier used as a printf spec; one is required</li>
 *   <li>date-times: {@code [utc:]format[:%spec]} where format is {@code unix}, {@code unixmilli},
 *       {@code unixnano}, {@code rfc3339}, {@code rfc3339fixed}, {@code rfc3339nano} or a
 *       {@link java.time.format.DateTimeFormatter} pattern</li>
 *   <li>anything else: {@link String#valueOf(Object)}</li>
 * </ul>
 */
public final class ConversionEngine {

  public static final String UTC_MODIFIER = "utc";

  private static final Pattern PRINTF_SPEC = Pattern.compile("%[-#+ 0,(]*\\d*(?:\\.\\d+)?[a-zA-Z]");

  private ConversionEngine() {}

  /**
   * Convert a field reference for both a named parameter and a record field access.
   */
  public static KeyConversion convertForKey(Segment.FieldRef ref, FieldType type) {
    ConversionDescriptor parameter = convert(ref, type, ValueSource.parameter(ref.parameterName()));
    ConversionDescriptor entityField = convert(ref, type, ValueSource.field(ref.pathComponents()));
    return new KeyConversion(ref, type, parameter, entityField);
  }

  public static ConversionDescriptor convert(Segment.FieldRef ref, FieldType type, ValueSource source) {
    ConversionExpr value = new ConversionExpr.Source(source);
    switch (type.category()) {
      case TEXT:
        if (ref.hasWidthSpec()) {
          return ConversionDescriptor.of(printf(ref, ref.widthSpec(), "", value));
        }
        return ConversionDescriptor.of(value);
      case SIGNED_INTEGER:
      case UNSIGNED_INTEGER:
        if (ref.hasWidthSpec()) {
          return ConversionDescriptor.of(printf(ref, ref.widthSpec(), 0L, value, type.isUnsigned()));
        }
        return ConversionDescriptor.of(new ConversionExpr.DecimalString(value, type.isUnsigned()));
      case FLOATING_POINT:
        return ConversionDescriptor.of(convertFloat(ref, type, value));
      case TEMPORAL:
        return ConversionDescriptor.of(convertTemporal(ref, value));
      default:
        return ConversionDescriptor.of(new ConversionExpr.Stringify(value));
    }
  }

  private static ConversionExpr convertFloat(Segment.FieldRef ref, FieldType type, ConversionExpr value) {
    String spec = ref.hasWidthSpec() ? ref.widthSpec() : ref.primaryFormat();
    if (spec == null) {
      throw new ConversionException(Reason.MISSING_FLOAT_FORMAT, ref.path(),
        "floating point field " + ref.path() + " (" + type.name() + ") requires an explicit format, "
          + "e.g. {" + ref.path() + ":%.2f} or {" + ref.path() + ":%020.2f}");
    }
    return printf(ref, spec, 0.0d, value);
  }

  private static ConversionExpr convertTemporal(Segment.FieldRef ref, ConversionExpr value) {
    String format = ref.primaryFormat();
    if (format == null || UTC_MODIFIER.equals(format)) {
      throw new ConversionException(Reason.MISSING_TEMPORAL_FORMAT, ref.path(),
        "date-time field " + ref.path() + " requires an explicit format, e.g. {" + ref.path() + ":unix}, "
          + "{" + ref.path() + ":unixmilli:%014d} or {" + ref.path() + ":utc:rfc3339fixed}");
    }

    List<String> preTransforms = ref.modifiers().subList(0, ref.modifiers().size() - 1);
    for (String modifier : preTransforms) {
      if (!UTC_MODIFIER.equals(modifier)) {
        throw new ConversionException(Reason.UNKNOWN_MODIFIER, ref.path(),
          "unknown modifier \"" + modifier + "\" on " + ref.path() + "; only \"utc\" may precede the format");
      }
    }
    ConversionExpr time = preTransforms.contains(UTC_MODIFIER) ? new ConversionExpr.ToUtc(value) : value;

    EpochUnit unit = EpochUnit.fromModifier(format);
    if (unit != null) {
      ConversionExpr count = new ConversionExpr.EpochCount(time, unit);
      if (ref.hasWidthSpec()) {
        return printf(ref, ref.widthSpec(), 0L, count);
      }
      return new ConversionExpr.DecimalString(count, false);
    }

    try {
      return new ConversionExpr.TemporalFormat(time, TemporalLayout.forModifier(format));
    } catch (IllegalArgumentException e) {
      throw new ConversionException(Reason.INVALID_TEMPORAL_LAYOUT, ref.path(),
        "invalid date-time layout \"" + format + "\" on " + ref.path() + ": " + e.getMessage(), e);
    }
  }

  private static ConversionExpr printf(Segment.FieldRef ref, String spec, Object sample, ConversionExpr operand) {
    return printf(ref, spec, sample, operand, false);
  }

  private static ConversionExpr printf(Segment.FieldRef ref, String spec, Object sample, ConversionExpr operand,
                                       boolean unsigned) {
    if (!PRINTF_SPEC.matcher(spec).matches()) {
      throw new ConversionException(Reason.INVALID_WIDTH_SPEC, ref.path(),
        "invalid format spec \"" + spec + "\" on " + ref.path() + ": expected a single printf directive such as %020d");
    }
    try {
      String.format(Locale.ROOT, spec, ValueCoercions.coerceForSpec(spec, sample));
    } catch (IllegalFormatException e) {
      throw new ConversionException(Reason.INVALID_WIDTH_SPEC, ref.path(),
        "format spec \"" + spec + "\" does not apply to " + ref.path() + ": " + e.getMessage(), e);
    }
    return new ConversionExpr.PrintfFormat(spec, operand, unsigned);
  }
}
