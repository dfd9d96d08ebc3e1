package co.keyfmt.core.sortability;

import co.keyfmt.core.FieldType;
import co.keyfmt.core.FieldTypeResolver;
import co.keyfmt.core.conversion.ConversionEngine;
import co.keyfmt.core.pattern.PatternSpec;
import co.keyfmt.core.pattern.Segment;
import co.keyfmt.core.sortability.SortabilityDiagnostic.UnsafeCondition;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flags sort-key encodings that do not order correctly under byte-wise string comparison.
 *
 * <p>Only meaningful for field references in sort-key position. Checks never throw.
 */
public final class SortabilityAdvisor {

  private SortabilityAdvisor() {}

  /**
   * Check every field reference of a sort-key pattern. References whose type the resolver does
   * not know are skipped.
   */
  public static List<SortabilityDiagnostic> checkAll(PatternSpec spec, FieldTypeResolver types, String entityLabel) {
    List<SortabilityDiagnostic> diagnostics = new ArrayList<>();
    for (Segment.FieldRef ref : spec.fieldRefs()) {
      types.resolve(ref.path())
        .flatMap(type -> checkSortSafety(ref, type, entityLabel))
        .ifPresent(diagnostics::add);
    }
    return diagnostics;
  }

  public static Optional<SortabilityDiagnostic> checkSortSafety(Segment.FieldRef ref, FieldType type, String entityLabel) {
    if (type.isInteger() && !hasPadding(ref.widthSpec())) {
      return diagnostic(entityLabel, ref, UnsafeCondition.UNPADDED_INTEGER,
        type.name() + " rendered without zero padding; string comparison puts \"9\" after \"10\"",
        "add zero padding such as {" + ref.path() + ":%020d}, or store the key as a number attribute");
    }

    if (type.isFloatingPoint() && !hasPadding(ref.widthSpec())) {
      String spec = ref.hasWidthSpec() ? ref.widthSpec() : ref.primaryFormat();
      return diagnostic(entityLabel, ref, UnsafeCondition.UNPADDED_FLOAT,
        type.name() + " format \"" + spec + "\" has no total width, so the integer part varies in length",
        "give the spec a zero-padded total width such as {" + ref.path() + ":%020.2f}");
    }

    if (!type.isTemporal()) {
      return Optional.empty();
    }

    String format = ref.primaryFormat();
    if (format == null) {
      return Optional.empty();
    }
    switch (format) {
      case "unix":
        return unpaddedEpoch(entityLabel, ref, "seconds", "9 digits before 2001-09-09, 10 after", "%011d");
      case "unixmilli":
        return unpaddedEpoch(entityLabel, ref, "milliseconds", "12 digits before 2001-09-09, 13 after", "%014d");
      case "unixnano":
        return unpaddedEpoch(entityLabel, ref, "nanoseconds", "18 digits before 2001-09-09, 19 after", "%020d");
      case "rfc3339":
        return diagnostic(entityLabel, ref, UnsafeCondition.TIMEZONE_DEPENDENT_TIMESTAMP,
          "rfc3339 keeps the caller's offset (Z vs +05:30), so instants in different zones misorder",
          "use {" + ref.path() + ":utc:rfc3339fixed} or a zero-padded unix/unixmilli/unixnano counter");
      case "rfc3339nano":
        return diagnostic(entityLabel, ref, UnsafeCondition.VARIABLE_WIDTH_TIMESTAMP,
          "rfc3339nano strips trailing fraction zeros and keeps the caller's offset, so its length varies",
          "use {" + ref.path() + ":utc:rfc3339fixed} or a zero-padded unix/unixmilli/unixnano counter");
      case "rfc3339fixed":
        if (!ref.hasModifier(ConversionEngine.UTC_MODIFIER)) {
          return diagnostic(entityLabel, ref, UnsafeCondition.TIMEZONE_DEPENDENT_TIMESTAMP,
            "rfc3339fixed has constant length but differing offsets still misorder (\"...+05:00\" > \"...Z\")",
            "normalize first: {" + ref.path() + ":utc:rfc3339fixed}");
        }
        return Optional.empty();
      default:
        return Optional.empty();
    }
  }

  /**
   * True when a printf spec zero-pads to a fixed width, e.g. {@code %020d} or {@code %020.2f}.
   */
  public static boolean hasPadding(String spec) {
    return spec != null && spec.startsWith("%0") && spec.length() > 2;
  }

  private static Optional<SortabilityDiagnostic> unpaddedEpoch(String entityLabel, Segment.FieldRef ref,
                                                              String resolution, String digits, String padding) {
    if (hasPadding(ref.widthSpec())) {
      return Optional.empty();
    }
    return diagnostic(entityLabel, ref, UnsafeCondition.UNPADDED_EPOCH,
      "epoch " + resolution + " without padding change digit count (" + digits + ")",
      "add padding: {" + ref.path() + ":" + ref.primaryFormat() + ":" + padding + "}");
  }

  private static Optional<SortabilityDiagnostic> diagnostic(String entityLabel, Segment.FieldRef ref,
                                                           UnsafeCondition condition, String cause, String suggestion) {
    return Optional.of(new SortabilityDiagnostic(entityLabel, ref.path(), condition, cause, suggestion));
  }
}
