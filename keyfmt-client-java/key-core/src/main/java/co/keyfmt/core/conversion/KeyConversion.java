package co.keyfmt.core.conversion;

import co.keyfmt.core.FieldType;
import co.keyfmt.core.pattern.Segment;

/**
 * Both conversions of one field reference: from a named parameter and from a record field.
 */
public record KeyConversion(
  Segment.FieldRef fieldRef,
  FieldType fieldType,
  ConversionDescriptor parameter,
  ConversionDescriptor entityField
) {

  public String parameterName() {
    return fieldRef.parameterName();
  }

  public boolean requiresNumericLibrary() {
    return parameter.requiresNumericLibrary() || entityField.requiresNumericLibrary();
  }

  public boolean requiresTemporalLibrary() {
    return parameter.requiresTemporalLibrary() || entityField.requiresTemporalLibrary();
  }
}
