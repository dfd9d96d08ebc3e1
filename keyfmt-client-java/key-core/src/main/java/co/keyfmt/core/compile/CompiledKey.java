package co.keyfmt.core.compile;

import co.keyfmt.core.index.KeyDef;
import co.keyfmt.core.pattern.AttributeKind;
import co.keyfmt.core.sortability.SortabilityDiagnostic;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A key definition compiled against the field types of its entity.
 *
 * <p>Holds everything an emitter needs (parts with both conversions, parameters, literal prefix,
 * capability flags, diagnostics) and can also build key values in-process.
 */
public final class CompiledKey {

  public enum Position { PARTITION, SORT }

  private final KeyDef keyDef;
  private final Position position;
  private final String source;
  private final AttributeValue constant;
  private final List<KeyPart> parts;
  private final List<KeyParameter> parameters;
  private final String literalPrefix;
  private final List<SortabilityDiagnostic> diagnostics;

  CompiledKey(KeyDef keyDef, Position position, String source, AttributeValue constant, List<KeyPart> parts,
              List<KeyParameter> parameters, String literalPrefix, List<SortabilityDiagnostic> diagnostics) {
    this.keyDef = Objects.requireNonNull(keyDef, "keyDef");
    this.position = Objects.requireNonNull(position, "position");
    this.source = source;
    this.constant = constant;
    this.parts = List.copyOf(parts);
    this.parameters = List.copyOf(parameters);
    this.literalPrefix = literalPrefix;
    this.diagnostics = List.copyOf(diagnostics);
  }

  public KeyDef keyDef() {
    return keyDef;
  }

  public String attributeName() {
    return keyDef.attributeName();
  }

  public AttributeKind kind() {
    return keyDef.kind();
  }

  public Position position() {
    return position;
  }

  /** The definition this key was compiled from, e.g. the raw pattern or field path. */
  public String source() {
    return source;
  }

  public boolean isConstant() {
    return constant != null;
  }

  /** The constant attribute value, or {@code null} when the key has parameters. */
  public AttributeValue constantValue() {
    return constant;
  }

  public List<KeyPart> parts() {
    return parts;
  }

  /** Distinct parameters in first-use order. */
  public List<KeyParameter> parameters() {
    return parameters;
  }

  public String literalPrefix() {
    return literalPrefix;
  }

  public List<SortabilityDiagnostic> diagnostics() {
    return diagnostics;
  }

  public boolean requiresNumericLibrary() {
    return fields().stream().anyMatch(f -> f.conversion().requiresNumericLibrary());
  }

  public boolean requiresTemporalLibrary() {
    return fields().stream().anyMatch(f -> f.conversion().requiresTemporalLibrary());
  }

  public List<KeyPart.Field> fields() {
    return parts.stream()
      .filter(KeyPart.Field.class::isInstance)
      .map(KeyPart.Field.class::cast)
      .collect(Collectors.toList());
  }

  /**
   * Build the key text from parameter values keyed by parameter name.
   *
   * @throws IllegalArgumentException if a parameter is missing or has the wrong Java type
   */
  public String format(Map<String, ?> parameterValues) {
    if (constant != null) return constantText();
    StringBuilder sb = new StringBuilder();
    for (KeyPart part : parts) {
      if (part instanceof KeyPart.Text text) {
        sb.append(text.value());
      } else if (part instanceof KeyPart.Field field) {
        Object value = require(parameterValues, field.parameterName(), "parameter");
        sb.append(field.conversion().parameter().encode(value));
      }
    }
    return sb.toString();
  }

  /**
   * Build the key text from record field values keyed by dotted field path.
   *
   * @throws IllegalArgumentException if a field is missing or has the wrong Java type
   */
  public String formatEntity(Map<String, ?> fieldValues) {
    if (constant != null) return constantText();
    StringBuilder sb = new StringBuilder();
    for (KeyPart part : parts) {
      if (part instanceof KeyPart.Text text) {
        sb.append(text.value());
      } else if (part instanceof KeyPart.Field field) {
        Object value = require(fieldValues, field.fieldPath(), "field");
        sb.append(field.conversion().entityField().encode(value));
      }
    }
    return sb.toString();
  }

  /** {@link #format(Map)} wrapped in an attribute value of this key's kind. */
  public AttributeValue formatAttribute(Map<String, ?> parameterValues) {
    if (constant != null) return constant;
    return toAttribute(format(parameterValues));
  }

  /**
   * Build a begins-with prefix from the leading parameters that are present.
   *
   * <p>Parts are appended in order until the first field whose parameter is absent; literal text
   * between supplied fields is kept. For {@code ORDER#{tenant}#{id}} with only {@code tenant}
   * supplied the result is {@code ORDER#acme#}. With no parameters this is the literal prefix.
   */
  public String beginsWith(Map<String, ?> leadingValues) {
    if (constant != null) return constantText();
    StringBuilder sb = new StringBuilder();
    for (KeyPart part : parts) {
      if (part instanceof KeyPart.Text text) {
        sb.append(text.value());
      } else if (part instanceof KeyPart.Field field) {
        Object value = leadingValues.get(field.parameterName());
        if (value == null) break;
        sb.append(field.conversion().parameter().encode(value));
      }
    }
    return sb.toString();
  }

  private AttributeValue toAttribute(String text) {
    switch (keyDef.kind()) {
      case NUMBER:
        return AttributeValue.fromN(text);
      case BINARY:
        return AttributeValue.fromB(SdkBytes.fromUtf8String(text));
      default:
        return AttributeValue.fromS(text);
    }
  }

  private String constantText() {
    if (constant.s() != null) return constant.s();
    if (constant.n() != null) return constant.n();
    return literalPrefix;
  }

  private static Object require(Map<String, ?> values, String name, String what) {
    Object value = values.get(name);
    if (value == null) {
      throw new IllegalArgumentException("missing value for " + what + " " + name);
    }
    return value;
  }

  @Override
  public String toString() {
    return keyDef.attributeName() + "=" + source;
  }
}
