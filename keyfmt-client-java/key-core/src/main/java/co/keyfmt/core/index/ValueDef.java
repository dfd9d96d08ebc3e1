package co.keyfmt.core.index;

import co.keyfmt.core.extract.ExtractionNode;
import co.keyfmt.core.extract.ExtractionNodes;
import co.keyfmt.core.pattern.AttributeKind;
import co.keyfmt.core.pattern.PatternSpec;
import co.keyfmt.core.pattern.Segment;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.Objects;

/**
 * How a key value is derived. Exactly one source per definition:
 * <pre>
 *   ValueDef.format("USER#{id}")     pattern over record fields
 *   ValueDef.fromField("user.id")    direct copy of one field
 *   ValueDef.constant("PROFILE")     constant string
 *   ValueDef.constant(42)            constant number
 *   ValueDef.bytes("AQID")           constant binary, given as base64
 * </pre>
 */
public sealed interface ValueDef permits ValueDef.Format, ValueDef.FromField, ValueDef.Constant {

  /** Build the extraction tree for this definition. */
  ExtractionNode toExtractionNode();

  record Format(PatternSpec pattern) implements ValueDef {
    public Format {
      Objects.requireNonNull(pattern, "pattern");
    }

    @Override
    public ExtractionNode toExtractionNode() {
      return ExtractionNodes.build(pattern);
    }
  }

  record FromField(String path) implements ValueDef {
    public FromField {
      Objects.requireNonNull(path, "path");
      if (Segment.FieldRef.of(path).pathComponents().contains("")) {
        throw new IllegalArgumentException("invalid field path \"" + path + "\"");
      }
    }

    /** The field as a bare reference, with no modifiers. */
    public Segment.FieldRef fieldRef() {
      return Segment.FieldRef.of(path);
    }

    @Override
    public ExtractionNode toExtractionNode() {
      return ExtractionNodes.field(path);
    }
  }

  record Constant(AttributeValue value) implements ValueDef {
    public Constant {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public ExtractionNode toExtractionNode() {
      return new ExtractionNode.Literal(value);
    }
  }

  /**
   * @throws co.keyfmt.core.pattern.PatternParseException if the pattern is malformed
   */
  static ValueDef format(String pattern) {
    return new Format(PatternSpec.parse(pattern));
  }

  static ValueDef format(String pattern, AttributeKind kind) {
    return new Format(PatternSpec.parse(pattern, kind));
  }

  static ValueDef fromField(String path) {
    return new FromField(path);
  }

  static ValueDef constant(String value) {
    return new Constant(AttributeValue.fromS(value));
  }

  static ValueDef constant(Number value) {
    return new Constant(AttributeValue.fromN(value.toString()));
  }

  /**
   * @throws IllegalArgumentException if {@code base64} is not valid base64
   */
  static ValueDef bytes(String base64) {
    ExtractionNode.Literal literal = (ExtractionNode.Literal) ExtractionNodes.binaryConstant(base64);
    return new Constant(literal.value());
  }
}
