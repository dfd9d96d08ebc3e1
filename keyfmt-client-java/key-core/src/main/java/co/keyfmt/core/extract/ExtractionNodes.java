package co.keyfmt.core.extract;

import co.keyfmt.core.pattern.AttributeKind;
import co.keyfmt.core.pattern.PatternSpec;
import co.keyfmt.core.pattern.Segment;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Builds extraction trees from parsed patterns.
 *
 * <p>Modifiers and width specs are not applied at extraction time: the stored item already holds
 * the encoded field values, so each reference copies its attribute as stored.
 */
public final class ExtractionNodes {

  private ExtractionNodes() {}

  /**
   * Build the tree for a pattern.
   *
   * <pre>
   *   "PROFILE"             Literal(S "PROFILE")
   *   "{userId}"            FieldPath(userId)
   *   "USER#{user.id}"      Concat(Literal(S "USER#"), FieldPath(user, id))
   * </pre>
   * A constant binary-kind pattern is read as base64 and becomes a {@code B} literal.
   */
  public static ExtractionNode build(PatternSpec spec) {
    if (spec.isConstant()) {
      String text = spec.raw();
      if (spec.kind() == AttributeKind.BINARY) {
        return binaryConstant(text);
      }
      return ExtractionNode.Literal.ofString(text);
    }

    List<ExtractionNode> parts = new ArrayList<>();
    for (Segment segment : spec.segments()) {
      if (segment instanceof Segment.Literal literal) {
        parts.add(ExtractionNode.Literal.ofString(literal.value()));
      } else if (segment instanceof Segment.FieldRef ref) {
        parts.add(new ExtractionNode.FieldPath(ref.pathComponents()));
      }
    }
    if (parts.size() == 1) {
      return parts.get(0);
    }
    return new ExtractionNode.Concat(parts);
  }

  /** Direct copy of one, possibly nested, field. */
  public static ExtractionNode field(String dottedPath) {
    return new ExtractionNode.FieldPath(Segment.FieldRef.of(dottedPath).pathComponents());
  }

  public static ExtractionNode constant(String value) {
    return ExtractionNode.Literal.ofString(value);
  }

  public static ExtractionNode constant(Number value) {
    return new ExtractionNode.Literal(AttributeValue.fromN(value.toString()));
  }

  /**
   * @throws IllegalArgumentException if {@code base64} is not valid base64
   */
  public static ExtractionNode binaryConstant(String base64) {
    byte[] bytes = Base64.getDecoder().decode(base64);
    return new ExtractionNode.Literal(AttributeValue.fromB(SdkBytes.fromByteArray(bytes)));
  }
}
