package co.keyfmt.core.extract;

import co.keyfmt.core.extract.KeyExtractionException.Reason;
import co.keyfmt.core.pattern.AttributeKind;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Derives a key attribute from a stored item.
 *
 * <p>A tree of {@link Literal}, {@link FieldPath} and {@link Concat} nodes. Nodes are immutable;
 * one instance is built per key definition and applied to any number of items from any thread.
 */
public sealed interface ExtractionNode permits ExtractionNode.Literal, ExtractionNode.FieldPath, ExtractionNode.Concat {

  /**
   * Resolve this node against an item, yielding a scalar {@code S}, {@code N} or {@code B} value.
   *
   * @throws KeyExtractionException if a referenced field is missing or not a scalar
   */
  AttributeValue resolve(Map<String, AttributeValue> item);

  /**
   * Resolve this node and coerce the result to the key's attribute kind.
   *
   * <ul>
   *   <li>{@code S}: strings and numbers pass their text through; binary is base64 encoded</li>
   *   <li>{@code N}: strings and numbers pass their text through; binary is rejected</li>
   *   <li>{@code B}: binary passes through; strings become their UTF-8 bytes; numbers are rejected</li>
   * </ul>
   */
  default AttributeValue apply(Map<String, AttributeValue> item, AttributeKind kind) {
    AttributeValue value = resolve(item);
    switch (kind) {
      case STRING:
        return AttributeValue.fromS(text(value));
      case NUMBER:
        if (value.type() == AttributeValue.Type.B) {
          throw new KeyExtractionException(Reason.INCOMPATIBLE_NUMBER_VALUE, describe(),
            "key kind N cannot hold binary value from " + describe());
        }
        return AttributeValue.fromN(text(value));
      case BINARY:
        if (value.type() == AttributeValue.Type.B) {
          return value;
        }
        if (value.type() == AttributeValue.Type.S) {
          return AttributeValue.fromB(SdkBytes.fromUtf8String(value.s()));
        }
        throw new KeyExtractionException(Reason.INCOMPATIBLE_BINARY_VALUE, describe(),
          "key kind B requires a string or binary value, got " + value.type() + " from " + describe());
      default:
        throw new IllegalStateException("unhandled attribute kind " + kind);
    }
  }

  /** Short description used in error messages. */
  String describe();

  /** A fixed value. */
  record Literal(AttributeValue value) implements ExtractionNode {
    public Literal {
      Objects.requireNonNull(value, "value");
      scalar(value, "literal");
    }

    public static Literal ofString(String text) {
      return new Literal(AttributeValue.fromS(text));
    }

    @Override
    public AttributeValue resolve(Map<String, AttributeValue> item) {
      return value;
    }

    @Override
    public String describe() {
      return "literal " + text(value);
    }
  }

  /** A field of the item, possibly nested inside map attributes. */
  record FieldPath(List<String> path) implements ExtractionNode {
    public FieldPath {
      path = List.copyOf(path);
      if (path.isEmpty()) throw new IllegalArgumentException("field path cannot be empty");
    }

    public static FieldPath of(String... path) {
      return new FieldPath(List.of(path));
    }

    @Override
    public AttributeValue resolve(Map<String, AttributeValue> item) {
      Map<String, AttributeValue> current = item;
      for (int i = 0; i < path.size() - 1; i++) {
        String key = path.get(i);
        AttributeValue value = current.get(key);
        if (value == null) {
          throw new KeyExtractionException(Reason.FIELD_NOT_FOUND, dotted(),
            "field \"" + key + "\" not found at path " + String.join(".", path.subList(0, i + 1)));
        }
        if (value.type() != AttributeValue.Type.M) {
          throw new KeyExtractionException(Reason.FIELD_NOT_FOUND, dotted(),
            "field \"" + key + "\" is not a map (got " + value.type() + "), cannot traverse " + dotted());
        }
        current = value.m();
      }

      AttributeValue leaf = current.get(path.get(path.size() - 1));
      if (leaf == null) {
        throw new KeyExtractionException(Reason.FIELD_NOT_FOUND, dotted(), "field \"" + dotted() + "\" not found");
      }
      return scalar(leaf, dotted());
    }

    @Override
    public String describe() {
      return "field " + dotted();
    }

    private String dotted() {
      return String.join(".", path);
    }
  }

  /** Children joined as text, in order. Always a string. */
  record Concat(List<ExtractionNode> parts) implements ExtractionNode {
    public Concat {
      parts = List.copyOf(parts);
      if (parts.isEmpty()) throw new IllegalArgumentException("concat needs at least one part");
    }

    @Override
    public AttributeValue resolve(Map<String, AttributeValue> item) {
      StringBuilder sb = new StringBuilder();
      for (ExtractionNode part : parts) {
        sb.append(text(part.resolve(item)));
      }
      return AttributeValue.fromS(sb.toString());
    }

    @Override
    public String describe() {
      return "concat of " + parts.size() + " parts";
    }
  }

  private static AttributeValue scalar(AttributeValue value, String where) {
    AttributeValue.Type type = value.type();
    if (type != AttributeValue.Type.S && type != AttributeValue.Type.N && type != AttributeValue.Type.B) {
      throw new KeyExtractionException(Reason.UNSUPPORTED_ATTRIBUTE_TYPE, where,
        "cannot derive a key from " + type + " attribute " + where + "; expected S, N or B");
    }
    return value;
  }

  private static String text(AttributeValue value) {
    switch (value.type()) {
      case S:
        return value.s();
      case N:
        return value.n();
      default:
        return Base64.getEncoder().encodeToString(value.b().asByteArray());
    }
  }
}
