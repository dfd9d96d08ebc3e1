package co.keyfmt.core.pattern;

import co.keyfmt.core.pattern.PatternParseException.Reason;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parses key pattern strings into {@link PatternSpec}s.
 *
 * <p>Grammar: {@code {path(:modifier)*(:%spec)?}} embedded anywhere in literal text, where
 * {@code path} is one or more non-empty components joined by dots. Only the last colon token may
 * be a printf spec; a {@code %} token anywhere else is kept as a modifier.
 *
 * <p>Braces have no escape form. A {@code }} outside a reference, a {@code {} inside one, or an
 * unclosed {@code {} is rejected with {@link Reason#UNBALANCED_BRACE}.
 */
public final class PatternParser {

  private PatternParser() {}

  public static PatternSpec parse(String raw) {
    return parse(raw, AttributeKind.STRING);
  }

  public static PatternSpec parse(String raw, AttributeKind kind) {
    if (raw == null || raw.isEmpty()) {
      throw new PatternParseException(Reason.EMPTY_PATTERN, raw, 0, "pattern cannot be empty");
    }

    List<Segment> segments = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    int i = 0;
    while (i < raw.length()) {
      char c = raw.charAt(i);
      if (c == '{') {
        int close = raw.indexOf('}', i + 1);
        if (close < 0) {
          throw new PatternParseException(Reason.UNBALANCED_BRACE, raw, i,
            "unclosed '{' at position " + i + " in pattern \"" + raw + "\"");
        }
        String body = raw.substring(i + 1, close);
        int nested = body.indexOf('{');
        if (nested >= 0) {
          int at = i + 1 + nested;
          throw new PatternParseException(Reason.UNBALANCED_BRACE, raw, at,
            "nested '{' at position " + at + " in pattern \"" + raw + "\"");
        }
        if (body.isEmpty()) {
          throw new PatternParseException(Reason.EMPTY_FIELD_REFERENCE, raw, i,
            "empty field reference at position " + i + " in pattern \"" + raw + "\"");
        }
        if (literal.length() > 0) {
          segments.add(new Segment.Literal(literal.toString()));
          literal.setLength(0);
        }
        segments.add(parseFieldRef(raw, body, i + 1));
        i = close + 1;
      } else if (c == '}') {
        throw new PatternParseException(Reason.UNBALANCED_BRACE, raw, i,
          "unmatched '}' at position " + i + " in pattern \"" + raw + "\"");
      } else {
        literal.append(c);
        i++;
      }
    }
    if (literal.length() > 0) {
      segments.add(new Segment.Literal(literal.toString()));
    }
    return new PatternSpec(raw, kind, segments);
  }

  private static Segment.FieldRef parseFieldRef(String raw, String ref, int bodyOffset) {
    String[] tokens = ref.split(":", -1);
    String path = tokens[0];
    validatePath(raw, path, bodyOffset);

    if (tokens.length == 1) {
      return Segment.FieldRef.of(path);
    }

    String widthSpec = null;
    List<String> modifiers;
    String last = tokens[tokens.length - 1];
    if (last.startsWith("%")) {
      widthSpec = last;
      modifiers = Arrays.asList(tokens).subList(1, tokens.length - 1);
    } else {
      modifiers = Arrays.asList(tokens).subList(1, tokens.length);
    }

    int offset = bodyOffset + path.length() + 1;
    for (String modifier : modifiers) {
      if (modifier.isEmpty()) {
        throw new PatternParseException(Reason.EMPTY_MODIFIER, raw, offset,
          "empty modifier at position " + offset + " in field reference {" + ref + "}");
      }
      offset += modifier.length() + 1;
    }
    return new Segment.FieldRef(path, modifiers, widthSpec);
  }

  private static void validatePath(String raw, String path, int bodyOffset) {
    String[] components = path.split("\\.", -1);
    int offset = bodyOffset;
    for (int i = 0; i < components.length; i++) {
      if (components[i].isEmpty()) {
        throw new PatternParseException(Reason.INVALID_FIELD_PATH, raw, offset,
          "invalid field path \"" + path + "\": empty component at index " + i);
      }
      offset += components[i].length() + 1;
    }
  }
}
