package co.keyfmt.core.pattern;

import co.keyfmt.core.pattern.PatternParseException.Reason;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class PatternParserTest {

  @Test
  void parsesConstantPattern() {
    PatternSpec spec = PatternParser.parse("PROFILE");

    assertThat(spec.isConstant()).isTrue();
    assertThat(spec.segments()).containsExactly(new Segment.Literal("PROFILE"));
    assertThat(spec.fieldRefs()).isEmpty();
    assertThat(spec.kind()).isEqualTo(AttributeKind.STRING);
  }

  @Test
  void parsesLiteralPrefixAndField() {
    PatternSpec spec = PatternParser.parse("USER#{id}");

    assertThat(spec.isConstant()).isFalse();
    assertThat(spec.segments()).containsExactly(
      new Segment.Literal("USER#"),
      Segment.FieldRef.of("id"));
    assertThat(spec.leadingLiteralPrefix()).isEqualTo("USER#");
  }

  @Test
  void keepsFieldOrder() {
    PatternSpec spec = PatternParser.parse("ORDER#{tenant}#{id}");

    assertThat(spec.fieldRefs()).extracting(Segment.FieldRef::path).containsExactly("tenant", "id");
    assertThat(spec.segments()).hasSize(4);
  }

  @Test
  void singleFieldHasNoPrefix() {
    PatternSpec spec = PatternParser.parse("{createdAt}");

    assertThat(spec.segments()).containsExactly(Segment.FieldRef.of("createdAt"));
    assertThat(spec.leadingLiteralPrefix()).isEmpty();
  }

  @Test
  void keepsTrailingLiteral() {
    PatternSpec spec = PatternParser.parse("{a}-{b}#END");

    assertThat(spec.segments()).containsExactly(
      Segment.FieldRef.of("a"),
      new Segment.Literal("-"),
      Segment.FieldRef.of("b"),
      new Segment.Literal("#END"));
  }

  @Test
  void parsesNestedPath() {
    Segment.FieldRef ref = PatternParser.parse("{user.id}").fieldRefs().get(0);

    assertThat(ref.path()).isEqualTo("user.id");
    assertThat(ref.pathComponents()).containsExactly("user", "id");
    assertThat(ref.parameterName()).isEqualTo("id");
  }

  @Test
  void parsesModifiersAndWidthSpec() {
    Segment.FieldRef ref = PatternParser.parse("EVT#{ts:utc:unixnano:%020d}").fieldRefs().get(0);

    assertThat(ref.path()).isEqualTo("ts");
    assertThat(ref.modifiers()).containsExactly("utc", "unixnano");
    assertThat(ref.widthSpec()).isEqualTo("%020d");
    assertThat(ref.primaryFormat()).isEqualTo("unixnano");
    assertThat(ref.hasModifier("utc")).isTrue();
  }

  @Test
  void widthSpecAlone() {
    Segment.FieldRef ref = PatternParser.parse("{count:%08d}").fieldRefs().get(0);

    assertThat(ref.modifiers()).isEmpty();
    assertThat(ref.widthSpec()).isEqualTo("%08d");
    assertThat(ref.primaryFormat()).isNull();
  }

  @Test
  void onlyLastTokenCanBeWidthSpec() {
    Segment.FieldRef ref = PatternParser.parse("{price:%.2f:x}").fieldRefs().get(0);

    assertThat(ref.modifiers()).containsExactly("%.2f", "x");
    assertThat(ref.hasWidthSpec()).isFalse();
  }

  @Test
  void carriesAttributeKind() {
    PatternSpec spec = PatternParser.parse("{n}", AttributeKind.NUMBER);

    assertThat(spec.kind()).isEqualTo(AttributeKind.NUMBER);
  }

  @ParameterizedTest
  @ValueSource(strings = {"PROFILE", "USER#{id}", "ORDER#{tenant}#{id}", "{ts:utc:rfc3339fixed}", "{seq:%020d}", "a{b.c}d"})
  void rawIsPreserved(String raw) {
    assertThat(PatternParser.parse(raw).raw()).isEqualTo(raw);
  }

  @Test
  void rejectsEmptyPattern() {
    assertThatThrownBy(() -> PatternParser.parse(""))
      .isInstanceOf(PatternParseException.class)
      .hasMessageContaining("pattern cannot be empty")
      .extracting(e -> ((PatternParseException) e).reason())
      .isEqualTo(Reason.EMPTY_PATTERN);
    assertThatThrownBy(() -> PatternParser.parse(null))
      .isInstanceOf(PatternParseException.class);
  }

  @Test
  void rejectsEmptyFieldReference() {
    PatternParseException e = catchThrowableOfType(() -> PatternParser.parse("USER#{}"), PatternParseException.class);

    assertThat(e.reason()).isEqualTo(Reason.EMPTY_FIELD_REFERENCE);
    assertThat(e.offset()).isEqualTo(5);
    assertThat(e.pattern()).isEqualTo("USER#{}");
  }

  @Test
  void rejectsEmptyPathComponent() {
    PatternParseException e = catchThrowableOfType(() -> PatternParser.parse("USER#{a..b}"), PatternParseException.class);

    assertThat(e.reason()).isEqualTo(Reason.INVALID_FIELD_PATH);
    assertThat(e.offset()).isEqualTo(8);
    assertThat(e).hasMessageContaining("a..b");
  }

  @ParameterizedTest
  @ValueSource(strings = {"{.a}", "{a.}", "X{.}"})
  void rejectsLeadingOrTrailingDot(String raw) {
    assertThatThrownBy(() -> PatternParser.parse(raw))
      .isInstanceOf(PatternParseException.class)
      .extracting(e -> ((PatternParseException) e).reason())
      .isEqualTo(Reason.INVALID_FIELD_PATH);
  }

  @Test
  void rejectsEmptyModifier() {
    assertThatThrownBy(() -> PatternParser.parse("{ts::unix}"))
      .isInstanceOf(PatternParseException.class)
      .extracting(e -> ((PatternParseException) e).reason())
      .isEqualTo(Reason.EMPTY_MODIFIER);
  }

  @ParameterizedTest
  @ValueSource(strings = {"USER#{id", "USER#id}", "{a{b}}", "}{"})
  void rejectsUnbalancedBraces(String raw) {
    assertThatThrownBy(() -> PatternParser.parse(raw))
      .isInstanceOf(PatternParseException.class)
      .extracting(e -> ((PatternParseException) e).reason())
      .isEqualTo(Reason.UNBALANCED_BRACE);
  }

  @Test
  void parseErrorsAreIllegalArgumentExceptions() {
    assertThatThrownBy(() -> PatternSpec.parse("{}")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void modifiersAreImmutable() {
    Segment.FieldRef ref = PatternParser.parse("{ts:utc:unix}").fieldRefs().get(0);

    assertThatThrownBy(() -> ref.modifiers().add("x")).isInstanceOf(UnsupportedOperationException.class);
    assertThat(ref.modifiers()).isEqualTo(List.of("utc", "unix"));
  }
}
