package co.keyfmt.core.pattern;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class PatternSpecTest {

  @Test
  void constantPatternPrefixIsWholeText() {
    PatternSpec spec = PatternSpec.parse("PROFILE");

    assertThat(spec.leadingLiteralPrefix()).isEqualTo("PROFILE");
    assertThat(spec.toString()).isEqualTo("PROFILE");
  }

  @Test
  void equalPatternsAreEqual() {
    assertThat(PatternSpec.parse("USER#{id}")).isEqualTo(PatternSpec.parse("USER#{id}"));
    assertThat(PatternSpec.parse("USER#{id}")).hasSameHashCodeAs(PatternSpec.parse("USER#{id}"));
    assertThat(PatternSpec.parse("USER#{id}")).isNotEqualTo(PatternSpec.parse("USER#{id}", AttributeKind.BINARY));
  }

  @Test
  void rejectsNoSegments() {
    assertThatThrownBy(() -> new PatternSpec("x", AttributeKind.STRING, List.of()))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void segmentsAreImmutable() {
    PatternSpec spec = PatternSpec.parse("A#{b}");

    assertThatThrownBy(() -> spec.segments().clear()).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void resolvesAttributeKindCodes() {
    assertThat(AttributeKind.fromCode("S")).isEqualTo(AttributeKind.STRING);
    assertThat(AttributeKind.fromCode("n")).isEqualTo(AttributeKind.NUMBER);
    assertThat(AttributeKind.fromCode("binary")).isEqualTo(AttributeKind.BINARY);
    assertThat(AttributeKind.fromCode(null)).isEqualTo(AttributeKind.STRING);
    assertThat(AttributeKind.fromCode("")).isEqualTo(AttributeKind.STRING);
    assertThatThrownBy(() -> AttributeKind.fromCode("BOOL"))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("BOOL");
  }
}
