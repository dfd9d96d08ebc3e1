package co.keyfmt.core;

import co.keyfmt.core.FieldType.Category;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

public class FieldTypeTest {

  @ParameterizedTest
  @ValueSource(strings = {"string", "String", "text", "CharSequence"})
  void classifiesText(String name) {
    assertThat(FieldType.of(name).category()).isEqualTo(Category.TEXT);
    assertThat(FieldType.of(name).isText()).isTrue();
  }

  @ParameterizedTest
  @ValueSource(strings = {"number", "number.int", "number.long", "timestamp.epoch", "int", "Long", "BigInteger", "int64"})
  void classifiesSignedIntegers(String name) {
    FieldType type = FieldType.of(name);
    assertThat(type.category()).isEqualTo(Category.SIGNED_INTEGER);
    assertThat(type.isInteger()).isTrue();
    assertThat(type.isUnsigned()).isFalse();
  }

  @ParameterizedTest
  @ValueSource(strings = {"uint", "uint8", "uint16", "uint32", "uint64"})
  void classifiesUnsignedIntegers(String name) {
    FieldType type = FieldType.of(name);
    assertThat(type.isInteger()).isTrue();
    assertThat(type.isUnsigned()).isTrue();
  }

  @ParameterizedTest
  @ValueSource(strings = {"number.float", "number.double", "number.decimal", "double", "BigDecimal", "float32", "float64"})
  void classifiesFloatingPoint(String name) {
    assertThat(FieldType.of(name).isFloatingPoint()).isTrue();
  }

  @ParameterizedTest
  @ValueSource(strings = {"timestamp", "Instant", "OffsetDateTime", "ZonedDateTime", "time.Time"})
  void classifiesTemporal(String name) {
    assertThat(FieldType.of(name).isTemporal()).isTrue();
  }

  @Test
  void unknownNamesAreOther() {
    FieldType type = FieldType.of("boolean");

    assertThat(type.category()).isEqualTo(Category.OTHER);
    assertThat(type.toString()).isEqualTo("boolean");
  }

  @Test
  void namesAreCaseSensitive() {
    assertThat(FieldType.of("INT").category()).isEqualTo(Category.OTHER);
  }

  @Test
  void resolverLooksUpPaths() {
    FieldTypeResolver resolver = FieldTypeResolver.of(Map.of("user.id", "string", "count", "int"));

    assertThat(resolver.resolve("user.id")).contains(FieldType.of("string"));
    assertThat(resolver.resolve("count").map(FieldType::category)).contains(Category.SIGNED_INTEGER);
    assertThat(resolver.resolve("missing")).isEmpty();
  }
}
