package co.keyfmt.core.model;

import co.keyfmt.core.FieldType;
import co.keyfmt.core.compile.CompiledIndex;
import co.keyfmt.core.compile.IndexCompiler;
import co.keyfmt.core.index.PrimaryIndex;
import co.keyfmt.core.index.ValueDef;
import co.keyfmt.core.model.IndexSchemaBinder.BoundSchema;
import co.keyfmt.core.pattern.AttributeKind;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.List;
import java.util.Map;

import static co.keyfmt.core.model.IndexSchemaValidatorTest.field;
import static co.keyfmt.core.model.IndexSchemaValidatorTest.key;
import static org.assertj.core.api.Assertions.*;

public class IndexSchemaBinderTest {

  @Test
  void bindsKeysAndFlattensFieldTypes() {
    IndexSchema s = IndexSchemaValidatorTest.order();
    IndexSchema.Field customer = field("customer", "map");
    customer.fields = List.of(field("id", "string"));
    s.fields.add(customer);
    IndexSchema.SecondaryIndex gsi = new IndexSchema.SecondaryIndex();
    gsi.name = "byCustomer";
    gsi.partitionKey = key("gpk", "CUSTOMER#{customer.id}");
    s.secondaryIndexes = List.of(gsi);

    BoundSchema bound = IndexSchemaBinder.bind(s);

    assertThat(bound.entityName()).isEqualTo("Order");
    assertThat(bound.fieldTypes()).containsExactly(
      entry("orderId", "string"), entry("seq", "long"), entry("customer", "map"), entry("customer.id", "string"));
    assertThat(bound.types().resolve("customer.id")).contains(FieldType.of("string"));

    PrimaryIndex index = bound.index();
    assertThat(index.tableName()).isEqualTo("orders");
    assertThat(index.partitionKey().value()).isEqualTo(ValueDef.format("ORDER#{orderId}"));
    assertThat(index.secondaryIndex("byCustomer")).isPresent();
  }

  @Test
  void bindsEveryValueSource() {
    IndexSchema s = IndexSchemaValidatorTest.order();
    s.partitionKey = new IndexSchema.Key();
    s.partitionKey.attribute = "pk";
    s.partitionKey.kind = "N";
    s.partitionKey.constant = 7;
    s.sortKey = new IndexSchema.Key();
    s.sortKey.attribute = "sk";
    s.sortKey.fromField = "orderId";
    IndexSchema.SecondaryIndex gsi = new IndexSchema.SecondaryIndex();
    gsi.name = "g";
    gsi.partitionKey = new IndexSchema.Key();
    gsi.partitionKey.attribute = "gpk";
    gsi.partitionKey.kind = "binary";
    gsi.partitionKey.bytes = "AQID";
    gsi.sortKey = new IndexSchema.Key();
    gsi.sortKey.attribute = "gsk";
    gsi.sortKey.constant = "ALL";
    s.secondaryIndexes = List.of(gsi);

    PrimaryIndex index = IndexSchemaBinder.bind(s).index();
    Map<String, AttributeValue> key = index.primaryKey(Map.of("orderId", AttributeValue.fromS("o-1")));

    assertThat(key).containsEntry("pk", AttributeValue.fromN("7")).containsEntry("sk", AttributeValue.fromS("o-1"));
    assertThat(index.secondaryKeys(Map.of())).containsKey("g");
    assertThat(index.secondaryIndexes().get(0).partitionKey().key().kind()).isEqualTo(AttributeKind.BINARY);
  }

  @Test
  void boundSchemaCompiles() {
    BoundSchema bound = IndexSchemaBinder.bind(IndexSchemaValidatorTest.order());

    CompiledIndex compiled = IndexCompiler.compile(bound.index(), bound.types(), bound.entityName());

    assertThat(compiled.sortKey()).isPresent();
    assertThat(compiled.diagnostics()).isEmpty();
  }

  @Test
  void bindRejectsInvalidSchema() {
    IndexSchema s = IndexSchemaValidatorTest.order();
    s.partitionKey = null;

    assertThatThrownBy(() -> IndexSchemaBinder.bind(s)).isInstanceOf(IllegalArgumentException.class);
  }
}
