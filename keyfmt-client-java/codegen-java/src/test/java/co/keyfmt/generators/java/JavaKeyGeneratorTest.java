package co.keyfmt.generators.java;

import co.keyfmt.core.compile.CompiledIndex;
import co.keyfmt.core.compile.IndexCompiler;
import co.keyfmt.core.index.IndexRegistry;
import co.keyfmt.core.model.IndexSchemaBinder;
import co.keyfmt.core.model.IndexSchemaBinder.BoundSchema;
import co.keyfmt.core.model.IndexSchemaLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import javax.tools.JavaCompiler;
import javax.tools.ToolProvider;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.lang.reflect.Method;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

public class JavaKeyGeneratorTest {

  @TempDir
  Path tempDir;

  private JavaKeyGenerator generator;
  private BoundSchema order;
  private BoundSchema user;

  @BeforeEach
  void setUp() throws Exception {
    generator = new JavaKeyGenerator();

    order = IndexSchemaBinder.bind(IndexSchemaLoader.parse("""
      {
        "entityName": "Order",
        "entityClass": "com.example.model.Order",
        "tableName": "orders",
        "fields": [
          { "name": "tenantId", "type": "string" },
          { "name": "orderId", "type": "string" },
          { "name": "placedAt", "type": "Instant" },
          { "name": "seq", "type": "long" },
          { "name": "customer", "type": "map", "fields": [ { "name": "id", "type": "string" } ] }
        ],
        "partitionKey": { "attribute": "pk", "format": "TENANT#{tenantId}" },
        "sortKey": { "attribute": "sk", "format": "ORDER#{placedAt:utc:rfc3339fixed}#{orderId}" },
        "secondaryIndexes": [
          { "name": "byCustomer",
            "partitionKey": { "attribute": "gsi1pk", "format": "CUSTOMER#{customer.id}" },
            "sortKey": { "attribute": "gsi1sk", "format": "{seq:%020d}" } }
        ]
      }
      """));

    user = IndexSchemaBinder.bind(IndexSchemaLoader.parse("""
      {
        "entityName": "User",
        "tableName": "users",
        "fields": [ { "name": "userId", "type": "string" }, { "name": "loginCount", "type": "int" } ],
        "partitionKey": { "attribute": "pk", "format": "USER#{userId}" },
        "sortKey": { "attribute": "sk", "constant": "PROFILE" }
      }
      """));
  }

  private String generate(BoundSchema schema) throws Exception {
    CompiledIndex compiled = IndexCompiler.compile(schema.index(), schema.types(), schema.entityName());
    Path file = generator.generate(compiled, schema.entityClass(), "com.example.model", tempDir);
    assertThat(Files.exists(file)).isTrue();
    return Files.readString(file);
  }

  @Test
  void writesKeysClassToKeysPackage() throws Exception {
    generate(user);

    Path file = tempDir.resolve("com/example/model/keys/UserKeys.java");
    assertThat(Files.exists(file)).isTrue();

    String content = Files.readString(file);
    assertThat(content).contains("package com.example.model.keys;");
    assertThat(content).contains("public final class UserKeys");
    assertThat(content).contains("private UserKeys()");
  }

  @Test
  void generatesConstants() throws Exception {
    String content = generate(order);

    assertThat(content).contains("public static final String TABLE_NAME = \"orders\";");
    assertThat(content).contains("public static final String PARTITION_KEY_FIELD = \"pk\";");
    assertThat(content).contains("public static final String SORT_KEY_FIELD = \"sk\";");
    assertThat(content).contains("public static final String INDEX_BY_CUSTOMER = \"byCustomer\";");
    assertThat(content).contains("public static final String BY_CUSTOMER_PARTITION_KEY_FIELD = \"gsi1pk\";");
    assertThat(content).contains("public static final String BY_CUSTOMER_SORT_KEY_FIELD = \"gsi1sk\";");
  }

  @Test
  void generatesParameterBuilders() throws Exception {
    String content = generate(order);

    assertThat(content).contains("public static String partitionKey(String tenantId)");
    assertThat(content).contains("return \"TENANT#\" + tenantId;");
    assertThat(content).contains("public static String sortKey(Instant placedAt, String orderId)");
    assertThat(content).contains("RFC3339_FIXED.format(placedAt.atOffset(ZoneOffset.UTC).withOffsetSameInstant(ZoneOffset.UTC))");
    assertThat(content).contains("Format: {@code ORDER#{placedAt:utc:rfc3339fixed}#{orderId}}");
  }

  @Test
  void generatesEntityBuildersWhenClassIsKnown() throws Exception {
    String content = generate(order);

    assertThat(content).contains("import com.example.model.Order;");
    assertThat(content).contains("public static String partitionKeyOf(Order entity)");
    assertThat(content).contains("return \"TENANT#\" + entity.getTenantId();");
    assertThat(content).contains("public static String byCustomerPartitionKeyOf(Order entity)");
    assertThat(content).contains("entity.getCustomer().getId()");
    assertThat(content).contains("public static Map<String, AttributeValue> keyOf(Order entity)");
  }

  @Test
  void skipsEntityBuildersWithoutClass() throws Exception {
    String content = generate(user);

    assertThat(content).doesNotContain("partitionKeyOf");
    assertThat(content).doesNotContain("keyOf(");
    assertThat(content).contains("public static Map<String, AttributeValue> key(String userId)");
  }

  @Test
  void generatesRangeQueryHelpers() throws Exception {
    String content = generate(order);

    assertThat(content).contains("public static String sortKeyPrefix()");
    assertThat(content).contains("return \"ORDER#\";");
    assertThat(content).contains("public static String sortKeyBeginsWith(Instant placedAt)");
    assertThat(content).doesNotContain("sortKeyBeginsWith(Instant placedAt, String orderId)");
  }

  @Test
  void generatesKeyMaps() throws Exception {
    String content = generate(order);

    assertThat(content).contains("import software.amazon.awssdk.services.dynamodb.model.AttributeValue;");
    assertThat(content).containsPattern("Map<String, AttributeValue> key\\(String tenantId, Instant placedAt,\\s+String orderId\\)");
    assertThat(content).contains("key.put(PARTITION_KEY_FIELD, AttributeValue.fromS(partitionKey(tenantId)));");
    assertThat(content).contains("key.put(SORT_KEY_FIELD, AttributeValue.fromS(sortKey(placedAt, orderId)));");
    assertThat(content).contains("public static Map<String, AttributeValue> byCustomerKey(String id, long seq)");
  }

  @Test
  void constantSortKey() throws Exception {
    String content = generate(user);

    assertThat(content).contains("public static String sortKey()");
    assertThat(content).contains("return \"PROFILE\";");
    assertThat(content).contains("key.put(SORT_KEY_FIELD, AttributeValue.fromS(sortKey()));");
    assertThat(content).doesNotContain("sortKeyPrefix");
  }

  @Test
  void declaresOnlyUsedHelpers() throws Exception {
    String userContent = generate(user);
    assertThat(userContent).doesNotContain("DateTimeFormatter");
    assertThat(userContent).doesNotContain("private static String format(");

    String orderContent = generate(order);
    assertThat(orderContent).contains("private static final DateTimeFormatter RFC3339_FIXED");
    assertThat(orderContent).doesNotContain("RFC3339_NANO");
    assertThat(orderContent).contains("private static String format(String spec, Object value)");
    assertThat(orderContent).contains("return String.format(Locale.ROOT, spec, value);");
    assertThat(orderContent).contains("format(\"%020d\", seq)");
  }

  @Test
  void notesUnsortableSortKeysInJavadoc() throws Exception {
    BoundSchema events = IndexSchemaBinder.bind(IndexSchemaLoader.parse("""
      {
        "entityName": "Event",
        "tableName": "events",
        "fields": [ { "name": "stream", "type": "string" }, { "name": "seq", "type": "long" } ],
        "partitionKey": { "attribute": "pk", "format": "{stream}" },
        "sortKey": { "attribute": "sk", "format": "SEQ#{seq}" }
      }
      """));

    String content = generate(events);

    assertThat(content).contains("Does not sort correctly as a string: field seq");
    assertThat(content).contains("return \"SEQ#\" + String.valueOf(seq);");
  }

  @Test
  void numberAndBinaryKeys() throws Exception {
    BoundSchema counters = IndexSchemaBinder.bind(IndexSchemaLoader.parse("""
      {
        "entityName": "Counter",
        "tableName": "counters",
        "fields": [ { "name": "id", "type": "long" } ],
        "partitionKey": { "attribute": "pk", "kind": "N", "format": "{id}" },
        "sortKey": { "attribute": "sk", "kind": "B", "bytes": "AQID" }
      }
      """));

    String content = generate(counters);

    assertThat(content).contains("AttributeValue.fromN(partitionKey(id))");
    assertThat(content).contains("AttributeValue.fromB(SdkBytes.fromByteArray(Base64.getDecoder().decode(sortKey())))");
  }

  @Test
  void generatedSourceCompilesAgainstEntityClass() throws Exception {
    BoundSchema ledger = IndexSchemaBinder.bind(IndexSchemaLoader.parse("""
      {
        "entityName": "LedgerEntry",
        "entityClass": "com.example.ledger.LedgerEntry",
        "tableName": "ledger",
        "fields": [
          { "name": "accountId", "type": "string" },
          { "name": "postedAt", "type": "OffsetDateTime" },
          { "name": "entryId", "type": "uint64" },
          { "name": "amount", "type": "double" },
          { "name": "seq", "type": "long" },
          { "name": "bookedOn", "type": "Instant" },
          { "name": "customer", "type": "map", "fields": [ { "name": "id", "type": "string" } ] }
        ],
        "partitionKey": { "attribute": "pk", "format": "ACCOUNT#{accountId}" },
        "sortKey": { "attribute": "sk", "format": "ENTRY#{postedAt:unixnano:%020d}#{entryId:%020d}" },
        "secondaryIndexes": [
          { "name": "byAmount",
            "partitionKey": { "attribute": "gsi1pk", "constant": "AMOUNTS" },
            "sortKey": { "attribute": "gsi1sk", "format": "{amount:%012.2f}#{seq:%020d}" } },
          { "name": "byDay",
            "partitionKey": { "attribute": "gsi2pk", "format": "DAY#{bookedOn:uuuuMMdd}" },
            "sortKey": { "attribute": "gsi2sk", "format": "{bookedOn:utc:rfc3339fixed}" } },
          { "name": "byCustomer",
            "partitionKey": { "attribute": "gsi3pk", "format": "CUSTOMER#{customer.id}" } },
          { "name": "bySeq",
            "partitionKey": { "attribute": "gsi4pk", "kind": "N", "fromField": "seq" } }
        ]
      }
      """));
    CompiledIndex compiled = IndexCompiler.compile(ledger.index(), ledger.types(), ledger.entityName());
    Path keysFile = generator.generate(compiled, ledger.entityClass(), "com.example.ledger", tempDir);

    Path entityFile = tempDir.resolve("com/example/ledger/LedgerEntry.java");
    Files.createDirectories(entityFile.getParent());
    Files.writeString(entityFile, """
      package com.example.ledger;

      import java.time.Instant;
      import java.time.OffsetDateTime;

      public class LedgerEntry {
        public static class Customer {
          public String getId() { return "c-1"; }
        }

        public String getAccountId() { return "a-1"; }
        public OffsetDateTime getPostedAt() { return OffsetDateTime.parse("2024-03-05T09:15:00+01:00"); }
        public long getEntryId() { return -1L; }
        public double getAmount() { return 12.5d; }
        public long getSeq() { return 7L; }
        public Instant getBookedOn() { return Instant.parse("2024-03-05T08:15:00Z"); }
        public Customer getCustomer() { return new Customer(); }
      }
      """);

    Path classes = Files.createDirectories(tempDir.resolve("classes"));
    JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
    assertThat(compiler).isNotNull();
    ByteArrayOutputStream errors = new ByteArrayOutputStream();
    int rc = compiler.run(null, null, errors,
      "-d", classes.toString(), "-cp", testClasspath(),
      keysFile.toString(), entityFile.toString());

    assertThat(rc).as(errors.toString()).isZero();

    try (URLClassLoader loader = new URLClassLoader(new URL[]{classes.toUri().toURL()}, getClass().getClassLoader())) {
      Class<?> keys = loader.loadClass("com.example.ledger.keys.LedgerEntryKeys");
      Method sortKey = keys.getMethod("sortKey", OffsetDateTime.class, long.class);

      Object key = sortKey.invoke(null, OffsetDateTime.ofInstant(Instant.ofEpochSecond(0, 5), ZoneOffset.UTC), -1L);

      assertThat(key).isEqualTo("ENTRY#00000000000000000005#18446744073709551615");
    }
  }

  /** Surefire's test classpath plus the jars holding the AWS types the generated code uses. */
  private static String testClasspath() throws Exception {
    Set<String> entries = new LinkedHashSet<>(List.of(System.getProperty("java.class.path").split(File.pathSeparator)));
    for (Class<?> type : List.of(AttributeValue.class, SdkBytes.class)) {
      entries.add(Path.of(type.getProtectionDomain().getCodeSource().getLocation().toURI()).toString());
    }
    return String.join(File.pathSeparator, entries);
  }

  @Test
  void generatesAllInRegistrationOrder() throws Exception {
    IndexRegistry registry = new IndexRegistry();
    registry.register("User", user.index());
    registry.register("Order", order.index());

    List<Path> files = generator.generateAll(registry, Map.of("User", user, "Order", order), "com.example.model", tempDir);

    assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("UserKeys.java", "OrderKeys.java");
    assertThat(files).allSatisfy(p -> assertThat(Files.exists(p)).isTrue());
  }

  @Test
  void generateAllRequiresFieldTypes() {
    IndexRegistry registry = new IndexRegistry();
    registry.register("User", user.index());

    assertThatThrownBy(() -> generator.generateAll(registry, Map.of(), "com.example.model", tempDir))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("User");
  }

  @Test
  void rejectsFieldNamesThatAreNotJavaIdentifiers() {
    assertThatThrownBy(() -> generate(IndexSchemaBinder.bind(IndexSchemaLoader.parse("""
      {
        "entityName": "Thing",
        "tableName": "things",
        "fields": [ { "name": "class", "type": "string" } ],
        "partitionKey": { "attribute": "pk", "format": "{class}" }
      }
      """))))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("class");
  }

  @Test
  void convertsNames() {
    assertThat(JavaKeyGenerator.toJavaCamelCase("by-customer")).isEqualTo("byCustomer");
    assertThat(JavaKeyGenerator.toJavaCamelCase("GSI")).isEqualTo("gsi");
    assertThat(JavaKeyGenerator.toJavaCamelCase("1st_index")).isEqualTo("_1stIndex");
    assertThat(JavaKeyGenerator.toConstantCase("byCustomer")).isEqualTo("BY_CUSTOMER");
    assertThat(JavaKeyGenerator.cap("order")).isEqualTo("Order");
  }
}
