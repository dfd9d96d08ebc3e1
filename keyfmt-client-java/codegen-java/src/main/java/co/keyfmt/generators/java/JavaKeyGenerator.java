package co.keyfmt.generators.java;

import co.keyfmt.core.compile.CompiledIndex;
import co.keyfmt.core.compile.CompiledKey;
import co.keyfmt.core.compile.CompiledSecondaryIndex;
import co.keyfmt.core.compile.IndexCompiler;
import co.keyfmt.core.compile.KeyParameter;
import co.keyfmt.core.compile.KeyPart;
import co.keyfmt.core.conversion.ConversionDescriptor;
import co.keyfmt.core.index.IndexRegistry;
import co.keyfmt.core.model.IndexSchemaBinder.BoundSchema;
import co.keyfmt.core.pattern.AttributeKind;
import co.keyfmt.core.sortability.SortabilityDiagnostic;
import com.squareup.javapoet.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.lang.model.SourceVersion;
import javax.lang.model.element.Modifier;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Java code generator for key builders.
 *
 * For every compiled entity index a {Entity}Keys class is written to {@code <pkg>.keys}. It holds:
 * - table, key attribute and index name constants
 * - {@code partitionKey(...)} / {@code sortKey(...)} builders taking the referenced fields as parameters
 * - {@code partitionKeyOf(entity)} / {@code sortKeyOf(entity)} builders when the entity class is known
 * - {@code sortKeyPrefix()} and {@code sortKeyBeginsWith(...)} helpers for range queries
 * - {@code key(...)} returning the primary key as an attribute value map
 * - the same builders for each secondary index, prefixed with the index name
 *
 * Date-time formatter constants are only declared when a key formats date-times, and the
 * Locale.ROOT printf helper only when a key uses a printf spec.
 *
 * Sort keys that do not order correctly as strings are generated anyway; the problem is logged
 * as a warning and noted in the builder's Javadoc.
 */
public class JavaKeyGenerator {

    private static final Logger log = LoggerFactory.getLogger(JavaKeyGenerator.class);

    private static final Pattern VALID_JAVA_IDENTIFIER = Pattern.compile("^[a-zA-Z_$][a-zA-Z0-9_$]*$");

    private static final ClassName ATTRIBUTE_VALUE = ClassName.get(
        "software.amazon.awssdk.services.dynamodb.model", "AttributeValue");
    private static final ClassName SDK_BYTES = ClassName.get(
        "software.amazon.awssdk.core", "SdkBytes");
    private static final TypeName KEY_MAP = ParameterizedTypeName.get(
        ClassName.get(Map.class), ClassName.get(String.class), ATTRIBUTE_VALUE);

    private static final String ENTITY = "entity";

    /**
     * Compile and generate every index in the registry, in registration order.
     *
     * @param registry registered indexes
     * @param schemas  bound schemas by entity name, supplying field types and entity classes
     * @param pkg      Java package name for generated code
     * @param outDir   output source root
     * @return the generated files
     */
    public List<Path> generateAll(IndexRegistry registry, Map<String, BoundSchema> schemas, String pkg, Path outDir) throws IOException {
        List<Path> files = new ArrayList<>();
        for (IndexRegistry.Entry entry : registry.all()) {
            BoundSchema schema = schemas.get(entry.entityName());
            if (schema == null) {
                throw new IllegalArgumentException("no field types for registered entity " + entry.entityName());
            }
            CompiledIndex compiled = IndexCompiler.compile(entry.index(), schema.types(), entry.entityName());
            files.add(generate(compiled, schema.entityClass(), pkg, outDir));
        }
        return files;
    }

    /**
     * Generate the {Entity}Keys class for one compiled index.
     *
     * @param index       the compiled index
     * @param entityClass fully qualified entity class, or null to skip entity-based builders
     * @param pkg         Java package name for generated code
     * @param outDir      output source root
     * @return path of the written file
     */
    public Path generate(CompiledIndex index, String entityClass, String pkg, Path outDir) throws IOException {
        String entityName = index.entityLabel();
        String keysClassName = cap(toJavaCamelCase(entityName)) + "Keys";
        ClassName entityType = entityClass == null || entityClass.isEmpty() ? null : ClassName.bestGuess(entityClass);

        for (SortabilityDiagnostic d : index.diagnostics()) {
            log.warn("{}", d.message());
        }

        ExpressionRenderer renderer = new ExpressionRenderer();

        TypeSpec.Builder tb = TypeSpec.classBuilder(keysClassName)
            .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
            .addJavadoc("Key builders for $L entity.\n", entityName)
            .addJavadoc("Table: $L\n", index.tableName())
            .addJavadoc("Partition key: $L = $L\n", index.partitionKey().attributeName(), index.partitionKey().source());
        index.sortKey().ifPresent(sk ->
            tb.addJavadoc("Sort key: $L = $L\n", sk.attributeName(), sk.source()));

        tb.addMethod(MethodSpec.constructorBuilder()
            .addModifiers(Modifier.PRIVATE)
            .build());

        tb.addField(constant("TABLE_NAME", index.tableName(), "The table name.\n"));

        KeyNames primary = new KeyNames("", "");
        addKeyMethods(tb, renderer, primary, index.partitionKey(), index.sortKey().orElse(null), entityType);

        for (CompiledSecondaryIndex gsi : index.secondaryIndexes()) {
            String prefix = toJavaCamelCase(gsi.name());
            if (!VALID_JAVA_IDENTIFIER.matcher(prefix).matches()) {
                throw new IllegalArgumentException(entityName + ": secondary index name " + gsi.name()
                    + " cannot be turned into a Java identifier");
            }
            String constantPrefix = toConstantCase(prefix) + "_";
            tb.addField(constant("INDEX_" + toConstantCase(prefix), gsi.name(), "Secondary index name: " + gsi.name() + "\n"));
            addKeyMethods(tb, renderer, new KeyNames(prefix, constantPrefix), gsi.partitionKey(), gsi.sortKey().orElse(null), entityType);
        }

        if (index.requiresTemporalLibrary()) {
            for (FieldSpec formatter : renderer.formatterFields()) {
                tb.addField(formatter);
            }
        }
        if (index.requiresNumericLibrary()) {
            tb.addMethod(ExpressionRenderer.formatHelper());
        }

        JavaFile file = JavaFile.builder(pkg + ".keys", tb.build())
            .skipJavaLangImports(true)
            .build();
        file.writeTo(outDir);
        return outDir.resolve((pkg + ".keys").replace('.', '/')).resolve(keysClassName + ".java");
    }

    /** Method and constant name prefixes for the primary index or one secondary index. */
    private record KeyNames(String methodPrefix, String constantPrefix) {
        String method(String name) {
            return methodPrefix.isEmpty() ? name : methodPrefix + cap(name);
        }

        String constant(String name) {
            return constantPrefix + name;
        }
    }

    private void addKeyMethods(TypeSpec.Builder tb, ExpressionRenderer renderer, KeyNames names,
                               CompiledKey pk, CompiledKey sk, ClassName entityType) {
        tb.addField(constant(names.constant("PARTITION_KEY_FIELD"), pk.attributeName(),
            "The attribute name used as partition key.\n"));
        if (sk != null) {
            tb.addField(constant(names.constant("SORT_KEY_FIELD"), sk.attributeName(),
                "The attribute name used as sort key.\n"));
        }

        String pkMethod = names.method("partitionKey");
        String skMethod = names.method("sortKey");
        tb.addMethod(keyBuilder(renderer, pkMethod, pk));
        if (sk != null) tb.addMethod(keyBuilder(renderer, skMethod, sk));

        if (entityType != null) {
            if (!pk.isConstant()) tb.addMethod(entityKeyBuilder(renderer, pkMethod + "Of", pk, entityType));
            if (sk != null && !sk.isConstant()) tb.addMethod(entityKeyBuilder(renderer, skMethod + "Of", sk, entityType));
        }

        if (sk != null && !sk.isConstant()) {
            if (!sk.literalPrefix().isEmpty()) {
                tb.addMethod(MethodSpec.methodBuilder(skMethod + "Prefix")
                    .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                    .addJavadoc("Literal text every $L value starts with.\n", sk.attributeName())
                    .returns(String.class)
                    .addStatement("return $S", sk.literalPrefix())
                    .build());
            }
            List<KeyParameter> params = sk.parameters();
            for (int k = 1; k < params.size(); k++) {
                tb.addMethod(beginsWith(renderer, skMethod + "BeginsWith", sk, params.subList(0, k)));
            }
        }

        tb.addMethod(keyMap(names, names.method("key"), pk, sk, null));
        if (entityType != null) {
            tb.addMethod(keyMap(names, names.method("keyOf"), pk, sk, entityType));
        }
    }

    private MethodSpec keyBuilder(ExpressionRenderer renderer, String name, CompiledKey key) {
        MethodSpec.Builder mb = MethodSpec.methodBuilder(name)
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .returns(String.class)
            .addJavadoc("Build the $L value.\n", key.attributeName())
            .addJavadoc("<p>Format: {@code $L}\n", key.source());
        addDiagnosticJavadoc(mb, key);
        if (key.isConstant()) {
            return mb.addStatement("return $S", key.literalPrefix()).build();
        }
        for (KeyParameter p : key.parameters()) {
            mb.addParameter(ExpressionRenderer.javaType(p.type()), parameterName(p));
        }
        return mb.addStatement("return $L", join(renderer, key.parts(), false)).build();
    }

    private MethodSpec entityKeyBuilder(ExpressionRenderer renderer, String name, CompiledKey key, ClassName entityType) {
        MethodSpec.Builder mb = MethodSpec.methodBuilder(name)
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .returns(String.class)
            .addJavadoc("Build the $L value from an entity.\n", key.attributeName())
            .addParameter(entityType, ENTITY);
        addDiagnosticJavadoc(mb, key);
        return mb.addStatement("return $L", join(renderer, key.parts(), true)).build();
    }

    private MethodSpec beginsWith(ExpressionRenderer renderer, String name, CompiledKey key, List<KeyParameter> leading) {
        Set<String> supplied = new HashSet<>();
        MethodSpec.Builder mb = MethodSpec.methodBuilder(name)
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .returns(String.class)
            .addJavadoc("Prefix of $L values whose leading fields are the given values.\n", key.attributeName());
        for (KeyParameter p : leading) {
            mb.addParameter(ExpressionRenderer.javaType(p.type()), parameterName(p));
            supplied.add(p.name());
        }
        List<KeyPart> parts = new ArrayList<>();
        for (KeyPart part : key.parts()) {
            if (part instanceof KeyPart.Field field && !supplied.contains(field.parameterName())) break;
            parts.add(part);
        }
        return mb.addStatement("return $L", join(renderer, parts, false)).build();
    }

    private MethodSpec keyMap(KeyNames names, String name, CompiledKey pk, CompiledKey sk, ClassName entityType) {
        MethodSpec.Builder mb = MethodSpec.methodBuilder(name)
            .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
            .returns(KEY_MAP)
            .addJavadoc("Build the key as an attribute value map.\n");

        Map<String, KeyParameter> params = new LinkedHashMap<>();
        if (entityType != null) {
            mb.addParameter(entityType, ENTITY);
        } else {
            collectParameters(params, pk);
            if (sk != null) collectParameters(params, sk);
            for (KeyParameter p : params.values()) {
                mb.addParameter(ExpressionRenderer.javaType(p.type()), parameterName(p));
            }
        }

        mb.addStatement("$T key = new $T<>()", KEY_MAP, LinkedHashMap.class);
        mb.addStatement("key.put($N, $L)", names.constant("PARTITION_KEY_FIELD"),
            attributeValue(pk, builderCall(names.method("partitionKey"), pk, entityType)));
        if (sk != null) {
            mb.addStatement("key.put($N, $L)", names.constant("SORT_KEY_FIELD"),
                attributeValue(sk, builderCall(names.method("sortKey"), sk, entityType)));
        }
        return mb.addStatement("return key").build();
    }

    private static void collectParameters(Map<String, KeyParameter> params, CompiledKey key) {
        for (KeyParameter p : key.parameters()) {
            KeyParameter existing = params.putIfAbsent(p.name(), p);
            if (existing != null && !existing.fieldPath().equals(p.fieldPath())) {
                throw new IllegalArgumentException("fields " + existing.fieldPath() + " and " + p.fieldPath()
                    + " both map to parameter \"" + p.name() + "\"");
            }
        }
    }

    private static CodeBlock builderCall(String method, CompiledKey key, ClassName entityType) {
        if (key.isConstant()) {
            return CodeBlock.of("$N()", method);
        }
        if (entityType != null) {
            return CodeBlock.of("$N($N)", method + "Of", ENTITY);
        }
        List<CodeBlock> args = new ArrayList<>();
        for (KeyParameter p : key.parameters()) {
            args.add(CodeBlock.of("$N", parameterName(p)));
        }
        return CodeBlock.of("$N($L)", method, CodeBlock.join(args, ", "));
    }

    private static CodeBlock attributeValue(CompiledKey key, CodeBlock text) {
        AttributeKind kind = key.kind();
        switch (kind) {
            case NUMBER:
                return CodeBlock.of("$T.fromN($L)", ATTRIBUTE_VALUE, text);
            case BINARY:
                if (key.isConstant() && key.constantValue().b() != null) {
                    return CodeBlock.of("$T.fromB($T.fromByteArray($T.getDecoder().decode($L)))",
                        ATTRIBUTE_VALUE, SDK_BYTES, Base64.class, text);
                }
                return CodeBlock.of("$T.fromB($T.fromUtf8String($L))", ATTRIBUTE_VALUE, SDK_BYTES, text);
            default:
                return CodeBlock.of("$T.fromS($L)", ATTRIBUTE_VALUE, text);
        }
    }

    private static CodeBlock join(ExpressionRenderer renderer, List<KeyPart> parts, boolean fromEntity) {
        if (parts.isEmpty()) {
            return CodeBlock.of("$S", "");
        }
        List<CodeBlock> pieces = new ArrayList<>();
        for (KeyPart part : parts) {
            if (part instanceof KeyPart.Text text) {
                pieces.add(CodeBlock.of("$S", text.value()));
            } else {
                KeyPart.Field field = (KeyPart.Field) part;
                ConversionDescriptor conversion = fromEntity ? field.conversion().entityField() : field.conversion().parameter();
                pieces.add(renderer.render(conversion.expression(), field.conversion().fieldType(), ENTITY));
            }
        }
        return CodeBlock.join(pieces, " + ");
    }

    private static void addDiagnosticJavadoc(MethodSpec.Builder mb, CompiledKey key) {
        for (SortabilityDiagnostic d : key.diagnostics()) {
            mb.addJavadoc("<p>Does not sort correctly as a string: field $L: $L.\n", d.fieldPath(), d.cause());
        }
    }

    private static String parameterName(KeyParameter p) {
        if (!SourceVersion.isName(p.name())) {
            throw new IllegalArgumentException("field " + p.fieldPath() + " cannot be used as a Java parameter name \""
                + p.name() + "\"");
        }
        return p.name();
    }

    private static FieldSpec constant(String name, String value, String doc) {
        return FieldSpec.builder(String.class, name, Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
            .initializer("$S", value)
            .addJavadoc("$L", doc)
            .build();
    }

    /**
     * Convert an entity or index name to a valid Java camelCase identifier.
     */
    static String toJavaCamelCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }

        // Handle all-caps: GSI -> gsi
        if (name.equals(name.toUpperCase()) && name.length() > 1 && !name.contains("-") && !name.contains("_")) {
            String result = name.toLowerCase();
            if (Character.isDigit(result.charAt(0))) {
                result = "_" + result;
            }
            return result;
        }

        String[] parts = name.split("[-_ .]");
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (part.isEmpty()) continue;
            if (sb.isEmpty()) {
                sb.append(part.substring(0, 1).toLowerCase());
            } else {
                sb.append(part.substring(0, 1).toUpperCase());
            }
            if (part.length() > 1) {
                sb.append(part.substring(1));
            }
        }

        String result = sb.toString();
        if (!result.isEmpty() && Character.isDigit(result.charAt(0))) {
            result = "_" + result;
        }
        return result;
    }

    /**
     * Convert a string to UPPER_SNAKE_CASE for constant names.
     */
    static String toConstantCase(String name) {
        if (name == null || name.isEmpty()) return name;
        String result = name.replace("-", "_");
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < result.length(); i++) {
            char c = result.charAt(i);
            if (Character.isUpperCase(c) && i > 0 && Character.isLowerCase(result.charAt(i - 1))) {
                sb.append('_');
            }
            sb.append(c);
        }
        return sb.toString().toUpperCase();
    }

    static String cap(String s) {
        if (s == null || s.isEmpty()) return s;
        return s.substring(0, 1).toUpperCase() + s.substring(1);
    }
}
