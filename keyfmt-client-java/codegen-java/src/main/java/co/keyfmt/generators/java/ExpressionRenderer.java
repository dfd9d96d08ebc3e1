package co.keyfmt.generators.java;

import co.keyfmt.core.FieldType;
import co.keyfmt.core.conversion.ConversionExpr;
import co.keyfmt.core.conversion.EpochUnit;
import co.keyfmt.core.conversion.TemporalLayout;
import co.keyfmt.core.conversion.ValueSource;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterSpec;
import com.squareup.javapoet.TypeName;

import javax.lang.model.element.Modifier;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Renders conversion expressions as Java source.
 *
 * <p>One renderer is used per generated class. It records the shared members the rendered code
 * refers to (date-time formatter constants) so the class only declares what it uses.
 */
class ExpressionRenderer {

    static final String FORMAT_HELPER = "format";

    private static final Set<String> LONG_TYPES = Set.of("long", "Long", "number.long", "int64", "timestamp.epoch");
    private static final Set<String> FLOAT_TYPES = Set.of("float", "Float", "float32", "number.float");
    private static final Set<String> DECIMAL_TYPES = Set.of("BigDecimal", "number.decimal");

    private final Map<TemporalLayout, String> formatters = new LinkedHashMap<>();
    private int customLayouts;

    /** Rendered code and the Java type it evaluates to. */
    record Rendered(CodeBlock code, TypeName type) {}

    /**
     * Java parameter type for a semantic field type.
     */
    static TypeName javaType(FieldType type) {
        String name = type.name();
        switch (type.category()) {
            case TEXT:
                return ClassName.get(String.class);
            case SIGNED_INTEGER:
                if (LONG_TYPES.contains(name)) return TypeName.LONG;
                if ("BigInteger".equals(name)) return ClassName.get(BigInteger.class);
                return TypeName.INT;
            case UNSIGNED_INTEGER:
                return TypeName.LONG;
            case FLOATING_POINT:
                if (FLOAT_TYPES.contains(name)) return TypeName.FLOAT;
                if (DECIMAL_TYPES.contains(name)) return ClassName.get(BigDecimal.class);
                return TypeName.DOUBLE;
            case TEMPORAL:
                if ("OffsetDateTime".equals(name)) return ClassName.get(OffsetDateTime.class);
                if ("ZonedDateTime".equals(name)) return ClassName.get(ZonedDateTime.class);
                return ClassName.get(Instant.class);
            default:
                return ClassName.get(Object.class);
        }
    }

    /**
     * Render an expression to code producing the key text.
     *
     * @param expr       the conversion
     * @param fieldType  semantic type of the source value
     * @param entityName name of the entity variable for field access sources
     */
    CodeBlock render(ConversionExpr expr, FieldType fieldType, String entityName) {
        Rendered r = renderNode(expr, fieldType, entityName);
        if (r.type().equals(ClassName.get(String.class))) {
            return r.code();
        }
        return CodeBlock.of("$T.valueOf($L)", String.class, r.code());
    }

    private Rendered renderNode(ConversionExpr expr, FieldType fieldType, String entityName) {
        if (expr instanceof ConversionExpr.Source source) {
            return new Rendered(sourceCode(source.valueSource(), entityName), javaType(fieldType));
        }
        if (expr instanceof ConversionExpr.ToUtc toUtc) {
            Rendered in = renderNode(toUtc.operand(), fieldType, entityName);
            return new Rendered(
                CodeBlock.of("$L.withOffsetSameInstant($T.UTC)", toOffsetDateTime(in), ZoneOffset.class),
                ClassName.get(OffsetDateTime.class));
        }
        if (expr instanceof ConversionExpr.EpochCount epoch) {
            Rendered in = renderNode(epoch.operand(), fieldType, entityName);
            return new Rendered(epochCount(in, epoch.unit()), TypeName.LONG);
        }
        if (expr instanceof ConversionExpr.PrintfFormat printf) {
            Rendered in = renderNode(printf.operand(), fieldType, entityName);
            if (printf.unsigned()) {
                in = unsigned(in);
            }
            return new Rendered(
                CodeBlock.of("$N($S, $L)", FORMAT_HELPER, printf.spec(), printfArgument(printf.spec(), in)),
                ClassName.get(String.class));
        }
        if (expr instanceof ConversionExpr.DecimalString decimal) {
            Rendered in = renderNode(decimal.operand(), fieldType, entityName);
            if (decimal.unsigned()) {
                return new Rendered(CodeBlock.of("$T.toUnsignedString($L)", Long.class, in.code()), ClassName.get(String.class));
            }
            return new Rendered(CodeBlock.of("$T.valueOf($L)", String.class, in.code()), ClassName.get(String.class));
        }
        if (expr instanceof ConversionExpr.TemporalFormat temporal) {
            Rendered in = renderNode(temporal.operand(), fieldType, entityName);
            String constant = formatterConstant(temporal.layout());
            return new Rendered(CodeBlock.of("$N.format($L)", constant, toOffsetDateTime(in)), ClassName.get(String.class));
        }
        ConversionExpr.Stringify stringify = (ConversionExpr.Stringify) expr;
        Rendered in = renderNode(stringify.operand(), fieldType, entityName);
        return new Rendered(CodeBlock.of("$T.valueOf($L)", String.class, in.code()), ClassName.get(String.class));
    }

    static CodeBlock sourceCode(ValueSource source, String entityName) {
        if (source instanceof ValueSource.Parameter parameter) {
            return CodeBlock.of("$N", parameter.name());
        }
        ValueSource.FieldAccess access = (ValueSource.FieldAccess) source;
        CodeBlock.Builder b = CodeBlock.builder().add("$N", entityName);
        for (String component : access.path()) {
            b.add(".get$L()", JavaKeyGenerator.cap(component));
        }
        return b.build();
    }

    private static CodeBlock toOffsetDateTime(Rendered in) {
        if (in.type().equals(ClassName.get(Instant.class))) {
            return CodeBlock.of("$L.atOffset($T.UTC)", in.code(), ZoneOffset.class);
        }
        if (in.type().equals(ClassName.get(ZonedDateTime.class))) {
            return CodeBlock.of("$L.toOffsetDateTime()", in.code());
        }
        return in.code();
    }

    private static CodeBlock epochCount(Rendered in, EpochUnit unit) {
        boolean instant = in.type().equals(ClassName.get(Instant.class));
        switch (unit) {
            case SECONDS:
                return instant
                    ? CodeBlock.of("$L.getEpochSecond()", in.code())
                    : CodeBlock.of("$L.toEpochSecond()", in.code());
            case MILLISECONDS:
                return instant
                    ? CodeBlock.of("$L.toEpochMilli()", in.code())
                    : CodeBlock.of("$L.toInstant().toEpochMilli()", in.code());
            default:
                return instant
                    ? CodeBlock.of("$T.NANOS.between($T.EPOCH, $L)", ChronoUnit.class, Instant.class, in.code())
                    : CodeBlock.of("$T.NANOS.between($T.EPOCH, $L.toInstant())", ChronoUnit.class, Instant.class, in.code());
        }
    }

    private static Rendered unsigned(Rendered in) {
        if (in.type().equals(TypeName.LONG)) {
            return new Rendered(CodeBlock.of("new $T($T.toUnsignedString($L))", BigInteger.class, Long.class, in.code()),
                ClassName.get(BigInteger.class));
        }
        if (in.type().equals(TypeName.INT)) {
            return new Rendered(CodeBlock.of("$T.valueOf($T.toUnsignedLong($L))", BigInteger.class, Integer.class, in.code()),
                ClassName.get(BigInteger.class));
        }
        return in;
    }

    /** Integral values under %f/%e/%g and decimals under %d/%x/%o need converting for Formatter. */
    private static CodeBlock printfArgument(String spec, Rendered in) {
        char conversion = Character.toLowerCase(spec.charAt(spec.length() - 1));
        boolean integral = in.type().equals(TypeName.INT) || in.type().equals(TypeName.LONG)
            || in.type().equals(ClassName.get(BigInteger.class));
        if ((conversion == 'f' || conversion == 'e' || conversion == 'g') && integral) {
            return CodeBlock.of("new $T($T.valueOf($L))", BigDecimal.class, String.class, in.code());
        }
        if ((conversion == 'd' || conversion == 'x' || conversion == 'o') && in.type().equals(ClassName.get(BigDecimal.class))) {
            return CodeBlock.of("$L.toBigIntegerExact()", in.code());
        }
        return in.code();
    }

    private String formatterConstant(TemporalLayout layout) {
        return formatters.computeIfAbsent(layout, l -> {
            if (l == TemporalLayout.RFC3339) return "RFC3339";
            if (l == TemporalLayout.RFC3339_FIXED) return "RFC3339_FIXED";
            if (l == TemporalLayout.RFC3339_NANO) return "RFC3339_NANO";
            return "LAYOUT_" + (++customLayouts);
        });
    }

    /** Formatter constants referenced so far, in first-use order. */
    List<FieldSpec> formatterFields() {
        List<FieldSpec> fields = new ArrayList<>();
        formatters.forEach((layout, name) -> {
            CodeBlock init = layout.pattern() == null
                ? CodeBlock.of("$T.ISO_OFFSET_DATE_TIME", DateTimeFormatter.class)
                : CodeBlock.of("$T.ofPattern($S)", DateTimeFormatter.class, layout.pattern());
            fields.add(FieldSpec.builder(DateTimeFormatter.class, name, Modifier.PRIVATE, Modifier.STATIC, Modifier.FINAL)
                .initializer(init)
                .build());
        });
        return fields;
    }

    /** {@code private static String format(String spec, Object value)} pinned to {@link Locale#ROOT}. */
    static MethodSpec formatHelper() {
        return MethodSpec.methodBuilder(FORMAT_HELPER)
            .addModifiers(Modifier.PRIVATE, Modifier.STATIC)
            .returns(String.class)
            .addParameter(ParameterSpec.builder(String.class, "spec").build())
            .addParameter(ParameterSpec.builder(Object.class, "value").build())
            .addStatement("return $T.format($T.ROOT, spec, value)", String.class, Locale.class)
            .build();
    }
}
