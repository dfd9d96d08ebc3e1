package co.keyfmt.core.compile;

import co.keyfmt.core.FieldType;
import co.keyfmt.core.FieldTypeResolver;
import co.keyfmt.core.compile.CompiledKey.Position;
import co.keyfmt.core.conversion.ConversionEngine;
import co.keyfmt.core.conversion.ConversionException;
import co.keyfmt.core.conversion.ConversionException.Reason;
import co.keyfmt.core.conversion.KeyConversion;
import co.keyfmt.core.index.KeyValueDef;
import co.keyfmt.core.index.PrimaryIndex;
import co.keyfmt.core.index.SecondaryIndex;
import co.keyfmt.core.index.ValueDef;
import co.keyfmt.core.pattern.PatternSpec;
import co.keyfmt.core.pattern.Segment;
import co.keyfmt.core.sortability.SortabilityAdvisor;
import co.keyfmt.core.sortability.SortabilityDiagnostic;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles an entity's index definition against its field types.
 *
 * <p>Every key is compiled or the whole call fails: there is no partially compiled index.
 * Sortability diagnostics are collected for sort keys only and never fail compilation.
 */
public final class IndexCompiler {

  private IndexCompiler() {}

  /**
   * @param index       the validated index definition
   * @param types       field path to semantic type lookup for the entity
   * @param entityLabel entity name used in messages and diagnostics
   * @throws ConversionException      if a field is unknown or cannot be converted
   * @throws IllegalArgumentException if the index is invalid or two fields share a parameter name
   */
  public static CompiledIndex compile(PrimaryIndex index, FieldTypeResolver types, String entityLabel) {
    index.validate();

    CompiledKey pk = compileKey(index.partitionKey(), Position.PARTITION, types, entityLabel, "partition key");
    CompiledKey sk = index.sortKey()
      .map(def -> compileKey(def, Position.SORT, types, entityLabel, "sort key"))
      .orElse(null);

    List<CompiledSecondaryIndex> gsis = new ArrayList<>();
    for (SecondaryIndex gsi : index.secondaryIndexes()) {
      String where = "secondary index " + gsi.name();
      CompiledKey gsiPk = compileKey(gsi.partitionKey(), Position.PARTITION, types, entityLabel, where + " partition key");
      CompiledKey gsiSk = gsi.sortKey()
        .map(def -> compileKey(def, Position.SORT, types, entityLabel, where + " sort key"))
        .orElse(null);
      gsis.add(new CompiledSecondaryIndex(gsi.name(), gsiPk, gsiSk));
    }
    return new CompiledIndex(entityLabel, index, pk, sk, gsis);
  }

  /**
   * Compile a single key definition.
   */
  public static CompiledKey compileKey(KeyValueDef def, Position position, FieldTypeResolver types, String entityLabel) {
    return compileKey(def, position, types, entityLabel, position == Position.SORT ? "sort key" : "partition key");
  }

  private static CompiledKey compileKey(KeyValueDef def, Position position, FieldTypeResolver types,
                                        String entityLabel, String where) {
    ValueDef value = def.value();
    if (value instanceof ValueDef.Constant constant) {
      AttributeValue av = constant.value();
      return new CompiledKey(def.key(), position, constantText(av), av, List.of(), List.of(), constantText(av), List.of());
    }

    PatternSpec spec;
    String source;
    if (value instanceof ValueDef.Format format) {
      spec = format.pattern();
      source = spec.raw();
      if (spec.isConstant()) {
        AttributeValue av = def.extract(Map.of());
        return new CompiledKey(def.key(), position, source, av, List.of(), List.of(), spec.raw(), List.of());
      }
    } else {
      String path = ((ValueDef.FromField) value).path();
      spec = PatternSpec.parse("{" + path + "}", def.key().kind());
      source = path;
    }

    List<KeyPart> parts = new ArrayList<>();
    Map<String, KeyParameter> parameters = new LinkedHashMap<>();
    List<SortabilityDiagnostic> diagnostics = new ArrayList<>();
    for (Segment segment : spec.segments()) {
      if (segment instanceof Segment.Literal literal) {
        parts.add(new KeyPart.Text(literal.value()));
        continue;
      }
      Segment.FieldRef ref = (Segment.FieldRef) segment;
      FieldType type = types.resolve(ref.path()).orElseThrow(() ->
        new ConversionException(Reason.UNKNOWN_FIELD, ref.path(),
          entityLabel + " " + where + ": unknown field " + ref.path() + " in " + source));

      KeyConversion conversion;
      try {
        conversion = ConversionEngine.convertForKey(ref, type);
      } catch (ConversionException e) {
        throw new ConversionException(e.reason(), e.fieldPath(), entityLabel + " " + where + ": " + e.getMessage(), e);
      }
      parts.add(new KeyPart.Field(conversion));
      addParameter(parameters, new KeyParameter(ref.parameterName(), ref.path(), type), entityLabel, where);

      if (position == Position.SORT) {
        SortabilityAdvisor.checkSortSafety(ref, type, entityLabel).ifPresent(diagnostics::add);
      }
    }
    return new CompiledKey(def.key(), position, source, null, parts, new ArrayList<>(parameters.values()),
      spec.leadingLiteralPrefix(), diagnostics);
  }

  private static void addParameter(Map<String, KeyParameter> parameters, KeyParameter parameter,
                                   String entityLabel, String where) {
    KeyParameter existing = parameters.get(parameter.name());
    if (existing == null) {
      parameters.put(parameter.name(), parameter);
    } else if (!existing.fieldPath().equals(parameter.fieldPath())) {
      throw new IllegalArgumentException(entityLabel + " " + where + ": fields " + existing.fieldPath() + " and "
        + parameter.fieldPath() + " both map to parameter \"" + parameter.name() + "\"");
    }
  }

  private static String constantText(AttributeValue value) {
    if (value.s() != null) return value.s();
    if (value.n() != null) return value.n();
    return Base64.getEncoder().encodeToString(value.b().asByteArray());
  }
}
