package co.keyfmt.core.compile;

import co.keyfmt.core.index.PrimaryIndex;
import co.keyfmt.core.sortability.SortabilityDiagnostic;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * All keys of one entity's index, compiled.
 */
public final class CompiledIndex {

  private final String entityLabel;
  private final PrimaryIndex index;
  private final CompiledKey partitionKey;
  private final CompiledKey sortKey;
  private final List<CompiledSecondaryIndex> secondaryIndexes;

  CompiledIndex(String entityLabel, PrimaryIndex index, CompiledKey partitionKey, CompiledKey sortKey,
                List<CompiledSecondaryIndex> secondaryIndexes) {
    this.entityLabel = entityLabel;
    this.index = index;
    this.partitionKey = partitionKey;
    this.sortKey = sortKey;
    this.secondaryIndexes = List.copyOf(secondaryIndexes);
  }

  public String entityLabel() {
    return entityLabel;
  }

  public String tableName() {
    return index.tableName();
  }

  public PrimaryIndex index() {
    return index;
  }

  public CompiledKey partitionKey() {
    return partitionKey;
  }

  public Optional<CompiledKey> sortKey() {
    return Optional.ofNullable(sortKey);
  }

  public List<CompiledSecondaryIndex> secondaryIndexes() {
    return secondaryIndexes;
  }

  /** Every compiled key: primary partition, primary sort, then each secondary index's keys. */
  public List<CompiledKey> allKeys() {
    List<CompiledKey> keys = new ArrayList<>();
    keys.add(partitionKey);
    if (sortKey != null) keys.add(sortKey);
    for (CompiledSecondaryIndex gsi : secondaryIndexes) {
      keys.add(gsi.partitionKey());
      gsi.sortKey().ifPresent(keys::add);
    }
    return keys;
  }

  public List<SortabilityDiagnostic> diagnostics() {
    List<SortabilityDiagnostic> all = new ArrayList<>();
    for (CompiledKey key : allKeys()) {
      all.addAll(key.diagnostics());
    }
    return all;
  }

  public boolean requiresNumericLibrary() {
    return allKeys().stream().anyMatch(CompiledKey::requiresNumericLibrary);
  }

  public boolean requiresTemporalLibrary() {
    return allKeys().stream().anyMatch(CompiledKey::requiresTemporalLibrary);
  }
}
