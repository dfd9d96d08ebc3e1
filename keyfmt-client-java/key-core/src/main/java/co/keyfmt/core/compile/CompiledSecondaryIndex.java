package co.keyfmt.core.compile;

import java.util.Optional;

public record CompiledSecondaryIndex(String name, CompiledKey partitionKey, CompiledKey sortKeyOrNull) {

  public Optional<CompiledKey> sortKey() {
    return Optional.ofNullable(sortKeyOrNull);
  }
}
