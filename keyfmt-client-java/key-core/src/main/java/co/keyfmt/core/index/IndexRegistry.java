package co.keyfmt.core.index;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Entity name to primary index mapping.
 *
 * <p>Registration normally happens once at startup while lookups happen from any thread, so reads
 * share a read lock and writes take the write lock. Registration order is preserved so code
 * generation output is deterministic.
 */
public final class IndexRegistry {

  /** A registered index and the entity it belongs to. */
  public record Entry(String entityName, PrimaryIndex index) {}

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, Entry> entries = new LinkedHashMap<>();

  /**
   * Register (or replace) the index for an entity. A replaced entity keeps its original position.
   *
   * @return the registered index
   * @throws IllegalArgumentException if the index does not validate
   */
  public PrimaryIndex register(String entityName, PrimaryIndex index) {
    if (entityName == null || entityName.isBlank()) {
      throw new IllegalArgumentException("entity name is required");
    }
    index.validate();
    lock.writeLock().lock();
    try {
      entries.put(entityName, new Entry(entityName, index));
    } finally {
      lock.writeLock().unlock();
    }
    return index;
  }

  /**
   * @throws NoSuchElementException if nothing is registered for the entity
   */
  public PrimaryIndex get(String entityName) {
    return find(entityName).orElseThrow(() ->
      new NoSuchElementException("no index registered for entity " + entityName));
  }

  public Optional<PrimaryIndex> find(String entityName) {
    lock.readLock().lock();
    try {
      Entry entry = entries.get(entityName);
      return entry == null ? Optional.empty() : Optional.of(entry.index());
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Snapshot of all entries in registration order. */
  public List<Entry> all() {
    lock.readLock().lock();
    try {
      return List.copyOf(new ArrayList<>(entries.values()));
    } finally {
      lock.readLock().unlock();
    }
  }

  public int size() {
    lock.readLock().lock();
    try {
      return entries.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  public void clear() {
    lock.writeLock().lock();
    try {
      entries.clear();
    } finally {
      lock.writeLock().unlock();
    }
  }
}
