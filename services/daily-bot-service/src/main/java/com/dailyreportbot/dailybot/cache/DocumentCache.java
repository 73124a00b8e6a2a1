package com.dailyreportbot.dailybot.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * In-memory copy of one collection, keyed by document id.
 *
 * <p>Filled by {@link #reload} at startup and kept current by the owning service, which calls
 * {@link #put} after every successful save. Reads never go to the store, so entries neither
 * expire nor get evicted by size.
 */
public class DocumentCache<T> {

  private final String name;
  private final Cache<String, T> entries;

  public DocumentCache(String name) {
    this.name = name;
    this.entries = Caffeine.newBuilder().build();
  }

  public String name() {
    return name;
  }

  public void reload(Map<String, T> snapshot) {
    entries.invalidateAll();
    entries.putAll(snapshot);
  }

  public Optional<T> get(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(entries.getIfPresent(id));
  }

  public void put(String id, T value) {
    entries.put(id, value);
  }

  /**
   * Replaces the entry of {@code id} with what {@code update} returns for the current entry (null
   * when absent). Runs atomically per id, so concurrent writers of one document queue up. When
   * {@code update} throws, the previous entry stays and the exception propagates.
   */
  public T compute(String id, UnaryOperator<T> update) {
    return entries.asMap().compute(id, (key, current) -> update.apply(current));
  }

  public void evict(String id) {
    entries.invalidate(id);
  }

  public Collection<T> values() {
    return List.copyOf(entries.asMap().values());
  }

  public int size() {
    return entries.asMap().size();
  }
}
