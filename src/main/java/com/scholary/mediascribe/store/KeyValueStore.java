package com.scholary.mediascribe.store;

import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Bounded key-value store shared between concurrent pipeline tasks.
 *
 * <p>Implementations must be safe for concurrent readers and writers and must evict entries on
 * their own (by size, age, or both), so callers never have to clean up after abandoned work.
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface KeyValueStore<K, V> {

  /**
   * Insert or replace a value.
   *
   * @param key the key
   * @param value the value, never null
   */
  void put(K key, V value);

  /**
   * Look up a value without removing it.
   *
   * @param key the key
   * @return the value, or empty if absent or evicted
   */
  Optional<V> get(K key);

  /**
   * Atomically remove and return a value. Two concurrent callers can never both receive the same
   * entry.
   *
   * @param key the key
   * @return the removed value, or empty if absent
   */
  Optional<V> remove(K key);

  /**
   * Atomically recompute the value for a key.
   *
   * @param key the key
   * @param remapping receives the current value (or null) and returns the new value, or null to
   *     remove the entry
   * @return the new value, or empty if the entry was removed
   */
  Optional<V> compute(K key, BiFunction<? super K, ? super V, ? extends V> remapping);

  /** Approximate number of live entries. */
  long size();

  /** Drop every entry. */
  void evictAll();
}
