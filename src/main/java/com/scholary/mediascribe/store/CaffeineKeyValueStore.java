package com.scholary.mediascribe.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Optional;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory implementation of KeyValueStore using Caffeine.
 *
 * <p>Entries expire a fixed time after their last write, and the store never holds more than
 * {@code maxSize} entries. When the size limit is reached Caffeine evicts the entries least likely
 * to be used again.
 */
public class CaffeineKeyValueStore<K, V> implements KeyValueStore<K, V> {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaffeineKeyValueStore.class);

  private final String name;
  private final Cache<K, V> cache;

  public CaffeineKeyValueStore(String name, long maxSize, Duration ttl) {
    this(name, maxSize, ttl, Ticker.systemTicker());
  }

  CaffeineKeyValueStore(String name, long maxSize, Duration ttl, Ticker ticker) {
    this.name = name;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(ttl)
            .ticker(ticker)
            .build();

    LOGGER.info("Initialized store: name={}, maxSize={}, ttl={}", name, maxSize, ttl);
  }

  @Override
  public void put(K key, V value) {
    cache.put(key, value);
  }

  @Override
  public Optional<V> get(K key) {
    return Optional.ofNullable(cache.getIfPresent(key));
  }

  @Override
  public Optional<V> remove(K key) {
    return Optional.ofNullable(cache.asMap().remove(key));
  }

  @Override
  public Optional<V> compute(K key, BiFunction<? super K, ? super V, ? extends V> remapping) {
    return Optional.ofNullable(cache.asMap().compute(key, remapping));
  }

  @Override
  public long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  @Override
  public void evictAll() {
    cache.invalidateAll();
    LOGGER.debug("Evicted all entries: name={}", name);
  }
}
