package io.intellixity.sift.spi.schema.internal;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * Synchronized LRU cache with expire-after-write.\n
 *
 * - LRU eviction: access-order LinkedHashMap, bounded by maxEntries\n
 * - TTL: entries older than ttlMillis are reloaded; 0 disables expiry\n
 * - failed loads are not cached\n
 */
public final class ExpiringLruCache<K, V> {
  private final long ttlMillis;
  private final LongSupplier nowMillis;
  private final LinkedHashMap<K, Slot<V>> map;

  private record Slot<V>(V value, long writeAt) {}

  public ExpiringLruCache(int maxEntries, long ttlMillis) {
    this(maxEntries, ttlMillis, System::currentTimeMillis);
  }

  public ExpiringLruCache(int maxEntries, long ttlMillis, LongSupplier nowMillis) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    if (ttlMillis < 0) throw new IllegalArgumentException("ttlMillis must be >= 0");
    this.ttlMillis = ttlMillis;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
    this.map = new LinkedHashMap<>(16, 0.75f, true) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<K, Slot<V>> eldest) {
        return size() > maxEntries;
      }
    };
  }

  public synchronized V getOrLoad(K key, Function<? super K, ? extends V> loader) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(loader, "loader");
    long now = nowMillis.getAsLong();
    Slot<V> e = map.get(key);
    if (e != null && !isExpired(e, now)) return e.value();

    V loaded = loader.apply(key);
    if (loaded == null) {
      map.remove(key);
      return null;
    }
    map.put(key, new Slot<>(loaded, now));
    return loaded;
  }

  public synchronized void invalidate(K key) {
    map.remove(key);
  }

  public synchronized void invalidateAll() {
    map.clear();
  }

  public synchronized int size() {
    return map.size();
  }

  private boolean isExpired(Slot<V> e, long now) {
    return ttlMillis > 0 && (now - e.writeAt()) >= ttlMillis;
  }
}
