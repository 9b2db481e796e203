package com.flow.discovery.service.engine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Bounded least-recently-used cache with hit/miss statistics.
 *
 * Values are computed outside the lock, so a computation may itself use this
 * or another cache. Two threads missing the same key may both compute it; the
 * first stored value wins.
 */
public class LruCache<K, V> {

    private final String name;
    private final int maxEntries;
    private final Map<K, V> entries;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public LruCache(String name, int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("Cache " + name + " needs at least one entry, was " + maxEntries);
        }
        this.name = name;
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                boolean evict = size() > LruCache.this.maxEntries;
                if (evict) {
                    evictions.incrementAndGet();
                }
                return evict;
            }
        };
    }

    public V getOrCompute(K key, Function<? super K, ? extends V> computer) {
        V cached = get(key);
        if (cached != null) {
            return cached;
        }
        V computed = computer.apply(key);
        synchronized (this) {
            V existing = entries.get(key);
            if (existing != null) {
                return existing;
            }
            entries.put(key, computed);
            return computed;
        }
    }

    public synchronized V get(K key) {
        V value = entries.get(key);
        if (value != null) {
            hits.incrementAndGet();
        } else {
            misses.incrementAndGet();
        }
        return value;
    }

    public synchronized void put(K key, V value) {
        entries.put(key, value);
    }

    public synchronized boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public String getName() {
        return name;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public long getEvictions() {
        return evictions.get();
    }

    public double getHitRate() {
        long h = hits.get();
        long total = h + misses.get();
        return total == 0 ? 0.0 : (double) h / total;
    }

    public synchronized void resetStats() {
        hits.set(0);
        misses.set(0);
        evictions.set(0);
    }
}
