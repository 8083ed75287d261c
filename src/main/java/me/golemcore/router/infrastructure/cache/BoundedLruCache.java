package me.golemcore.router.infrastructure.cache;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Thread-safe LRU map with a fixed capacity. Reads refresh recency; inserting
 * beyond capacity evicts the least recently used entry.
 *
 * @param <K>
 *            key type
 * @param <V>
 *            value type
 */
public class BoundedLruCache<K, V> {

    private final int capacity;
    private final LinkedHashMap<K, V> entries;

    public BoundedLruCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > BoundedLruCache.this.capacity;
            }
        };
    }

    public synchronized Optional<V> get(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    public synchronized void put(K key, V value) {
        entries.put(key, value);
    }

    /**
     * Returns the cached value or computes, stores and returns a new one.
     */
    public synchronized V computeIfAbsent(K key, Function<? super K, ? extends V> loader) {
        V existing = entries.get(key);
        if (existing != null) {
            return existing;
        }
        V created = loader.apply(key);
        if (created != null) {
            entries.put(key, created);
        }
        return created;
    }

    /**
     * Inserts the key unless already present.
     *
     * @return true if the key was absent
     */
    public synchronized boolean putIfAbsent(K key, V value) {
        if (entries.containsKey(key)) {
            entries.get(key);
            return false;
        }
        entries.put(key, value);
        return true;
    }

    public synchronized boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    public synchronized V remove(K key) {
        return entries.remove(key);
    }

    /**
     * Drops the {@code count} least recently used entries.
     */
    public synchronized void evictOldest(int count) {
        Iterator<K> it = entries.keySet().iterator();
        int removed = 0;
        while (it.hasNext() && removed < count) {
            it.next();
            it.remove();
            removed++;
        }
    }

    public synchronized int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void clear() {
        entries.clear();
    }

    /**
     * Copy of the current entries, least recently used first.
     */
    public synchronized Map<K, V> snapshot() {
        return new LinkedHashMap<>(entries);
    }

    public synchronized List<K> keys() {
        return new ArrayList<>(entries.keySet());
    }
}
