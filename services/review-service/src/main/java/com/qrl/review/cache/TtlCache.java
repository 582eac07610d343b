package com.qrl.review.cache;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.LongSupplier;

/** Size-bounded TTL map; evicts in insertion order once {@code maxEntries} is exceeded. */
public class TtlCache<V> {
    private final ConcurrentHashMap<String, Entry<V>> entries = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<String> insertionOrder = new ConcurrentLinkedQueue<>();
    private final int maxEntries;
    private final LongSupplier clock;

    public TtlCache(int maxEntries) {
        this(maxEntries, System::currentTimeMillis);
    }

    public TtlCache(int maxEntries, LongSupplier clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock;
    }

    public Optional<V> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (clock.getAsLong() >= entry.expiresAtMs()) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public void put(String key, V value, long ttlMs) {
        if (key == null || value == null || ttlMs <= 0) {
            return;
        }
        Entry<V> previous = entries.put(key, new Entry<>(value, clock.getAsLong() + ttlMs));
        if (previous == null) {
            insertionOrder.add(key);
        }
        while (entries.size() > maxEntries) {
            String oldest = insertionOrder.poll();
            if (oldest == null) {
                break;
            }
            entries.remove(oldest);
        }
    }

    public int size() {
        return entries.size();
    }

    private record Entry<V>(V value, long expiresAtMs) {
    }
}
