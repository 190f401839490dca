// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.cache;

import java.time.Duration;
import java.time.InstantSource;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Key-value cache whose entries expire a fixed time after they are stored.
 *
 * <p>
 * Expiry is lazy: an expired entry is evicted when {@link #get(Object)} reads
 * it, and still counts towards {@link #size()} until then. There is no size
 * bound.
 *
 * <p>
 * <strong>Thread Safety:</strong> Safe for concurrent use.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class TtlCache<K, V> {

    private final ConcurrentMap<K, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final InstantSource clock;

    public TtlCache(final Duration ttl) {
        this(ttl, InstantSource.system());
    }

    public TtlCache(final Duration ttl, final InstantSource clock) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
        }
        this.ttl = ttl;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns the value for {@code key} if it was stored less than one TTL ago.
     * An expired entry is removed.
     */
    public Optional<V> get(final K key) {
        final CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.isFresh(clock.instant(), ttl)) {
            // only drop the entry we looked at; a concurrent set wins
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    /**
     * Stores {@code value}, replacing any previous entry and restarting its TTL.
     */
    public void set(final K key, final V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        entries.put(key, new CacheEntry<>(value, clock.instant()));
    }

    public void remove(final K key) {
        entries.remove(key);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}
