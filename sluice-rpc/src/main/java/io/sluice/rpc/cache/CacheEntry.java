// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached value and the instant it was stored.
 *
 * @param value      the cached value
 * @param insertedAt when the value was stored
 * @param <V>        the value type
 */
public record CacheEntry<V>(V value, Instant insertedAt) {

    /**
     * Returns whether this entry is still valid at {@code now}, that is
     * {@code now - insertedAt < ttl}.
     */
    public boolean isFresh(final Instant now, final Duration ttl) {
        return Duration.between(insertedAt, now).compareTo(ttl) < 0;
    }
}
