// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.reader;

import java.time.Duration;
import java.time.InstantSource;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sluice.rpc.cache.TtlCache;
import io.sluice.rpc.scheduler.RequestScheduler;

/**
 * Read-through cache of user records keyed by transaction id.
 *
 * <p>
 * Misses are decoded through the shared {@link RequestScheduler}, so reader
 * traffic obeys the same rate limits as every other caller. Only found
 * records are cached; decoder failures reach the caller unchanged.
 */
public final class UserTransactionReader {

    private static final Logger log = LoggerFactory.getLogger(UserTransactionReader.class);

    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);
    public static final String DEFAULT_SERVICE_ID = "user-transaction-reader";

    private final GenesisDecoder decoder;
    private final RequestScheduler scheduler;
    private final TtlCache<String, UserRecord> cache;
    private final InstantSource clock;
    private final String serviceId;

    public UserTransactionReader(final GenesisDecoder decoder, final RequestScheduler scheduler) {
        this(decoder, scheduler, DEFAULT_CACHE_TTL, InstantSource.system(), DEFAULT_SERVICE_ID);
    }

    public UserTransactionReader(
            final GenesisDecoder decoder,
            final RequestScheduler scheduler,
            final Duration cacheTtl,
            final InstantSource clock,
            final String serviceId) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.cache = new TtlCache<>(cacheTtl, clock);
        this.serviceId = Objects.requireNonNull(serviceId, "serviceId");
    }

    /**
     * Returns the user record stored in {@code transactionId}.
     *
     * @param transactionId the transaction signature
     * @return the record, or empty when the transaction holds no genesis record
     */
    public CompletableFuture<Optional<UserRecord>> fetchUserData(final String transactionId) {
        Objects.requireNonNull(transactionId, "transactionId");
        final Optional<UserRecord> cached = cache.get(transactionId);
        if (cached.isPresent()) {
            log.debug("Cache hit for transaction {}", transactionId);
            return CompletableFuture.completedFuture(cached);
        }

        log.debug("Cache miss for transaction {}, decoding", transactionId);
        return scheduler
                .submit(() -> decoder.readGenesis(transactionId), "readGenesis " + transactionId, serviceId)
                .thenApply(raw -> {
                    if (raw == null || raw.isEmpty()) {
                        log.warn("No genesis record in transaction {}", transactionId);
                        return Optional.<UserRecord>empty();
                    }
                    final UserRecord record = UserRecord.normalize(raw.get(), clock.instant());
                    cache.set(transactionId, record);
                    log.debug("Cached user {} ({}) for transaction {}", record.alias(), record.kind(), transactionId);
                    return Optional.of(record);
                });
    }

    public void clearCache() {
        cache.clear();
        log.debug("User record cache cleared");
    }

    public int cachedCount() {
        return cache.size();
    }
}
