// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.scheduler;

import org.jspecify.annotations.Nullable;

/**
 * A partial change to a {@link RateConfig}. Absent fields keep their live value.
 *
 * <pre>{@code
 * scheduler.updateRateConfig(RateConfigUpdate.builder()
 *         .requestsPerSecond(2)
 *         .maxConcurrentRequests(4)
 *         .build());
 * }</pre>
 *
 * @param requestsPerSecond     new rate; when present, also sets {@code minIntervalMs}
 * @param maxConcurrentRequests new concurrency cap
 * @param minIntervalMs         new spacing; ignored when {@code requestsPerSecond} is present
 */
public record RateConfigUpdate(
        @Nullable Double requestsPerSecond,
        @Nullable Integer maxConcurrentRequests,
        @Nullable Long minIntervalMs) {

    public static RateConfigUpdate requestsPerSecond(final double requestsPerSecond) {
        return new RateConfigUpdate(requestsPerSecond, null, null);
    }

    public static RateConfigUpdate maxConcurrentRequests(final int maxConcurrentRequests) {
        return new RateConfigUpdate(null, maxConcurrentRequests, null);
    }

    public static RateConfigUpdate minIntervalMs(final long minIntervalMs) {
        return new RateConfigUpdate(null, null, minIntervalMs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private @Nullable Double requestsPerSecond;
        private @Nullable Integer maxConcurrentRequests;
        private @Nullable Long minIntervalMs;

        private Builder() {}

        public Builder requestsPerSecond(final double requestsPerSecond) {
            this.requestsPerSecond = requestsPerSecond;
            return this;
        }

        public Builder maxConcurrentRequests(final int maxConcurrentRequests) {
            this.maxConcurrentRequests = maxConcurrentRequests;
            return this;
        }

        public Builder minIntervalMs(final long minIntervalMs) {
            this.minIntervalMs = minIntervalMs;
            return this;
        }

        public RateConfigUpdate build() {
            return new RateConfigUpdate(requestsPerSecond, maxConcurrentRequests, minIntervalMs);
        }
    }
}
