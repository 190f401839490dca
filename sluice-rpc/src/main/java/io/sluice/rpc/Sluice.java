// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc;

import java.time.Duration;
import java.time.InstantSource;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sluice.rpc.reader.GenesisDecoder;
import io.sluice.rpc.reader.UserTransactionReader;
import io.sluice.rpc.scheduler.FailureClassifier;
import io.sluice.rpc.scheduler.RateConfig;
import io.sluice.rpc.scheduler.RequestScheduler;
import io.sluice.rpc.scheduler.RetryBackoff;
import io.sluice.rpc.scheduler.RetryConfig;
import io.sluice.rpc.scheduler.SchedulerMetrics;

/**
 * Entry point that wires a transport, one shared {@link RequestScheduler}, a
 * {@link ScheduledRpcClient} and user transaction readers.
 *
 * <p>
 * Every reader and the RPC client created from one {@code Sluice} share its
 * scheduler, so together they never exceed the configured rate.
 *
 * <p>
 * <strong>Example:</strong>
 *
 * <pre>{@code
 * try (Sluice sluice = Sluice.builder()
 *         .rpcUrl(Sluice.DEVNET_URL)
 *         .rateConfig(RateConfig.of(2, 2))
 *         .build()) {
 *     boolean up = sluice.rpc().testConnection().join();
 *     UserTransactionReader reader = sluice.userTransactionReader(myDecoder);
 *     Optional<UserRecord> user = reader.fetchUserData(signature).join();
 * }
 * }</pre>
 */
public final class Sluice implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Sluice.class);

    /** Public Solana devnet endpoint. */
    public static final String DEVNET_URL = "https://api.devnet.solana.com";

    private final RpcTransport transport;
    private final boolean ownsTransport;
    private final RequestScheduler scheduler;
    private final ExecutorService ioExecutor;
    private final ScheduledRpcClient rpc;
    private final Duration cacheTtl;
    private final InstantSource clock;

    private Sluice(final Builder builder, final RpcTransport transport, final boolean ownsTransport) {
        this.transport = transport;
        this.ownsTransport = ownsTransport;
        this.scheduler = RequestScheduler.builder()
                .rateConfig(builder.rateConfig)
                .retryConfig(builder.retryConfig)
                .classifier(builder.classifier)
                .metrics(builder.metrics)
                .rateLimitFloor(builder.rateLimitFloor)
                .build();
        this.ioExecutor = SluiceExecutors.newIoBoundExecutor();
        this.rpc = new ScheduledRpcClient(transport, scheduler, ioExecutor, builder.serviceId);
        this.cacheTtl = builder.cacheTtl;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Connects to {@code rpcUrl} with default rate and retry settings.
     */
    public static Sluice connect(final String rpcUrl) {
        return builder().rpcUrl(rpcUrl).build();
    }

    public ScheduledRpcClient rpc() {
        return rpc;
    }

    public RequestScheduler scheduler() {
        return scheduler;
    }

    public RpcTransport transport() {
        return transport;
    }

    /**
     * Creates a reader that decodes through this instance's scheduler.
     */
    public UserTransactionReader userTransactionReader(final GenesisDecoder decoder) {
        return userTransactionReader(decoder, UserTransactionReader.DEFAULT_SERVICE_ID);
    }

    public UserTransactionReader userTransactionReader(final GenesisDecoder decoder, final String serviceId) {
        return new UserTransactionReader(decoder, scheduler, cacheTtl, clock, serviceId);
    }

    /**
     * Closes the scheduler, the I/O pool and, if it was created here, the
     * transport. Pending requests fail with
     * {@link java.util.concurrent.RejectedExecutionException}.
     */
    @Override
    public void close() {
        scheduler.close();
        ioExecutor.shutdown();
        if (ownsTransport) {
            try {
                transport.close();
            } catch (Exception e) {
                log.warn("Failed to close transport", e);
            }
        }
    }

    /**
     * Builder for {@link Sluice}. Either {@link #rpcUrl(String)} or
     * {@link #transport(RpcTransport)} is required; if both are set the
     * explicit transport takes precedence.
     */
    public static final class Builder {

        private @Nullable String rpcUrl;
        private @Nullable RpcTransport transport;
        private @Nullable Duration connectTimeout;
        private @Nullable Duration readTimeout;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private RateConfig rateConfig = RateConfig.defaults();
        private RetryConfig retryConfig = RetryConfig.defaults();
        private FailureClassifier classifier = FailureClassifier.defaults();
        private SchedulerMetrics metrics = SchedulerMetrics.noop();
        private Duration rateLimitFloor = Duration.ofMillis(RetryBackoff.DEFAULT_RATE_LIMIT_FLOOR_MS);
        private Duration cacheTtl = UserTransactionReader.DEFAULT_CACHE_TTL;
        private InstantSource clock = InstantSource.system();
        private String serviceId = ScheduledRpcClient.DEFAULT_SERVICE_ID;

        private Builder() {
        }

        public Builder rpcUrl(final String rpcUrl) {
            this.rpcUrl = rpcUrl;
            return this;
        }

        public Builder transport(final RpcTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder rateConfig(final RateConfig rateConfig) {
            this.rateConfig = Objects.requireNonNull(rateConfig, "rateConfig");
            return this;
        }

        public Builder retryConfig(final RetryConfig retryConfig) {
            this.retryConfig = Objects.requireNonNull(retryConfig, "retryConfig");
            return this;
        }

        public Builder classifier(final FailureClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier");
            return this;
        }

        public Builder metrics(final SchedulerMetrics metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics");
            return this;
        }

        public Builder rateLimitFloor(final Duration rateLimitFloor) {
            this.rateLimitFloor = Objects.requireNonNull(rateLimitFloor, "rateLimitFloor");
            return this;
        }

        public Builder cacheTtl(final Duration cacheTtl) {
            this.cacheTtl = Objects.requireNonNull(cacheTtl, "cacheTtl");
            return this;
        }

        public Builder clock(final InstantSource clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Sets the service tag used by {@link Sluice#rpc()} in logs and metrics.
         */
        public Builder serviceId(final String serviceId) {
            this.serviceId = Objects.requireNonNull(serviceId, "serviceId");
            return this;
        }

        /**
         * @throws IllegalStateException if neither rpcUrl nor transport is configured
         */
        public Sluice build() {
            if (transport != null) {
                return new Sluice(this, transport, false);
            }
            if (rpcUrl == null || rpcUrl.isBlank()) {
                throw new IllegalStateException("Either rpcUrl or transport must be configured");
            }
            final HttpRpcTransport.Builder http = HttpRpcTransport.builder(rpcUrl)
                    .connectTimeout(connectTimeout)
                    .readTimeout(readTimeout);
            headers.forEach(http::header);
            return new Sluice(this, http.build(), true);
        }
    }
}
