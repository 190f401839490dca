// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.scheduler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class RateConfigTest {

    @Test
    void defaultsMatchOneRequestPerSecond() {
        final RateConfig config = RateConfig.defaults();
        assertEquals(1000, config.minIntervalMs());
        assertEquals(2, config.maxConcurrentRequests());
        assertEquals(1.0, config.requestsPerSecond());
    }

    @Test
    void intervalIsCeilingOfRate() {
        assertEquals(500, RateConfig.intervalFor(2));
        assertEquals(334, RateConfig.intervalFor(3));
        assertEquals(4000, RateConfig.intervalFor(0.25));
    }

    @Test
    void rateWinsOverExplicitInterval() {
        final RateConfig merged = RateConfig.defaults().merge(
                RateConfigUpdate.builder().requestsPerSecond(2).minIntervalMs(50).build());
        assertEquals(500, merged.minIntervalMs());
        assertEquals(2.0, merged.requestsPerSecond());
    }

    @Test
    void intervalOnlyUpdateKeepsRate() {
        final RateConfig merged = RateConfig.defaults().merge(RateConfigUpdate.minIntervalMs(250));
        assertEquals(250, merged.minIntervalMs());
        assertEquals(1.0, merged.requestsPerSecond());
        assertEquals(2, merged.maxConcurrentRequests());
    }

    @Test
    void emptyUpdateChangesNothing() {
        final RateConfig config = RateConfig.of(4, 3);
        assertEquals(config, config.merge(RateConfigUpdate.builder().build()));
    }

    @Test
    void invalidValuesRejected() {
        final RateConfig config = RateConfig.defaults();
        assertThrows(IllegalArgumentException.class, () -> config.merge(RateConfigUpdate.requestsPerSecond(0)));
        assertThrows(IllegalArgumentException.class, () -> config.merge(RateConfigUpdate.requestsPerSecond(-1)));
        assertThrows(IllegalArgumentException.class, () -> config.merge(RateConfigUpdate.maxConcurrentRequests(0)));
        assertThrows(IllegalArgumentException.class, () -> config.merge(RateConfigUpdate.minIntervalMs(-5)));
    }
}
