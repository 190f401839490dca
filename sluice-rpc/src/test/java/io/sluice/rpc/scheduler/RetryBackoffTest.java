// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.scheduler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class RetryBackoffTest {

    private final RetryBackoff backoff = RetryBackoff.standard(RetryConfig.defaults());

    @Test
    void transientDelaysDoubleUpToCap() {
        assertEquals(2000, backoff.delayMs(0, FailureKind.TRANSIENT));
        assertEquals(4000, backoff.delayMs(1, FailureKind.TRANSIENT));
        assertEquals(8000, backoff.delayMs(2, FailureKind.TRANSIENT));
        assertEquals(16_000, backoff.delayMs(3, FailureKind.TRANSIENT));
        assertEquals(30_000, backoff.delayMs(4, FailureKind.TRANSIENT));
        assertEquals(30_000, backoff.delayMs(40, FailureKind.TRANSIENT));
    }

    @Test
    void rateLimitedDelaysNeverBelowFloor() {
        assertEquals(5000, backoff.delayMs(0, FailureKind.RATE_LIMITED));
        assertEquals(5000, backoff.delayMs(1, FailureKind.RATE_LIMITED));
        assertEquals(8000, backoff.delayMs(2, FailureKind.RATE_LIMITED));
    }

    @Test
    void delaysStayWithinBoundsForEveryAttempt() {
        final RetryConfig config = RetryConfig.defaults();
        for (int attempt = 0; attempt < 100; attempt++) {
            for (FailureKind kind : FailureKind.values()) {
                final long delay = backoff.delayMs(attempt, kind);
                assertTrue(delay <= Math.max(config.maxDelayMs(), RetryBackoff.DEFAULT_RATE_LIMIT_FLOOR_MS));
                assertTrue(delay >= Math.min(config.baseDelayMs(), config.maxDelayMs()));
                if (kind == FailureKind.RATE_LIMITED) {
                    assertTrue(delay >= RetryBackoff.DEFAULT_RATE_LIMIT_FLOOR_MS);
                }
            }
        }
    }

    @Test
    void customFloorApplies() {
        final RetryBackoff fast = new RetryBackoff(new RetryConfig(3, 1, 10), 2);
        assertEquals(2, fast.delayMs(0, FailureKind.RATE_LIMITED));
        assertEquals(1, fast.delayMs(0, FailureKind.TRANSIENT));
    }

    @Test
    void negativeAttemptRejected() {
        assertThrows(IllegalArgumentException.class, () -> backoff.delayMs(-1, FailureKind.TRANSIENT));
    }
}
