// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.scheduler;

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.sluice.core.SluiceDebug;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class RequestSchedulerDebugTest {

    private final Logger debugLogger = (Logger) LoggerFactory.getLogger("io.sluice.debug");
    private final Logger schedulerLogger = (Logger) LoggerFactory.getLogger(RequestScheduler.class);
    private final ListAppender<ILoggingEvent> debugEvents = new ListAppender<>();
    private final ListAppender<ILoggingEvent> schedulerEvents = new ListAppender<>();
    private RequestScheduler scheduler;

    @BeforeEach
    void setUp() {
        debugEvents.start();
        schedulerEvents.start();
        debugLogger.addAppender(debugEvents);
        schedulerLogger.addAppender(schedulerEvents);
        scheduler = RequestScheduler.builder()
                .rateConfig(new RateConfig(0, 1, 1.0))
                .retryConfig(new RetryConfig(0, 1, 1))
                .build();
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
        SluiceDebug.setEnabled(false);
        debugLogger.detachAppender(debugEvents);
        schedulerLogger.detachAppender(schedulerEvents);
    }

    @Test
    void dispatchTraceWhenSchedulerLoggingEnabled() throws Exception {
        SluiceDebug.setSchedulerLogging(true);

        scheduler.submit(() -> CompletableFuture.completedFuture(1), "getSlot", "wallet").get(5, TimeUnit.SECONDS);

        assertTrue(debugEvents.list.stream().anyMatch(e ->
                e.getFormattedMessage().startsWith("[DISPATCH] getSlot service=wallet attempt=0 waited=")));
    }

    @Test
    void permanentFailureLoggedAtError() {
        final CompletableFuture<Object> result =
                scheduler.submit(() -> CompletableFuture.failedFuture(new IllegalArgumentException("bad input")),
                        "getSlot", "wallet");

        result.handle((v, e) -> null).join();

        assertTrue(schedulerEvents.list.stream().anyMatch(e -> e.getLevel() == Level.ERROR
                && e.getFormattedMessage().contains("getSlot")
                && e.getFormattedMessage().contains("PERMANENT")));
    }

    @Test
    void brakeLoggedAtWarn() {
        scheduler.pause(Duration.ofMillis(50));

        assertTrue(schedulerEvents.list.stream().anyMatch(e -> e.getLevel() == Level.WARN
                && e.getFormattedMessage().startsWith("Emergency brake applied")));
    }
}
