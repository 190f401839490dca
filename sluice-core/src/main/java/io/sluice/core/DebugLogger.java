// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for wire-level traces.
 *
 * <p>
 * Messages are only emitted when the matching {@link SluiceDebug} toggle is on,
 * and always pass through {@link LogSanitizer} first.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("io.sluice.debug");

    private DebugLogger() {
    }

    public static void logRpc(final String message, final Object... args) {
        if (!SluiceDebug.isRpcLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logScheduler(final String message, final Object... args) {
        if (!SluiceDebug.isSchedulerLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!SluiceDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
