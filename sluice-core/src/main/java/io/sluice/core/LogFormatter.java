// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.core;

import java.util.Locale;

/**
 * Formats one-line traces for RPC calls and scheduler events.
 */
public final class LogFormatter {

    private LogFormatter() {
    }

    public static String formatRpc(final String method, final long durationMicros) {
        return "[RPC] method=%s duration=%s".formatted(method, formatDuration(durationMicros));
    }

    public static String formatRpcError(
            final String method, final int code, final String message, final long durationMicros) {
        return "[RPC-ERROR] method=%s code=%d message=%s duration=%s"
                .formatted(method, code, message, formatDuration(durationMicros));
    }

    public static String formatDispatch(
            final String description, final String serviceId, final int attempt, final long waitedMs) {
        return "[DISPATCH] %s service=%s attempt=%d waited=%dms".formatted(description, serviceId, attempt, waitedMs);
    }

    static String formatDuration(final long durationMicros) {
        if (durationMicros < 1_000) {
            return durationMicros + "us";
        }
        if (durationMicros < 1_000_000) {
            return String.format(Locale.ROOT, "%.1fms", durationMicros / 1_000.0);
        }
        return String.format(Locale.ROOT, "%.2fs", durationMicros / 1_000_000.0);
    }
}
