// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.core;

/**
 * Global toggle for enabling verbose debug logging across Sluice modules.
 */
public final class SluiceDebug {

    private static volatile boolean rpcLogging = false;
    private static volatile boolean schedulerLogging = false;

    private SluiceDebug() {
    }

    public static boolean isEnabled() {
        return rpcLogging || schedulerLogging;
    }

    public static void setEnabled(final boolean enabled) {
        rpcLogging = enabled;
        schedulerLogging = enabled;
    }

    public static void setRpcLogging(final boolean enabled) {
        rpcLogging = enabled;
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }

    public static void setSchedulerLogging(final boolean enabled) {
        schedulerLogging = enabled;
    }

    public static boolean isSchedulerLoggingEnabled() {
        return schedulerLogging;
    }
}
