// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.scheduler;

/**
 * Decides whether a failed attempt is worth retrying.
 *
 * <p>
 * Implementations must be thread-safe and must not throw.
 */
@FunctionalInterface
public interface FailureClassifier {

    FailureKind classify(Throwable error);

    /**
     * Returns the classifier used when none is configured.
     */
    static FailureClassifier defaults() {
        return DefaultFailureClassifier.INSTANCE;
    }
}
