// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc;

import java.util.Map;

import org.jspecify.annotations.Nullable;

/**
 * Result of the {@code getVersion} call.
 *
 * @param solanaCore the node software version, e.g. {@code "1.18.22"}
 * @param featureSet the node's feature set id, if reported
 */
public record NodeVersion(String solanaCore, @Nullable Long featureSet) {

    static NodeVersion fromResult(final Map<String, Object> result) {
        final Object core = result.get("solana-core");
        final Object features = result.get("feature-set");
        return new NodeVersion(
                core == null ? "unknown" : core.toString(),
                features instanceof Number ? ((Number) features).longValue() : null);
    }
}
