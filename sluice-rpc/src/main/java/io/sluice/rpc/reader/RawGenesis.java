// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.reader;

import java.util.Map;

import org.jspecify.annotations.Nullable;

/**
 * A user genesis record as decoded from a transaction. Every field may be
 * missing.
 *
 * @param kind      record type tag
 * @param timestamp creation time in epoch milliseconds
 * @param alias     display name
 * @param username  legacy display name, used when {@code alias} is missing
 * @param parent    parent record reference
 * @param publicKey owner public key (base58)
 * @param fields    every decoded field, including the ones above
 */
public record RawGenesis(
        @Nullable String kind,
        @Nullable Long timestamp,
        @Nullable String alias,
        @Nullable String username,
        @Nullable String parent,
        @Nullable String publicKey,
        Map<String, Object> fields) {

    public RawGenesis {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }
}
