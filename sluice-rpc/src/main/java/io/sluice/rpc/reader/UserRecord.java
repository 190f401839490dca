// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.reader;

import java.time.Instant;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Display-ready view of a user's genesis record.
 *
 * @param kind            record type, {@code "user_genesis"} when absent
 * @param timestamp       creation time, the fetch time when absent
 * @param alias           alias, else username, else {@code "anonymous"}
 * @param parentPrefix    first 5 characters of the parent reference, or empty
 * @param publicKeyPrefix first 5 characters of the public key, or empty
 * @param raw             the decoded record as returned by the decoder
 */
public record UserRecord(
        String kind,
        Instant timestamp,
        String alias,
        String parentPrefix,
        String publicKeyPrefix,
        RawGenesis raw) {

    public static final String DEFAULT_KIND = "user_genesis";
    public static final String ANONYMOUS = "anonymous";
    public static final int PREFIX_LENGTH = 5;

    /**
     * Normalizes a decoded record, filling defaults for missing fields.
     *
     * @param raw the decoded record
     * @param now the instant to use when the record carries no timestamp
     * @return the normalized record
     */
    public static UserRecord normalize(final RawGenesis raw, final Instant now) {
        Objects.requireNonNull(raw, "raw");
        final String kind = isPresent(raw.kind()) ? raw.kind() : DEFAULT_KIND;
        final Instant timestamp = raw.timestamp() != null && raw.timestamp() != 0
                ? Instant.ofEpochMilli(raw.timestamp())
                : now;
        final String alias;
        if (isPresent(raw.alias())) {
            alias = raw.alias();
        } else if (isPresent(raw.username())) {
            alias = raw.username();
        } else {
            alias = ANONYMOUS;
        }
        return new UserRecord(kind, timestamp, alias, prefix(raw.parent()), prefix(raw.publicKey()), raw);
    }

    private static boolean isPresent(final @Nullable String value) {
        return value != null && !value.isEmpty();
    }

    private static String prefix(final @Nullable String value) {
        if (!isPresent(value)) {
            return "";
        }
        return value.length() <= PREFIX_LENGTH ? value : value.substring(0, PREFIX_LENGTH);
    }
}
