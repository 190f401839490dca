// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.core.error;

/**
 * Thrown when a transaction payload cannot be turned into a structured record.
 *
 * <p>
 * Decoding failures are independent of transport failures and are never
 * retried: fetching the same bytes again will not make them decodable.
 */
public final class DecodeException extends SluiceException {

    public DecodeException(final String message) {
        super(message);
    }

    public DecodeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
