// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.rpc.reader;

import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * Reads the user genesis record embedded in a transaction.
 *
 * <p>
 * Implementations fetch the transaction and decode its memo payload. A
 * transaction without a genesis record yields an empty {@link Optional}; a
 * payload that cannot be decoded should fail with
 * {@link io.sluice.core.error.DecodeException}, which is never retried.
 */
@FunctionalInterface
public interface GenesisDecoder {

    CompletionStage<Optional<RawGenesis>> readGenesis(String transactionId);
}
