// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.model;

import io.drawpool.core.types.Address;
import io.drawpool.core.types.Hash;
import io.drawpool.core.types.Wei;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Transaction as known to the node, mined or still in the mempool.
 *
 * @param hash        transaction hash
 * @param from        sender
 * @param to          recipient, {@code null} for contract creation
 * @param value       transferred value
 * @param nonce       sender nonce
 * @param blockNumber including block, {@code null} while pending
 */
public record TransactionDetails(
        Hash hash,
        Address from,
        @Nullable Address to,
        Wei value,
        long nonce,
        @Nullable Long blockNumber) {

    public TransactionDetails {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(value, "value");
    }

    public boolean isMined() {
        return blockNumber != null;
    }
}
