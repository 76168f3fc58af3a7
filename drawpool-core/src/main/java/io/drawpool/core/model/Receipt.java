// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.model;

import io.drawpool.core.types.Hash;
import io.drawpool.core.types.Wei;
import java.math.BigInteger;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Receipt of a mined transaction.
 *
 * @param transactionHash   hash of the mined transaction
 * @param blockNumber       block that includes the transaction
 * @param status            {@code true} if execution succeeded, {@code false}
 *                          if it reverted
 * @param gasUsed           gas consumed by this transaction
 * @param effectiveGasPrice price actually paid per gas unit, when the node
 *                          reports it
 */
public record Receipt(
        Hash transactionHash,
        long blockNumber,
        boolean status,
        BigInteger gasUsed,
        @Nullable Wei effectiveGasPrice) {

    public Receipt {
        Objects.requireNonNull(transactionHash, "transactionHash cannot be null");
        Objects.requireNonNull(gasUsed, "gasUsed cannot be null");
        if (blockNumber < 0) {
            throw new IllegalArgumentException("blockNumber must be non-negative, got: " + blockNumber);
        }
    }
}
