// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.model;

import io.drawpool.core.types.Hash;
import io.drawpool.core.types.Wei;
import java.math.BigInteger;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Result of confirmation tracking for one transaction hash.
 *
 * <p>
 * Block number, gas used and effective gas price are present only for
 * {@link ConfirmationOutcome#SUCCESS} and {@link ConfirmationOutcome#REVERTED}.
 */
public record ConfirmationResult(
        Hash hash,
        ConfirmationOutcome outcome,
        @Nullable Long blockNumber,
        @Nullable BigInteger gasUsed,
        @Nullable Wei effectiveGasPrice,
        long confirmations) {

    public ConfirmationResult {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(outcome, "outcome");
        if (outcome == ConfirmationOutcome.TIMED_OUT) {
            if (blockNumber != null || gasUsed != null || effectiveGasPrice != null) {
                throw new IllegalArgumentException("timed out result cannot carry receipt fields");
            }
        } else {
            Objects.requireNonNull(blockNumber, "blockNumber");
            Objects.requireNonNull(gasUsed, "gasUsed");
        }
    }

    /**
     * Builds a SUCCESS or REVERTED result from a receipt.
     */
    public static ConfirmationResult fromReceipt(final Receipt receipt, final long confirmations) {
        return new ConfirmationResult(
                receipt.transactionHash(),
                receipt.status() ? ConfirmationOutcome.SUCCESS : ConfirmationOutcome.REVERTED,
                receipt.blockNumber(),
                receipt.gasUsed(),
                receipt.effectiveGasPrice(),
                confirmations);
    }

    public static ConfirmationResult timedOut(final Hash hash) {
        return new ConfirmationResult(hash, ConfirmationOutcome.TIMED_OUT, null, null, null, 0L);
    }

    public boolean isSuccess() {
        return outcome == ConfirmationOutcome.SUCCESS;
    }
}
