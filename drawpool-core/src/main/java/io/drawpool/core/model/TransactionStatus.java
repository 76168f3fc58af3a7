// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.model;

import io.drawpool.core.error.ClassifiedError;
import io.drawpool.core.types.Hash;
import java.util.Objects;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Point-in-time snapshot of a transaction as seen by the chain, independent of
 * any local record or confirmation watch.
 *
 * @param hash    queried hash
 * @param phase   what the node reported
 * @param result  receipt-derived result when {@link Phase#CONFIRMED}
 * @param details transaction as known to the node, when found
 * @param error   classified query failure when {@link Phase#UNAVAILABLE}
 */
public record TransactionStatus(
        Hash hash,
        Phase phase,
        @Nullable ConfirmationResult result,
        @Nullable TransactionDetails details,
        @Nullable ClassifiedError error) {

    public enum Phase {
        /** Known to the node (or assumed in flight) but not mined yet. */
        PENDING,
        /** A receipt exists; see {@link #result()} for success or revert. */
        CONFIRMED,
        /** Neither the transaction nor a receipt is known to the node. */
        NOT_FOUND,
        /** The node could not be queried; ask again later. */
        UNAVAILABLE
    }

    public TransactionStatus {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(phase, "phase");
        if (phase == Phase.CONFIRMED) {
            Objects.requireNonNull(result, "result is required when confirmed");
        }
    }

    public static TransactionStatus confirmed(final ConfirmationResult result, final TransactionDetails details) {
        return new TransactionStatus(result.hash(), Phase.CONFIRMED, result, details, null);
    }

    public static TransactionStatus pending(final Hash hash, final TransactionDetails details) {
        return new TransactionStatus(hash, Phase.PENDING, null, details, null);
    }

    public static TransactionStatus notFound(final Hash hash) {
        return new TransactionStatus(hash, Phase.NOT_FOUND, null, null, null);
    }

    public static TransactionStatus unavailable(final Hash hash, final ClassifiedError error) {
        return new TransactionStatus(hash, Phase.UNAVAILABLE, null, null, error);
    }

    public Optional<ConfirmationResult> resultOpt() {
        return Optional.ofNullable(result);
    }

    public boolean isConfirmed() {
        return phase == Phase.CONFIRMED;
    }
}
