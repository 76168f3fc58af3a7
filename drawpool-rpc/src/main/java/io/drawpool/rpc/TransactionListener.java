// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

import io.drawpool.core.error.ClassifiedError;
import io.drawpool.core.model.ConfirmationResult;
import io.drawpool.core.types.Hash;

/**
 * Lifecycle callbacks for one {@link TransactionExecutor#execute} call. Every
 * method is optional.
 *
 * <p>
 * {@code onConfirmed} and {@code onTimedOut} run on the watcher thread; the
 * others run on the thread that called {@code execute}. Exceptions thrown by a
 * listener are logged and otherwise ignored.
 */
public interface TransactionListener {

    TransactionListener NO_OP = new TransactionListener() { };

    default void onSubmitted(final Hash hash) {
    }

    /** Called for mined receipts, reverted ones included. */
    default void onConfirmed(final ConfirmationResult result) {
    }

    default void onFailed(final ClassifiedError error) {
    }

    /**
     * The watch gave up waiting. The transaction may still be mined; query
     * {@link TransactionExecutor#getStatus} later.
     */
    default void onTimedOut(final Hash hash) {
    }
}
