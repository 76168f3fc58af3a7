// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.model;

/**
 * Lifecycle of a locally tracked transaction.
 *
 * <pre>
 * IDLE → ESTIMATING → SUBMITTING → PENDING → CONFIRMING → {CONFIRMED, TIMED_OUT}
 *                          └──────→ FAILED
 * any state ──reset──→ IDLE
 * </pre>
 */
public enum TransactionState {
    IDLE,
    ESTIMATING,
    SUBMITTING,
    PENDING,
    CONFIRMING,
    CONFIRMED,
    FAILED,
    TIMED_OUT;

    /**
     * Returns whether a record in this state may move to {@code next}. Reset to
     * {@link #IDLE} is always allowed.
     */
    public boolean canTransitionTo(final TransactionState next) {
        if (next == IDLE) {
            return true;
        }
        return switch (this) {
            case IDLE -> next == ESTIMATING;
            case ESTIMATING -> next == SUBMITTING;
            case SUBMITTING -> next == PENDING || next == FAILED;
            case PENDING -> next == CONFIRMING;
            case CONFIRMING -> next == CONFIRMED || next == TIMED_OUT;
            case CONFIRMED, FAILED, TIMED_OUT -> false;
        };
    }

    public boolean isTerminal() {
        return this == CONFIRMED || this == FAILED || this == TIMED_OUT;
    }
}
