// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

import io.drawpool.core.error.ClassifiedError;
import io.drawpool.core.model.ConfirmationResult;
import io.drawpool.core.model.GasProfile;
import io.drawpool.core.model.TransactionRequest;
import io.drawpool.core.model.TransactionState;
import io.drawpool.core.types.Hash;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable local view of one logical transaction, owned by the
 * {@link TransactionExecutor} that created it.
 *
 * <p>
 * State changes go through {@link TransactionState#canTransitionTo}; an
 * illegal move raises {@link IllegalStateException}. Each submission run
 * captures a generation number from {@link #beginAttempt()}; {@link #reset()}
 * bumps the generation, so updates from an abandoned run (a late watch
 * result, a send that returns after the reset) are dropped instead of
 * overwriting the newer state.
 *
 * <p>
 * <strong>Thread Safety:</strong> All accessors and mutators synchronize on
 * the record.
 */
public final class TransactionRecord {

    private final TransactionRequest request;
    private final Clock clock;
    private final Instant createdAt;

    private TransactionState state = TransactionState.IDLE;
    private Instant updatedAt;
    private int attempts;
    private long generation;
    private GasProfile gasProfile;
    private Hash hash;
    private ClassifiedError lastError;
    private ConfirmationResult result;
    private Watch watch;

    TransactionRecord(final TransactionRequest request, final Clock clock) {
        this.request = Objects.requireNonNull(request, "request");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;
    }

    public String correlationId() {
        return request.correlationId();
    }

    public TransactionRequest request() {
        return request;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public synchronized Instant updatedAt() {
        return updatedAt;
    }

    public synchronized TransactionState state() {
        return state;
    }

    /** Submission attempts so far. Survives {@link TransactionExecutor#reset}. */
    public synchronized int attempts() {
        return attempts;
    }

    public synchronized Optional<GasProfile> gasProfile() {
        return Optional.ofNullable(gasProfile);
    }

    public synchronized Optional<Hash> hash() {
        return Optional.ofNullable(hash);
    }

    public synchronized Optional<ClassifiedError> lastError() {
        return Optional.ofNullable(lastError);
    }

    public synchronized Optional<ConfirmationResult> result() {
        return Optional.ofNullable(result);
    }

    /** The confirmation watch of the current attempt, while one exists. */
    public synchronized Optional<Watch> watch() {
        return Optional.ofNullable(watch);
    }

    /**
     * IDLE to ESTIMATING; counts the attempt.
     *
     * @return the generation the caller must pass to later updates
     */
    synchronized long beginAttempt() {
        moveTo(TransactionState.ESTIMATING);
        attempts++;
        return generation;
    }

    synchronized boolean markSubmitting(final long gen, final GasProfile profile) {
        if (gen != generation) {
            return false;
        }
        moveTo(TransactionState.SUBMITTING);
        gasProfile = profile;
        return true;
    }

    synchronized boolean markFailed(final long gen, final ClassifiedError error) {
        if (gen != generation) {
            return false;
        }
        moveTo(TransactionState.FAILED);
        lastError = error;
        return true;
    }

    synchronized boolean markPending(final long gen, final Hash submitted) {
        if (gen != generation) {
            return false;
        }
        moveTo(TransactionState.PENDING);
        hash = submitted;
        return true;
    }

    synchronized boolean markConfirming(final long gen, final Watch confirmationWatch) {
        if (gen != generation) {
            return false;
        }
        moveTo(TransactionState.CONFIRMING);
        watch = confirmationWatch;
        return true;
    }

    /**
     * CONFIRMING to CONFIRMED or TIMED_OUT depending on the result outcome.
     */
    synchronized boolean markResolved(final long gen, final ConfirmationResult confirmation) {
        if (gen != generation || state != TransactionState.CONFIRMING) {
            return false;
        }
        switch (confirmation.outcome()) {
            case TIMED_OUT -> moveTo(TransactionState.TIMED_OUT);
            case SUCCESS, REVERTED -> moveTo(TransactionState.CONFIRMED);
        }
        result = confirmation;
        return true;
    }

    /**
     * Back to IDLE. Cancels the current watch and clears per-attempt data;
     * the attempt counter is kept.
     */
    synchronized void reset() {
        if (watch != null) {
            watch.cancel();
        }
        moveTo(TransactionState.IDLE);
        generation++;
        gasProfile = null;
        hash = null;
        lastError = null;
        result = null;
        watch = null;
    }

    private void moveTo(final TransactionState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal transition " + state + " -> " + next + " for " + request.correlationId());
        }
        state = next;
        updatedAt = clock.instant();
    }

    @Override
    public synchronized String toString() {
        return "TransactionRecord{correlationId=" + request.correlationId()
                + ", state=" + state
                + ", attempts=" + attempts
                + ", hash=" + (hash != null ? hash.value() : null)
                + '}';
    }
}
