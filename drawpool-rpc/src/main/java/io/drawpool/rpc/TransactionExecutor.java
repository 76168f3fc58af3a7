// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

import io.drawpool.core.DebugLogger;
import io.drawpool.core.LogFormatter;
import io.drawpool.core.error.ClassifiedError;
import io.drawpool.core.error.ErrorClassifier;
import io.drawpool.core.error.ValidationException;
import io.drawpool.core.model.ConfirmationOutcome;
import io.drawpool.core.model.ConfirmationResult;
import io.drawpool.core.model.GasProfile;
import io.drawpool.core.model.Receipt;
import io.drawpool.core.model.TransactionDetails;
import io.drawpool.core.model.TransactionRequest;
import io.drawpool.core.model.TransactionState;
import io.drawpool.core.model.TransactionStatus;
import io.drawpool.core.types.Hash;
import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a transaction from request to a terminal state: estimate, submit,
 * then track confirmations.
 *
 * <p>
 * <strong>Lifecycle:</strong>
 * <pre>
 * IDLE → ESTIMATING → SUBMITTING → PENDING → CONFIRMING → {CONFIRMED, TIMED_OUT}
 *                          └──────→ FAILED
 * </pre>
 * {@link #execute(TransactionRequest, ExecuteOptions)} returns once the
 * transaction has been submitted (or has failed); confirmation continues in
 * the background and is reported through the {@link TransactionListener} and
 * the record itself.
 *
 * <p>
 * <strong>Failure policy:</strong>
 * <ul>
 * <li>Invalid requests throw {@link ValidationException} before any record is
 * created or any provider call is made.</li>
 * <li>Estimation failures never surface; {@link GasEstimator} falls back to a
 * static profile.</li>
 * <li>Send failures move the record to FAILED with a {@link ClassifiedError}
 * and fire {@code onFailed}. The executor never resubmits on its own; call
 * {@link #reset} and {@link #execute(TransactionRecord, ExecuteOptions)} to
 * try again.</li>
 * <li>A timed-out watch is not a failure. Use {@link #getStatus} or
 * {@link #watch} to keep tracking the hash.</li>
 * </ul>
 *
 * <p>
 * Callers must not submit concurrently for the same account: nonce allocation
 * belongs to the provider, and races surface as {@code NONCE_CONFLICT} or
 * {@code REPLACEMENT_CONFLICT}.
 *
 * <p>
 * <strong>Thread Safety:</strong> This class is thread-safe. The provider is
 * not closed by {@link #close()}; its owner closes it.
 */
public final class TransactionExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TransactionExecutor.class);

    private final ChainProvider provider;
    private final ExecutorConfig config;
    private final GasEstimator gasEstimator;
    private final ConfirmationWatcher watcher;
    private final Clock clock;
    private final AtomicBoolean closed = new AtomicBoolean();

    public TransactionExecutor(final ChainProvider provider) {
        this(provider, ExecutorConfig.defaults());
    }

    public TransactionExecutor(final ChainProvider provider, final ExecutorConfig config) {
        this(provider, config, new ConfirmationWatcher(config.pollInterval()), Clock.systemUTC());
    }

    TransactionExecutor(
            final ChainProvider provider,
            final ExecutorConfig config,
            final ConfirmationWatcher watcher,
            final Clock clock) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.config = Objects.requireNonNull(config, "config");
        this.watcher = Objects.requireNonNull(watcher, "watcher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.gasEstimator = new GasEstimator(config);
    }

    public ExecutorConfig config() {
        return config;
    }

    public GasEstimator gasEstimator() {
        return gasEstimator;
    }

    /**
     * Validates, estimates and submits a new transaction.
     *
     * @return the record, in PENDING/CONFIRMING (or later) on success and
     *         FAILED when the provider rejected the send
     * @throws ValidationException if the request is incomplete
     * @throws IllegalStateException if the executor has been closed
     */
    public TransactionRecord execute(final TransactionRequest request, final ExecuteOptions options) {
        Objects.requireNonNull(request, "request");
        ensureOpen();
        validate(request);
        final TransactionRecord record = new TransactionRecord(request, clock);
        return submit(record, options != null ? options : ExecuteOptions.defaults());
    }

    /**
     * Resubmits a record that was {@link #reset} to IDLE. The attempt counter
     * continues from its previous value.
     *
     * @throws IllegalStateException if the record is not IDLE or the executor
     *                               has been closed
     */
    public TransactionRecord execute(final TransactionRecord record, final ExecuteOptions options) {
        Objects.requireNonNull(record, "record");
        ensureOpen();
        if (record.state() != TransactionState.IDLE) {
            throw new IllegalStateException(
                    "Record " + record.correlationId() + " is " + record.state() + ", reset it before resubmitting");
        }
        validate(record.request());
        return submit(record, options != null ? options : ExecuteOptions.defaults());
    }

    /**
     * Point-in-time status of a hash, independent of any watch. Never throws:
     * provider failures are reported as {@link TransactionStatus.Phase#UNAVAILABLE}.
     */
    public TransactionStatus getStatus(final Hash hash) {
        Objects.requireNonNull(hash, "hash");
        try {
            final Optional<Receipt> receipt = provider.getReceipt(hash);
            final TransactionDetails details = provider.getTransaction(hash).orElse(null);
            if (receipt.isPresent()) {
                final long head = provider.getBlockNumber();
                final long confirmations = Math.max(1L, head - receipt.get().blockNumber() + 1L);
                return TransactionStatus.confirmed(ConfirmationResult.fromReceipt(receipt.get(), confirmations), details);
            }
            if (details != null) {
                return TransactionStatus.pending(hash, details);
            }
            return TransactionStatus.notFound(hash);
        } catch (RuntimeException e) {
            final ClassifiedError error = ErrorClassifier.classify(e);
            log.warn("Status lookup for {} failed ({}): {}", hash, error.kind(), e.getMessage());
            return TransactionStatus.unavailable(hash, error);
        }
    }

    /**
     * Starts a fresh confirmation watch for an already submitted hash, for
     * example after a previous watch timed out. Nothing is resubmitted.
     */
    public Watch watch(final Hash hash, final ExecuteOptions options) {
        final ExecuteOptions opts = options != null ? options : ExecuteOptions.defaults();
        final Watch watch = watcher.watch(
                hash,
                opts.confirmationsOr(config.defaultConfirmations()),
                opts.timeoutOr(config.defaultTimeout()),
                provider);
        watch.result().thenAccept(result -> notifyResolved(opts.listener(), result));
        return watch;
    }

    /**
     * Returns the record to IDLE and cancels its watch. On-chain state is not
     * affected; a transaction already sent may still be mined.
     */
    public void reset(final TransactionRecord record) {
        Objects.requireNonNull(record, "record");
        record.reset();
        log.debug("Reset transaction {}", record.correlationId());
    }

    /**
     * Stops confirmation tracking for every record of this executor.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            watcher.close();
        }
    }

    private void ensureOpen() {
        if (closed.get() || watcher.isClosed()) {
            throw new IllegalStateException("TransactionExecutor is closed");
        }
    }

    private TransactionRecord submit(final TransactionRecord record, final ExecuteOptions options) {
        final TransactionRequest request = record.request();
        final TransactionListener listener = options.listener();
        final long generation = record.beginAttempt();

        final GasProfile gasProfile = gasEstimator.estimate(request, provider);
        if (!record.markSubmitting(generation, gasProfile)) {
            return record;
        }

        DebugLogger.logTx(LogFormatter.formatTxSend(
                request.correlationId(),
                request.fromOpt().map(a -> a.value()).orElse(null),
                request.toOpt().map(a -> a.value()).orElse(null),
                record.attempts(),
                gasProfile.gasLimit(),
                request.value()));
        final long start = System.nanoTime();
        final Hash hash;
        try {
            hash = Objects.requireNonNull(provider.sendTransaction(request, gasProfile), "provider returned no hash");
        } catch (RuntimeException e) {
            final ClassifiedError error = ErrorClassifier.classify(e);
            log.warn("Transaction {} failed on attempt {} ({}): {}",
                    request.correlationId(), record.attempts(), error.kind(), e.getMessage());
            DebugLogger.logTx(LogFormatter.formatTxFailed(request.correlationId(), error.kind(), e.getMessage()));
            if (record.markFailed(generation, error)) {
                notify(listener, "onFailed", l -> l.onFailed(error));
            }
            return record;
        }
        DebugLogger.logTx(LogFormatter.formatTxHash(
                request.correlationId(), hash.value(), (System.nanoTime() - start) / 1_000L));

        if (!record.markPending(generation, hash)) {
            return record;
        }
        notify(listener, "onSubmitted", l -> l.onSubmitted(hash));

        final Watch watch;
        try {
            watch = watcher.watch(
                    hash,
                    options.confirmationsOr(config.defaultConfirmations()),
                    options.timeoutOr(config.defaultTimeout()),
                    provider);
        } catch (IllegalStateException e) {
            // closed between the check and the send; the hash is on the record for getStatus
            log.warn("Transaction {} submitted as {} but not watched: {}",
                    request.correlationId(), hash, e.getMessage());
            return record;
        }
        if (!record.markConfirming(generation, watch)) {
            watch.cancel();
            return record;
        }
        watch.result().thenAccept(result -> {
            if (record.markResolved(generation, result)) {
                notifyResolved(listener, result);
            }
        });
        return record;
    }

    private void notifyResolved(final TransactionListener listener, final ConfirmationResult result) {
        if (result.outcome() == ConfirmationOutcome.TIMED_OUT) {
            notify(listener, "onTimedOut", l -> l.onTimedOut(result.hash()));
        } else {
            notify(listener, "onConfirmed", l -> l.onConfirmed(result));
        }
    }

    private static void notify(
            final TransactionListener listener, final String callback, final Consumer<TransactionListener> call) {
        try {
            call.accept(listener);
        } catch (RuntimeException e) {
            log.error("TransactionListener.{} threw", callback, e);
        }
    }

    static void validate(final TransactionRequest request) {
        final List<String> violations = new ArrayList<>();
        if (request.to() == null) {
            violations.add("target address is required");
        }
        if (request.from() == null) {
            violations.add("sender address is required");
        }
        if (request.value().compareTo(BigInteger.ZERO) < 0) {
            violations.add("value must not be negative");
        }
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }
}
