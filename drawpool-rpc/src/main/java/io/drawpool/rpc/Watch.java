// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

import io.drawpool.core.DebugLogger;
import io.drawpool.core.LogFormatter;
import io.drawpool.core.model.ConfirmationResult;
import io.drawpool.core.model.Receipt;
import io.drawpool.core.types.Hash;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle on one in-flight confirmation watch created by
 * {@link ConfirmationWatcher#watch}.
 *
 * <p>
 * The {@link #result()} future completes exactly once with a
 * {@link ConfirmationResult} whose outcome is {@code SUCCESS}, {@code REVERTED}
 * or {@code TIMED_OUT}. It never completes exceptionally; provider errors
 * during polling are logged and polling continues until the deadline. After
 * {@link #cancel()} the future is cancelled, so dependent stages never observe
 * a result.
 *
 * <p>
 * The deadline is a task of its own on the watcher's scheduler. Provider reads
 * and result delivery run on the watcher's reader pool, so a read that blocks
 * delays neither this watch's timeout nor any other watch.
 */
public final class Watch {

    private static final Logger log = LoggerFactory.getLogger(Watch.class);

    /** Lifecycle of a watch. */
    public enum WatchState {
        WATCHING,
        SUCCESS,
        REVERTED,
        TIMED_OUT,
        CANCELLED;

        public boolean isResolved() {
            return this != WATCHING;
        }
    }

    private final Hash hash;
    private final int requiredConfirmations;
    private final long startNanos;
    private final long deadlineNanos;
    private final long pollIntervalNanos;
    private final ChainProvider provider;
    private final ScheduledExecutorService scheduler;
    private final Executor readers;
    private final Consumer<Watch> onDone;
    private final CompletableFuture<ConfirmationResult> result = new CompletableFuture<>();
    private final AtomicReference<WatchState> state = new AtomicReference<>(WatchState.WATCHING);
    private final AtomicBoolean readInFlight = new AtomicBoolean();

    private volatile ScheduledFuture<?> nextTick;
    private volatile ScheduledFuture<?> deadline;
    private volatile Subscription subscription;

    Watch(
            final Hash hash,
            final int requiredConfirmations,
            final long timeoutNanos,
            final long pollIntervalNanos,
            final ChainProvider provider,
            final ScheduledExecutorService scheduler,
            final Executor readers,
            final Consumer<Watch> onDone) {
        this.hash = hash;
        this.requiredConfirmations = requiredConfirmations;
        this.startNanos = System.nanoTime();
        this.deadlineNanos = startNanos + timeoutNanos;
        this.pollIntervalNanos = pollIntervalNanos;
        this.provider = provider;
        this.scheduler = scheduler;
        this.readers = readers;
        this.onDone = onDone;
    }

    public Hash hash() {
        return hash;
    }

    public int requiredConfirmations() {
        return requiredConfirmations;
    }

    public WatchState state() {
        return state.get();
    }

    public CompletableFuture<ConfirmationResult> result() {
        return result;
    }

    /**
     * Stops polling and cancels {@link #result()}. No-op once the watch has
     * resolved or was already cancelled.
     *
     * @return {@code true} if this call cancelled the watch
     */
    public boolean cancel() {
        if (!state.compareAndSet(WatchState.WATCHING, WatchState.CANCELLED)) {
            return false;
        }
        stop();
        result.cancel(false);
        log.debug("Cancelled confirmation watch for {}", hash);
        return true;
    }

    void start() {
        DebugLogger.logTx(LogFormatter.formatTxWait(
                hash.value(), requiredConfirmations, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - startNanos)));
        try {
            deadline = scheduler.schedule(
                    () -> dispatch(this::expire), deadlineNanos - startNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Watcher scheduler is shut down, cancelling watch for {}", hash);
            cancel();
            return;
        }
        final Optional<Subscription> sub;
        try {
            sub = provider.subscribeNewBlocks(block -> trigger());
        } catch (RuntimeException e) {
            log.warn("New-block subscription failed for {}, relying on polling: {}", hash, e.getMessage());
            schedule(0L);
            return;
        }
        sub.ifPresent(s -> {
            subscription = s;
            if (state.get().isResolved()) {
                unsubscribe(s);
            }
        });
        schedule(0L);
    }

    private void trigger() {
        if (state.get().isResolved()) {
            return;
        }
        try {
            scheduler.execute(() -> tick(false));
        } catch (RejectedExecutionException e) {
            log.debug("Watcher scheduler rejected push-triggered tick for {}", hash);
        }
    }

    private void schedule(final long delayNanos) {
        if (state.get().isResolved()) {
            return;
        }
        try {
            nextTick = scheduler.schedule(() -> tick(true), delayNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Watcher scheduler is shut down, cancelling watch for {}", hash);
            cancel();
        }
    }

    /**
     * One poll, started on the scheduler thread and read on the reader pool.
     * At most one read per watch is in flight. Only scheduled ticks
     * reschedule; a push-triggered tick is dropped while a read is running.
     */
    private void tick(final boolean scheduled) {
        if (state.get().isResolved()) {
            return;
        }
        if (System.nanoTime() - deadlineNanos >= 0) {
            dispatch(this::expire);
            return;
        }
        if (!readInFlight.compareAndSet(false, true)) {
            if (scheduled) {
                scheduleNext();
            }
            return;
        }
        try {
            readers.execute(() -> read(scheduled));
        } catch (RejectedExecutionException e) {
            readInFlight.set(false);
            log.debug("Watcher reader pool is shut down, cancelling watch for {}", hash);
            cancel();
        }
    }

    private void read(final boolean scheduled) {
        try {
            final Optional<Receipt> receipt = provider.getReceipt(hash);
            if (receipt.isPresent() && !state.get().isResolved()) {
                final long confirmations = confirmationsOf(receipt.get());
                if (confirmations >= requiredConfirmations) {
                    resolve(receipt.get(), confirmations);
                    return;
                }
            }
        } catch (RuntimeException e) {
            log.warn("Confirmation poll for {} failed, will retry: {}", hash, e.getMessage());
        } finally {
            readInFlight.set(false);
        }
        if (scheduled) {
            scheduleNext();
        }
    }

    private void scheduleNext() {
        final long remaining = deadlineNanos - System.nanoTime();
        if (remaining > 0) {
            schedule(Math.min(pollIntervalNanos, remaining));
        }
    }

    private long confirmationsOf(final Receipt receipt) {
        if (requiredConfirmations <= 1) {
            return 1L;
        }
        final long head = provider.getBlockNumber();
        return Math.max(0L, head - receipt.blockNumber() + 1L);
    }

    private void expire() {
        if (!state.compareAndSet(WatchState.WATCHING, WatchState.TIMED_OUT)) {
            return;
        }
        stop();
        DebugLogger.logTx(LogFormatter.formatTxTimeout(
                hash.value(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos)));
        result.complete(ConfirmationResult.timedOut(hash));
    }

    private void resolve(final Receipt receipt, final long confirmations) {
        final WatchState terminal = receipt.status() ? WatchState.SUCCESS : WatchState.REVERTED;
        if (!state.compareAndSet(WatchState.WATCHING, terminal)) {
            return;
        }
        stop();
        DebugLogger.logTx(LogFormatter.formatTxReceipt(hash.value(), receipt.blockNumber(), receipt.status()));
        result.complete(ConfirmationResult.fromReceipt(receipt, confirmations));
    }

    /** Runs on the reader pool so completion handlers stay off the scheduler thread. */
    private void dispatch(final Runnable task) {
        try {
            readers.execute(task);
        } catch (RejectedExecutionException e) {
            task.run();
        }
    }

    private void stop() {
        final ScheduledFuture<?> tick = nextTick;
        if (tick != null) {
            tick.cancel(false);
        }
        final ScheduledFuture<?> timer = deadline;
        if (timer != null) {
            timer.cancel(false);
        }
        final Subscription sub = subscription;
        if (sub != null) {
            unsubscribe(sub);
        }
        onDone.accept(this);
    }

    private void unsubscribe(final Subscription sub) {
        try {
            sub.unsubscribe();
        } catch (RuntimeException e) {
            log.warn("Failed to unsubscribe {} for {}: {}", sub.id(), hash, e.getMessage());
        }
    }
}
