// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

import io.drawpool.core.types.Hash;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks submitted transactions until they reach the required confirmation
 * depth or a deadline passes.
 *
 * <p>
 * All watches share one single-threaded scheduler for timing: poll ticks and a
 * separate deadline task per watch. Receipt and head-block reads run on a
 * cached pool of reader threads, at most one read per watch at a time, so a
 * blocking read never holds back a deadline. Each tick checks cancellation,
 * then the deadline, then asks the provider for a receipt; with a receipt and more than one
 * required confirmation the head block is polled until
 * {@code head - receiptBlock + 1 >= required}. The next tick is scheduled at
 * {@code min(pollInterval, timeRemaining)} after a read returns; the deadline
 * task resolves the watch with {@code TIMED_OUT} on time even while a read is
 * still blocked.
 *
 * <p>
 * Providers offering {@link ChainProvider#subscribeNewBlocks} get an extra
 * tick per new head; polling stays in place as the backstop.
 *
 * <p>
 * <strong>Thread Safety:</strong> This class is thread-safe.
 */
public final class ConfirmationWatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationWatcher.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final Duration pollInterval;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService readers;
    private final Set<Watch> active = ConcurrentHashMap.newKeySet();

    public ConfirmationWatcher(final Duration pollInterval) {
        this(
                pollInterval,
                Executors.newSingleThreadScheduledExecutor(daemonThreads("drawpool-confirmation-")),
                Executors.newCachedThreadPool(daemonThreads("drawpool-confirmation-read-")));
    }

    ConfirmationWatcher(
            final Duration pollInterval,
            final ScheduledExecutorService scheduler,
            final ExecutorService readers) {
        Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        this.pollInterval = pollInterval;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.readers = Objects.requireNonNull(readers, "readers");
    }

    /**
     * Starts watching {@code hash}.
     *
     * @param requiredConfirmations confirmation depth; values below one are treated as one
     * @param timeout               how long to wait before resolving with {@code TIMED_OUT}
     * @throws IllegalStateException if the watcher has been closed
     */
    public Watch watch(
            final Hash hash,
            final int requiredConfirmations,
            final Duration timeout,
            final ChainProvider provider) {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(provider, "provider");
        if (isClosed()) {
            throw new IllegalStateException("ConfirmationWatcher is closed");
        }
        final Watch watch = new Watch(
                hash,
                Math.max(1, requiredConfirmations),
                Math.max(0L, timeout.toNanos()),
                pollInterval.toNanos(),
                provider,
                scheduler,
                readers,
                active::remove);
        active.add(watch);
        watch.start();
        return watch;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public boolean isClosed() {
        return scheduler.isShutdown();
    }

    /** Number of watches still polling. */
    public int activeCount() {
        return active.size();
    }

    /**
     * Cancels every active watch and stops the scheduler and reader threads.
     */
    @Override
    public void close() {
        for (Watch watch : new ArrayList<>(active)) {
            watch.cancel();
        }
        scheduler.shutdownNow();
        readers.shutdownNow();
        log.debug("ConfirmationWatcher closed");
    }

    private static ThreadFactory daemonThreads(final String prefix) {
        return runnable -> {
            final Thread thread = new Thread(runnable, prefix + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
