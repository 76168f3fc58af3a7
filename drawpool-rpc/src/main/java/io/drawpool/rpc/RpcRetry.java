// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

import io.drawpool.core.error.RpcException;
import java.io.IOException;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Internal utility for retrying read-only RPC calls on transient failures.
 *
 * <p>
 * <strong>Retry Conditions:</strong>
 * <ul>
 * <li>✅ "header not found" - Block not yet propagated</li>
 * <li>✅ "timeout" - Network or node timeout</li>
 * <li>✅ "connection reset" - Network hiccup</li>
 * <li>✅ I/O exceptions anywhere in the cause chain</li>
 * <li>❌ "insufficient funds" - User error</li>
 * <li>❌ anything else</li>
 * </ul>
 *
 * <p>
 * Linear backoff: 200ms × attempt number. Never wrap
 * {@code eth_sendTransaction} in this helper; a retried send can broadcast a
 * duplicate transaction.
 */
final class RpcRetry {

    static final long BACKOFF_BASE_MS = 200L;

    private RpcRetry() {
    }

    /**
     * Executes the supplier with retry on transient failures.
     *
     * @param <T>         the return type
     * @param supplier    the operation to retry
     * @param maxAttempts maximum number of attempts (must be >= 1)
     * @return the result from the supplier
     * @throws RpcException             if all retries fail or the error is not
     *                                  retryable
     * @throws IllegalArgumentException if maxAttempts < 1
     */
    static <T> T run(final Supplier<T> supplier, final int maxAttempts) {
        Objects.requireNonNull(supplier, "supplier");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return supplier.get();
            } catch (RuntimeException e) {
                last = e;
                if (!isRetryable(e) || attempt == maxAttempts) {
                    throw e;
                }
            }

            try {
                Thread.sleep(BACKOFF_BASE_MS * attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw last;
            }
        }
        throw new IllegalStateException("Retry finished without result or exception", last);
    }

    static boolean isRetryable(final RuntimeException e) {
        if (hasIoCause(e)) {
            return true;
        }
        if (!(e instanceof RpcException) || e.getMessage() == null) {
            return false;
        }
        final String message = e.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("insufficient funds")) {
            return false;
        }
        return message.contains("header not found")
                || message.contains("timeout")
                || message.contains("connection reset")
                || message.contains("temporary unavailable")
                || message.contains("try again");
    }

    private static boolean hasIoCause(final Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof IOException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
