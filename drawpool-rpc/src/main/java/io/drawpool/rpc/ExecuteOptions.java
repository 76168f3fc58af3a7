// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

import java.time.Duration;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Per-call options for {@link TransactionExecutor#execute}. Unset values fall
 * back to the executor's {@link ExecutorConfig}.
 *
 * @param confirmations required confirmation depth, or {@code null} for the default
 * @param timeout       confirmation timeout, or {@code null} for the default
 * @param listener      lifecycle callbacks
 */
public record ExecuteOptions(
        @Nullable Integer confirmations,
        @Nullable Duration timeout,
        TransactionListener listener) {

    private static final ExecuteOptions DEFAULTS = new ExecuteOptions(null, null, TransactionListener.NO_OP);

    public ExecuteOptions {
        if (confirmations != null && confirmations < 1) {
            throw new IllegalArgumentException("confirmations must be at least 1");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        listener = listener == null ? TransactionListener.NO_OP : listener;
    }

    public static ExecuteOptions defaults() {
        return DEFAULTS;
    }

    public static ExecuteOptions withListener(final TransactionListener listener) {
        return new ExecuteOptions(null, null, Objects.requireNonNull(listener, "listener"));
    }

    public static Builder builder() {
        return new Builder();
    }

    int confirmationsOr(final int fallback) {
        return confirmations != null ? confirmations : fallback;
    }

    Duration timeoutOr(final Duration fallback) {
        return timeout != null ? timeout : fallback;
    }

    public static final class Builder {
        private Integer confirmations;
        private Duration timeout;
        private TransactionListener listener = TransactionListener.NO_OP;

        private Builder() {
        }

        public Builder confirmations(final int confirmations) {
            this.confirmations = confirmations;
            return this;
        }

        public Builder timeout(final Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder listener(final TransactionListener listener) {
            this.listener = listener;
            return this;
        }

        public ExecuteOptions build() {
            return new ExecuteOptions(confirmations, timeout, listener);
        }
    }
}
