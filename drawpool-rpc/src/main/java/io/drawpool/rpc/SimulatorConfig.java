// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

import io.drawpool.core.types.Wei;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Behaviour of a {@link DevModeSimulator}.
 *
 * @param confirmationLatency time between submission and the receipt becoming visible
 * @param blockTime           simulated block interval, drives {@code getBlockNumber()}
 * @param startBlock          head block number when the simulator is created
 * @param gasEstimate         value returned by {@code estimateGas}
 * @param gasPrice            value returned by {@code getGasPrice}
 * @param gasUsed             gas used reported in receipts
 * @param forceFailure        reject every {@code sendTransaction} with {@code failureMessage}
 * @param failureMessage      provider message of the forced failure
 * @param forceRevert         mine every transaction with a failed status
 * @param failEstimation      make {@code estimateGas} throw, to exercise the static fallback
 * @param seed                seed for hash generation; {@code null} uses {@link java.security.SecureRandom}
 */
public record SimulatorConfig(
        Duration confirmationLatency,
        Duration blockTime,
        long startBlock,
        BigInteger gasEstimate,
        Wei gasPrice,
        BigInteger gasUsed,
        boolean forceFailure,
        String failureMessage,
        boolean forceRevert,
        boolean failEstimation,
        @Nullable Long seed) {

    public static final Duration DEFAULT_CONFIRMATION_LATENCY = Duration.ofSeconds(2);
    public static final Duration DEFAULT_BLOCK_TIME = Duration.ofSeconds(2);
    public static final long DEFAULT_START_BLOCK = 1_000_000L;
    public static final BigInteger DEFAULT_GAS_ESTIMATE = BigInteger.valueOf(100_000L);
    public static final Wei DEFAULT_GAS_PRICE = Wei.gwei(2);
    public static final BigInteger DEFAULT_GAS_USED = BigInteger.valueOf(85_000L);
    public static final String DEFAULT_FAILURE_MESSAGE = "User rejected the request";

    public SimulatorConfig {
        Objects.requireNonNull(confirmationLatency, "confirmationLatency");
        Objects.requireNonNull(blockTime, "blockTime");
        Objects.requireNonNull(gasEstimate, "gasEstimate");
        Objects.requireNonNull(gasPrice, "gasPrice");
        Objects.requireNonNull(gasUsed, "gasUsed");
        Objects.requireNonNull(failureMessage, "failureMessage");
        if (confirmationLatency.isNegative()) {
            throw new IllegalArgumentException("confirmationLatency must not be negative");
        }
        if (blockTime.isNegative() || blockTime.isZero()) {
            throw new IllegalArgumentException("blockTime must be positive");
        }
        if (startBlock < 0) {
            throw new IllegalArgumentException("startBlock must not be negative");
        }
        if (gasEstimate.signum() <= 0) {
            throw new IllegalArgumentException("gasEstimate must be positive");
        }
    }

    public static SimulatorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration confirmationLatency = DEFAULT_CONFIRMATION_LATENCY;
        private Duration blockTime = DEFAULT_BLOCK_TIME;
        private long startBlock = DEFAULT_START_BLOCK;
        private BigInteger gasEstimate = DEFAULT_GAS_ESTIMATE;
        private Wei gasPrice = DEFAULT_GAS_PRICE;
        private BigInteger gasUsed = DEFAULT_GAS_USED;
        private boolean forceFailure;
        private String failureMessage = DEFAULT_FAILURE_MESSAGE;
        private boolean forceRevert;
        private boolean failEstimation;
        private Long seed;

        private Builder() {
        }

        public Builder confirmationLatency(final Duration confirmationLatency) {
            this.confirmationLatency = confirmationLatency;
            return this;
        }

        public Builder blockTime(final Duration blockTime) {
            this.blockTime = blockTime;
            return this;
        }

        public Builder startBlock(final long startBlock) {
            this.startBlock = startBlock;
            return this;
        }

        public Builder gasEstimate(final BigInteger gasEstimate) {
            this.gasEstimate = gasEstimate;
            return this;
        }

        public Builder gasPrice(final Wei gasPrice) {
            this.gasPrice = gasPrice;
            return this;
        }

        public Builder gasUsed(final BigInteger gasUsed) {
            this.gasUsed = gasUsed;
            return this;
        }

        public Builder forceFailure(final boolean forceFailure) {
            this.forceFailure = forceFailure;
            return this;
        }

        public Builder failureMessage(final String failureMessage) {
            this.failureMessage = failureMessage;
            return this;
        }

        public Builder forceRevert(final boolean forceRevert) {
            this.forceRevert = forceRevert;
            return this;
        }

        public Builder failEstimation(final boolean failEstimation) {
            this.failEstimation = failEstimation;
            return this;
        }

        public Builder seed(final long seed) {
            this.seed = seed;
            return this;
        }

        public SimulatorConfig build() {
            return new SimulatorConfig(
                    confirmationLatency,
                    blockTime,
                    startBlock,
                    gasEstimate,
                    gasPrice,
                    gasUsed,
                    forceFailure,
                    failureMessage,
                    forceRevert,
                    failEstimation,
                    seed);
        }
    }
}
