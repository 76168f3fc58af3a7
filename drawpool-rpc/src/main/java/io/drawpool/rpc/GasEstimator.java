// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

import io.drawpool.core.DebugLogger;
import io.drawpool.core.LogFormatter;
import io.drawpool.core.error.ClassifiedError;
import io.drawpool.core.error.ErrorClassifier;
import io.drawpool.core.model.GasProfile;
import io.drawpool.core.model.OperationType;
import io.drawpool.core.model.TransactionRequest;
import io.drawpool.core.types.Wei;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces a {@link GasProfile} for a request, preferring live network data and
 * falling back to static per-operation profiles.
 *
 * <p>
 * The live path calls {@link ChainProvider#estimateGas} and
 * {@link ChainProvider#getGasPrice}, then applies the configured buffers:
 * <pre>
 *   gasLimit             = ceil(estimate × gasLimitMultiplier)
 *   maxFeePerGas         = ceil(gasPrice × gasPriceMultiplier)
 *   maxPriorityFeePerGas = min(priorityFeePerGas, maxFeePerGas)
 * </pre>
 *
 * <p>
 * Any failure on the live path (RPC error, timeout, missing or malformed
 * result) is logged at WARN and answered with the static profile for the
 * request's {@link OperationType}. {@link #estimate} never throws: a missing
 * estimate must not block a submission that has a reasonable default.
 */
public final class GasEstimator {

    private static final Logger log = LoggerFactory.getLogger(GasEstimator.class);

    private final ExecutorConfig config;

    public GasEstimator(final ExecutorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public GasProfile estimate(final TransactionRequest request, final ChainProvider provider) {
        Objects.requireNonNull(request, "request");
        DebugLogger.logTx(LogFormatter.formatEstimateGas(
                request.correlationId(),
                request.operation(),
                request.fromOpt().map(a -> a.value()).orElse(null),
                request.toOpt().map(a -> a.value()).orElse(null)));
        final long start = System.nanoTime();
        try {
            final GasProfile live = estimateLive(request, provider);
            DebugLogger.logTx(LogFormatter.formatEstimateGasResult(
                    request.correlationId(), "live", live.gasLimit(),
                    live.maxFeePerGas().toGweiString(), elapsedMicros(start)));
            return live;
        } catch (RuntimeException e) {
            final GasProfile fallback = fallbackProfile(request.operation());
            final ClassifiedError classified = ErrorClassifier.classify(e);
            log.warn("Gas estimation failed for request {} ({}), using static {} profile: {}",
                    request.correlationId(), classified.kind(), request.operation(), e.getMessage());
            DebugLogger.logTx(LogFormatter.formatEstimateGasResult(
                    request.correlationId(), "static", fallback.gasLimit(),
                    fallback.maxFeePerGas().toGweiString(), elapsedMicros(start)));
            return fallback;
        }
    }

    /**
     * Returns the configured static profile for an operation. Requests without
     * an operation tag get the most generous configured profile.
     */
    public GasProfile fallbackProfile(final OperationType operation) {
        if (operation != null) {
            return config.staticProfile(operation);
        }
        return config.staticGasProfiles().values().stream()
                .max(Comparator.comparing(GasProfile::gasLimit))
                .orElseThrow();
    }

    /**
     * Whether every fee in the profile is at or below the configured ceiling.
     * Callers use this to warn users, never to block.
     */
    public boolean isReasonable(final GasProfile profile) {
        return isReasonableGasPrice(profile.maxFeePerGas());
    }

    public boolean isReasonableGasPrice(final Wei gasPrice) {
        return !gasPrice.greaterThan(config.reasonableGasPriceCeiling());
    }

    /**
     * Formats a gas price for display, e.g. {@code 2.50 gwei}.
     */
    public static String formatGasPrice(final Wei gasPrice) {
        return gasPrice.toGweiString();
    }

    /**
     * {@code ceil(raw × multiplier)}; never less than {@code raw} for
     * multipliers of at least one.
     */
    static BigInteger applyMultiplier(final BigInteger raw, final BigDecimal multiplier) {
        return new BigDecimal(raw).multiply(multiplier).setScale(0, RoundingMode.CEILING).toBigIntegerExact();
    }

    private GasProfile estimateLive(final TransactionRequest request, final ChainProvider provider) {
        final BigInteger estimate = Objects.requireNonNull(provider.estimateGas(request), "estimateGas returned null");
        final Wei gasPrice = Objects.requireNonNull(provider.getGasPrice(), "getGasPrice returned null");
        if (estimate.signum() <= 0) {
            throw new IllegalStateException("estimateGas returned a non-positive value: " + estimate);
        }
        final BigInteger gasLimit = applyMultiplier(estimate, config.gasLimitMultiplier());
        final Wei maxFee = new Wei(applyMultiplier(gasPrice.value(), config.gasPriceMultiplier()));
        final Wei priority = config.priorityFeePerGas().min(maxFee);
        return new GasProfile(gasLimit, maxFee, priority);
    }

    private static long elapsedMicros(final long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000L;
    }
}
