// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

import io.drawpool.core.model.GasProfile;
import io.drawpool.core.model.OperationType;
import io.drawpool.core.types.Wei;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for {@link TransactionExecutor}, {@link GasEstimator} and
 * {@link ConfirmationWatcher}.
 *
 * <p>
 * <strong>Defaults:</strong>
 * <ul>
 * <li>{@code gasLimitMultiplier} 1.2 (20% buffer on estimated gas)</li>
 * <li>{@code gasPriceMultiplier} 1.1 (10% buffer on network gas price)</li>
 * <li>{@code defaultConfirmations} 1</li>
 * <li>{@code defaultTimeout} 60s, {@code pollInterval} 2s</li>
 * <li>{@code priorityFeePerGas} 1.5 gwei</li>
 * <li>{@code reasonableGasPriceCeiling} 10 gwei</li>
 * <li>{@code staticGasProfiles} see {@link #defaultStaticProfiles()}</li>
 * </ul>
 *
 * <pre>{@code
 * ExecutorConfig config = ExecutorConfig.builder()
 *     .gasLimitMultiplier(new BigDecimal("1.3"))
 *     .defaultTimeout(Duration.ofSeconds(90))
 *     .build();
 * }</pre>
 *
 * @param gasLimitMultiplier        multiplier applied to estimated gas, must be &gt;= 1
 * @param gasPriceMultiplier        multiplier applied to the network gas price, must be &gt;= 1
 * @param defaultConfirmations      confirmations required when options do not say, must be &gt;= 1
 * @param defaultTimeout            confirmation timeout when options do not say
 * @param pollInterval              receipt polling interval
 * @param priorityFeePerGas         tip used on live estimates, capped at the fee cap
 * @param reasonableGasPriceCeiling fee above which a profile is flagged as unusual
 * @param staticGasProfiles         fallback profile for every {@link OperationType}
 */
public record ExecutorConfig(
        BigDecimal gasLimitMultiplier,
        BigDecimal gasPriceMultiplier,
        int defaultConfirmations,
        Duration defaultTimeout,
        Duration pollInterval,
        Wei priorityFeePerGas,
        Wei reasonableGasPriceCeiling,
        Map<OperationType, GasProfile> staticGasProfiles) {

    public static final BigDecimal DEFAULT_GAS_LIMIT_MULTIPLIER = new BigDecimal("1.2");
    public static final BigDecimal DEFAULT_GAS_PRICE_MULTIPLIER = new BigDecimal("1.1");
    public static final int DEFAULT_CONFIRMATIONS = 1;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);
    public static final Wei DEFAULT_PRIORITY_FEE = Wei.gwei(new BigDecimal("1.5"));
    public static final Wei DEFAULT_MAX_FEE = Wei.gwei(new BigDecimal("2.5"));
    public static final Wei DEFAULT_REASONABLE_CEILING = Wei.gwei(10);

    public ExecutorConfig {
        requireAtLeastOne(gasLimitMultiplier, "gasLimitMultiplier");
        requireAtLeastOne(gasPriceMultiplier, "gasPriceMultiplier");
        if (defaultConfirmations < 1) {
            throw new IllegalArgumentException("defaultConfirmations must be >= 1, got: " + defaultConfirmations);
        }
        requirePositive(defaultTimeout, "defaultTimeout");
        requirePositive(pollInterval, "pollInterval");
        Objects.requireNonNull(priorityFeePerGas, "priorityFeePerGas");
        Objects.requireNonNull(reasonableGasPriceCeiling, "reasonableGasPriceCeiling");
        Objects.requireNonNull(staticGasProfiles, "staticGasProfiles");
        for (OperationType type : OperationType.values()) {
            if (staticGasProfiles.get(type) == null) {
                throw new IllegalArgumentException("staticGasProfiles is missing an entry for " + type);
            }
        }
        staticGasProfiles = Collections.unmodifiableMap(new EnumMap<>(staticGasProfiles));
    }

    public static ExecutorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fallback profiles with the 20% safety margin already applied to the
     * measured gas of each pool operation (deposit 150k, withdraw 200k,
     * approval 50k, verification 100k, lottery 250k), 2.5 gwei fee cap and
     * 1.5 gwei tip.
     */
    public static Map<OperationType, GasProfile> defaultStaticProfiles() {
        final Map<OperationType, GasProfile> profiles = new EnumMap<>(OperationType.class);
        profiles.put(OperationType.DEPOSIT, GasProfile.of(180_000L, DEFAULT_MAX_FEE, DEFAULT_PRIORITY_FEE));
        profiles.put(OperationType.WITHDRAW, GasProfile.of(240_000L, DEFAULT_MAX_FEE, DEFAULT_PRIORITY_FEE));
        profiles.put(OperationType.APPROVAL, GasProfile.of(60_000L, DEFAULT_MAX_FEE, DEFAULT_PRIORITY_FEE));
        profiles.put(OperationType.VERIFICATION, GasProfile.of(120_000L, DEFAULT_MAX_FEE, DEFAULT_PRIORITY_FEE));
        profiles.put(OperationType.LOTTERY, GasProfile.of(300_000L, DEFAULT_MAX_FEE, DEFAULT_PRIORITY_FEE));
        return profiles;
    }

    public GasProfile staticProfile(final OperationType type) {
        return staticGasProfiles.get(type);
    }

    private static void requireAtLeastOne(final BigDecimal value, final String name) {
        Objects.requireNonNull(value, name);
        if (value.compareTo(BigDecimal.ONE) < 0) {
            throw new IllegalArgumentException(name + " must be >= 1.0, got: " + value);
        }
    }

    private static void requirePositive(final Duration value, final String name) {
        Objects.requireNonNull(value, name);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
    }

    /**
     * Builder initialized with default values; override selectively.
     */
    public static final class Builder {
        private BigDecimal gasLimitMultiplier = DEFAULT_GAS_LIMIT_MULTIPLIER;
        private BigDecimal gasPriceMultiplier = DEFAULT_GAS_PRICE_MULTIPLIER;
        private int defaultConfirmations = DEFAULT_CONFIRMATIONS;
        private Duration defaultTimeout = DEFAULT_TIMEOUT;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;
        private Wei priorityFeePerGas = DEFAULT_PRIORITY_FEE;
        private Wei reasonableGasPriceCeiling = DEFAULT_REASONABLE_CEILING;
        private final Map<OperationType, GasProfile> staticGasProfiles = defaultStaticProfiles();

        private Builder() {}

        public Builder gasLimitMultiplier(final BigDecimal gasLimitMultiplier) {
            this.gasLimitMultiplier = gasLimitMultiplier;
            return this;
        }

        public Builder gasPriceMultiplier(final BigDecimal gasPriceMultiplier) {
            this.gasPriceMultiplier = gasPriceMultiplier;
            return this;
        }

        public Builder defaultConfirmations(final int defaultConfirmations) {
            this.defaultConfirmations = defaultConfirmations;
            return this;
        }

        public Builder defaultTimeout(final Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder pollInterval(final Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder priorityFeePerGas(final Wei priorityFeePerGas) {
            this.priorityFeePerGas = priorityFeePerGas;
            return this;
        }

        public Builder reasonableGasPriceCeiling(final Wei reasonableGasPriceCeiling) {
            this.reasonableGasPriceCeiling = reasonableGasPriceCeiling;
            return this;
        }

        /**
         * Replaces the fallback profile for one operation type.
         */
        public Builder staticGasProfile(final OperationType type, final GasProfile profile) {
            this.staticGasProfiles.put(Objects.requireNonNull(type, "type"), profile);
            return this;
        }

        public ExecutorConfig build() {
            return new ExecutorConfig(
                    gasLimitMultiplier,
                    gasPriceMultiplier,
                    defaultConfirmations,
                    defaultTimeout,
                    pollInterval,
                    priorityFeePerGas,
                    reasonableGasPriceCeiling,
                    staticGasProfiles);
        }
    }
}
