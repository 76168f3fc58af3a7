// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.model;

import io.drawpool.core.types.Wei;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Gas limit and EIP-1559 fee caps applied to a single submission.
 *
 * <p>
 * Profiles are produced fresh per request and never mutated; a new estimate
 * replaces the previous profile on the record.
 *
 * @param gasLimit             maximum gas the transaction may consume
 * @param maxFeePerGas         total fee cap per gas unit
 * @param maxPriorityFeePerGas tip cap per gas unit, never above
 *                             {@code maxFeePerGas}
 */
public record GasProfile(BigInteger gasLimit, Wei maxFeePerGas, Wei maxPriorityFeePerGas) {

    public GasProfile {
        Objects.requireNonNull(gasLimit, "gasLimit");
        Objects.requireNonNull(maxFeePerGas, "maxFeePerGas");
        Objects.requireNonNull(maxPriorityFeePerGas, "maxPriorityFeePerGas");
        if (gasLimit.signum() < 0) {
            throw new IllegalArgumentException("gasLimit must be non-negative, got: " + gasLimit);
        }
        if (maxPriorityFeePerGas.greaterThan(maxFeePerGas)) {
            throw new IllegalArgumentException(
                    "maxPriorityFeePerGas must be <= maxFeePerGas, got: "
                            + maxPriorityFeePerGas.value() + " > " + maxFeePerGas.value());
        }
    }

    public static GasProfile of(final long gasLimit, final Wei maxFeePerGas, final Wei maxPriorityFeePerGas) {
        return new GasProfile(BigInteger.valueOf(gasLimit), maxFeePerGas, maxPriorityFeePerGas);
    }

    /**
     * Worst-case fee for this profile: {@code gasLimit * maxFeePerGas}.
     */
    public Wei maxCost() {
        return new Wei(gasLimit.multiply(maxFeePerGas.value()));
    }
}
