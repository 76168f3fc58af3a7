// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Represents a fee or token quantity in base units (10^-18 of a whole token).
 * <p>
 * <strong>Common Conversions:</strong>
 * <ul>
 * <li>1 token = 10^18 Wei</li>
 * <li>1 Gwei = 10^9 Wei</li>
 * </ul>
 */
public record Wei(BigInteger value) {
    private static final BigDecimal WEI_PER_ETHER = BigDecimal.TEN.pow(18);
    private static final BigInteger GWEI_MULTIPLIER = BigInteger.valueOf(1_000_000_000L);

    public static final Wei ZERO = new Wei(BigInteger.ZERO);

    public Wei {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Wei must be non-negative");
        }
    }

    public static Wei of(final long wei) {
        return new Wei(BigInteger.valueOf(wei));
    }

    public static Wei of(final BigInteger wei) {
        return new Wei(wei);
    }

    public static Wei gwei(final long gwei) {
        return new Wei(BigInteger.valueOf(gwei).multiply(GWEI_MULTIPLIER));
    }

    /**
     * Converts a decimal gwei amount such as {@code 2.5} to wei, rounding down
     * below one wei.
     */
    public static Wei gwei(final BigDecimal gwei) {
        Objects.requireNonNull(gwei, "gwei");
        return new Wei(gwei.multiply(new BigDecimal(GWEI_MULTIPLIER)).setScale(0, RoundingMode.DOWN).toBigIntegerExact());
    }

    public static Wei fromEther(final BigDecimal ether) {
        Objects.requireNonNull(ether, "ether");
        return new Wei(ether.multiply(WEI_PER_ETHER).toBigIntegerExact());
    }

    public BigDecimal toEther() {
        return new BigDecimal(value).divide(WEI_PER_ETHER, 18, RoundingMode.DOWN);
    }

    public BigDecimal toGwei() {
        return new BigDecimal(value).divide(new BigDecimal(GWEI_MULTIPLIER), 9, RoundingMode.DOWN);
    }

    /**
     * Formats this amount for display, e.g. {@code 2.50 gwei}.
     */
    public String toGweiString() {
        return toGwei().setScale(2, RoundingMode.HALF_UP).toPlainString() + " gwei";
    }

    public Wei min(final Wei other) {
        return value.compareTo(other.value) <= 0 ? this : other;
    }

    public boolean greaterThan(final Wei other) {
        return value.compareTo(other.value) > 0;
    }

    public String toHexString() {
        return "0x" + value.toString(16);
    }
}
