// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.drawpool.core.model.GasProfile;
import io.drawpool.core.model.OperationType;
import io.drawpool.core.types.Wei;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExecutorConfigTest {

    @Test
    void defaultsMatchPoolOperations() {
        ExecutorConfig config = ExecutorConfig.defaults();

        assertEquals(new BigDecimal("1.2"), config.gasLimitMultiplier());
        assertEquals(new BigDecimal("1.1"), config.gasPriceMultiplier());
        assertEquals(1, config.defaultConfirmations());
        assertEquals(Duration.ofSeconds(60), config.defaultTimeout());
        assertEquals(Duration.ofSeconds(2), config.pollInterval());
        assertEquals(BigInteger.valueOf(180_000), config.staticProfile(OperationType.DEPOSIT).gasLimit());
        assertEquals(BigInteger.valueOf(240_000), config.staticProfile(OperationType.WITHDRAW).gasLimit());
        assertEquals(BigInteger.valueOf(60_000), config.staticProfile(OperationType.APPROVAL).gasLimit());
        assertEquals(BigInteger.valueOf(120_000), config.staticProfile(OperationType.VERIFICATION).gasLimit());
        assertEquals(BigInteger.valueOf(300_000), config.staticProfile(OperationType.LOTTERY).gasLimit());
    }

    @Test
    void rejectsMultipliersBelowOne() {
        assertThrows(IllegalArgumentException.class,
                () -> ExecutorConfig.builder().gasLimitMultiplier(new BigDecimal("0.9")).build());
        assertThrows(IllegalArgumentException.class,
                () -> ExecutorConfig.builder().gasPriceMultiplier(new BigDecimal("0.99")).build());
    }

    @Test
    void rejectsNonPositiveDurationsAndConfirmations() {
        assertThrows(IllegalArgumentException.class,
                () -> ExecutorConfig.builder().defaultTimeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> ExecutorConfig.builder().pollInterval(Duration.ofMillis(-1)).build());
        assertThrows(IllegalArgumentException.class,
                () -> ExecutorConfig.builder().defaultConfirmations(0).build());
    }

    @Test
    void rejectsMissingStaticProfile() {
        assertThrows(IllegalArgumentException.class,
                () -> ExecutorConfig.builder().staticGasProfile(OperationType.LOTTERY, null).build());
    }

    @Test
    void staticProfilesAreImmutableCopies() {
        Map<OperationType, GasProfile> source = ExecutorConfig.defaultStaticProfiles();
        ExecutorConfig config = new ExecutorConfig(
                BigDecimal.ONE, BigDecimal.ONE, 1, Duration.ofSeconds(5), Duration.ofSeconds(1),
                Wei.gwei(1), Wei.gwei(10), source);

        source.put(OperationType.DEPOSIT, GasProfile.of(1L, Wei.gwei(1), Wei.gwei(1)));

        assertEquals(BigInteger.valueOf(180_000), config.staticProfile(OperationType.DEPOSIT).gasLimit());
        assertThrows(UnsupportedOperationException.class,
                () -> config.staticGasProfiles().put(OperationType.DEPOSIT, null));
    }

    @Test
    void overridesStaticProfile() {
        GasProfile custom = GasProfile.of(99_000L, Wei.gwei(4), Wei.gwei(2));
        ExecutorConfig config = ExecutorConfig.builder().staticGasProfile(OperationType.APPROVAL, custom).build();

        assertSame(custom, config.staticProfile(OperationType.APPROVAL));
    }

    @Test
    void executeOptionsFallBackToConfig() {
        ExecuteOptions options = ExecuteOptions.defaults();

        assertNull(options.confirmations());
        assertEquals(3, options.confirmationsOr(3));
        assertEquals(Duration.ofSeconds(9), options.timeoutOr(Duration.ofSeconds(9)));
        assertSame(TransactionListener.NO_OP, options.listener());
    }

    @Test
    void executeOptionsValidateOverrides() {
        assertThrows(IllegalArgumentException.class, () -> ExecuteOptions.builder().confirmations(0).build());
        assertThrows(IllegalArgumentException.class, () -> ExecuteOptions.builder().timeout(Duration.ZERO).build());
        assertSame(TransactionListener.NO_OP, new ExecuteOptions(2, null, null).listener());
        assertEquals(5, ExecuteOptions.builder().confirmations(5).build().confirmationsOr(1));
    }
}
