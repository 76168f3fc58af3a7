// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.drawpool.core.error.ErrorClassifier;
import io.drawpool.core.error.ErrorKind;
import io.drawpool.core.error.EstimationException;
import io.drawpool.core.error.RpcException;
import io.drawpool.core.model.GasProfile;
import io.drawpool.core.model.OperationType;
import io.drawpool.core.model.Receipt;
import io.drawpool.core.model.TransactionDetails;
import io.drawpool.core.model.TransactionRequest;
import io.drawpool.core.types.Address;
import io.drawpool.core.types.Hash;
import io.drawpool.core.types.Wei;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class DevModeSimulatorTest {

    private static final Address SENDER = new Address("0x" + "1".repeat(40));
    private static final Address POOL = new Address("0x" + "2".repeat(40));
    private static final GasProfile PROFILE = GasProfile.of(180_000, Wei.gwei(3), Wei.gwei(1));

    private final MutableClock clock = new MutableClock(Instant.parse("2026-05-01T00:00:00Z"));

    @Test
    void hashesAreThirtyTwoByteHex() {
        DevModeSimulator simulator = new DevModeSimulator(SimulatorConfig.defaults(), clock);

        Hash first = simulator.sendTransaction(request(), PROFILE);
        Hash second = simulator.sendTransaction(request(), PROFILE);

        assertEquals(66, first.value().length());
        assertNotEquals(first, second);
    }

    @Test
    void seededSimulatorsAreReproducible() {
        SimulatorConfig config = SimulatorConfig.builder().seed(42L).build();
        Hash a = new DevModeSimulator(config, clock).sendTransaction(request(), PROFILE);
        Hash b = new DevModeSimulator(config, clock).sendTransaction(request(), PROFILE);

        assertEquals(a, b);
    }

    @Test
    void receiptAppearsAfterLatency() {
        DevModeSimulator simulator = new DevModeSimulator(
                SimulatorConfig.builder().confirmationLatency(Duration.ofSeconds(3)).build(), clock);
        Hash hash = simulator.sendTransaction(request(), PROFILE);

        assertTrue(simulator.getReceipt(hash).isEmpty());
        TransactionDetails pending = simulator.getTransaction(hash).orElseThrow();
        assertNull(pending.blockNumber());
        assertEquals(0L, pending.nonce());

        clock.advance(Duration.ofSeconds(3));

        Receipt receipt = simulator.getReceipt(hash).orElseThrow();
        assertTrue(receipt.status());
        assertEquals(receipt.blockNumber(), simulator.getTransaction(hash).orElseThrow().blockNumber().longValue());
        assertEquals(receipt.blockNumber(), simulator.getBlockNumber());
    }

    @Test
    void headAdvancesWithBlockTime() {
        DevModeSimulator simulator = new DevModeSimulator(
                SimulatorConfig.builder().startBlock(500L).blockTime(Duration.ofSeconds(2)).build(), clock);

        assertEquals(500L, simulator.getBlockNumber());
        clock.advance(Duration.ofSeconds(5));
        assertEquals(502L, simulator.getBlockNumber());
    }

    @Test
    void noncesIncreasePerSender() {
        DevModeSimulator simulator = new DevModeSimulator(SimulatorConfig.defaults(), clock);
        simulator.sendTransaction(request(), PROFILE);
        Hash second = simulator.sendTransaction(request(), PROFILE);

        assertEquals(1L, simulator.getTransaction(second).orElseThrow().nonce());
    }

    @Test
    void forcedFailureRejectsSend() {
        DevModeSimulator simulator = new DevModeSimulator(SimulatorConfig.builder().forceFailure(true).build(), clock);

        RpcException e = assertThrows(RpcException.class, () -> simulator.sendTransaction(request(), PROFILE));
        assertEquals(ErrorKind.USER_REJECTED, ErrorClassifier.classify(e).kind());
    }

    @Test
    void forcedRevertMinesWithFailedStatus() {
        DevModeSimulator simulator = new DevModeSimulator(
                SimulatorConfig.builder().forceRevert(true).confirmationLatency(Duration.ZERO).build(), clock);
        Hash hash = simulator.sendTransaction(request(), PROFILE);

        assertFalse(simulator.getReceipt(hash).orElseThrow().status());
    }

    @Test
    void estimationCanBeMadeToFail() {
        DevModeSimulator simulator = new DevModeSimulator(SimulatorConfig.builder().failEstimation(true).build(), clock);

        assertThrows(EstimationException.class, () -> simulator.estimateGas(request()));
        assertEquals(SimulatorConfig.DEFAULT_GAS_PRICE, simulator.getGasPrice());
    }

    @Test
    void unknownHashIsNotFound() {
        DevModeSimulator simulator = new DevModeSimulator(SimulatorConfig.defaults(), clock);
        Hash unknown = new Hash("0x" + "0".repeat(64));

        assertTrue(simulator.getReceipt(unknown).isEmpty());
        assertTrue(simulator.getTransaction(unknown).isEmpty());
    }

    @Test
    void rejectsInvalidConfig() {
        assertThrows(IllegalArgumentException.class,
                () -> SimulatorConfig.builder().blockTime(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
                () -> SimulatorConfig.builder().gasEstimate(BigInteger.ZERO).build());
    }

    private static TransactionRequest request() {
        return TransactionRequest.builder()
                .from(SENDER)
                .to(POOL)
                .value(BigInteger.valueOf(1_000))
                .operation(OperationType.DEPOSIT)
                .build();
    }
}
