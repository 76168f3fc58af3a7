// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

import io.drawpool.core.error.EstimationException;
import io.drawpool.core.error.RpcException;
import io.drawpool.core.model.GasProfile;
import io.drawpool.core.model.Receipt;
import io.drawpool.core.model.TransactionDetails;
import io.drawpool.core.model.TransactionRequest;
import io.drawpool.core.types.Address;
import io.drawpool.core.types.Hash;
import io.drawpool.core.types.Wei;
import io.drawpool.core.util.Hex;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link ChainProvider} for non-production environments.
 *
 * <p>
 * Submissions are accepted without a network, get a random 32-byte hash and
 * become "mined" once {@link SimulatorConfig#confirmationLatency()} has passed
 * on the injected {@link Clock}. The head block advances by one every
 * {@link SimulatorConfig#blockTime()}, so confirmation depth grows the same
 * way it does on a real chain. A seeded config produces the same hash sequence
 * on every run.
 *
 * <p>
 * Failure paths are switched on by config: {@code forceFailure} rejects sends,
 * {@code forceRevert} mines with a failed status and {@code failEstimation}
 * makes gas estimation throw.
 *
 * <p>
 * <strong>Thread Safety:</strong> This class is thread-safe.
 */
public final class DevModeSimulator implements ChainProvider {

    private static final Logger log = LoggerFactory.getLogger(DevModeSimulator.class);

    /** Sender recorded for requests that carry none. */
    static final Address DEFAULT_SENDER = new Address("0x000000000000000000000000000000000000dead");

    private final SimulatorConfig config;
    private final Clock clock;
    private final Instant genesis;
    private final Random random;
    private final Map<Hash, SimulatedTransaction> transactions = new ConcurrentHashMap<>();
    private final Map<Address, AtomicLong> nonces = new ConcurrentHashMap<>();

    public DevModeSimulator() {
        this(SimulatorConfig.defaults());
    }

    public DevModeSimulator(final SimulatorConfig config) {
        this(config, Clock.systemUTC());
    }

    public DevModeSimulator(final SimulatorConfig config, final Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.genesis = clock.instant();
        this.random = config.seed() != null ? new Random(config.seed()) : new SecureRandom();
        log.info("Dev-mode chain simulator active (latency={}, forceFailure={}, forceRevert={})",
                config.confirmationLatency(), config.forceFailure(), config.forceRevert());
    }

    public SimulatorConfig config() {
        return config;
    }

    @Override
    public BigInteger estimateGas(final TransactionRequest request) {
        if (config.failEstimation()) {
            throw new EstimationException("Simulated estimation failure");
        }
        return config.gasEstimate();
    }

    @Override
    public Wei getGasPrice() {
        return config.gasPrice();
    }

    @Override
    public Hash sendTransaction(final TransactionRequest request, final GasProfile gasProfile) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(gasProfile, "gasProfile");
        if (config.forceFailure()) {
            throw new RpcException(-32000, config.failureMessage(), null, (Long) null);
        }
        final Hash hash = nextHash();
        final Address from = request.from() != null ? request.from() : DEFAULT_SENDER;
        final long nonce = nonces.computeIfAbsent(from, a -> new AtomicLong()).getAndIncrement();
        final Instant minedAt = clock.instant().plus(config.confirmationLatency());
        transactions.put(hash, new SimulatedTransaction(
                request, from, nonce, minedAt, blockAt(minedAt), !config.forceRevert()));
        log.debug("Simulated send {} for {} (nonce {}, gasLimit {})",
                hash.value(), request.correlationId(), nonce, gasProfile.gasLimit());
        return hash;
    }

    @Override
    public Optional<TransactionDetails> getTransaction(final Hash hash) {
        final SimulatedTransaction tx = transactions.get(hash);
        if (tx == null) {
            return Optional.empty();
        }
        return Optional.of(new TransactionDetails(
                hash,
                tx.from(),
                tx.request().to(),
                Wei.of(tx.request().value()),
                tx.nonce(),
                isMined(tx) ? tx.blockNumber() : null));
    }

    @Override
    public Optional<Receipt> getReceipt(final Hash hash) {
        final SimulatedTransaction tx = transactions.get(hash);
        if (tx == null || !isMined(tx)) {
            return Optional.empty();
        }
        return Optional.of(new Receipt(hash, tx.blockNumber(), tx.success(), config.gasUsed(), config.gasPrice()));
    }

    @Override
    public long getBlockNumber() {
        return blockAt(clock.instant());
    }

    private boolean isMined(final SimulatedTransaction tx) {
        return !clock.instant().isBefore(tx.minedAt());
    }

    private long blockAt(final Instant instant) {
        final Duration elapsed = Duration.between(genesis, instant);
        if (elapsed.isNegative()) {
            return config.startBlock();
        }
        return config.startBlock() + elapsed.toNanos() / config.blockTime().toNanos();
    }

    private Hash nextHash() {
        final byte[] bytes = new byte[32];
        synchronized (random) {
            random.nextBytes(bytes);
        }
        return new Hash(Hex.encode(bytes));
    }

    private record SimulatedTransaction(
            TransactionRequest request,
            Address from,
            long nonce,
            Instant minedAt,
            long blockNumber,
            boolean success) {
    }
}
