// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

import io.drawpool.core.error.EstimationException;
import io.drawpool.core.error.RpcException;
import io.drawpool.core.model.GasProfile;
import io.drawpool.core.model.Receipt;
import io.drawpool.core.model.TransactionDetails;
import io.drawpool.core.model.TransactionRequest;
import io.drawpool.core.types.Hash;
import io.drawpool.core.types.Wei;
import java.math.BigInteger;
import java.util.Optional;
import java.util.function.LongConsumer;

/**
 * Capability set the transaction lifecycle needs from a chain: fee discovery,
 * submission and status lookup.
 *
 * <p>
 * Implemented by the real wallet/RPC binding ({@link JsonRpcChainProvider}) and
 * by the deterministic {@link DevModeSimulator}; {@link TransactionExecutor}
 * is agnostic to which one it is bound to. The provider is treated as
 * stateless: nonce allocation, caching and any internal retry are its own
 * business.
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe; the
 * confirmation watcher calls read methods from its scheduler thread.
 */
public interface ChainProvider extends AutoCloseable {

    /**
     * Estimates the gas a request will consume.
     *
     * @throws EstimationException if the node cannot estimate the request
     */
    BigInteger estimateGas(TransactionRequest request);

    /**
     * Returns the current network gas price.
     *
     * @throws RpcException on network failure
     */
    Wei getGasPrice();

    /**
     * Submits a transaction with the given gas profile and returns its hash.
     * Failures are raw provider errors; callers classify them.
     */
    Hash sendTransaction(TransactionRequest request, GasProfile gasProfile);

    /**
     * Looks up a transaction, mined or pending.
     */
    Optional<TransactionDetails> getTransaction(Hash hash);

    /**
     * Looks up the receipt of a mined transaction.
     */
    Optional<Receipt> getReceipt(Hash hash);

    /**
     * Returns the current head block number.
     */
    long getBlockNumber();

    /**
     * Subscribes to new head block numbers, if the provider supports push.
     *
     * @return the subscription, or empty when push is not supported
     */
    default Optional<Subscription> subscribeNewBlocks(final LongConsumer onBlock) {
        return Optional.empty();
    }

    @Override
    default void close() {
        // Default no-op for providers that don't hold resources
    }
}
