// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

import io.drawpool.core.DebugLogger;
import io.drawpool.core.LogFormatter;
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
import io.drawpool.rpc.internal.RpcUtils;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ChainProvider} backed by a wallet-signing JSON-RPC endpoint.
 *
 * <p>
 * Submission uses {@code eth_sendTransaction}: the connected wallet (or node
 * account) owns the key and assigns the nonce. Methods map as follows:
 * <ul>
 * <li>{@link #estimateGas} → {@code eth_estimateGas}</li>
 * <li>{@link #getGasPrice} → {@code eth_gasPrice}</li>
 * <li>{@link #sendTransaction} → {@code eth_sendTransaction}</li>
 * <li>{@link #getTransaction} → {@code eth_getTransactionByHash}</li>
 * <li>{@link #getReceipt} → {@code eth_getTransactionReceipt}</li>
 * <li>{@link #getBlockNumber} → {@code eth_blockNumber}</li>
 * </ul>
 *
 * <p>
 * Read calls are retried on transient failures via {@link RpcRetry}; sends
 * are issued exactly once.
 */
public final class JsonRpcChainProvider implements ChainProvider {

    static final int READ_ATTEMPTS = 3;

    private final JsonRpcTransport transport;

    public JsonRpcChainProvider(final JsonRpcTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public static JsonRpcChainProvider http(final String url) {
        return new JsonRpcChainProvider(JsonRpcTransport.http(url));
    }

    @Override
    public BigInteger estimateGas(final TransactionRequest request) {
        final Map<String, Object> tx = toTxObject(request);
        try {
            final String result = read("eth_estimateGas", List.of(tx));
            if (result == null) {
                throw new EstimationException("eth_estimateGas returned no result");
            }
            return Hex.decodeQuantity(result);
        } catch (EstimationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EstimationException("Gas estimation failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Wei getGasPrice() {
        final String result = read("eth_gasPrice", List.of());
        if (result == null) {
            throw new RpcException(-32603, "eth_gasPrice returned no result", null, (Long) null);
        }
        return new Wei(Hex.decodeQuantity(result));
    }

    @Override
    public Hash sendTransaction(final TransactionRequest request, final GasProfile gasProfile) {
        final Map<String, Object> tx = toTxObject(request);
        tx.put("type", "0x2");
        tx.put("gas", Hex.toQuantity(gasProfile.gasLimit()));
        tx.put("maxFeePerGas", gasProfile.maxFeePerGas().toHexString());
        tx.put("maxPriorityFeePerGas", gasProfile.maxPriorityFeePerGas().toHexString());

        final JsonRpcResponse response = transport.send("eth_sendTransaction", List.of(tx));
        final String result = response.resultAsString();
        if (result == null) {
            throw new RpcException(-32603, "eth_sendTransaction returned no transaction hash", null, (Long) null);
        }
        return new Hash(result);
    }

    @Override
    public Optional<TransactionDetails> getTransaction(final Hash hash) {
        final Map<String, Object> map = readObject("eth_getTransactionByHash", hash);
        if (map == null) {
            return Optional.empty();
        }
        final String to = RpcUtils.stringValue(map.get("to"));
        final BigInteger value = RpcUtils.decodeHexBigInteger(map.get("value"));
        final Long nonce = RpcUtils.decodeHexLong(map.get("nonce"));
        return Optional.of(new TransactionDetails(
                hash,
                new Address(RpcUtils.stringValue(map.get("from"))),
                to != null ? new Address(to) : null,
                value != null ? new Wei(value) : Wei.ZERO,
                nonce != null ? nonce : 0L,
                RpcUtils.decodeHexLong(map.get("blockNumber"))));
    }

    @Override
    public Optional<Receipt> getReceipt(final Hash hash) {
        final Map<String, Object> map = readObject("eth_getTransactionReceipt", hash);
        if (map == null) {
            return Optional.empty();
        }
        final String statusHex = RpcUtils.stringValue(map.get("status"));
        final boolean status = statusHex != null && !statusHex.isBlank() && !statusHex.equalsIgnoreCase("0x0");
        final Long blockNumber = RpcUtils.decodeHexLong(map.get("blockNumber"));
        if (blockNumber == null) {
            // Some nodes return a receipt skeleton for pending transactions.
            return Optional.empty();
        }
        final BigInteger gasUsed = RpcUtils.decodeHexBigInteger(map.get("gasUsed"));
        final BigInteger effectiveGasPrice = RpcUtils.decodeHexBigInteger(map.get("effectiveGasPrice"));
        final Receipt receipt = new Receipt(
                hash,
                blockNumber,
                status,
                gasUsed != null ? gasUsed : BigInteger.ZERO,
                effectiveGasPrice != null ? new Wei(effectiveGasPrice) : null);
        DebugLogger.logTx(LogFormatter.formatTxReceipt(hash.value(), blockNumber, status));
        return Optional.of(receipt);
    }

    @Override
    public long getBlockNumber() {
        final String result = read("eth_blockNumber", List.of());
        if (result == null) {
            throw new RpcException(-32603, "eth_blockNumber returned no result", null, (Long) null);
        }
        return Hex.decodeQuantity(result).longValueExact();
    }

    @Override
    public void close() {
        transport.close();
    }

    Map<String, Object> toTxObject(final TransactionRequest request) {
        final Map<String, Object> tx = new LinkedHashMap<>();
        request.fromOpt().ifPresent(address -> tx.put("from", address.value()));
        request.toOpt().ifPresent(address -> tx.put("to", address.value()));
        if (request.value().signum() > 0) {
            tx.put("value", Hex.toQuantity(request.value()));
        }
        if (request.hasData()) {
            tx.put("data", request.data().value());
        }
        return tx;
    }

    private String read(final String method, final List<?> params) {
        final JsonRpcResponse response = RpcRetry.run(() -> transport.send(method, params), READ_ATTEMPTS);
        return response.resultAsString();
    }

    private Map<String, Object> readObject(final String method, final Hash hash) {
        final JsonRpcResponse response =
                RpcRetry.run(() -> transport.send(method, List.of(hash.value())), READ_ATTEMPTS);
        return response.resultAsMap();
    }
}
