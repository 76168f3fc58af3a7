// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.drawpool.core.error.EstimationException;
import io.drawpool.core.error.RpcException;
import io.drawpool.core.model.GasProfile;
import io.drawpool.core.model.OperationType;
import io.drawpool.core.model.Receipt;
import io.drawpool.core.model.TransactionDetails;
import io.drawpool.core.model.TransactionRequest;
import io.drawpool.core.types.Address;
import io.drawpool.core.types.Hash;
import io.drawpool.core.types.HexData;
import io.drawpool.core.types.Wei;
import java.io.IOException;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for {@link JsonRpcChainProvider} with a mock transport.
 */
@ExtendWith(MockitoExtension.class)
class JsonRpcChainProviderTest {

    private static final Address SENDER = new Address("0x" + "1".repeat(40));
    private static final Address POOL = new Address("0x" + "2".repeat(40));
    private static final Hash TX_HASH = new Hash("0x" + "a".repeat(64));

    @Mock
    private JsonRpcTransport transport;

    private JsonRpcChainProvider provider;

    @BeforeEach
    void setUp() {
        provider = new JsonRpcChainProvider(transport);
    }

    // ==================== estimateGas / getGasPrice ====================

    @Test
    void estimateGasDecodesQuantity() {
        when(transport.send(eq("eth_estimateGas"), anyList())).thenReturn(ok("0x186a0"));

        assertEquals(BigInteger.valueOf(100_000), provider.estimateGas(request()));
    }

    @Test
    void estimateGasWrapsNodeErrors() {
        RpcException revert = new RpcException(3, "execution reverted", "0x08c379a0", 1L);
        when(transport.send(eq("eth_estimateGas"), anyList())).thenThrow(revert);

        EstimationException e = assertThrows(EstimationException.class, () -> provider.estimateGas(request()));
        assertSame(revert, e.getCause());
    }

    @Test
    void estimateGasTreatsNullResultAsFailure() {
        when(transport.send(eq("eth_estimateGas"), anyList())).thenReturn(ok(null));

        assertThrows(EstimationException.class, () -> provider.estimateGas(request()));
    }

    @Test
    void gasPriceIsRetriedOnTransientErrors() {
        when(transport.send(eq("eth_gasPrice"), anyList()))
                .thenThrow(new RpcException(-32000, "header not found", null, 1L))
                .thenReturn(ok("0x77359400"));

        assertEquals(Wei.gwei(2), provider.getGasPrice());
        verify(transport, times(2)).send(eq("eth_gasPrice"), anyList());
    }

    // ==================== sendTransaction ====================

    @Test
    @SuppressWarnings("unchecked")
    void sendTransactionCarriesGasProfile() {
        when(transport.send(eq("eth_sendTransaction"), anyList())).thenReturn(ok(TX_HASH.value()));
        GasProfile profile = GasProfile.of(180_000, Wei.gwei(3), Wei.gwei(1));

        Hash hash = provider.sendTransaction(request(), profile);

        assertEquals(TX_HASH, hash);
        ArgumentCaptor<List<?>> params = ArgumentCaptor.forClass(List.class);
        verify(transport).send(eq("eth_sendTransaction"), params.capture());
        Map<String, Object> tx = (Map<String, Object>) params.getValue().get(0);
        assertEquals(SENDER.value(), tx.get("from"));
        assertEquals(POOL.value(), tx.get("to"));
        assertEquals("0x2", tx.get("type"));
        assertEquals("0x2bf20", tx.get("gas"));
        assertEquals("0xb2d05e00", tx.get("maxFeePerGas"));
        assertEquals("0x3b9aca00", tx.get("maxPriorityFeePerGas"));
        assertEquals("0xb6b55f25", tx.get("data"));
    }

    @Test
    void sendTransactionIsNeverRetried() {
        when(transport.send(eq("eth_sendTransaction"), anyList()))
                .thenThrow(new RpcException(-32000, "Network error during JSON-RPC call", null, new IOException("reset")));

        assertThrows(RpcException.class,
                () -> provider.sendTransaction(request(), GasProfile.of(21_000, Wei.gwei(2), Wei.gwei(1))));
        verify(transport, times(1)).send(eq("eth_sendTransaction"), anyList());
    }

    // ==================== reads ====================

    @Test
    void parsesReceipt() {
        Map<String, Object> receipt = new LinkedHashMap<>();
        receipt.put("transactionHash", TX_HASH.value());
        receipt.put("blockNumber", "0x64");
        receipt.put("status", "0x1");
        receipt.put("gasUsed", "0x14c08");
        receipt.put("effectiveGasPrice", "0x77359400");
        when(transport.send("eth_getTransactionReceipt", List.of(TX_HASH.value()))).thenReturn(ok(receipt));

        Receipt parsed = provider.getReceipt(TX_HASH).orElseThrow();

        assertEquals(100L, parsed.blockNumber());
        assertTrue(parsed.status());
        assertEquals(BigInteger.valueOf(85_000), parsed.gasUsed());
        assertEquals(Wei.gwei(2), parsed.effectiveGasPrice());
    }

    @Test
    void revertedReceiptHasFalseStatus() {
        Map<String, Object> receipt = new LinkedHashMap<>();
        receipt.put("blockNumber", "0x65");
        receipt.put("status", "0x0");
        receipt.put("gasUsed", "0x5208");
        when(transport.send("eth_getTransactionReceipt", List.of(TX_HASH.value()))).thenReturn(ok(receipt));

        Receipt parsed = provider.getReceipt(TX_HASH).orElseThrow();

        assertFalse(parsed.status());
        assertNull(parsed.effectiveGasPrice());
    }

    @Test
    void missingReceiptIsEmpty() {
        when(transport.send("eth_getTransactionReceipt", List.of(TX_HASH.value()))).thenReturn(ok(null));

        assertEquals(Optional.empty(), provider.getReceipt(TX_HASH));
    }

    @Test
    void parsesPendingTransaction() {
        Map<String, Object> tx = new LinkedHashMap<>();
        tx.put("hash", TX_HASH.value());
        tx.put("from", SENDER.value());
        tx.put("to", POOL.value());
        tx.put("value", "0x3e8");
        tx.put("nonce", "0x7");
        tx.put("blockNumber", null);
        when(transport.send("eth_getTransactionByHash", List.of(TX_HASH.value()))).thenReturn(ok(tx));

        TransactionDetails details = provider.getTransaction(TX_HASH).orElseThrow();

        assertEquals(SENDER, details.from());
        assertEquals(Wei.of(1_000), details.value());
        assertEquals(7L, details.nonce());
        assertFalse(details.isMined());
    }

    @Test
    void blockNumberDecodesHex() {
        when(transport.send(eq("eth_blockNumber"), anyList())).thenReturn(ok("0x1b4"));

        assertEquals(436L, provider.getBlockNumber());
    }

    @Test
    void nonTransientReadErrorsPropagate() {
        when(transport.send(eq("eth_blockNumber"), anyList()))
                .thenThrow(new RpcException(-32601, "method not found", null, 1L));

        RpcException e = assertThrows(RpcException.class, () -> provider.getBlockNumber());
        assertEquals(-32601, e.code());
        verify(transport, times(1)).send(eq("eth_blockNumber"), anyList());
    }

    @Test
    void txObjectOmitsZeroValueAndEmptyData() {
        TransactionRequest bare = TransactionRequest.builder().from(SENDER).to(POOL).build();

        Map<String, Object> tx = provider.toTxObject(bare);

        assertFalse(tx.containsKey("value"));
        assertFalse(tx.containsKey("data"));
        assertInstanceOf(String.class, tx.get("from"));
    }

    @Test
    void closeClosesTransport() {
        provider.close();
        verify(transport).close();
    }

    private static JsonRpcResponse ok(Object result) {
        return new JsonRpcResponse("2.0", result, null, "1");
    }

    private static TransactionRequest request() {
        return TransactionRequest.builder()
                .from(SENDER)
                .to(POOL)
                .data(new HexData("0xb6b55f25"))
                .operation(OperationType.DEPOSIT)
                .build();
    }
}
