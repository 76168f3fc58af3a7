// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

class ErrorClassifierTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', value = {
        "insufficient funds for gas * price + value                    | INSUFFICIENT_FUNDS",
        "Insufficient Funds                                            | INSUFFICIENT_FUNDS",
        "intrinsic gas too low                                         | GAS_TOO_LOW",
        "max fee per gas less than block base fee: gas underpriced     | GAS_TOO_LOW",
        "nonce too low: next nonce 7, tx nonce 5                       | NONCE_CONFLICT",
        "replacement transaction underpriced                           | REPLACEMENT_CONFLICT",
        "network request failed                                        | NETWORK_ERROR",
        "User rejected the request.                                    | USER_REJECTED",
        "MetaMask Tx Signature: User denied transaction signature.     | USER_REJECTED",
        "user cancelled                                                | USER_REJECTED",
        "execution reverted                                            | UNKNOWN",
        "''                                                            | UNKNOWN"
    })
    void classifiesMessages(String message, ErrorKind expected) {
        assertEquals(expected, ErrorClassifier.classify(message).kind());
    }

    @Test
    void ruleOrderDecidesOverlaps() {
        // mentions funds and network: funds wins
        assertEquals(ErrorKind.INSUFFICIENT_FUNDS,
                ErrorClassifier.classify("network says insufficient funds").kind());
        // mentions gas and replacement: gas rule comes first
        assertEquals(ErrorKind.GAS_TOO_LOW,
                ErrorClassifier.classify("replacement transaction gas underpriced").kind());
    }

    @Test
    void nullMessageIsUnknown() {
        ClassifiedError error = ErrorClassifier.classify((String) null);
        assertEquals(ErrorKind.UNKNOWN, error.kind());
        assertEquals("", error.originalMessage());
    }

    @Test
    void typedExceptionsWinOverText() {
        assertEquals(ErrorKind.VALIDATION_ERROR,
                ErrorClassifier.classify(new ValidationException(List.of("network address missing"))).kind());
        assertEquals(ErrorKind.ESTIMATION_ERROR,
                ErrorClassifier.classify(new EstimationException("insufficient funds")).kind());
    }

    @Test
    void connectivityFailuresInCauseChainAreNetworkErrors() {
        RpcException wrapped = new RpcException(-32000, "Transport failure", null, new IOException("Connection refused"));
        assertEquals(ErrorKind.NETWORK_ERROR, ErrorClassifier.classify(wrapped).kind());
        assertEquals(ErrorKind.NETWORK_ERROR,
                ErrorClassifier.classify(new RuntimeException(new HttpTimeoutException("request timed out"))).kind());
        assertEquals(ErrorKind.NETWORK_ERROR,
                ErrorClassifier.classify(new RuntimeException("wait", new TimeoutException())).kind());
    }

    @Test
    void textRulesBeatConnectivityType() {
        RuntimeException raw = new RuntimeException("nonce too low", new IOException("reset"));
        assertEquals(ErrorKind.NONCE_CONFLICT, ErrorClassifier.classify(raw).kind());
    }

    @Test
    void readsRpcErrorData() {
        RpcException raw = new RpcException(-32000, "execution failed", "insufficient funds for transfer", (Long) null);
        assertEquals(ErrorKind.INSUFFICIENT_FUNDS, ErrorClassifier.classify(raw).kind());
    }

    @Test
    void ignoresHexRevertData() {
        RpcException raw = new RpcException(-32000, "execution reverted", "0x08c379a0", (Long) null);
        assertEquals(ErrorKind.UNKNOWN, ErrorClassifier.classify(raw).kind());
    }

    @Test
    void keepsCauseAndOriginalMessage() {
        RuntimeException raw = new RuntimeException("User rejected the request");
        ClassifiedError error = ErrorClassifier.classify(raw);
        assertSame(raw, error.cause());
        assertEquals("User rejected the request", error.originalMessage());
    }

    @ParameterizedTest
    @EnumSource(ErrorKind.class)
    void userMessagesNeverEchoProviderText(ErrorKind kind) {
        String raw = "secret-provider-detail-" + kind.name();
        ClassifiedError error = new ClassifiedError(kind, raw, null);
        assertFalse(error.userMessage().contains(raw));
        assertTrue(kind.code().startsWith("TX_"));
    }

    @Test
    void retryHints() {
        assertFalse(ErrorKind.VALIDATION_ERROR.retryable());
        assertFalse(ErrorKind.INSUFFICIENT_FUNDS.retryable());
        assertFalse(ErrorKind.REPLACEMENT_CONFLICT.retryable());
        assertTrue(ErrorKind.NETWORK_ERROR.retryable());
        assertTrue(ErrorKind.NONCE_CONFLICT.retryable());
    }
}
