// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.error;

/**
 * Exception thrown when a JSON-RPC request to a chain node or wallet fails.
 *
 * <p>
 * <strong>Common Standard Error Codes:</strong>
 * <ul>
 * <li><strong>-32700</strong>: Parse error (invalid JSON)</li>
 * <li><strong>-32600</strong>: Invalid JSON-RPC request</li>
 * <li><strong>-32601</strong>: Method not found</li>
 * <li><strong>-32602</strong>: Invalid method parameters</li>
 * <li><strong>-32603</strong>: Internal JSON-RPC error</li>
 * <li><strong>-32000</strong>: Generic server error, insufficient funds, gas
 * too low, network failure</li>
 * <li><strong>4001</strong>: Wallet user rejected the request (EIP-1193)</li>
 * </ul>
 *
 * <p>
 * The {@code data} field may contain additional error details returned by the
 * node.
 */
public final class RpcException extends DrawpoolException {

    private final int code;
    private final String data;
    private final Long requestId;

    public RpcException(
            final int code,
            final String message,
            final String data,
            final Long requestId,
            final Throwable cause) {
        super(augmentMessage(message, requestId), cause);
        this.code = code;
        this.data = data;
        this.requestId = requestId;
    }

    public RpcException(final int code, final String message, final String data, final Long requestId) {
        this(code, message, data, requestId, null);
    }

    public RpcException(final int code, final String message, final String data, final Throwable cause) {
        this(code, message, data, null, cause);
    }

    public int code() {
        return code;
    }

    public String data() {
        return data;
    }

    public Long requestId() {
        return requestId;
    }

    @Override
    public String toString() {
        return "RpcException{"
                + "code="
                + code
                + ", message="
                + getMessage()
                + ", data="
                + data
                + ", requestId="
                + requestId
                + "}";
    }

    private static String augmentMessage(final String message, final Long requestId) {
        if (requestId == null || message == null || message.isBlank()) {
            return message;
        }
        return "[requestId=" + requestId + "] " + message;
    }
}
