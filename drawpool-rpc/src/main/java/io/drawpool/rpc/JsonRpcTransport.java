// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

import io.drawpool.core.error.RpcException;
import java.util.List;

/**
 * Low-level abstraction for sending JSON-RPC requests to a node or an
 * injected wallet.
 *
 * <p>
 * Implementations handle serialization, the wire protocol and conversion of
 * JSON-RPC error objects into {@link RpcException}. Most callers should use a
 * {@link ChainProvider} instead of calling this directly.
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe.
 *
 * @see HttpJsonRpcTransport
 * @see JsonRpcChainProvider
 */
public interface JsonRpcTransport extends AutoCloseable {

    /**
     * Sends a JSON-RPC request.
     *
     * @param method the JSON-RPC method name
     * @param params the list of parameters
     * @return the JSON-RPC response
     * @throws RpcException if the request fails or returns an error
     */
    JsonRpcResponse send(String method, List<?> params) throws RpcException;

    /**
     * Creates a default HTTP transport.
     *
     * @param url the JSON-RPC endpoint URL
     */
    static JsonRpcTransport http(final String url) {
        return HttpJsonRpcTransport.builder(url).build();
    }

    @Override
    default void close() {
        // Default no-op for transports that don't need cleanup
    }
}
