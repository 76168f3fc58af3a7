// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

import static io.drawpool.rpc.internal.RpcUtils.MAPPER;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Represents a JSON-RPC 2.0 response from a node or wallet.
 * <p>
 * Holds either a successful result or an error; use {@link #hasError()} to
 * check which is present.
 *
 * @param jsonrpc the JSON-RPC version (always "2.0")
 * @param result  the result object if successful, or {@code null} if error or
 *                not found
 * @param error   the error object if failed, or {@code null} if successful
 * @param id      the request ID that this response corresponds to
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcResponse(
        String jsonrpc,
        @Nullable Object result,
        @Nullable JsonRpcError error,
        String id) {

    public boolean hasError() {
        return error != null;
    }

    /**
     * Returns the result as a String, for hex quantities such as
     * {@code eth_gasPrice}.
     */
    public @Nullable String resultAsString() {
        return result != null ? result.toString() : null;
    }

    /**
     * Returns the result as a Map, for objects such as receipts.
     *
     * @throws IllegalArgumentException if the result cannot be converted to a map
     */
    @SuppressWarnings("unchecked")
    public @Nullable Map<String, Object> resultAsMap() {
        if (result == null) {
            return null;
        }
        if (result instanceof Map<?, ?>) {
            return (Map<String, Object>) result;
        }
        return MAPPER.convertValue(result, new TypeReference<Map<String, Object>>() {});
    }
}
