// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.drawpool.core.util.Hex;
import java.lang.reflect.Array;
import java.math.BigInteger;
import java.util.Map;

/**
 * Internal helpers shared by the RPC layer: error data extraction, hex
 * quantity decoding and the shared {@link ObjectMapper}.
 */
public final class RpcUtils {

    /**
     * Shared, thread-safe ObjectMapper instance.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private RpcUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Recursively extracts error data from nested JSON-RPC error payloads.
     * Nodes often return {@code {data: {data: "0x..."}}}; this flattens it.
     *
     * @param dataValue the error data object from the response
     * @return extracted error data string, or null if dataValue is null
     */
    public static String extractErrorData(final Object dataValue) {
        if (dataValue == null) {
            return null;
        }
        if (dataValue instanceof String s) {
            return s;
        }
        if (dataValue instanceof Map<?, ?> map) {
            return extractFromIterable(map.values(), dataValue);
        }
        if (dataValue.getClass().isArray()) {
            return extractFromArray(dataValue, dataValue);
        }
        if (dataValue instanceof Iterable<?> iterable) {
            return extractFromIterable(iterable, dataValue);
        }
        return dataValue.toString();
    }

    private static String extractFromIterable(final Iterable<?> iterable, final Object fallback) {
        for (final Object item : iterable) {
            final String extracted = extractErrorData(item);
            if (extracted != null) {
                return extracted;
            }
        }
        return fallback.toString();
    }

    private static String extractFromArray(final Object array, final Object fallback) {
        final int length = Array.getLength(array);
        for (int i = 0; i < length; i++) {
            final String extracted = extractErrorData(Array.get(array, i));
            if (extracted != null) {
                return extracted;
            }
        }
        return fallback.toString();
    }

    /**
     * Safely converts object to string, returning null for null inputs.
     */
    public static String stringValue(final Object value) {
        return value != null ? value.toString() : null;
    }

    /**
     * Decodes a hex quantity to Long, returning null for null input.
     */
    public static Long decodeHexLong(final Object value) {
        if (value == null) {
            return null;
        }
        return Hex.decodeQuantity(value.toString()).longValueExact();
    }

    /**
     * Decodes a hex quantity to BigInteger, returning null for null input.
     */
    public static BigInteger decodeHexBigInteger(final Object value) {
        if (value == null) {
            return null;
        }
        return Hex.decodeQuantity(value.toString());
    }
}
