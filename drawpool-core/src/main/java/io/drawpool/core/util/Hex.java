// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.util;

import java.math.BigInteger;

/**
 * Hex encoding helpers for byte payloads and JSON-RPC quantities.
 *
 * <p>
 * Quantities follow the JSON-RPC convention: {@code 0x}-prefixed, lower-case,
 * no leading zeros ({@code 0x0} for zero).
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLE_LOOKUP = new int[128];

    static {
        for (int i = 0; i < NIBBLE_LOOKUP.length; i++) {
            NIBBLE_LOOKUP[i] = -1;
        }
        for (int i = 0; i <= 9; i++) {
            NIBBLE_LOOKUP['0' + i] = i;
        }
        for (int i = 0; i < 6; i++) {
            NIBBLE_LOOKUP['a' + i] = 10 + i;
            NIBBLE_LOOKUP['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("Hex string cannot be null");
        }
        final String cleanHex = cleanPrefix(hexString);
        if ((cleanHex.length() & 1) == 1) {
            throw new IllegalArgumentException("Hex string must have an even length: " + hexString);
        }
        final byte[] result = new byte[cleanHex.length() / 2];
        for (int i = 0; i < result.length; i++) {
            final int high = toNibble(cleanHex.charAt(i * 2), hexString);
            final int low = toNibble(cleanHex.charAt(i * 2 + 1), hexString);
            result[i] = (byte) ((high << 4) | low);
        }
        return result;
    }

    public static String encode(final byte[] bytes) {
        return "0x" + encodeNoPrefix(bytes);
    }

    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("Bytes cannot be null");
        }
        final char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            chars[i * 2] = HEX_CHARS[v >>> 4];
            chars[i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(chars);
    }

    /**
     * Encodes a non-negative integer as a JSON-RPC quantity.
     *
     * @throws IllegalArgumentException if the value is negative
     */
    public static String toQuantity(final BigInteger value) {
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException("Quantity must be non-negative: " + value);
        }
        return "0x" + value.toString(16);
    }

    /**
     * Decodes a JSON-RPC quantity. Accepts values with or without the prefix; an
     * empty payload ({@code "0x"}) decodes to zero.
     *
     * @throws IllegalArgumentException if the input is null or not hex
     */
    public static BigInteger decodeQuantity(final String quantity) {
        if (quantity == null) {
            throw new IllegalArgumentException("Quantity cannot be null");
        }
        final String clean = cleanPrefix(quantity.trim());
        if (clean.isEmpty()) {
            return BigInteger.ZERO;
        }
        for (int i = 0; i < clean.length(); i++) {
            toNibble(clean.charAt(i), quantity);
        }
        return new BigInteger(clean, 16);
    }

    public static String cleanPrefix(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("Hex string cannot be null");
        }
        return hasPrefix(hexString) ? hexString.substring(2) : hexString;
    }

    public static boolean hasPrefix(final String hexString) {
        return hexString != null
                && hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    private static int toNibble(final char c, final String originalInput) {
        if (c >= NIBBLE_LOOKUP.length || NIBBLE_LOOKUP[c] == -1) {
            throw new IllegalArgumentException("Invalid hex character in: " + originalInput);
        }
        return NIBBLE_LOOKUP[c];
    }
}
