// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.types;

import io.drawpool.core.util.Hex;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Hex-encoded 32-byte transaction hash.
 */
public record Hash(String value) {
    private static final Pattern HEX = Pattern.compile("^0x[0-9a-fA-F]{64}$");

    public Hash {
        Objects.requireNonNull(value, "hash");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hash: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public static Hash fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != 32) {
            throw new IllegalArgumentException("Hash must be exactly 32 bytes");
        }
        return new Hash(Hex.encode(bytes));
    }
}
