// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Call data attached to a transaction, as {@code 0x}-prefixed hex of even length.
 */
public record HexData(String value) {
    private static final Pattern HEX = Pattern.compile("^0x([0-9a-fA-F]{2})*$");

    public static final HexData EMPTY = new HexData("0x");

    public HexData {
        Objects.requireNonNull(value, "hex");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hex data: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public boolean isEmpty() {
        return value.length() == 2;
    }

    /**
     * Returns the number of bytes encoded by this value.
     */
    public int byteLength() {
        return (value.length() - 2) / 2;
    }
}
