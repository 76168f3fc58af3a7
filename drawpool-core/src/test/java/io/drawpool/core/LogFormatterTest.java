// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogFormatterTest {

    private static final String HASH = "0x1234" + "0".repeat(56) + "5678";

    @Test
    void shortensHashes() {
        assertEquals("0x1234...5678", LogFormatter.shortenHash(HASH));
        assertEquals("0x12", LogFormatter.shortenHash("0x12"));
        assertNull(LogFormatter.shortenHash(null));
    }

    @Test
    void formatsSend() {
        String line = LogFormatter.formatTxSend("corr-1", HASH, null, 2, 180000, 0);
        assertEquals("[TX-SEND] corr=corr-1 from=0x1234...5678 to=null attempt=2 gasLimit=180000 value=0", line);
    }

    @Test
    void formatsReceiptStatus() {
        assertTrue(LogFormatter.formatTxReceipt(HASH, 100L, true).startsWith("✓ [TX-RECEIPT]"));
        assertTrue(LogFormatter.formatTxReceipt(HASH, 101L, false).endsWith("status=REVERTED"));
    }

    @Test
    void formatsDurations() {
        assertTrue(LogFormatter.formatTxHash("c", HASH, 930).endsWith("duration=0.93ms"));
        assertTrue(LogFormatter.formatTxTimeout(HASH, 60_000).endsWith("waited=60.0s"));
        assertTrue(LogFormatter.formatTxWait(HASH, 1, 500).endsWith("timeout=500ms"));
    }
}
