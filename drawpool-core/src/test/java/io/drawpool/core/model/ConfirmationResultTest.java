// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.drawpool.core.types.Hash;
import io.drawpool.core.types.Wei;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class ConfirmationResultTest {

    private static final Hash HASH = new Hash("0x" + "a".repeat(64));

    @Test
    void successfulReceipt() {
        Receipt receipt = new Receipt(HASH, 120L, true, BigInteger.valueOf(85_000), Wei.gwei(2));
        ConfirmationResult result = ConfirmationResult.fromReceipt(receipt, 3);

        assertEquals(ConfirmationOutcome.SUCCESS, result.outcome());
        assertTrue(result.isSuccess());
        assertEquals(Long.valueOf(120L), result.blockNumber());
        assertEquals(3, result.confirmations());
    }

    @Test
    void revertedReceiptStillCarriesBlock() {
        Receipt receipt = new Receipt(HASH, 121L, false, BigInteger.valueOf(40_000), null);
        ConfirmationResult result = ConfirmationResult.fromReceipt(receipt, 1);

        assertEquals(ConfirmationOutcome.REVERTED, result.outcome());
        assertFalse(result.isSuccess());
        assertEquals(BigInteger.valueOf(40_000), result.gasUsed());
        assertNull(result.effectiveGasPrice());
    }

    @Test
    void timedOutHasNoReceiptFields() {
        ConfirmationResult result = ConfirmationResult.timedOut(HASH);
        assertEquals(ConfirmationOutcome.TIMED_OUT, result.outcome());
        assertNull(result.blockNumber());
        assertNull(result.gasUsed());
        assertThrows(IllegalArgumentException.class,
                () -> new ConfirmationResult(HASH, ConfirmationOutcome.TIMED_OUT, 1L, null, null, 0));
    }

    @Test
    void successRequiresBlockAndGas() {
        assertThrows(NullPointerException.class,
                () -> new ConfirmationResult(HASH, ConfirmationOutcome.SUCCESS, null, BigInteger.ONE, null, 1));
    }
}
