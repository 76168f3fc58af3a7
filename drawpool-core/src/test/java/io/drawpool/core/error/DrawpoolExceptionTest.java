// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class DrawpoolExceptionTest {

    @Test
    void rpcExceptionIncludesRequestId() {
        RpcException e = new RpcException(-32000, "header not found", null, 42L);
        assertTrue(e.getMessage().contains("[requestId=42]"));
        assertEquals(-32000, e.code());
        assertEquals(Long.valueOf(42L), e.requestId());
        assertInstanceOf(DrawpoolException.class, e);
    }

    @Test
    void validationExceptionListsViolations() {
        List<String> violations = new ArrayList<>(List.of("target address is required", "value must not be negative"));
        ValidationException e = new ValidationException(violations);
        violations.clear();

        assertEquals(2, e.violations().size());
        assertTrue(e.getMessage().contains("target address is required"));
        assertThrows(UnsupportedOperationException.class, () -> e.violations().add("x"));
        assertInstanceOf(TxnException.class, e);
    }
}
