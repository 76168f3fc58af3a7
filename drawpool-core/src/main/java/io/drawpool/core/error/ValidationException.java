// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.error;

import java.util.List;

/**
 * Thrown when a transaction request is incomplete or malformed. Raised before
 * any network call is made.
 */
public final class ValidationException extends TxnException {

    private final List<String> violations;

    public ValidationException(final List<String> violations) {
        super("Invalid transaction request: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    /**
     * Returns each rule the request broke, in check order.
     */
    public List<String> violations() {
        return violations;
    }
}
