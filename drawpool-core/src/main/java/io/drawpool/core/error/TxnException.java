// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.error;

/**
 * Base class for transaction-related failures (validation, estimation, send).
 */
public non-sealed class TxnException extends DrawpoolException {

    public TxnException(final String message) {
        super(message);
    }

    public TxnException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
