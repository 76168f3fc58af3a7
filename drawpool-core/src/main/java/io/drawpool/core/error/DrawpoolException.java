// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.error;

/**
 * Base runtime exception for all drawpool failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * DrawpoolException
 * ├── {@link RpcException} - JSON-RPC communication failures
 * └── {@link TxnException} - Transaction-specific failures
 *     ├── {@link ValidationException} - request rejected before any network call
 *     └── {@link EstimationException} - live gas estimation failed
 * </pre>
 *
 * <p>
 * Raw exceptions are turned into user-facing errors by
 * {@link ErrorClassifier}; never show {@link #getMessage()} to end users.
 */
public sealed class DrawpoolException extends RuntimeException
        permits RpcException,
        TxnException {

    public DrawpoolException(final String message) {
        super(message);
    }

    public DrawpoolException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
