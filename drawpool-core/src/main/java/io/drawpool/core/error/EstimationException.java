// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.error;

/**
 * Live gas estimation failed. Always recovered by falling back to a static gas
 * profile; never surfaced to end users as a failure.
 */
public final class EstimationException extends TxnException {

    public EstimationException(final String message) {
        super(message);
    }

    public EstimationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
