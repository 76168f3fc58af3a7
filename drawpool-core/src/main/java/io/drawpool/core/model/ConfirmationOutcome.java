// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.model;

/**
 * Terminal outcome of watching a transaction for confirmation.
 */
public enum ConfirmationOutcome {
    SUCCESS,
    REVERTED,
    /**
     * The watch gave up before a receipt reached the required depth. The
     * transaction may still confirm later and must be queried again.
     */
    TIMED_OUT
}
