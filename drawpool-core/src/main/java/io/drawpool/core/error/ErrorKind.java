// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.error;

/**
 * Closed taxonomy of transaction errors. Each kind carries exactly one fixed
 * user-facing message, a stable code for support and analytics, and a hint
 * whether simply trying again can help.
 */
public enum ErrorKind {
    VALIDATION_ERROR(
            "TX_001", false,
            "Invalid transaction request. Please check the details and try again."),
    ESTIMATION_ERROR(
            "TX_002", true,
            "Unable to estimate network fees. Default fees were used."),
    INSUFFICIENT_FUNDS(
            "TX_003", false,
            "Insufficient funds for transaction. Please ensure you have enough ETH for gas fees."),
    GAS_TOO_LOW(
            "TX_004", true,
            "Gas limit too low. Please try again with a higher gas limit."),
    NONCE_CONFLICT(
            "TX_005", true,
            "Transaction nonce error. Please refresh and try again."),
    REPLACEMENT_CONFLICT(
            "TX_006", false,
            "Transaction replacement failed. Please wait for the current transaction to complete."),
    NETWORK_ERROR(
            "TX_007", true,
            "Network error. Please check your connection and try again."),
    USER_REJECTED(
            "TX_008", true,
            "Transaction cancelled. Please approve the request in your wallet to continue."),
    UNKNOWN(
            "TX_999", true,
            "Transaction failed. Please try again.");

    private final String code;
    private final boolean retryable;
    private final String userMessage;

    ErrorKind(final String code, final boolean retryable, final String userMessage) {
        this.code = code;
        this.retryable = retryable;
        this.userMessage = userMessage;
    }

    public String code() {
        return code;
    }

    /**
     * Whether a new, caller-initiated attempt may succeed without changing the
     * request. The executor itself never retries submissions.
     */
    public boolean retryable() {
        return retryable;
    }

    public String userMessage() {
        return userMessage;
    }
}
