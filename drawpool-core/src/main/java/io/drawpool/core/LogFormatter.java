// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core;

import java.util.Locale;

/**
 * Formats RPC and transaction lifecycle events into single structured lines.
 *
 * <p>
 * All lines use a bracketed {@code [OPERATION]} tag, status symbols (✓ ✗ ○)
 * for outcomes, shortened hashes ({@code 0x1234...5678}) and human readable
 * durations.
 *
 * <pre>{@code
 * DebugLogger.logTx(LogFormatter.formatTxSend(corr, from, to, attempt, gasLimit, value));
 * // [TX-SEND] corr=deposit-1 from=0x1111...1111 to=0x2222...2222 attempt=1 gasLimit=180000 value=0
 * }</pre>
 */
public final class LogFormatter {

    private static final int HASH_PREFIX_LENGTH = 6;
    private static final int HASH_SUFFIX_LENGTH = 4;
    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    /**
     * Format: ✗ [RPC-ERROR] method=eth_call code=-32000 message=error duration=1.50ms
     */
    public static String formatRpcError(String method, Object code, String message, long durationMicros) {
        return String.format(
                "✗ [RPC-ERROR] method=%s code=%s message=%s %s",
                method, code, message, duration(durationMicros));
    }

    /**
     * Format: [RPC] method=eth_chainId duration=1.06ms
     */
    public static String formatRpc(String method, long durationMicros) {
        return String.format("[RPC] method=%s %s", method, duration(durationMicros));
    }

    /**
     * Format: [ESTIMATE-GAS] corr=abc op=DEPOSIT from=0x1234...5678 to=0xabcd...ef01
     */
    public static String formatEstimateGas(String correlationId, Object operation, String from, String to) {
        return String.format(
                "[ESTIMATE-GAS] corr=%s op=%s from=%s to=%s",
                correlationId, operation, shortenHash(from), shortenHash(to));
    }

    /**
     * Format: ✓ [ESTIMATE-GAS-RESULT] corr=abc source=live gasLimit=180000 maxFee=2.75 gwei duration=3.10ms
     */
    public static String formatEstimateGasResult(
            String correlationId, String source, Object gasLimit, String maxFee, long durationMicros) {
        return String.format(
                "✓ [ESTIMATE-GAS-RESULT] corr=%s source=%s gasLimit=%s maxFee=%s %s",
                correlationId, source, gasLimit, maxFee, duration(durationMicros));
    }

    /**
     * Format: [TX-SEND] corr=abc from=0x1234...5678 to=0xabcd...ef01 attempt=1 gasLimit=25200 value=0
     */
    public static String formatTxSend(
            String correlationId, String from, String to, int attempt, Object gasLimit, Object value) {
        return String.format(
                "[TX-SEND] corr=%s from=%s to=%s attempt=%d gasLimit=%s value=%s",
                correlationId,
                shortenHash(from),
                to != null ? shortenHash(to) : "null",
                attempt, gasLimit, value);
    }

    /**
     * Format: [TX-HASH] corr=abc hash=0x1234...5678 duration=0.93ms
     */
    public static String formatTxHash(String correlationId, String hash, long durationMicros) {
        return String.format("[TX-HASH] corr=%s hash=%s %s", correlationId, shortenHash(hash), duration(durationMicros));
    }

    /**
     * Format: ✗ [TX-FAILED] corr=abc kind=NONCE_CONFLICT message=nonce too low
     */
    public static String formatTxFailed(String correlationId, Object kind, String message) {
        return String.format("✗ [TX-FAILED] corr=%s kind=%s message=%s", correlationId, kind, message);
    }

    /**
     * Format: ○ [TX-WAIT] hash=0x1234...5678 confirmations=1 timeout=60.0s
     */
    public static String formatTxWait(String hash, int confirmations, long timeoutMillis) {
        return String.format(
                "○ [TX-WAIT] hash=%s confirmations=%d timeout=%s",
                shortenHash(hash), confirmations, millis(timeoutMillis));
    }

    /**
     * Format: ✓ [TX-RECEIPT] hash=0x1234...5678 block=100 status=SUCCESS
     * or: ✗ [TX-RECEIPT] hash=0x1234...5678 block=101 status=REVERTED
     */
    public static String formatTxReceipt(String hash, Object block, boolean status) {
        return String.format(
                "%s [TX-RECEIPT] hash=%s block=%s status=%s",
                status ? "✓" : "✗",
                shortenHash(hash),
                block,
                status ? "SUCCESS" : "REVERTED");
    }

    /**
     * Format: ○ [TX-TIMEOUT] hash=0x1234...5678 waited=60.0s
     */
    public static String formatTxTimeout(String hash, long waitedMillis) {
        return String.format("○ [TX-TIMEOUT] hash=%s waited=%s", shortenHash(hash), millis(waitedMillis));
    }

    private static String duration(long micros) {
        final double ms = micros / 1000.0;
        if (ms < 1000) {
            return String.format(Locale.ROOT, "duration=%.2fms", ms);
        }
        return String.format(Locale.ROOT, "duration=%.2fs", ms / 1000.0);
    }

    private static String millis(long millis) {
        return millis < 1000 ? millis + "ms" : String.format(Locale.ROOT, "%.1fs", millis / 1000.0);
    }

    /**
     * Shortens a hash to {@code 0xabcd...ef12}; short or null input is returned as is.
     */
    static String shortenHash(String fullHash) {
        if (fullHash == null || fullHash.length() <= HASH_SHORTEN_THRESHOLD) {
            return fullHash;
        }
        return fullHash.substring(0, HASH_PREFIX_LENGTH)
                + "..."
                + fullHash.substring(fullHash.length() - HASH_SUFFIX_LENGTH);
    }
}
