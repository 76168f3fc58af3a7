// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core;

/**
 * Utility that removes sensitive data from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts signatures and session tokens that wallets echo back in
 * payloads</li>
 * <li>Truncates excessively long logs</li>
 * </ul>
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("\"signature\"")) {
            sanitized = sanitized.replaceAll(
                    "\\\"signature\\\"\\s*:\\s*\\\"0x[^\\\"]+\\\"",
                    "\"signature\":\"0x***[REDACTED]***\"");
        }

        if (sanitized.toLowerCase().contains("authorization")) {
            sanitized = sanitized.replaceAll(
                    "(?i)(authorization\\\"?\\s*[:=]\\s*\\\"?)(bearer\\s+)?[^\\\"\\s,}]+",
                    "$1***[REDACTED]***");
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            final int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
