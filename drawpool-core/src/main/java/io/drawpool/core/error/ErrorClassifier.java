// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.error;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps raw provider and network failures onto {@link ErrorKind}.
 *
 * <p>
 * Matching is done on the lower-cased message text of the throwable and its
 * causes, in a fixed priority order where the first match wins:
 * <ol>
 * <li>"insufficient funds" → {@link ErrorKind#INSUFFICIENT_FUNDS}</li>
 * <li>"gas" with "too low" or "underpriced" → {@link ErrorKind#GAS_TOO_LOW}</li>
 * <li>"nonce" with "low" → {@link ErrorKind#NONCE_CONFLICT}</li>
 * <li>"replacement" with "underpriced" → {@link ErrorKind#REPLACEMENT_CONFLICT}</li>
 * <li>"network", or an I/O or timeout exception in the cause chain →
 * {@link ErrorKind#NETWORK_ERROR}</li>
 * <li>"reject", "denied" or "cancel" → {@link ErrorKind#USER_REJECTED}</li>
 * <li>anything else → {@link ErrorKind#UNKNOWN}</li>
 * </ol>
 * {@link ValidationException} and {@link EstimationException} are classified
 * by type before any text matching.
 *
 * <p>
 * Note that "replacement transaction underpriced" also satisfies rule 2 when
 * the text mentions gas; the order above is the contract.
 */
public final class ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 8;

    private ErrorClassifier() {
    }

    public static ClassifiedError classify(final Throwable raw) {
        if (raw == null) {
            return new ClassifiedError(ErrorKind.UNKNOWN, "", null);
        }
        final String original = raw.getMessage() != null ? raw.getMessage() : raw.getClass().getSimpleName();
        if (raw instanceof ValidationException) {
            return new ClassifiedError(ErrorKind.VALIDATION_ERROR, original, raw);
        }
        if (raw instanceof EstimationException) {
            return new ClassifiedError(ErrorKind.ESTIMATION_ERROR, original, raw);
        }
        final String text = normalize(raw);
        return new ClassifiedError(match(text, hasConnectivityCause(raw)), original, raw);
    }

    public static ClassifiedError classify(final String message) {
        final String text = message != null ? message.toLowerCase(Locale.ROOT) : "";
        return new ClassifiedError(match(text, false), message, null);
    }

    static ErrorKind match(final String text, final boolean connectivityFailure) {
        if (text.contains("insufficient funds")) {
            return ErrorKind.INSUFFICIENT_FUNDS;
        }
        if (text.contains("gas") && (text.contains("too low") || text.contains("underpriced"))) {
            return ErrorKind.GAS_TOO_LOW;
        }
        if (text.contains("nonce") && text.contains("low")) {
            return ErrorKind.NONCE_CONFLICT;
        }
        if (text.contains("replacement") && text.contains("underpriced")) {
            return ErrorKind.REPLACEMENT_CONFLICT;
        }
        if (text.contains("network") || connectivityFailure) {
            return ErrorKind.NETWORK_ERROR;
        }
        if (text.contains("reject") || text.contains("denied") || text.contains("cancel")) {
            return ErrorKind.USER_REJECTED;
        }
        return ErrorKind.UNKNOWN;
    }

    private static String normalize(final Throwable raw) {
        final StringBuilder sb = new StringBuilder();
        Throwable current = raw;
        int depth = 0;
        while (current != null && depth < MAX_CAUSE_DEPTH) {
            if (current.getMessage() != null) {
                if (sb.length() > 0) {
                    sb.append(" | ");
                }
                sb.append(current.getMessage());
            }
            if (current instanceof RpcException rpc && rpc.data() != null && !rpc.data().startsWith("0x")) {
                sb.append(" | ").append(rpc.data());
            }
            current = current.getCause();
            depth++;
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    private static boolean hasConnectivityCause(final Throwable raw) {
        Throwable current = raw;
        int depth = 0;
        while (current != null && depth < MAX_CAUSE_DEPTH) {
            if (current instanceof IOException || current instanceof TimeoutException) {
                return true;
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }
}
