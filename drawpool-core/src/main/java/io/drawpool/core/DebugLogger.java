// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for RPC and transaction lifecycle lines.
 *
 * <p>
 * Output goes to the {@code io.drawpool.debug} SLF4J logger and is gated by
 * {@link DrawpoolDebug}; every line passes through {@link LogSanitizer}.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("io.drawpool.debug");

    private DebugLogger() {
    }

    public static void logRpc(final String message, final Object... args) {
        if (!DrawpoolDebug.isRpcLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logTx(final String message, final Object... args) {
        if (!DrawpoolDebug.isTxLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
