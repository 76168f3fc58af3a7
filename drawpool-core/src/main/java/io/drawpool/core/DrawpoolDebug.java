// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core;

/**
 * Global toggle for enabling verbose debug logging across drawpool modules.
 */
public final class DrawpoolDebug {

    private static volatile boolean rpcLogging = false;
    private static volatile boolean txLogging = false;

    private DrawpoolDebug() {
    }

    public static void setEnabled(final boolean enabled) {
        rpcLogging = enabled;
        txLogging = enabled;
    }

    public static void setRpcLogging(final boolean enabled) {
        rpcLogging = enabled;
    }

    public static boolean isRpcLoggingEnabled() {
        return rpcLogging;
    }

    public static void setTxLogging(final boolean enabled) {
        txLogging = enabled;
    }

    public static boolean isTxLoggingEnabled() {
        return txLogging;
    }
}
