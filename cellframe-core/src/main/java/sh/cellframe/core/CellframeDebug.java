// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core;

/**
 * Global toggle for enabling verbose debug logging across Cellframe modules.
 *
 * <p>Thread safety: The individual boolean fields are volatile, ensuring visibility
 * across threads. The compound check in {@link #isEnabled()} is not atomic; a brief
 * inconsistency between flags only affects which debug lines are printed.
 */
public final class CellframeDebug {

    private static volatile boolean rpcLogging = false;
    private static volatile boolean txLogging = false;

    private CellframeDebug() {
    }

    /**
     * Checks if any debug logging is enabled.
     *
     * @return true if either RPC or transaction logging is enabled
     */
    public static boolean isEnabled() {
        return rpcLogging || txLogging;
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
