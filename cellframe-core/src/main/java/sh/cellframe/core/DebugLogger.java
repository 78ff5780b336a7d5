// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger with colored formatting.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.cellframe.debug");

    private DebugLogger() {
    }

    public static void logRpc(final String message, final Object... args) {
        if (!CellframeDebug.isRpcLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logTx(final String message, final Object... args) {
        if (!CellframeDebug.isTxLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!CellframeDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Direct output to stdout for colored logs in TTY environments.
     * Falls back to SLF4J for non-TTY environments.
     * Always sanitizes: transaction payloads carry keys and signatures.
     */
    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);

        final String sanitized = LogSanitizer.sanitize(formatted);

        if (AnsiColors.IS_TTY) {
            System.out.println(sanitized);
        } else {
            LOG.info(sanitized);
        }
    }
}
