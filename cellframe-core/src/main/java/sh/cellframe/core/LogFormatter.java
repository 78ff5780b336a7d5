// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core;

import static sh.cellframe.core.AnsiColors.*;

/**
 * Log formatter producing colored, structured lines for RPC calls and transfers.
 *
 * <p>
 * All logs use a bracketed {@code [OPERATION]} tag; status symbols (✓ ✗) mark
 * results. Long hashes and addresses are shortened to {@code 0x1234...5678}.
 *
 * <pre>{@code
 * DebugLogger.logRpc(LogFormatter.formatRpc("wallet", "info", 1200));
 * // [RPC] method=wallet subcommand=info duration=1.20ms
 *
 * DebugLogger.logTx(LogFormatter.formatTxAssemble(2, 3, true, 1700000000L));
 * // [TX-ASSEMBLE] ins=2 outs=3 fee=yes ts_created=1700000000
 * }</pre>
 *
 * @since 0.1.0
 * @see DebugLogger
 */
public final class LogFormatter {

    private static final int HASH_PREFIX_LENGTH = 6;
    private static final int HASH_SUFFIX_LENGTH = 4;
    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    /**
     * Format: [RPC] method=wallet subcommand=info duration=1.06ms
     */
    public static String formatRpc(String method, String subcommand, long durationMicros) {
        return String.format(
                "%s[RPC]%s method=%s subcommand=%s %s",
                INDIGO, RESET,
                method,
                subcommand == null || subcommand.isEmpty() ? "-" : subcommand,
                duration(durationMicros));
    }

    /**
     * Format: ✗ [RPC-ERROR] method=tx_history code=-32001 message=HTTP 502 duration=1.5ms
     */
    public static String formatRpcError(String method, Object code, String message, long durationMicros) {
        return String.format(
                "%s✗%s %s[RPC-ERROR]%s method=%s code=%s message=%s %s",
                CORAL, RESET,
                CORAL, RESET,
                method,
                code,
                CORAL + message + RESET,
                duration(durationMicros));
    }

    /**
     * Format: [TX-ASSEMBLE] ins=2 outs=3 fee=yes ts_created=1700000000
     */
    public static String formatTxAssemble(int inputs, int outputs, boolean validatorFee, long tsCreated) {
        return String.format(
                "%s[TX-ASSEMBLE]%s ins=%d outs=%d fee=%s ts_created=%d",
                LAVENDER, RESET,
                inputs, outputs,
                validatorFee ? AMBER + "yes" + RESET : "no",
                tsCreated);
    }

    /**
     * Format: [TX-SIGN] sig_type=sig_dil pub_key_size=2592 sig_size=4627 payload=812
     */
    public static String formatTxSign(String sigType, int pubKeySize, int sigSize, int payloadBytes) {
        return String.format(
                "%s[TX-SIGN]%s sig_type=%s pub_key_size=%d sig_size=%d payload=%d",
                LAVENDER, RESET,
                sigType, pubKeySize, sigSize, payloadBytes);
    }

    /**
     * Format: [TX-SUBMIT] net=Backbone chain=main items=4 bytes=9817
     */
    public static String formatTxSubmit(String net, String chain, int items, int bytes) {
        return String.format(
                "%s[TX-SUBMIT]%s net=%s chain=%s items=%d bytes=%d",
                LAVENDER, RESET,
                net, chain, items, bytes);
    }

    /**
     * Format: ✓ [TX-HASH] hash=0x1234...5678 duration=934.00ms
     */
    public static String formatTxHash(String hash, long durationMicros) {
        return String.format(
                "%s✓%s %s[TX-HASH]%s hash=%s %s",
                TEAL, RESET,
                LAVENDER, RESET,
                hash != null ? shortenHash(hash) : "unknown",
                duration(durationMicros));
    }

    private static String duration(long micros) {
        double ms = micros / 1000.0;
        String formatted;
        if (ms < 1000) {
            formatted = String.format("%.2fms", ms);
        } else {
            formatted = String.format("%.2fs", ms / 1000.0);
        }
        return SLATE + "duration=" + formatted + RESET;
    }

    private static String shortenHash(String fullHash) {
        if (fullHash.length() <= HASH_SHORTEN_THRESHOLD) {
            return fullHash;
        }
        return fullHash.substring(0, HASH_PREFIX_LENGTH)
                + "..."
                + fullHash.substring(fullHash.length() - HASH_SUFFIX_LENGTH);
    }
}
