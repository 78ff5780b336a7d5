// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility that removes sensitive or oversized data from debug log payloads.
 *
 * <p>
 * Performs three sanitization operations:
 * <ul>
 * <li>Redacts private key and seed values</li>
 * <li>Elides base64 key and signature blobs, keeping only their length</li>
 * <li>Truncates excessively long logs</li>
 * </ul>
 */
public final class LogSanitizer {

    /** Maximum length for sanitized log output. */
    private static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated logs. */
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final Pattern SECRET_FIELD = Pattern.compile(
            "\"(priv_key|private_key|privateKey|seed|mnemonic)\"\\s*:\\s*\"[^\"]*\"");

    private static final Pattern BLOB_FIELD = Pattern.compile(
            "\"(pub_key_b64|sig_b64)\"\\s*:\\s*\"([^\"]*)\"");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("key\"") || sanitized.contains("seed\"") || sanitized.contains("mnemonic\"")) {
            sanitized = SECRET_FIELD.matcher(sanitized).replaceAll("\"$1\":\"***[REDACTED]***\"");
        }

        if (sanitized.contains("_b64\"")) {
            final Matcher matcher = BLOB_FIELD.matcher(sanitized);
            final StringBuilder out = new StringBuilder(sanitized.length());
            while (matcher.find()) {
                matcher.appendReplacement(out,
                        Matcher.quoteReplacement("\"" + matcher.group(1) + "\":\"<" + matcher.group(2).length() + " chars>\""));
            }
            matcher.appendTail(out);
            sanitized = out.toString();
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
