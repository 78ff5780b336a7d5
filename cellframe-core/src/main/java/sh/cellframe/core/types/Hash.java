// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;
import sh.cellframe.primitives.Hex;

/**
 * Hex-encoded 32-byte hash, as used for {@code prev_hash} and datum hashes.
 * <p>
 * The canonical text form is {@code 0x} followed by 64 <em>uppercase</em> hex
 * characters, which is what the Cellframe JSON parser expects. Lowercase input is
 * accepted and normalized.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 64 hex characters long (32 bytes)</li>
 * </ul>
 *
 * @since 0.1.0
 */
public record Hash(@JsonValue String value) {
    /** Length of a hash in bytes. */
    public static final int BYTE_LENGTH = 32;
    private static final Pattern HEX = Pattern.compile("^0x[0-9a-fA-F]{" + BYTE_LENGTH * 2 + "}$");

    public Hash {
        Objects.requireNonNull(value, "hash");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hash: " + value);
        }
        value = "0x" + value.substring(2).toUpperCase(Locale.ROOT);
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public static Hash fromBytes(final byte[] bytes) {
        return new Hash(format(bytes));
    }

    /**
     * Renders raw hash bytes as {@code 0x} + 64 uppercase hex characters.
     *
     * @param bytes exactly 32 bytes, rendered in the order given
     * @return the ledger text form
     * @throws IllegalArgumentException if {@code bytes} is null or not 32 bytes long
     */
    public static String format(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Hash must be exactly " + BYTE_LENGTH + " bytes");
        }
        return Hex.encodeUpper(bytes);
    }

    @Override
    public String toString() {
        return value;
    }
}
