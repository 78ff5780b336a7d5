// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.primitives;

import java.util.Arrays;

/**
 * Utility methods for hex encoding/decoding with optional {@code 0x} prefixes.
 *
 * <p>The Cellframe ledger renders hashes in uppercase ({@code 0xAB12...}), which
 * is the only encoding offered. Decoding is case-insensitive.
 *
 * @since 1.0
 */
public final class Hex {
    private static final char[] UPPER_CHARS = "0123456789ABCDEF".toCharArray();
    private static final int[] NIBBLE_LOOKUP = new int[128];

    static {
        Arrays.fill(NIBBLE_LOOKUP, -1);

        for (int i = 0; i <= 9; i++) {
            NIBBLE_LOOKUP['0' + i] = i;
        }

        for (int i = 0; i < 6; i++) {
            NIBBLE_LOOKUP['a' + i] = 10 + i;
            NIBBLE_LOOKUP['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Convert a hex string, with or without {@code 0x} prefix, into a byte array.
     *
     * @param hexString the string to decode
     * @return the decoded bytes
     * @throws IllegalArgumentException if the input is null, has an odd number of
     *                                  characters, or contains invalid hex
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }

        final int start = hasPrefix(hexString) ? 2 : 0;
        final int hexLength = hexString.length() - start;

        if (hexLength == 0) {
            return new byte[0];
        }

        if ((hexLength & 1) == 1) {
            throw new IllegalArgumentException("hex string must have even length: " + hexString);
        }

        final int len = hexLength / 2;
        final byte[] result = new byte[len];

        for (int i = 0; i < len; i++) {
            final int high = toNibble(hexString.charAt(start + i * 2), hexString);
            final int low = toNibble(hexString.charAt(start + i * 2 + 1), hexString);
            result[i] = (byte) ((high << 4) | low);
        }

        return result;
    }

    /**
     * Convert a byte array into an uppercase hex string with a lowercase {@code 0x} prefix,
     * the form the ledger uses for {@code prev_hash} and other hash fields.
     *
     * @param bytes the bytes to encode
     * @return hex string such as {@code 0x00FF}
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encodeUpper(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }

        final char[] chars = new char[2 + bytes.length * 2];
        chars[0] = '0';
        chars[1] = 'x';
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            chars[2 + i * 2] = UPPER_CHARS[v >>> 4];
            chars[2 + i * 2 + 1] = UPPER_CHARS[v & 0x0F];
        }
        return new String(chars);
    }

    /**
     * Returns {@code true} if the provided string starts with {@code 0x}
     * (case-insensitive).
     *
     * @param hexString the string to check
     * @return {@code true} when the prefix is present
     */
    public static boolean hasPrefix(final String hexString) {
        return hexString != null
                && hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    private static int toNibble(final char c, final String input) {
        if (c >= NIBBLE_LOOKUP.length || NIBBLE_LOOKUP[c] == -1) {
            throw new IllegalArgumentException("invalid hex character in: " + input);
        }
        return NIBBLE_LOOKUP[c];
    }
}
