// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.primitives;

/**
 * Base64 encoder for the {@code *_b64} fields of Cellframe JSON transactions.
 *
 * <p>The ledger calls these fields URL-safe, but its JSON parser expects the
 * classic alphabet: {@code A-Z a-z 0-9 + /}, {@code =} padding, no line breaks.
 * Input is processed in 3-byte groups producing 4 characters; a trailing group of
 * one or two bytes is zero-filled and padded with {@code ==} or {@code =}.
 *
 * @since 1.0
 */
public final class Base64Url {
    private static final char[] ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/".toCharArray();
    private static final char PAD = '=';

    private Base64Url() {
        // Utility class
    }

    /**
     * Returns the encoded length for {@code byteLength} input bytes.
     *
     * @param byteLength number of input bytes, non-negative
     * @return number of output characters including padding
     */
    public static int encodedLength(final int byteLength) {
        if (byteLength < 0) {
            throw new IllegalArgumentException("byteLength cannot be negative: " + byteLength);
        }
        final long groups = (byteLength + 2L) / 3L;
        if (groups * 4L > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("input too large to encode: " + byteLength + " bytes");
        }
        return (int) (groups * 4L);
    }

    /**
     * Encodes the given bytes.
     *
     * @param data bytes to encode
     * @return padded base64 text; empty for empty input
     * @throws IllegalArgumentException if {@code data} is {@code null}
     */
    public static String encode(final byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }

        final char[] out = new char[encodedLength(data.length)];
        int j = 0;
        for (int i = 0; i < data.length; i += 3) {
            final boolean hasSecond = i + 1 < data.length;
            final boolean hasThird = i + 2 < data.length;
            final int triple = ((data[i] & 0xFF) << 16)
                    | ((hasSecond ? data[i + 1] & 0xFF : 0) << 8)
                    | (hasThird ? data[i + 2] & 0xFF : 0);

            out[j++] = ALPHABET[(triple >>> 18) & 0x3F];
            out[j++] = ALPHABET[(triple >>> 12) & 0x3F];
            out[j++] = hasSecond ? ALPHABET[(triple >>> 6) & 0x3F] : PAD;
            out[j++] = hasThird ? ALPHABET[triple & 0x3F] : PAD;
        }
        return new String(out);
    }
}
