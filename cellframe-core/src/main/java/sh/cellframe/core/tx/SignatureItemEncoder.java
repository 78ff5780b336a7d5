// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.tx;

import sh.cellframe.primitives.Base64Url;

/**
 * Builds the {@code sign} item from a raw public key and signature.
 * <p>
 * Sizes are taken from the buffers as given; callers pass the true key and
 * signature lengths (see {@link sh.cellframe.core.crypto.SignatureSizes}).
 *
 * @since 0.1.0
 */
public final class SignatureItemEncoder {

    private SignatureItemEncoder() {
    }

    /**
     * @param publicKey serialized public key, non-empty
     * @param signature signature bytes, non-empty
     * @return the sign item
     * @throws TxBuilderException        if either buffer is null or empty
     * @throws BufferAllocationException if the base64 text cannot be allocated
     */
    public static TransactionItem.Sign encode(final byte[] publicKey, final byte[] signature) {
        if (publicKey == null || publicKey.length == 0) {
            throw new TxBuilderException("public key is required");
        }
        if (signature == null || signature.length == 0) {
            throw new TxBuilderException("signature is required");
        }
        return new TransactionItem.Sign(
                publicKey.length,
                signature.length,
                encodeField(publicKey, "pub_key_b64"),
                encodeField(signature, "sig_b64"));
    }

    private static String encodeField(final byte[] data, final String field) {
        final long required = requireEncodable(data.length, field);
        try {
            return Base64Url.encode(data);
        } catch (OutOfMemoryError e) {
            throw new BufferAllocationException("cannot allocate " + field, required, e);
        }
    }

    /**
     * Returns the base64 length of {@code byteLength} bytes, or fails if no
     * string of that length can exist.
     */
    static long requireEncodable(final int byteLength, final String field) {
        final long required = (byteLength + 2L) / 3L * 4L;
        if (required > Integer.MAX_VALUE) {
            throw new BufferAllocationException(
                    "cannot allocate " + field + ": " + byteLength + " bytes encode to " + required + " characters",
                    required);
        }
        return required;
    }
}
