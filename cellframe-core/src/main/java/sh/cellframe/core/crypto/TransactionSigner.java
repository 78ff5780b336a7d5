// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.crypto;

/**
 * Post-quantum signer that authorizes transfers.
 * <p>
 * Implementations wrap the wallet's Dilithium key pair (local key file, secure
 * enclave, remote signer). The library treats keys and signatures as opaque bytes
 * and only needs their true lengths; see {@link SignatureSizes}.
 */
public interface TransactionSigner {

    /**
     * Returns the serialized public key placed in the {@code sign} item.
     *
     * @return the public key bytes, never empty
     */
    byte[] publicKey();

    /**
     * Signs the given payload.
     * <p>
     * The payload is the UTF-8 text of the unsigned transaction document, as returned
     * by {@link sh.cellframe.core.tx.TransactionDraft#signingPayload()}.
     *
     * @param payload the bytes to sign
     * @return the signature bytes, never empty
     */
    byte[] sign(byte[] payload);
}
