// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.crypto;

/**
 * Key and signature lengths of the Dilithium variants seen on the Cellframe network.
 * <p>
 * {@link sh.cellframe.core.tx.SignatureItemEncoder} does not enforce these; they are
 * here for signer implementations and tests.
 */
public final class SignatureSizes {

    /** Wire tag of the Dilithium signature family. */
    public static final String SIG_TYPE_DILITHIUM = "sig_dil";

    /** Dilithium public key length in bytes. */
    public static final int DILITHIUM_PUBLIC_KEY = 2592;

    /** Dilithium raw signature length in bytes. */
    public static final int DILITHIUM_SIGNATURE = 4627;

    /** Dilithium signature length in bytes including the ledger's serialization header. */
    public static final int DILITHIUM_SIGNATURE_SERIALIZED = 4896;

    private SignatureSizes() {
    }
}
