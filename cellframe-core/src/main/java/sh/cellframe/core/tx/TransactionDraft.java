// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.tx;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

import sh.cellframe.core.DebugLogger;
import sh.cellframe.core.LogFormatter;
import sh.cellframe.core.crypto.TransactionSigner;

/**
 * An assembled, unsigned transaction awaiting its signature.
 * <p>
 * {@code ts_created} is fixed when the draft is assembled, so the signed document
 * carries the same timestamp as the payload that was signed. A draft is finalized
 * exactly once, by one of {@link #sign(byte[], byte[])}, {@link #sign(TransactionSigner)}
 * or {@link #buildUnsigned()}.
 *
 * @since 0.1.0
 */
public final class TransactionDraft {
    private final TransactionItemBuilder builder;
    private final List<TransactionItem> items;
    private final long tsCreated;
    private final String unsignedJson;
    private boolean finalized;

    TransactionDraft(final TransactionItemBuilder builder, final long tsCreated) {
        this.builder = Objects.requireNonNull(builder, "builder");
        this.items = builder.items();
        this.tsCreated = tsCreated;
        this.unsignedJson = builder.snapshot(tsCreated);
    }

    /**
     * @return the unsigned items in document order
     */
    public List<TransactionItem> items() {
        return items;
    }

    public long tsCreated() {
        return tsCreated;
    }

    /**
     * @return the complete document text without a sign item
     */
    public String unsignedJson() {
        return unsignedJson;
    }

    /**
     * Returns the bytes a signer must sign: the UTF-8 encoding of {@link #unsignedJson()},
     * including {@code ts_created} and {@code datum_type}.
     *
     * @return a fresh copy of the signing payload
     */
    public byte[] signingPayload() {
        return unsignedJson.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Appends the sign item and finalizes the document.
     *
     * @param publicKey serialized public key
     * @param signature signature over {@link #signingPayload()}
     * @return the signed document
     * @throws TxBuilderException        if either buffer is empty
     * @throws BufferAllocationException if the document buffer cannot grow
     * @throws IllegalStateException     if the draft was already finalized
     */
    public TransactionDocument sign(final byte[] publicKey, final byte[] signature) {
        ensureNotFinalized();
        final TransactionItem.Sign sign = SignatureItemEncoder.encode(publicKey, signature);
        finalized = true;
        DebugLogger.logTx(LogFormatter.formatTxSign(
                sign.sigType(), sign.pubKeySize(), sign.sigSize(), unsignedJson.length()));
        return builder.append(sign).build(tsCreated);
    }

    /**
     * Signs {@link #signingPayload()} with {@code signer} and finalizes the document.
     *
     * @param signer the wallet signer
     * @return the signed document
     */
    public TransactionDocument sign(final TransactionSigner signer) {
        Objects.requireNonNull(signer, "signer");
        ensureNotFinalized();
        final byte[] signature = signer.sign(signingPayload());
        return sign(signer.publicKey(), signature);
    }

    /**
     * Finalizes the document without a signature, for inspection or fee estimation.
     *
     * @return the unsigned document
     */
    public TransactionDocument buildUnsigned() {
        ensureNotFinalized();
        finalized = true;
        return builder.build(tsCreated);
    }

    public boolean isFinalized() {
        return finalized;
    }

    private void ensureNotFinalized() {
        if (finalized) {
            throw new IllegalStateException("draft already finalized");
        }
    }
}
