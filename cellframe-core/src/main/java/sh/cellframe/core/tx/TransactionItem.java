// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.tx;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonGenerator;
import sh.cellframe.core.model.UtxoRef;
import sh.cellframe.core.types.Address;
import sh.cellframe.core.types.Amount;
import sh.cellframe.core.types.Hash;

/**
 * One entry of the {@code items} array of a Cellframe JSON transaction.
 * <p>
 * Each variant writes its fields in the exact order the ledger parser expects.
 * No whitespace is emitted.
 *
 * <pre>
 * {"type":"in","prev_hash":"0x...","out_prev_idx":0}
 * {"type":"out","addr":"...","value":"1.0"}
 * {"type":"out_cond","ts_expires":"never","value":"0.001","service_id":"0x0000000000000000","subtype":"fee"}
 * {"type":"sign","sig_type":"sig_dil","pub_key_size":2592,"sig_size":4627,"hash_type":1,"pub_key_b64":"...","sig_b64":"..."}
 * </pre>
 *
 * @since 0.1.0
 */
public sealed interface TransactionItem
        permits TransactionItem.In, TransactionItem.Out, TransactionItem.Fee, TransactionItem.Sign {

    /**
     * @return the value of the {@code type} field
     */
    String type();

    /**
     * Writes this item as a single JSON object.
     *
     * @param generator target generator, left positioned after the closing brace
     * @throws IOException if the generator fails
     */
    void writeTo(JsonGenerator generator) throws IOException;

    /**
     * @return the compact JSON text of this item
     */
    default String toJson() {
        return new String(TxJson.serialize(this), StandardCharsets.UTF_8);
    }

    /** Spends a previous output. */
    record In(Hash prevHash, long outPrevIdx) implements TransactionItem {
        public static final String TYPE = "in";

        public In {
            Objects.requireNonNull(prevHash, "prevHash");
            if (outPrevIdx < 0 || outPrevIdx > UtxoRef.MAX_INDEX) {
                throw new IllegalArgumentException("outPrevIdx must be an unsigned 32-bit value: " + outPrevIdx);
            }
        }

        public static In from(final UtxoRef utxo) {
            return new In(utxo.prevHash(), utxo.prevIdx());
        }

        @Override
        public String type() {
            return TYPE;
        }

        @Override
        public void writeTo(final JsonGenerator generator) throws IOException {
            generator.writeStartObject();
            generator.writeStringField("type", TYPE);
            generator.writeStringField("prev_hash", prevHash.value());
            generator.writeNumberField("out_prev_idx", outPrevIdx);
            generator.writeEndObject();
        }
    }

    /**
     * Pays {@code value} to {@code addr}.
     * <p>
     * The ledger infers the token from the inputs; an {@code out} item never names one.
     */
    record Out(Address addr, Amount value) implements TransactionItem {
        public static final String TYPE = "out";

        public Out {
            Objects.requireNonNull(addr, "addr");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String type() {
            return TYPE;
        }

        @Override
        public void writeTo(final JsonGenerator generator) throws IOException {
            generator.writeStartObject();
            generator.writeStringField("type", TYPE);
            generator.writeStringField("addr", addr.value());
            generator.writeStringField("value", value.value());
            generator.writeEndObject();
        }
    }

    /** Validator fee, a conditional output of subtype {@code fee} that never expires. */
    record Fee(Amount value) implements TransactionItem {
        public static final String TYPE = "out_cond";
        public static final String TS_EXPIRES_NEVER = "never";
        public static final String SERVICE_ID_NONE = "0x0000000000000000";
        public static final String SUBTYPE = "fee";

        public Fee {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String type() {
            return TYPE;
        }

        @Override
        public void writeTo(final JsonGenerator generator) throws IOException {
            generator.writeStartObject();
            generator.writeStringField("type", TYPE);
            generator.writeStringField("ts_expires", TS_EXPIRES_NEVER);
            generator.writeStringField("value", value.value());
            generator.writeStringField("service_id", SERVICE_ID_NONE);
            generator.writeStringField("subtype", SUBTYPE);
            generator.writeEndObject();
        }
    }

    /**
     * Dilithium authorization of the transaction. Built by {@link SignatureItemEncoder}.
     *
     * @param pubKeySize length of the raw public key in bytes
     * @param sigSize    length of the raw signature in bytes
     * @param pubKeyB64  base64 of the public key
     * @param sigB64     base64 of the signature
     */
    record Sign(int pubKeySize, int sigSize, String pubKeyB64, String sigB64) implements TransactionItem {
        public static final String TYPE = "sign";
        public static final String SIG_TYPE = "sig_dil";
        public static final int HASH_TYPE = 1;

        public Sign {
            if (pubKeySize <= 0 || sigSize <= 0) {
                throw new IllegalArgumentException("key and signature sizes must be positive");
            }
            Objects.requireNonNull(pubKeyB64, "pubKeyB64");
            Objects.requireNonNull(sigB64, "sigB64");
        }

        public String sigType() {
            return SIG_TYPE;
        }

        public int hashType() {
            return HASH_TYPE;
        }

        @Override
        public String type() {
            return TYPE;
        }

        @Override
        public void writeTo(final JsonGenerator generator) throws IOException {
            generator.writeStartObject();
            generator.writeStringField("type", TYPE);
            generator.writeStringField("sig_type", SIG_TYPE);
            generator.writeNumberField("pub_key_size", pubKeySize);
            generator.writeNumberField("sig_size", sigSize);
            generator.writeNumberField("hash_type", HASH_TYPE);
            generator.writeStringField("pub_key_b64", pubKeyB64);
            generator.writeStringField("sig_b64", sigB64);
            generator.writeEndObject();
        }

        @Override
        public String toString() {
            return "Sign[sigType=" + SIG_TYPE + ", pubKeySize=" + pubKeySize + ", sigSize=" + sigSize + "]";
        }
    }
}
