// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.tx;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import sh.cellframe.core.crypto.TransactionSigner;
import sh.cellframe.core.model.TransferRequest;
import sh.cellframe.core.model.UtxoRef;
import sh.cellframe.core.types.Address;
import sh.cellframe.core.types.Amount;

class TransactionAssemblerTest {

    private static final long TS = 1700000000L;
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String PREV_1 = "0x" + "a".repeat(64);
    private static final String PREV_2 = "0x" + "b".repeat(64);
    private static final String PREV_3 = "0x" + "c".repeat(64);

    private final TransactionAssembler assembler =
            new TransactionAssembler(Clock.fixed(Instant.ofEpochSecond(TS), ZoneOffset.UTC));

    private static TransferRequest.Builder simpleTransfer() {
        return TransferRequest.builder()
                .utxo(UtxoRef.of(PREV_1, 0))
                .recipient(Address.of("Tabc"))
                .amount(Amount.of("1.0"))
                .token("CELL");
    }

    @Test
    void singleInputTransferHasTwoItemsThenThreeAfterSigning() throws Exception {
        final TransactionDraft draft = assembler.assemble(simpleTransfer().build());

        assertEquals(2, draft.items().size());
        assertEquals(
                "{\"items\":[{\"type\":\"in\",\"prev_hash\":\"0x" + "A".repeat(64) + "\",\"out_prev_idx\":0},"
                        + "{\"type\":\"out\",\"addr\":\"Tabc\",\"value\":\"1.0\"}],"
                        + "\"ts_created\":1700000000,\"datum_type\":\"tx\"}",
                draft.unsignedJson());

        final TransactionDocument signed = draft.sign(new byte[] {1, 2, 3}, new byte[] {4, 5});

        assertEquals(3, signed.itemCount());
        assertInstanceOf(TransactionItem.Sign.class, signed.items().get(2));
        final JsonNode items = MAPPER.readTree(signed.json()).get("items");
        assertEquals(3, items.size());
        assertEquals("sign", items.get(2).get("type").asText());
        assertEquals(TS, MAPPER.readTree(signed.json()).get("ts_created").asLong());
    }

    @Test
    void inputsKeepCallerOrder() throws Exception {
        final TransferRequest request = simpleTransfer()
                .utxos(List.of(UtxoRef.of(PREV_3, 2), UtxoRef.of(PREV_1, 0), UtxoRef.of(PREV_2, 1)))
                .build();

        final JsonNode items = MAPPER.readTree(assembler.assemble(request).unsignedJson()).get("items");

        assertEquals("0x" + "C".repeat(64), items.get(0).get("prev_hash").asText());
        assertEquals(2, items.get(0).get("out_prev_idx").asLong());
        assertEquals("0x" + "A".repeat(64), items.get(1).get("prev_hash").asText());
        assertEquals("0x" + "B".repeat(64), items.get(2).get("prev_hash").asText());
        assertEquals("out", items.get(3).get("type").asText());
    }

    @Test
    void recipientOutputNeverCarriesToken() throws Exception {
        final TransactionDraft draft = assembler.assemble(simpleTransfer().token("KEL").build());

        final JsonNode out = MAPPER.readTree(draft.unsignedJson()).get("items").get(1);
        assertFalse(out.has("token"));
        assertFalse(draft.unsignedJson().contains("KEL"));
    }

    @Test
    void fullTransferItemOrder() throws Exception {
        final TransferRequest request = simpleTransfer()
                .utxo(UtxoRef.of(PREV_2, 5))
                .networkFee(Amount.of("0.002"), Address.of("Tfee"))
                .validatorFee(Amount.of("0.001"))
                .change(Address.of("Tdef"), Amount.of("3.997"))
                .build();

        final TransactionDocument signed = assembler.assemble(request).sign(new byte[32], new byte[64]);

        final List<String> types = new ArrayList<>();
        MAPPER.readTree(signed.json()).get("items").forEach(item -> types.add(item.get("type").asText()));
        assertEquals(List.of("in", "in", "out", "out", "out_cond", "out", "sign"), types);

        final JsonNode items = MAPPER.readTree(signed.json()).get("items");
        assertEquals("Tabc", items.get(2).get("addr").asText());
        assertEquals("Tfee", items.get(3).get("addr").asText());
        assertEquals("0.002", items.get(3).get("value").asText());
        assertEquals("0.001", items.get(4).get("value").asText());
        assertEquals("Tdef", items.get(5).get("addr").asText());
        assertEquals("3.997", items.get(5).get("value").asText());
    }

    @Test
    void validatorFeeWithoutNetworkFee() {
        final TransactionDraft draft = assembler.assemble(simpleTransfer()
                .validatorFee(Amount.of("0.001"))
                .change(Address.of("Tdef"), Amount.of("1"))
                .build());

        assertInstanceOf(TransactionItem.Out.class, draft.items().get(1));
        assertInstanceOf(TransactionItem.Fee.class, draft.items().get(2));
        assertInstanceOf(TransactionItem.Out.class, draft.items().get(3));
    }

    @Test
    void incompleteOptionalPairsAreSkipped() {
        final TransferRequest request = new TransferRequest(
                List.of(UtxoRef.of(PREV_1, 0)),
                Address.of("Tabc"),
                Amount.of("1.0"),
                Amount.of("0.002"),
                null,
                null,
                Address.of("Tdef"),
                null,
                "CELL");

        assertEquals(2, assembler.assemble(request).items().size());
    }

    @Test
    void emptyUtxoListIsAccepted() {
        final TransactionDraft draft = assembler.assemble(simpleTransfer().utxos(List.of()).build());

        assertEquals(1, draft.items().size());
        assertTrue(draft.unsignedJson().startsWith("{\"items\":[{\"type\":\"out\""));
    }

    @Test
    void missingRequiredFieldsAreRejected() {
        assertThrows(TxBuilderException.class, () -> assembler.assemble(null));
        assertThrows(TxBuilderException.class, () -> assembler.assemble(simpleTransfer().utxos(null).build()));
        assertThrows(TxBuilderException.class, () -> assembler.assemble(simpleTransfer().recipient(null).build()));
        assertThrows(TxBuilderException.class, () -> assembler.assemble(simpleTransfer().amount(null).build()));
        assertThrows(TxBuilderException.class, () -> assembler.assemble(simpleTransfer().token(null).build()));
        assertThrows(TxBuilderException.class, () -> assembler.assemble(simpleTransfer().token(" ").build()));
    }

    @Test
    void signingPayloadIsUnsignedDocument() {
        final TransactionDraft draft = assembler.assemble(simpleTransfer().build());

        assertArrayEquals(draft.unsignedJson().getBytes(StandardCharsets.UTF_8), draft.signingPayload());
        assertTrue(draft.unsignedJson().endsWith(",\"ts_created\":1700000000,\"datum_type\":\"tx\"}"));
    }

    @Test
    void signedDocumentExtendsUnsignedItems() {
        final TransactionDraft draft = assembler.assemble(simpleTransfer().build());
        final String unsigned = draft.unsignedJson();

        final TransactionDocument signed = draft.sign(new byte[] {9}, new byte[] {8});

        final String prefix = unsigned.substring(0, unsigned.indexOf("],\"ts_created\""));
        assertTrue(signed.json().startsWith(prefix + ",{\"type\":\"sign\""));
    }

    @Test
    void draftIsFinalizedOnce() {
        final TransactionDraft draft = assembler.assemble(simpleTransfer().build());
        draft.sign(new byte[] {1}, new byte[] {2});

        assertTrue(draft.isFinalized());
        assertThrows(IllegalStateException.class, () -> draft.sign(new byte[] {1}, new byte[] {2}));
        assertThrows(IllegalStateException.class, draft::buildUnsigned);
    }

    @Test
    void failedSignatureEncodingLeavesDraftUsable() {
        final TransactionDraft draft = assembler.assemble(simpleTransfer().build());

        assertThrows(TxBuilderException.class, () -> draft.sign(new byte[0], new byte[] {2}));
        assertFalse(draft.isFinalized());

        final TransactionDocument unsigned = draft.buildUnsigned();
        assertFalse(unsigned.isSigned());
        assertEquals(draft.unsignedJson(), unsigned.json());
    }

    @Test
    void signerReceivesUnsignedPayload() throws Exception {
        final TransactionDraft draft = assembler.assemble(simpleTransfer().build());
        final RecordingSigner signer = new RecordingSigner(new byte[] {7, 7, 7, 7}, new byte[] {1, 2, 3, 4, 5});

        final TransactionDocument signed = draft.sign(signer);

        assertArrayEquals(draft.signingPayload(), signer.signedPayload);
        final JsonNode sign = MAPPER.readTree(signed.json()).get("items").get(2);
        assertEquals(4, sign.get("pub_key_size").asInt());
        assertEquals(5, sign.get("sig_size").asInt());
        assertArrayEquals(new byte[] {1, 2, 3, 4, 5}, Base64.getDecoder().decode(sign.get("sig_b64").asText()));
    }

    private static final class RecordingSigner implements TransactionSigner {
        private final byte[] publicKey;
        private final byte[] signature;
        private byte[] signedPayload;

        RecordingSigner(final byte[] publicKey, final byte[] signature) {
            this.publicKey = publicKey;
            this.signature = signature;
        }

        @Override
        public byte[] publicKey() {
            return publicKey;
        }

        @Override
        public byte[] sign(final byte[] payload) {
            this.signedPayload = payload;
            return signature;
        }
    }
}
