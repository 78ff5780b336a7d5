// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.rpc;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static sh.cellframe.rpc.internal.RpcUtils.MAPPER;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.cellframe.core.crypto.SignatureSizes;
import sh.cellframe.core.crypto.TransactionSigner;
import sh.cellframe.core.model.TransferRequest;
import sh.cellframe.core.model.UtxoRef;
import sh.cellframe.core.tx.TransactionAssembler;
import sh.cellframe.core.tx.TxBuilderException;
import sh.cellframe.core.types.Address;
import sh.cellframe.core.types.Amount;

@ExtendWith(MockitoExtension.class)
class TransferClientTest {

    private static final long TS = 1700000000L;
    private static final String HASH = "0x" + "5A".repeat(32);

    @Mock
    private RpcTransport transport;

    @Mock
    private TransactionSigner signer;

    private TransferClient client;

    @BeforeEach
    void setUp() {
        final TransactionAssembler assembler =
                new TransactionAssembler(Clock.fixed(Instant.ofEpochSecond(TS), ZoneOffset.UTC));
        client = new TransferClient(assembler, new CellframeRpcClient(transport));
    }

    private static TransferRequest request() {
        return TransferRequest.builder()
                .utxo(UtxoRef.of("0x" + "1".repeat(64), 1))
                .recipient(Address.of("Tabc"))
                .amount(Amount.of("1.0"))
                .validatorFee(Amount.of("0.001"))
                .change(Address.of("Tdef"), Amount.of("0.999"))
                .token(TransferRequest.DEFAULT_TOKEN)
                .build();
    }

    @Test
    void assemblesSignsAndSubmits() throws Exception {
        final byte[] publicKey = new byte[SignatureSizes.DILITHIUM_PUBLIC_KEY];
        final byte[] signature = new byte[SignatureSizes.DILITHIUM_SIGNATURE];
        publicKey[0] = 1;
        signature[0] = 2;
        when(signer.publicKey()).thenReturn(publicKey);
        when(signer.sign(any())).thenReturn(signature);
        when(transport.submit(any())).thenReturn(
                ("{\"type\":0,\"result\":{\"hash\":\"" + HASH + "\"},\"id\":1,\"version\":1}")
                        .getBytes(StandardCharsets.UTF_8));

        final SubmitResult result = client.send(request(), signer, "Backbone", "main");

        assertEquals(HASH, result.hash());

        final ArgumentCaptor<RpcRequest> requestCaptor = ArgumentCaptor.forClass(RpcRequest.class);
        verify(transport).submit(requestCaptor.capture());
        final JsonNode envelope = MAPPER.readTree(MAPPER.writeValueAsString(requestCaptor.getValue()));
        assertEquals("tx_create_json", envelope.get("method").asText());
        final JsonNode txObj = envelope.get("arguments").get("tx_obj");
        assertEquals(TS, txObj.get("ts_created").asLong());
        assertEquals("tx", txObj.get("datum_type").asText());

        final List<String> types = new ArrayList<>();
        txObj.get("items").forEach(item -> types.add(item.get("type").asText()));
        assertEquals(List.of("in", "out", "out_cond", "out", "sign"), types);

        final JsonNode sign = txObj.get("items").get(4);
        assertEquals(2592, sign.get("pub_key_size").asInt());
        assertEquals(4627, sign.get("sig_size").asInt());
        assertArrayEquals(signature, Base64.getDecoder().decode(sign.get("sig_b64").asText()));
    }

    @Test
    void signerSeesUnsignedDocument() throws Exception {
        final ArgumentCaptor<byte[]> payloadCaptor = ArgumentCaptor.forClass(byte[].class);
        when(signer.publicKey()).thenReturn(new byte[] {1});
        when(signer.sign(payloadCaptor.capture())).thenReturn(new byte[] {2});
        when(transport.submit(any())).thenReturn("{}".getBytes(StandardCharsets.UTF_8));

        client.send(request(), signer, "Backbone", "main");

        final JsonNode unsigned = MAPPER.readTree(new String(payloadCaptor.getValue(), StandardCharsets.UTF_8));
        assertEquals(4, unsigned.get("items").size());
        assertEquals(TS, unsigned.get("ts_created").asLong());
    }

    @Test
    void incompleteRequestNeverReachesNetwork() {
        final TransferRequest missingAmount = TransferRequest.builder()
                .utxo(UtxoRef.of("0x" + "1".repeat(64), 1))
                .recipient(Address.of("Tabc"))
                .token("CELL")
                .build();

        assertThrows(TxBuilderException.class, () -> client.send(missingAmount, signer, "Backbone", "main"));

        verifyNoInteractions(transport, signer);
    }

    @Test
    void emptySignatureNeverReachesNetwork() {
        when(signer.publicKey()).thenReturn(new byte[] {1});
        when(signer.sign(any())).thenReturn(new byte[0]);

        assertThrows(TxBuilderException.class, () -> client.send(request(), signer, "Backbone", "main"));

        verifyNoInteractions(transport);
    }

    @Test
    void requiresNetworkAndChain() {
        assertThrows(IllegalArgumentException.class, () -> client.send(request(), signer, null, "main"));
        assertThrows(IllegalArgumentException.class, () -> client.send(request(), signer, "Backbone", ""));

        verifyNoInteractions(transport, signer);
    }
}
