// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static sh.cellframe.rpc.internal.RpcUtils.MAPPER;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

class RpcResponseTest {

    record Balance(String token, String coins) {
    }

    private static RpcResponse withResult(final String json) throws Exception {
        return new RpcResponse(0, MAPPER.readTree(json), 1L, 1);
    }

    @Test
    void convertsResultToRecord() throws Exception {
        RpcResponse response = withResult("{\"token\":\"CELL\",\"coins\":\"12.5\"}");

        assertEquals(new Balance("CELL", "12.5"), response.resultAs(Balance.class));
    }

    @Test
    void convertsResultWithTypeReference() throws Exception {
        RpcResponse response = withResult("[{\"a\":\"1\"},{\"a\":\"2\"}]");

        List<Map<String, String>> rows = response.resultAs(new TypeReference<List<Map<String, String>>>() {});

        assertEquals("2", rows.get(1).get("a"));
    }

    @Test
    void incompatibleResultThrows() throws Exception {
        RpcResponse response = withResult("[1,2]");

        assertThrows(IllegalArgumentException.class, () -> response.resultAs(Balance.class));
    }

    @Test
    void findTextSearchesNestedResult() throws Exception {
        RpcResponse response = withResult("{\"tx\":{\"status\":\"accepted\",\"hash\":\"0xDEAD\"}}");

        assertEquals("0xDEAD", response.findText("hash"));
        assertNull(response.findText("missing"));
    }

    @Test
    void findTextIgnoresContainers() throws Exception {
        RpcResponse response = withResult("{\"hash\":{\"nested\":true}}");

        assertNull(response.findText("hash"));
    }

    @Test
    void absentResultYieldsNulls() {
        RpcResponse response = new RpcResponse(0, null, 1L, 0);

        assertNull(response.resultAs(Balance.class));
        assertNull(response.findText("hash"));
    }

    @Test
    void resultCannotBeChangedThroughReferences() throws Exception {
        ObjectNode source = (ObjectNode) MAPPER.readTree("{\"hash\":\"0xAA\"}");
        RpcResponse response = new RpcResponse(0, source, 1L, 1);

        source.put("hash", "0xBB");
        ((ObjectNode) response.result()).put("hash", "0xCC");

        assertEquals("0xAA", response.findText("hash"));
        assertEquals("0xAA", response.result().get("hash").asText());
    }
}
