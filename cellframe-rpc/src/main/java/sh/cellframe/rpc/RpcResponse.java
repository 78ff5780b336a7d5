// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.rpc;

import static sh.cellframe.rpc.internal.RpcUtils.MAPPER;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * Reply envelope of the Cellframe public RPC.
 * <p>
 * Every field is optional on the wire. Missing numbers read as {@code 0} and a
 * missing {@code result} as {@code null}. The schema of {@code result} depends on
 * the command; use {@link #resultAs(Class)} or {@link #findText(String)} for
 * command-specific handling.
 *
 * @param type    reply type code
 * @param result  the command result, or {@code null} if absent
 * @param id      the request id echoed by the node
 * @param version protocol version of the node
 * @since 0.1.0
 */
public record RpcResponse(int type, @Nullable JsonNode result, long id, int version) {

    public RpcResponse {
        result = result == null ? null : result.deepCopy();
    }

    /**
     * @return a copy of the result, or {@code null}; changes to it do not affect this response
     */
    @Override
    public @Nullable JsonNode result() {
        return result == null ? null : result.deepCopy();
    }

    public boolean hasResult() {
        return result != null;
    }

    /**
     * Converts the result to the specified type using Jackson.
     *
     * @param type the target class type
     * @param <T>  the target type
     * @return the converted result, or {@code null} if there is no result
     * @throws IllegalArgumentException if the result cannot be converted
     */
    public <T> @Nullable T resultAs(final Class<T> type) {
        if (result == null) {
            return null;
        }
        try {
            return MAPPER.treeToValue(result, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot convert result to " + type.getSimpleName(), e);
        }
    }

    public <T> @Nullable T resultAs(final TypeReference<T> typeRef) {
        if (result == null) {
            return null;
        }
        return MAPPER.convertValue(result, typeRef);
    }

    /**
     * Finds the first field named {@code field} anywhere in the result and returns
     * its text. Nested objects and arrays are searched depth first.
     *
     * @param field the field name, for example {@code hash}
     * @return the text value, or {@code null} if absent or not a scalar
     */
    public @Nullable String findText(final String field) {
        if (result == null) {
            return null;
        }
        final JsonNode value = result.findValue(field);
        if (value == null || !value.isValueNode() || value.isNull()) {
            return null;
        }
        return value.asText();
    }
}
