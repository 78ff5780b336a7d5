// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.rpc.internal;

import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;

/**
 * Internal helpers shared by the RPC classes.
 * <p>
 * Not part of the public API.
 */
public final class RpcUtils {

    /**
     * Shared, thread-safe mapper. Rejects trailing content after the reply document.
     */
    public static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private RpcUtils() {
        // Utility class - prevent instantiation
    }

    public static ObjectNode newObject() {
        return JsonNodeFactory.instance.objectNode();
    }

    /**
     * Ensures a required string argument is present.
     *
     * @param value the argument value
     * @param name  the argument name used in the error message
     * @return {@code value}
     * @throws IllegalArgumentException if {@code value} is null or blank
     */
    public static String requireText(final @Nullable String value, final String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    /**
     * Renders a reply body for error messages, cut at {@code maxChars}.
     */
    public static String preview(final byte[] body, final int maxChars) {
        if (body == null) {
            return "";
        }
        final String text = new String(body, StandardCharsets.UTF_8);
        return text.length() <= maxChars ? text : text.substring(0, maxChars) + "...";
    }
}
