// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.rpc;

import static sh.cellframe.rpc.internal.RpcUtils.MAPPER;

import java.io.IOException;
import java.util.Locale;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.cellframe.core.error.RpcDecodingException;
import sh.cellframe.rpc.internal.RpcUtils;

/**
 * Parses raw reply bytes into an {@link RpcResponse}.
 * <p>
 * Bytes that are not JSON (including an empty body) fail with kind
 * {@link RpcDecodingException.Kind#MALFORMED}; valid JSON that is not an object
 * fails with {@link RpcDecodingException.Kind#NOT_AN_OBJECT}. Missing or
 * non-numeric envelope fields are not errors.
 */
public final class RpcResponseDecoder {
    private static final Logger LOG = LoggerFactory.getLogger(RpcResponseDecoder.class);
    private static final int PREVIEW_CHARS = 512;

    private RpcResponseDecoder() {
    }

    /**
     * @param body the raw reply body
     * @return the decoded envelope
     * @throws RpcDecodingException if the body is not a JSON object
     */
    public static RpcResponse decode(final byte[] body) {
        if (body == null || body.length == 0) {
            throw new RpcDecodingException(RpcDecodingException.Kind.MALFORMED, "Empty RPC reply", "");
        }

        final JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (IOException e) {
            throw new RpcDecodingException(
                    RpcDecodingException.Kind.MALFORMED,
                    "RPC reply is not valid JSON",
                    RpcUtils.preview(body, PREVIEW_CHARS),
                    e);
        }
        if (root == null || root.isMissingNode()) {
            throw new RpcDecodingException(
                    RpcDecodingException.Kind.MALFORMED, "RPC reply has no content", RpcUtils.preview(body, PREVIEW_CHARS));
        }
        if (!root.isObject()) {
            throw new RpcDecodingException(
                    RpcDecodingException.Kind.NOT_AN_OBJECT,
                    "RPC reply is a JSON " + root.getNodeType().name().toLowerCase(Locale.ROOT)
                            + ", expected an object",
                    RpcUtils.preview(body, PREVIEW_CHARS));
        }

        final JsonNode result = root.get("result");
        final RpcResponse response = new RpcResponse(
                root.path("type").asInt(0),
                result == null || result.isNull() ? null : result,
                root.path("id").asLong(0L),
                root.path("version").asInt(0));
        LOG.debug("decoded reply id={} type={} hasResult={}", response.id(), response.type(), response.hasResult());
        return response;
    }
}
