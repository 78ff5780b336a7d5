// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.rpc;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import sh.cellframe.rpc.internal.RpcUtils;

/**
 * Request envelope of the Cellframe public RPC.
 * <p>
 * Serializes as {@code {"method":..,"subcommand":..,"arguments":..,"id":..}} in that
 * order. An unused {@code subcommand} is sent as the empty string and unused
 * {@code arguments} as an empty object; the node rejects envelopes lacking either.
 *
 * @param method     the command, for example {@code wallet}
 * @param subcommand the sub-command, for example {@code info}, or empty
 * @param arguments  named arguments of the command
 * @param id         request identifier echoed in the reply
 * @since 0.1.0
 */
@JsonPropertyOrder({"method", "subcommand", "arguments", "id"})
public record RpcRequest(String method, String subcommand, JsonNode arguments, long id) {

    public RpcRequest {
        method = RpcUtils.requireText(method, "method");
        subcommand = subcommand == null ? "" : subcommand;
        arguments = arguments == null ? RpcUtils.newObject() : arguments.deepCopy();
    }

    /**
     * Creates an envelope, applying the protocol defaults.
     *
     * @param method     the command
     * @param subcommand the sub-command, {@code null} for none
     * @param arguments  the arguments, {@code null} for none
     * @param id         the request id
     * @return the envelope
     */
    public static RpcRequest of(
            final String method,
            final @Nullable String subcommand,
            final @Nullable JsonNode arguments,
            final long id) {
        return new RpcRequest(method, subcommand, arguments, id);
    }

    public static RpcRequest of(final String method, final long id) {
        return new RpcRequest(method, null, null, id);
    }

    /**
     * @return a copy of the arguments; changes to it do not affect this request
     */
    @Override
    public JsonNode arguments() {
        return arguments.deepCopy();
    }
}
