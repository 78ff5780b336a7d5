// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.rpc;

import sh.cellframe.core.error.RpcException;

/**
 * Moves one request envelope to the node and returns the raw reply.
 * <p>
 * Implementations deliver the complete reply body or fail; they never return
 * partial data and never retry. Implementations must be thread-safe.
 *
 * @see HttpRpcTransport
 */
public interface RpcTransport extends AutoCloseable {

    /**
     * Sends the request and waits for the complete reply.
     *
     * @param request the envelope to send
     * @return the reply body
     * @throws RpcException if the exchange cannot be completed
     */
    byte[] submit(RpcRequest request) throws RpcException;

    /**
     * Creates an HTTP transport with default timeouts.
     *
     * @param url the RPC endpoint
     * @return a new transport
     */
    static RpcTransport http(final String url) {
        return HttpRpcTransport.builder(url).build();
    }

    /**
     * Releases resources held by the transport. The default does nothing.
     */
    @Override
    default void close() {
        // nothing to release
    }
}
