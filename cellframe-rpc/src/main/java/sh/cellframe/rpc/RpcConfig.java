// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.rpc;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

import sh.cellframe.core.chain.CellframeNetworks;

/**
 * Connection settings of an {@link HttpRpcTransport}.
 *
 * @param url            the RPC endpoint
 * @param connectTimeout bound on establishing the connection, default 10 s
 * @param readTimeout    bound on the whole exchange once connected, default 30 s
 * @param headers        extra HTTP headers sent with every request
 */
public record RpcConfig(
        String url,
        Duration connectTimeout,
        Duration readTimeout,
        Map<String, String> headers) {

    public static final Duration DEFAULT_CONNECT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_READ = Duration.ofSeconds(30);

    public RpcConfig {
        Objects.requireNonNull(url, "url");
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT : connectTimeout;
        readTimeout = readTimeout == null ? DEFAULT_READ : readTimeout;
        if (connectTimeout.isNegative() || connectTimeout.isZero()
                || readTimeout.isNegative() || readTimeout.isZero()) {
            throw new IllegalArgumentException("timeouts must be positive");
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static RpcConfig withDefaults(final String url) {
        return new RpcConfig(url, DEFAULT_CONNECT, DEFAULT_READ, Map.of());
    }

    /**
     * @return defaults pointing at the public Cellframe endpoint
     */
    public static RpcConfig publicEndpoint() {
        return withDefaults(CellframeNetworks.DEFAULT_RPC_URL);
    }
}
