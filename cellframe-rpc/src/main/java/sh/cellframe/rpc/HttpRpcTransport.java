// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.rpc;

import static sh.cellframe.rpc.internal.RpcUtils.MAPPER;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.cellframe.core.DebugLogger;
import sh.cellframe.core.LogFormatter;
import sh.cellframe.core.error.RpcException;

/**
 * {@link RpcTransport} over HTTP POST using {@code java.net.http}.
 * <p>
 * Each {@link #submit(RpcRequest)} sends one {@code application/json} request and
 * blocks until the full body has arrived or the read timeout expires. The body
 * of every completed exchange is returned, whatever the status, so that a node's
 * error envelope reaches {@link RpcResponseDecoder}. I/O failures, and a non-2xx
 * reply with no body at all, raise {@link RpcException}.
 *
 * <pre>{@code
 * RpcTransport transport = HttpRpcTransport.builder("http://rpc.cellframe.net/connect")
 *     .readTimeout(Duration.ofSeconds(15))
 *     .build();
 * }</pre>
 */
public final class HttpRpcTransport implements RpcTransport {
    private static final Logger LOG = LoggerFactory.getLogger(HttpRpcTransport.class);

    private final RpcConfig config;
    private final URI uri;
    private final HttpClient httpClient;

    private HttpRpcTransport(final RpcConfig config) {
        this.config = config;
        this.uri = URI.create(config.url());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
    }

    public static Builder builder(final String url) {
        return new Builder(url);
    }

    public static HttpRpcTransport create(final RpcConfig config) {
        return new HttpRpcTransport(config);
    }

    public RpcConfig config() {
        return config;
    }

    @Override
    public byte[] submit(final RpcRequest request) throws RpcException {
        final byte[] payload = serialize(request);
        final HttpRequest httpRequest = buildRequest(payload);

        final long start = System.nanoTime();
        final HttpResponse<byte[]> response = execute(httpRequest, request, start);
        final long durationMicros = (System.nanoTime() - start) / 1_000L;

        final int status = response.statusCode();
        final byte[] body = response.body() == null ? new byte[0] : response.body();
        if (status < 200 || status >= 300) {
            DebugLogger.logRpc(
                    LogFormatter.formatRpcError(request.method(), status, "HTTP " + status, durationMicros));
            if (body.length == 0) {
                throw new RpcException(
                        RpcException.HTTP_ERROR,
                        "HTTP error for method " + request.method() + ": " + status,
                        null,
                        request.id());
            }
            LOG.debug("rpc {} returned HTTP {} with {} bytes", request.method(), status, body.length);
            return body;
        }

        DebugLogger.logRpc(LogFormatter.formatRpc(request.method(), request.subcommand(), durationMicros));
        LOG.debug("rpc {} returned {} bytes", request.method(), body.length);
        return body;
    }

    private byte[] serialize(final RpcRequest request) throws RpcException {
        try {
            return MAPPER.writeValueAsBytes(request);
        } catch (JsonProcessingException e) {
            throw new RpcException(
                    RpcException.SERIALIZATION_ERROR,
                    "Unable to serialize RPC request for " + request.method(),
                    null,
                    request.id(),
                    e);
        }
    }

    private HttpRequest buildRequest(final byte[] payload) {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .header("Content-Type", "application/json")
                .timeout(config.readTimeout())
                .POST(HttpRequest.BodyPublishers.ofByteArray(payload));

        for (Map.Entry<String, String> entry : config.headers().entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }

        return builder.build();
    }

    private HttpResponse<byte[]> execute(final HttpRequest httpRequest, final RpcRequest request, final long start)
            throws RpcException {
        try {
            return httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw networkError(request, "Interrupted during RPC call", start, e);
        } catch (HttpTimeoutException e) {
            throw networkError(request, "RPC call timed out", start, e);
        } catch (IOException e) {
            throw networkError(request, "Network error during RPC call", start, e);
        }
    }

    private static RpcException networkError(
            final RpcRequest request, final String message, final long start, final Exception cause) {
        final long durationMicros = (System.nanoTime() - start) / 1_000L;
        DebugLogger.logRpc(
                LogFormatter.formatRpcError(request.method(), RpcException.NETWORK_ERROR, message, durationMicros));
        return new RpcException(RpcException.NETWORK_ERROR, message, null, request.id(), cause);
    }

    public static final class Builder {
        private final String url;
        private Duration connectTimeout = RpcConfig.DEFAULT_CONNECT;
        private Duration readTimeout = RpcConfig.DEFAULT_READ;
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(final String url) {
            this.url = url;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            if (readTimeout != null) {
                this.readTimeout = readTimeout;
            }
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        public HttpRpcTransport build() {
            return new HttpRpcTransport(new RpcConfig(url, connectTimeout, readTimeout, new LinkedHashMap<>(headers)));
        }
    }
}
