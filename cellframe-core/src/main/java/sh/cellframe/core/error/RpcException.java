// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.error;

/**
 * Exception thrown when a JSON-RPC exchange with the Cellframe node cannot be completed.
 *
 * <p>
 * <strong>Codes used by this library:</strong>
 * <ul>
 * <li><strong>-32700</strong>: the request could not be serialized</li>
 * <li><strong>-32000</strong>: network error (connect, timeout, reset)</li>
 * <li><strong>-32001</strong>: the endpoint answered with a non-2xx HTTP status and an empty body</li>
 * </ul>
 *
 * <p>
 * The {@code data} field carries optional error detail; it is {@code null} for transport failures.
 */
public final class RpcException extends CellframeException {

    /** Request serialization failed. */
    public static final int SERIALIZATION_ERROR = -32700;

    /** Network-level failure. */
    public static final int NETWORK_ERROR = -32000;

    /** Non-2xx HTTP status with no body to decode. */
    public static final int HTTP_ERROR = -32001;

    private final int code;
    private final String data;
    private final Long requestId;

    public RpcException(
            final int code,
            final String message,
            final String data,
            final Long requestId,
            final Throwable cause) {
        super(augmentMessage(message, requestId), cause);
        this.code = code;
        this.data = data;
        this.requestId = requestId;
    }

    public RpcException(final int code, final String message, final String data, final Long requestId) {
        this(code, message, data, requestId, null);
    }

    public int code() {
        return code;
    }

    public String data() {
        return data;
    }

    public Long requestId() {
        return requestId;
    }

    public boolean isNetworkError() {
        return code == NETWORK_ERROR;
    }

    public boolean isHttpError() {
        return code == HTTP_ERROR;
    }

    @Override
    public String toString() {
        return "RpcException{"
                + "code="
                + code
                + ", message="
                + getMessage()
                + ", data="
                + data
                + ", requestId="
                + requestId
                + "}";
    }

    private static String augmentMessage(final String message, final Long requestId) {
        if (requestId == null || message == null || message.isBlank()) {
            return message;
        }

        return "[requestId=" + requestId + "] " + message;
    }
}
