// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.error;

/**
 * Thrown when the bytes returned by the RPC endpoint cannot be turned into a reply.
 * <p>
 * A reply that parses as a JSON object but lacks some of its fields is not an error;
 * only unparseable bytes and non-object documents are.
 *
 * @since 0.1.0
 */
public final class RpcDecodingException extends CellframeException {

    /** What was wrong with the reply bytes. */
    public enum Kind {
        /** Empty body or invalid JSON. */
        MALFORMED,
        /** Valid JSON whose root is not an object. */
        NOT_AN_OBJECT
    }

    private final Kind kind;
    private final String body;

    public RpcDecodingException(final Kind kind, final String message, final String body, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.body = body;
    }

    public RpcDecodingException(final Kind kind, final String message, final String body) {
        this(kind, message, body, null);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns the raw reply text, possibly empty.
     *
     * @return the reply body as received
     */
    public String body() {
        return body;
    }

    public boolean isMalformed() {
        return kind == Kind.MALFORMED;
    }

    public boolean isNotAnObject() {
        return kind == Kind.NOT_AN_OBJECT;
    }
}
