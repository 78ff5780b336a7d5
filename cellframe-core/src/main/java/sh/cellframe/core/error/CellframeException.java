// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.error;

/**
 * Base runtime exception for all failures of the transfer pipeline.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * CellframeException
 * ├── {@link RpcException} - transport failures (network, HTTP status)
 * ├── {@link RpcDecodingException} - reply bytes that are not a JSON object
 * └── {@link TxnException} - transaction assembly failures
 *     ├── {@link sh.cellframe.core.tx.TxBuilderException TxBuilderException} - missing or invalid parameters, misuse of a builder
 *     └── {@link sh.cellframe.core.tx.BufferAllocationException BufferAllocationException} - document buffer could not grow
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     client.send(request, signer, "Backbone", "main");
 * } catch (TxnException e) {
 *     // Nothing was sent
 * } catch (RpcException e) {
 *     // Network or HTTP failure
 * } catch (CellframeException e) {
 *     // Catch-all
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class CellframeException extends RuntimeException
        permits RpcDecodingException,
        RpcException,
        TxnException {

    public CellframeException(final String message) {
        super(message);
    }

    public CellframeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
