// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.error;

/**
 * Base class for transaction assembly and signing failures.
 * <p>
 * Non-sealed so that wallet integrations can add their own failure types
 * (for example insufficient balance reported by a UTXO selector).
 *
 * @since 0.1.0
 */
public non-sealed class TxnException extends CellframeException {

    public TxnException(final String message) {
        super(message);
    }

    public TxnException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
