// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.tx;

import sh.cellframe.core.error.TxnException;

/** Thrown when a transaction cannot be assembled from the parameters it was given. */
public final class TxBuilderException extends TxnException {
    public TxBuilderException(final String message) {
        super(message);
    }

    public TxBuilderException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
