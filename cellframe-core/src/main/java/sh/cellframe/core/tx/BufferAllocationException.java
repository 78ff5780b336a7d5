// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.tx;

import sh.cellframe.core.error.TxnException;

/**
 * Thrown when the document buffer of a {@link TransactionItemBuilder} cannot grow.
 * <p>
 * The builder discards its partial content before this is thrown.
 */
public final class BufferAllocationException extends TxnException {
    private final long requestedCapacity;

    public BufferAllocationException(final String message, final long requestedCapacity) {
        super(message);
        this.requestedCapacity = requestedCapacity;
    }

    public BufferAllocationException(final String message, final long requestedCapacity, final Throwable cause) {
        super(message, cause);
        this.requestedCapacity = requestedCapacity;
    }

    /**
     * @return the capacity in bytes the builder tried to reach
     */
    public long requestedCapacity() {
        return requestedCapacity;
    }
}
