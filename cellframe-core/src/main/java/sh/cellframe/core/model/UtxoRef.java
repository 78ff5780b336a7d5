// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.model;

import java.util.Objects;

import sh.cellframe.core.types.Hash;

/**
 * Reference to a spendable output of an earlier transaction.
 *
 * @param prevHash hash of the transaction holding the output
 * @param prevIdx  index of the output within that transaction, an unsigned 32-bit value
 * @since 0.1.0
 */
public record UtxoRef(Hash prevHash, long prevIdx) {
    /** Largest output index representable on the wire. */
    public static final long MAX_INDEX = 0xFFFF_FFFFL;

    public UtxoRef {
        Objects.requireNonNull(prevHash, "prevHash");
        if (prevIdx < 0 || prevIdx > MAX_INDEX) {
            throw new IllegalArgumentException("prevIdx must be an unsigned 32-bit value: " + prevIdx);
        }
    }

    public static UtxoRef of(final String prevHash, final long prevIdx) {
        return new UtxoRef(new Hash(prevHash), prevIdx);
    }
}
