// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class UtxoRefTest {

    private static final String PREV = "0x" + "1f".repeat(32);

    @Test
    void acceptsFullUnsignedRange() {
        assertEquals(0L, UtxoRef.of(PREV, 0).prevIdx());
        assertEquals(4294967295L, UtxoRef.of(PREV, 4294967295L).prevIdx());
    }

    @Test
    void rejectsIndexOutsideUint32() {
        assertThrows(IllegalArgumentException.class, () -> UtxoRef.of(PREV, -1));
        assertThrows(IllegalArgumentException.class, () -> UtxoRef.of(PREV, 4294967296L));
    }

    @Test
    void requiresHash() {
        assertThrows(NullPointerException.class, () -> new UtxoRef(null, 0));
    }
}
