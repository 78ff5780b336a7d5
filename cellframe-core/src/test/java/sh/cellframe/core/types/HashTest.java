// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.types;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class HashTest {

    @Test
    void allZeroHashRendersAsSixtyFourZeros() {
        assertEquals("0x" + "0".repeat(64), Hash.fromBytes(new byte[32]).value());
    }

    @Test
    void leadingFfByteRendersUppercaseFirst() {
        final byte[] bytes = new byte[32];
        bytes[0] = (byte) 0xFF;

        final String formatted = Hash.format(bytes);

        assertTrue(formatted.startsWith("0xFF"));
        assertEquals("0xFF" + "0".repeat(62), formatted);
    }

    @Test
    void byteOrderIsPreserved() {
        final byte[] bytes = new byte[32];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = (byte) i;
        }

        final Hash hash = Hash.fromBytes(bytes);

        assertTrue(hash.value().startsWith("0x000102030405"));
        assertTrue(hash.value().endsWith("1D1E1F"));
        assertArrayEquals(bytes, hash.toBytes());
    }

    @Test
    void lowercaseInputIsNormalized() {
        final Hash hash = new Hash("0x" + "ab".repeat(32));
        assertEquals("0x" + "AB".repeat(32), hash.value());
        assertEquals(new Hash("0x" + "AB".repeat(32)), hash);
    }

    @Test
    void rejectsWrongLengthAndMissingPrefix() {
        assertThrows(IllegalArgumentException.class, () -> new Hash("0x1234"));
        assertThrows(IllegalArgumentException.class, () -> new Hash("a".repeat(64)));
        assertThrows(IllegalArgumentException.class, () -> new Hash("0x" + "g".repeat(64)));
        assertThrows(IllegalArgumentException.class, () -> Hash.format(new byte[31]));
        assertThrows(NullPointerException.class, () -> new Hash(null));
    }
}
