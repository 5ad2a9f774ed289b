// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HexTest {
    @Test
    @DisplayName("Encoding empty and single bytes")
    void testEncodeBasic() {
        assertEquals("", Hex.encode(new byte[] {}));
        assertEquals("00", Hex.encode(new byte[] {0x00}));
        assertEquals("ff", Hex.encode(new byte[] {(byte) 0xFF}));
    }

    @Test
    void testEncodeMultipleBytes() {
        byte[] bytes = new byte[] {0x01, 0x23, (byte) 0xAB, (byte) 0xCD};
        assertEquals("0123abcd", Hex.encode(bytes));
    }

    @Test
    void testDecodeCaseInsensitivity() {
        byte[] expected = new byte[] {0x0A, (byte) 0xBC, (byte) 0xDE, (byte) 0xF0};
        assertArrayEquals(expected, Hex.decode("0AbCdEf0"));
        assertArrayEquals(expected, Hex.decode("0x0aBcDeF0"));
    }

    @Test
    void testDecodeEmpty() {
        assertArrayEquals(new byte[] {}, Hex.decode(""));
        assertArrayEquals(new byte[] {}, Hex.decode("0x"));
    }

    @Test
    void testDecodeInvalidInputs() {
        assertThrows(IllegalArgumentException.class, () -> Hex.decode(null));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("abc"));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("zz"));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0é"));
        assertThrows(IllegalArgumentException.class, () -> Hex.encode(null));
    }

    @Test
    void testIsValid() {
        assertTrue(Hex.isValid(""));
        assertTrue(Hex.isValid("deadBEEF"));
        assertTrue(Hex.isValid("0x00"));
        assertFalse(Hex.isValid(null));
        assertFalse(Hex.isValid("0"));
        assertFalse(Hex.isValid("0g"));
    }

    @Test
    void testRoundTripAllByteValues() {
        byte[] all = new byte[256];
        for (int i = 0; i < all.length; i++) {
            all[i] = (byte) i;
        }
        assertArrayEquals(all, Hex.decode(Hex.encode(all)));
    }
}
