// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.crypto;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import sh.bpl.primitives.Hex;

class Sha256Test {

    @AfterEach
    void cleanup() {
        Sha256.cleanup();
    }

    @Test
    void hashesEmptyInput() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                Hex.encode(Sha256.hash(new byte[0])));
    }

    @Test
    void hashesAbc() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                Hex.encode(Sha256.hash("abc".getBytes(StandardCharsets.US_ASCII))));
    }

    @Test
    void hashesUtf8Text() {
        assertArrayEquals(Sha256.hash("pässphrase".getBytes(StandardCharsets.UTF_8)), Sha256.hashUtf8("pässphrase"));
        assertEquals(Sha256.DIGEST_LENGTH, Sha256.hashUtf8("").length);
    }

    @Test
    void repeatedCallsAreIndependent() {
        byte[] first = Sha256.hash(new byte[] {1, 2, 3});
        Sha256.hash(new byte[] {9});
        assertArrayEquals(first, Sha256.hash(new byte[] {1, 2, 3}));
    }
}
