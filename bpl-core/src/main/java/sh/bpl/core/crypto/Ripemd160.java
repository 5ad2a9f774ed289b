// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.crypto;

import java.util.Objects;

import org.bouncycastle.crypto.digests.RIPEMD160Digest;

/**
 * RIPEMD-160 hashing, used for address derivation.
 *
 * <p>The JDK ships no RIPEMD-160 provider, so this delegates to Bouncy Castle's
 * lightweight digest. A fresh digest is created per call; the class is thread-safe.
 *
 * @since 1.0
 */
public final class Ripemd160 {

    public static final int DIGEST_LENGTH = 20;

    private Ripemd160() {
        // Utility class
    }

    /**
     * Computes the RIPEMD-160 hash of the input.
     *
     * @param input the data to hash
     * @return 20-byte hash
     * @throws NullPointerException if input is null
     */
    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");
        final RIPEMD160Digest digest = new RIPEMD160Digest();
        digest.update(input, 0, input.length);
        final byte[] out = new byte[DIGEST_LENGTH];
        digest.doFinal(out, 0);
        return out;
    }
}
