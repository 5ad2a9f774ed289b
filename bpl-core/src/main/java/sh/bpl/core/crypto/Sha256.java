// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * SHA-256 over byte arrays and UTF-8 text.
 *
 * <p>Used for transaction ids and signing hashes, for deriving a private key from a
 * passphrase, and as the inner hash of address derivation. One {@link MessageDigest}
 * is kept per thread; pooled threads that outlive a class loader should call
 * {@link #cleanup()}.
 *
 * @since 1.0
 */
public final class Sha256 {

    /** Digest size in bytes. */
    public static final int DIGEST_LENGTH = 32;

    private static final ThreadLocal<MessageDigest> DIGESTS = ThreadLocal.withInitial(Sha256::newDigest);

    private Sha256() {
    }

    /**
     * Hashes {@code data}.
     *
     * @param data bytes to hash
     * @return the 32-byte digest
     */
    public static byte[] hash(final byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        final MessageDigest md = DIGESTS.get();
        md.reset();
        return md.digest(data);
    }

    /**
     * Hashes the UTF-8 encoding of {@code text}. This is how a passphrase becomes a
     * private scalar.
     *
     * @param text text to hash
     * @return the 32-byte digest
     */
    public static byte[] hashUtf8(final String text) {
        Objects.requireNonNull(text, "text cannot be null");
        return hash(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Drops this thread's cached digest.
     */
    public static void cleanup() {
        DIGESTS.remove();
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JDK without SHA-256", e);
        }
    }
}
