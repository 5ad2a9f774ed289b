// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import javax.security.auth.Destroyable;

import org.bouncycastle.math.ec.FixedPointCombMultiplier;

import sh.bpl.primitives.Hex;

/**
 * secp256k1 private key.
 *
 * <p>Accounts derive their key from a passphrase: the scalar is
 * {@code SHA-256(UTF-8(passphrase))} and the account's public key is the compressed
 * point {@code scalar * G}.
 *
 * <pre>{@code
 * PrivateKey key = PrivateKey.fromPassphrase("my secret");
 * String senderPublicKey = key.publicKey().toHex();
 * Signature signature = key.sign(TransactionSigner.signingHash(tx));
 * }</pre>
 *
 * <p>{@link #destroy()} releases the scalar; every later call except
 * {@link #isDestroyed()} and {@link #toString()} throws {@link IllegalStateException}.
 *
 * @since 1.0
 */
public final class PrivateKey implements Destroyable {

    private static final int SCALAR_LENGTH = 32;

    private record Material(BigInteger scalar, PublicKey publicKey) {
    }

    private volatile Material material;

    private PrivateKey(final BigInteger scalar) {
        this.material = new Material(scalar,
                new PublicKey(new FixedPointCombMultiplier().multiply(Ecdsa.CURVE.getG(), scalar)));
    }

    /**
     * Derives the key of the account controlled by {@code passphrase}.
     *
     * @param passphrase the secret passphrase
     * @return the account's private key
     */
    public static PrivateKey fromPassphrase(final String passphrase) {
        Objects.requireNonNull(passphrase, "passphrase cannot be null");
        return fromBytes(Sha256.hashUtf8(passphrase));
    }

    /**
     * @param hexString 64 hex characters
     * @throws IllegalArgumentException if the hex is malformed or the scalar out of range
     */
    public static PrivateKey fromHex(final String hexString) {
        Objects.requireNonNull(hexString, "hex string cannot be null");
        return fromBytes(Hex.decode(hexString));
    }

    /**
     * Wraps a raw 32-byte scalar. The caller's array is zeroed.
     *
     * @param keyBytes big-endian scalar in {@code [1, n-1]}
     * @return the private key
     * @throws IllegalArgumentException if the length or value is invalid
     */
    public static PrivateKey fromBytes(final byte[] keyBytes) {
        Objects.requireNonNull(keyBytes, "key bytes cannot be null");
        try {
            return new PrivateKey(scalarOf(keyBytes));
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    public PublicKey publicKey() {
        return live().publicKey();
    }

    /**
     * Signs a 32-byte hash (RFC 6979, low-S).
     *
     * @param hash message hash
     * @return the signature
     * @throws IllegalStateException if the key has been destroyed
     */
    public Signature sign(final byte[] hash) {
        return Ecdsa.sign(hash, live().scalar());
    }

    @Override
    public void destroy() {
        material = null;
    }

    @Override
    public boolean isDestroyed() {
        return material == null;
    }

    @Override
    public String toString() {
        final Material current = material;
        return current == null ? "PrivateKey[destroyed]" : "PrivateKey[publicKey=" + current.publicKey().toHex() + "]";
    }

    private Material live() {
        final Material current = material;
        if (current == null) {
            throw new IllegalStateException("PrivateKey has been destroyed");
        }
        return current;
    }

    private static BigInteger scalarOf(final byte[] keyBytes) {
        if (keyBytes.length != SCALAR_LENGTH) {
            throw new IllegalArgumentException(
                    "Private key must be " + SCALAR_LENGTH + " bytes, got " + keyBytes.length);
        }
        final BigInteger scalar = new BigInteger(1, keyBytes);
        if (scalar.signum() == 0 || scalar.compareTo(Ecdsa.CURVE.getN()) >= 0) {
            throw new IllegalArgumentException("Private key is outside [1, n-1]");
        }
        return scalar;
    }
}
