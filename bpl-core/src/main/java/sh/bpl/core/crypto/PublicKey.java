// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.crypto;

import java.util.Objects;

import org.bouncycastle.math.ec.ECPoint;

import sh.bpl.core.error.MalformedKeyException;
import sh.bpl.primitives.Hex;

/**
 * A secp256k1 public key, serialized in 33-byte compressed form.
 *
 * @since 1.0
 */
public final class PublicKey {

    public static final int COMPRESSED_LENGTH = 33;

    private final ECPoint point;

    PublicKey(final ECPoint point) {
        this.point = Objects.requireNonNull(point, "point cannot be null").normalize();
    }

    /**
     * Parses a compressed (or uncompressed) hex-encoded public key.
     *
     * @param hex key hex
     * @return the public key
     * @throws MalformedKeyException if the hex is malformed or not a point on the curve
     */
    public static PublicKey fromHex(final String hex) {
        Objects.requireNonNull(hex, "public key hex cannot be null");
        final byte[] bytes;
        try {
            bytes = Hex.decode(hex);
        } catch (IllegalArgumentException e) {
            throw new MalformedKeyException("Public key is not valid hex: " + hex, e);
        }
        return fromBytes(bytes);
    }

    /**
     * Parses an encoded public key.
     *
     * @param bytes SEC1 encoded point
     * @return the public key
     * @throws MalformedKeyException if the bytes are not a valid point
     */
    public static PublicKey fromBytes(final byte[] bytes) {
        Objects.requireNonNull(bytes, "public key bytes cannot be null");
        if (bytes.length == 0) {
            throw new MalformedKeyException("Public key is empty");
        }
        try {
            final ECPoint decoded = Ecdsa.CURVE.getCurve().decodePoint(bytes);
            if (decoded.isInfinity() || !decoded.isValid()) {
                throw new MalformedKeyException("Public key is not a valid secp256k1 point");
            }
            return new PublicKey(decoded);
        } catch (IllegalArgumentException e) {
            throw new MalformedKeyException("Public key is not a valid secp256k1 point", e);
        }
    }

    /**
     * Verifies {@code signature} over {@code hash}.
     *
     * @param hash      32-byte hash
     * @param signature the signature
     * @return whether the signature was produced by this key
     */
    public boolean verify(final byte[] hash, final Signature signature) {
        return Ecdsa.verify(hash, signature, point);
    }

    /**
     * Returns the 33-byte compressed encoding.
     *
     * @return compressed point bytes
     */
    public byte[] toBytes() {
        return point.getEncoded(true);
    }

    public String toHex() {
        return Hex.encode(toBytes());
    }

    @Override
    public boolean equals(final Object obj) {
        return obj instanceof PublicKey other && point.equals(other.point);
    }

    @Override
    public int hashCode() {
        return point.hashCode();
    }

    @Override
    public String toString() {
        return "PublicKey[" + toHex() + "]";
    }
}
