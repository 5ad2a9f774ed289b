// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.crypto;

import java.math.BigInteger;
import java.util.Objects;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;

/**
 * Deterministic ECDSA over secp256k1.
 * <p>
 * Signing follows <a href="https://tools.ietf.org/html/rfc6979">RFC 6979</a> with an
 * HMAC-SHA256 nonce, so the same key and hash always produce the same signature. The
 * result is normalized to low-s. Verification accepts either s half.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Stateless. Each call builds its own {@link ECDSASigner} and {@link HMacDSAKCalculator}.
 *
 * @since 1.0
 */
public final class Ecdsa {

    public static final int HASH_LENGTH = 32;

    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    static final ECDomainParameters CURVE = new ECDomainParameters(
            CURVE_PARAMS.getCurve(),
            CURVE_PARAMS.getG(),
            CURVE_PARAMS.getN(),
            CURVE_PARAMS.getH());
    private static final BigInteger HALF_CURVE_ORDER = CURVE_PARAMS.getN().shiftRight(1);

    private Ecdsa() {
    }

    /**
     * Signs a 32-byte hash.
     *
     * @param hash       32-byte message hash
     * @param privateKey private scalar in {@code [1, n-1]}
     * @return low-s signature
     * @throws IllegalArgumentException if hash is not 32 bytes
     */
    public static Signature sign(final byte[] hash, final BigInteger privateKey) {
        requireHash(hash);
        Objects.requireNonNull(privateKey, "privateKey cannot be null");

        final ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
        signer.init(true, new ECPrivateKeyParameters(privateKey, CURVE));
        final BigInteger[] rs = signer.generateSignature(hash);

        BigInteger s = rs[1];
        if (s.compareTo(HALF_CURVE_ORDER) > 0) {
            // (r, n - s) is equally valid; keep the low half so the encoding is unique
            s = CURVE.getN().subtract(s);
        }
        return new Signature(rs[0], s);
    }

    /**
     * Verifies a signature against a public key.
     *
     * @param hash      32-byte message hash
     * @param signature the signature
     * @param publicKey the signer's public point
     * @return true if the signature matches; false otherwise
     * @throws IllegalArgumentException if hash is not 32 bytes
     */
    public static boolean verify(final byte[] hash, final Signature signature, final ECPoint publicKey) {
        requireHash(hash);
        Objects.requireNonNull(signature, "signature cannot be null");
        Objects.requireNonNull(publicKey, "publicKey cannot be null");

        if (signature.r().compareTo(CURVE.getN()) >= 0 || signature.s().compareTo(CURVE.getN()) >= 0) {
            return false;
        }
        final ECDSASigner verifier = new ECDSASigner();
        verifier.init(false, new ECPublicKeyParameters(publicKey, CURVE));
        return verifier.verifySignature(hash, signature.r(), signature.s());
    }

    private static void requireHash(final byte[] hash) {
        Objects.requireNonNull(hash, "hash cannot be null");
        if (hash.length != HASH_LENGTH) {
            throw new IllegalArgumentException("Message hash must be 32 bytes, got " + hash.length);
        }
    }
}
