// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.crypto;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.DERSequence;

import sh.bpl.primitives.Hex;

/**
 * ECDSA signature over secp256k1, carried on the wire as a DER {@code SEQUENCE}
 * of two {@code INTEGER}s.
 *
 * <p>
 * DER parsing is strict: the input must re-encode to exactly the same bytes, so a
 * signature has a single valid byte form and cannot be padded or re-tagged without
 * changing the transaction bytes that include it.
 *
 * @param r the r component (positive)
 * @param s the s component (positive)
 * @since 1.0
 */
public record Signature(BigInteger r, BigInteger s) {

    public Signature {
        Objects.requireNonNull(r, "r cannot be null");
        Objects.requireNonNull(s, "s cannot be null");
        if (r.signum() <= 0) {
            throw new IllegalArgumentException("r must be positive");
        }
        if (s.signum() <= 0) {
            throw new IllegalArgumentException("s must be positive");
        }
    }

    /**
     * Parses a strict DER signature.
     *
     * @param der DER bytes
     * @return the signature
     * @throws IllegalArgumentException if the bytes are not canonical DER
     */
    public static Signature fromDer(final byte[] der) {
        Objects.requireNonNull(der, "der cannot be null");
        final ASN1Sequence sequence;
        try {
            sequence = ASN1Sequence.getInstance(ASN1Primitive.fromByteArray(der));
        } catch (IOException | RuntimeException e) {
            // Bouncy Castle reports malformed encodings through several unchecked types
            throw new IllegalArgumentException("Signature is not valid DER", e);
        }
        if (sequence == null) {
            throw new IllegalArgumentException("Signature is empty");
        }
        if (sequence.size() != 2) {
            throw new IllegalArgumentException("DER signature must hold 2 integers, got " + sequence.size());
        }
        final BigInteger r;
        final BigInteger s;
        try {
            r = ASN1Integer.getInstance(sequence.getObjectAt(0)).getPositiveValue();
            s = ASN1Integer.getInstance(sequence.getObjectAt(1)).getPositiveValue();
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("DER signature components must be integers", e);
        }
        final Signature signature = new Signature(r, s);
        if (!Arrays.equals(signature.toDer(), der)) {
            throw new IllegalArgumentException("Signature is not canonical DER");
        }
        return signature;
    }

    /**
     * Parses a hex-encoded strict DER signature.
     *
     * @param hex signature hex
     * @return the signature
     * @throws IllegalArgumentException on malformed hex or DER
     */
    public static Signature fromHex(final String hex) {
        return fromDer(Hex.decode(hex));
    }

    /**
     * Encodes this signature as DER.
     *
     * @return DER bytes (typically 70-72 bytes)
     */
    public byte[] toDer() {
        try {
            return new DERSequence(new ASN1Integer[] {new ASN1Integer(r), new ASN1Integer(s)})
                    .getEncoded(ASN1Encoding.DER);
        } catch (IOException e) {
            throw new IllegalStateException("DER encoding failed", e);
        }
    }

    public String toHex() {
        return Hex.encode(toDer());
    }

    @Override
    public String toString() {
        return "Signature[" + toHex() + "]";
    }
}
