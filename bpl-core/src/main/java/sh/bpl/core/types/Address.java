// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.types;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.bpl.core.crypto.PublicKey;
import sh.bpl.core.crypto.Ripemd160;
import sh.bpl.core.crypto.Sha256;
import sh.bpl.core.error.InvalidAddressException;
import sh.bpl.primitives.Base58;

/**
 * Base58Check-encoded account address.
 * <p>
 * The decoded payload is exactly 21 bytes: a network version byte followed by
 * {@code RIPEMD160(SHA256(compressedPublicKey))}.
 * <p>
 * <strong>Validation:</strong> the checksum must match and the payload must be 21 bytes;
 * anything else is rejected with {@link InvalidAddressException}.
 *
 * @since 1.0
 */
public record Address(@JsonValue String value) {

    public static final int BYTE_LENGTH = 21;

    public Address {
        Objects.requireNonNull(value, "address");
        decode(value);
    }

    /**
     * Parses and validates a Base58Check address.
     *
     * @param base58 the address string
     * @return the address
     * @throws InvalidAddressException if the checksum or length is wrong
     */
    public static Address fromBase58(final String base58) {
        return new Address(base58);
    }

    /**
     * Derives the address of {@code publicKey} on the network identified by {@code version}.
     *
     * @param publicKey the account's public key
     * @param version   network address version byte ({@code 0..255})
     * @return the derived address
     */
    public static Address fromPublicKey(final PublicKey publicKey, final int version) {
        Objects.requireNonNull(publicKey, "publicKey cannot be null");
        if (version < 0 || version > 0xFF) {
            throw new IllegalArgumentException("address version must fit in one byte: " + version);
        }
        final byte[] payload = new byte[BYTE_LENGTH];
        payload[0] = (byte) version;
        System.arraycopy(Ripemd160.hash(Sha256.hash(publicKey.toBytes())), 0, payload, 1, Ripemd160.DIGEST_LENGTH);
        return new Address(Base58.encodeChecked(payload));
    }

    /**
     * Returns the 21-byte decoded payload.
     *
     * @return version byte followed by the 20-byte key hash
     */
    public byte[] toBytes() {
        return decode(value);
    }

    public String toBase58() {
        return value;
    }

    public int version() {
        return toBytes()[0] & 0xFF;
    }

    private static byte[] decode(final String value) {
        final byte[] payload;
        try {
            payload = Base58.decodeChecked(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidAddressException("Invalid address '" + value + "': " + e.getMessage(), e);
        }
        if (payload.length != BYTE_LENGTH) {
            throw new InvalidAddressException(
                    "Address must decode to " + BYTE_LENGTH + " bytes, got " + payload.length + ": " + value);
        }
        return payload;
    }

    @Override
    public String toString() {
        return value;
    }
}
