// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.tx;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.bpl.core.error.MalformedHexException;
import sh.bpl.core.error.MalformedKeyException;
import sh.bpl.core.error.MissingFeeException;
import sh.bpl.core.types.Address;
import sh.bpl.primitives.ByteWriter;
import sh.bpl.primitives.Hex;

/**
 * Fixed-width canonical encodings of the individual transaction fields.
 *
 * <table border="1">
 * <tr><th>Field</th><th>Width</th><th>Encoding</th></tr>
 * <tr><td>type</td><td>1</td><td>type code</td></tr>
 * <tr><td>timestamp</td><td>4</td><td>little-endian unsigned</td></tr>
 * <tr><td>public key</td><td>key length (33)</td><td>hex-decoded, verbatim</td></tr>
 * <tr><td>recipient</td><td>21</td><td>Base58Check payload, or zeros when absent or empty</td></tr>
 * <tr><td>vendor field</td><td>64</td><td>hex-decoded, right-padded with zeros</td></tr>
 * <tr><td>amount, fee</td><td>8</td><td>little-endian</td></tr>
 * </table>
 *
 * <p>
 * Every {@code write*} method validates its whole input before appending, so a failure
 * never leaves a half-written field behind.
 */
public final class FieldCodec {

    public static final int TYPE_LENGTH = 1;
    public static final int TIMESTAMP_LENGTH = 4;
    public static final int RECIPIENT_LENGTH = Address.BYTE_LENGTH;
    public static final int VENDOR_FIELD_LENGTH = 64;
    public static final int AMOUNT_LENGTH = 8;
    public static final int FEE_LENGTH = 8;

    private static final long MAX_TIMESTAMP = 0xFFFF_FFFFL;

    private FieldCodec() {
        // Utility class
    }

    public static void writeType(final ByteWriter writer, final TransactionType type) {
        Objects.requireNonNull(type, "type cannot be null");
        writer.writeByte(type.code());
    }

    /**
     * Writes the timestamp as 4 little-endian bytes.
     *
     * @throws IllegalArgumentException if the timestamp does not fit in 32 unsigned bits
     */
    public static void writeTimestamp(final ByteWriter writer, final long timestamp) {
        requireTimestamp(timestamp);
        writer.writeInt(timestamp);
    }

    /**
     * Writes a hex public key verbatim.
     *
     * @throws MalformedKeyException if the key is not valid hex
     */
    public static void writePublicKey(final ByteWriter writer, final String publicKeyHex) {
        writer.writeBytes(publicKeyBytes(publicKeyHex));
    }

    /**
     * Writes the 21-byte recipient payload, or 21 zero bytes for no recipient.
     *
     * @throws sh.bpl.core.error.InvalidAddressException on a bad checksum or length
     */
    public static void writeRecipient(final ByteWriter writer, final @Nullable String recipientId) {
        writer.writeBytes(recipientBytes(recipientId));
    }

    /**
     * Writes the vendor field padded to 64 bytes, or 64 zero bytes when absent.
     *
     * @throws MalformedHexException if the value is not hex or decodes to more than 64 bytes
     */
    public static void writeVendorField(final ByteWriter writer, final @Nullable String vendorFieldHex) {
        writer.writePadded(vendorFieldPayload(vendorFieldHex), VENDOR_FIELD_LENGTH);
    }

    public static void writeAmount(final ByteWriter writer, final long amount) {
        requireNonNegative("amount", amount);
        writer.writeLong(amount);
    }

    /**
     * Writes the fee.
     *
     * @throws MissingFeeException if {@code fee} is null
     */
    public static void writeFee(final ByteWriter writer, final @Nullable Long fee) {
        writer.writeLong(requireFee(fee));
    }

    /**
     * Writes a hex-encoded signature verbatim.
     *
     * @throws MalformedHexException if the signature is not valid hex
     */
    public static void writeSignature(final ByteWriter writer, final String signatureHex) {
        writer.writeBytes(signatureBytes(signatureHex));
    }

    /**
     * Decodes a hex public key.
     *
     * @param publicKeyHex key hex
     * @return raw key bytes
     * @throws MalformedKeyException if the key is null, empty or not valid hex
     */
    public static byte[] publicKeyBytes(final String publicKeyHex) {
        if (publicKeyHex == null) {
            throw new MalformedKeyException("Public key is missing");
        }
        final byte[] bytes;
        try {
            bytes = Hex.decode(publicKeyHex);
        } catch (IllegalArgumentException e) {
            throw new MalformedKeyException("Public key is not valid hex: " + publicKeyHex, e);
        }
        if (bytes.length == 0) {
            throw new MalformedKeyException("Public key is empty");
        }
        return bytes;
    }

    /**
     * Returns the 21-byte recipient section.
     *
     * @param recipientId Base58Check address, empty or null
     * @return decoded payload, or 21 zero bytes when null or empty
     */
    public static byte[] recipientBytes(final @Nullable String recipientId) {
        if (recipientId == null || recipientId.isEmpty()) {
            return new byte[RECIPIENT_LENGTH];
        }
        return Address.fromBase58(recipientId).toBytes();
    }

    /**
     * Returns the 64-byte vendor field section.
     *
     * @param vendorFieldHex hex payload or null
     * @return decoded payload right-padded with zeros to 64 bytes
     */
    public static byte[] vendorFieldBytes(final @Nullable String vendorFieldHex) {
        return Arrays.copyOf(vendorFieldPayload(vendorFieldHex), VENDOR_FIELD_LENGTH);
    }

    private static byte[] vendorFieldPayload(final @Nullable String vendorFieldHex) {
        if (vendorFieldHex == null) {
            return new byte[0];
        }
        final byte[] raw;
        try {
            raw = Hex.decode(vendorFieldHex);
        } catch (IllegalArgumentException e) {
            throw new MalformedHexException("Vendor field is not valid hex: " + e.getMessage(), e);
        }
        if (raw.length > VENDOR_FIELD_LENGTH) {
            throw new MalformedHexException(
                    "Vendor field is " + raw.length + " bytes, maximum is " + VENDOR_FIELD_LENGTH);
        }
        return raw;
    }

    /**
     * Hex-encodes UTF-8 text for use as a vendor field.
     *
     * @param text free text
     * @return vendor field hex
     * @throws MalformedHexException if the UTF-8 form is longer than 64 bytes
     */
    public static String vendorFieldFromText(final String text) {
        Objects.requireNonNull(text, "text cannot be null");
        final byte[] utf8 = text.getBytes(StandardCharsets.UTF_8);
        if (utf8.length > VENDOR_FIELD_LENGTH) {
            throw new MalformedHexException(
                    "Vendor field text is " + utf8.length + " bytes, maximum is " + VENDOR_FIELD_LENGTH);
        }
        return Hex.encode(utf8);
    }

    /**
     * Decodes a hex signature.
     *
     * @param signatureHex signature hex
     * @return raw signature bytes
     * @throws MalformedHexException if the signature is not valid hex
     */
    public static byte[] signatureBytes(final String signatureHex) {
        Objects.requireNonNull(signatureHex, "signature cannot be null");
        try {
            return Hex.decode(signatureHex);
        } catch (IllegalArgumentException e) {
            throw new MalformedHexException("Signature is not valid hex: " + e.getMessage(), e);
        }
    }

    /**
     * Unboxes the fee.
     *
     * @throws MissingFeeException if {@code fee} is null
     * @throws IllegalArgumentException if {@code fee} is negative
     */
    public static long requireFee(final @Nullable Long fee) {
        if (fee == null) {
            throw new MissingFeeException("Transaction fee has not been set");
        }
        requireNonNegative("fee", fee);
        return fee;
    }

    static void requireTimestamp(final long timestamp) {
        if (timestamp < 0 || timestamp > MAX_TIMESTAMP) {
            throw new IllegalArgumentException("timestamp out of uint32 range: " + timestamp);
        }
    }

    static void requireNonNegative(final String name, final long value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0, got: " + value);
        }
    }
}
