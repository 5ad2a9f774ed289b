// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.tx;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import sh.bpl.core.crypto.PrivateKey;
import sh.bpl.core.error.InvalidAddressException;
import sh.bpl.core.error.MalformedHexException;
import sh.bpl.core.error.MalformedKeyException;
import sh.bpl.core.error.MissingFeeException;
import sh.bpl.core.types.Address;
import sh.bpl.primitives.ByteWriter;
import sh.bpl.primitives.Hex;

class FieldCodecTest {

    @Test
    void absentRecipientIsTwentyOneZeroBytes() {
        assertArrayEquals(new byte[21], FieldCodec.recipientBytes(null));
    }

    @Test
    void emptyRecipientIsTreatedAsAbsent() {
        assertArrayEquals(new byte[21], FieldCodec.recipientBytes(""));

        ByteWriter writer = new ByteWriter();
        FieldCodec.writeRecipient(writer, "");
        assertArrayEquals(new byte[FieldCodec.RECIPIENT_LENGTH], writer.toBytes());
    }

    @Test
    void recipientIsDecodedPayload() {
        Address address = Address.fromPublicKey(PrivateKey.fromPassphrase("recipient").publicKey(), 0x19);
        byte[] bytes = FieldCodec.recipientBytes(address.value());
        assertEquals(FieldCodec.RECIPIENT_LENGTH, bytes.length);
        assertArrayEquals(address.toBytes(), bytes);
        assertEquals(0x19, bytes[0]);
    }

    @Test
    void rejectsInvalidRecipient() {
        assertThrows(InvalidAddressException.class, () -> FieldCodec.recipientBytes("not-an-address"));
    }

    @Test
    void absentVendorFieldIsSixtyFourZeroBytes() {
        assertArrayEquals(new byte[64], FieldCodec.vendorFieldBytes(null));
    }

    static IntStream vendorLengths() {
        return IntStream.rangeClosed(0, 64);
    }

    @ParameterizedTest
    @MethodSource("vendorLengths")
    void vendorFieldIsRightPaddedToSixtyFour(int length) {
        byte[] payload = new byte[length];
        Arrays.fill(payload, (byte) 0xab);

        byte[] section = FieldCodec.vendorFieldBytes(Hex.encode(payload));

        assertEquals(64, section.length);
        assertArrayEquals(payload, Arrays.copyOfRange(section, 0, length));
        assertArrayEquals(new byte[64 - length], Arrays.copyOfRange(section, length, 64));
    }

    @Test
    void rejectsVendorFieldLongerThanSixtyFour() {
        String tooLong = Hex.encode(new byte[65]);
        assertThrows(MalformedHexException.class, () -> FieldCodec.vendorFieldBytes(tooLong));
    }

    @ParameterizedTest
    @ValueSource(strings = {"zz", "abc", "0xg0"})
    void rejectsMalformedVendorHex(String hex) {
        assertThrows(MalformedHexException.class, () -> FieldCodec.vendorFieldBytes(hex));
    }

    @Test
    void vendorFieldFromTextIsUtf8Hex() {
        assertEquals("68656c6c6f", FieldCodec.vendorFieldFromText("hello"));
        assertThrows(MalformedHexException.class, () -> FieldCodec.vendorFieldFromText("x".repeat(65)));
    }

    @Test
    void publicKeyIsCopiedVerbatim() {
        String key = PrivateKey.fromPassphrase("sender").publicKey().toHex();
        assertArrayEquals(Hex.decode(key), FieldCodec.publicKeyBytes(key));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "0", "xyz"})
    void rejectsMalformedPublicKey(String hex) {
        assertThrows(MalformedKeyException.class, () -> FieldCodec.publicKeyBytes(hex));
    }

    @Test
    void rejectsMissingPublicKey() {
        assertThrows(MalformedKeyException.class, () -> FieldCodec.publicKeyBytes(null));
    }

    @Test
    void rejectsMalformedSignatureHex() {
        assertThrows(MalformedHexException.class, () -> FieldCodec.signatureBytes("30zz"));
    }

    @Test
    void unsetFeeIsMissing() {
        assertThrows(MissingFeeException.class, () -> FieldCodec.requireFee(null));
        assertEquals(0L, FieldCodec.requireFee(0L));
    }

    @Test
    void writesFixedWidthLittleEndianFields() {
        ByteWriter writer = new ByteWriter();
        FieldCodec.writeType(writer, TransactionType.VOTE);
        FieldCodec.writeTimestamp(writer, 10_000_000L);
        FieldCodec.writeAmount(writer, 1L);
        FieldCodec.writeFee(writer, 256L);

        assertArrayEquals(Hex.decode("03" + "80969800" + "0100000000000000" + "0001000000000000"),
                writer.toBytes());
    }

    @Test
    void eachFieldWritesItsDeclaredWidth() {
        ByteWriter writer = new ByteWriter();
        FieldCodec.writeType(writer, TransactionType.TRANSFER);
        assertEquals(FieldCodec.TYPE_LENGTH, writer.size());
        FieldCodec.writeTimestamp(writer, 1L);
        assertEquals(FieldCodec.TYPE_LENGTH + FieldCodec.TIMESTAMP_LENGTH, writer.size());

        int before = writer.size();
        FieldCodec.writeRecipient(writer, null);
        assertEquals(FieldCodec.RECIPIENT_LENGTH, writer.size() - before);
        before = writer.size();
        FieldCodec.writeVendorField(writer, "6869");
        assertEquals(FieldCodec.VENDOR_FIELD_LENGTH, writer.size() - before);
        before = writer.size();
        FieldCodec.writeAmount(writer, 5L);
        assertEquals(FieldCodec.AMOUNT_LENGTH, writer.size() - before);
        before = writer.size();
        FieldCodec.writeFee(writer, 5L);
        assertEquals(FieldCodec.FEE_LENGTH, writer.size() - before);
    }

    @Test
    void writtenVendorFieldMatchesPaddedSection() {
        ByteWriter writer = new ByteWriter();
        FieldCodec.writeVendorField(writer, "6869");

        assertArrayEquals(FieldCodec.vendorFieldBytes("6869"), writer.toBytes());
        assertThrows(MalformedHexException.class,
                () -> FieldCodec.writeVendorField(new ByteWriter(), "ab".repeat(65)));
    }

    @Test
    void writeFeeRequiresValue() {
        assertThrows(MissingFeeException.class, () -> FieldCodec.writeFee(new ByteWriter(), null));
    }
}
