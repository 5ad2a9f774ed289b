// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.primitives;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * Base58 (Bitcoin alphabet) codec, with and without the 4-byte double-SHA-256 checksum.
 *
 * <p>Leading zero bytes map to leading {@code '1'} characters and back, so the decoded
 * length of a checked string is exact.
 *
 * @since 1.0
 */
public final class Base58 {
    private static final char[] ALPHABET =
            "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz".toCharArray();
    private static final char ENCODED_ZERO = ALPHABET[0];
    private static final int[] INDEXES = new int[128];
    private static final int CHECKSUM_LENGTH = 4;

    static {
        Arrays.fill(INDEXES, -1);
        for (int i = 0; i < ALPHABET.length; i++) {
            INDEXES[ALPHABET[i]] = i;
        }
    }

    private Base58() {
        // Utility class
    }

    /**
     * Encodes bytes as Base58.
     *
     * @param input bytes to encode
     * @return Base58 string, empty for empty input
     */
    public static String encode(final byte[] input) {
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        if (input.length == 0) {
            return "";
        }
        int zeros = 0;
        while (zeros < input.length && input[zeros] == 0) {
            ++zeros;
        }
        final byte[] number = Arrays.copyOf(input, input.length);
        final char[] encoded = new char[input.length * 2];
        int outputStart = encoded.length;
        for (int inputStart = zeros; inputStart < number.length; ) {
            encoded[--outputStart] = ALPHABET[divmod(number, inputStart, 256, 58)];
            if (number[inputStart] == 0) {
                ++inputStart;
            }
        }
        while (outputStart < encoded.length && encoded[outputStart] == ENCODED_ZERO) {
            ++outputStart;
        }
        while (--zeros >= 0) {
            encoded[--outputStart] = ENCODED_ZERO;
        }
        return new String(encoded, outputStart, encoded.length - outputStart);
    }

    /**
     * Decodes a Base58 string.
     *
     * @param input Base58 string
     * @return decoded bytes
     * @throws IllegalArgumentException on null input or a character outside the alphabet
     */
    public static byte[] decode(final String input) {
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        if (input.isEmpty()) {
            return new byte[0];
        }
        final byte[] input58 = new byte[input.length()];
        for (int i = 0; i < input.length(); ++i) {
            final char c = input.charAt(i);
            final int digit = c < 128 ? INDEXES[c] : -1;
            if (digit < 0) {
                throw new IllegalArgumentException("invalid Base58 character '" + c + "' at position " + i);
            }
            input58[i] = (byte) digit;
        }
        int zeros = 0;
        while (zeros < input58.length && input58[zeros] == 0) {
            ++zeros;
        }
        final byte[] decoded = new byte[input.length()];
        int outputStart = decoded.length;
        for (int inputStart = zeros; inputStart < input58.length; ) {
            decoded[--outputStart] = divmod(input58, inputStart, 58, 256);
            if (input58[inputStart] == 0) {
                ++inputStart;
            }
        }
        while (outputStart < decoded.length && decoded[outputStart] == 0) {
            ++outputStart;
        }
        return Arrays.copyOfRange(decoded, outputStart - zeros, decoded.length);
    }

    /**
     * Encodes {@code payload} followed by the first four bytes of its double SHA-256.
     *
     * @param payload bytes to encode
     * @return Base58Check string
     */
    public static String encodeChecked(final byte[] payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        final byte[] checksum = checksum(payload);
        final byte[] withChecksum = Arrays.copyOf(payload, payload.length + CHECKSUM_LENGTH);
        System.arraycopy(checksum, 0, withChecksum, payload.length, CHECKSUM_LENGTH);
        return encode(withChecksum);
    }

    /**
     * Decodes a Base58Check string and verifies its checksum.
     *
     * @param input Base58Check string
     * @return the payload without checksum
     * @throws IllegalArgumentException if the string is malformed, too short, or the
     *                                  checksum does not match
     */
    public static byte[] decodeChecked(final String input) {
        final byte[] decoded = decode(input);
        if (decoded.length < CHECKSUM_LENGTH) {
            throw new IllegalArgumentException("Base58Check input too short: " + decoded.length + " bytes");
        }
        final byte[] payload = Arrays.copyOfRange(decoded, 0, decoded.length - CHECKSUM_LENGTH);
        final byte[] actual = Arrays.copyOfRange(decoded, decoded.length - CHECKSUM_LENGTH, decoded.length);
        final byte[] expected = Arrays.copyOf(checksum(payload), CHECKSUM_LENGTH);
        if (!MessageDigest.isEqual(expected, actual)) {
            throw new IllegalArgumentException("Base58Check checksum mismatch");
        }
        return payload;
    }

    private static byte[] checksum(final byte[] payload) {
        try {
            final MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(digest.digest(payload));
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Divides {@code number} (big-endian digits in {@code base}) by {@code divisor} in place
     * and returns the remainder.
     */
    private static byte divmod(final byte[] number, final int firstDigit, final int base, final int divisor) {
        int remainder = 0;
        for (int i = firstDigit; i < number.length; i++) {
            final int digit = number[i] & 0xFF;
            final int temp = remainder * base + digit;
            number[i] = (byte) (temp / divisor);
            remainder = temp % divisor;
        }
        return (byte) remainder;
    }
}
