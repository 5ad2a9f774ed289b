// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.primitives;

/**
 * Hex codec for keys, signatures and vendor fields.
 *
 * <p>Output is lowercase with no {@code 0x} prefix, which is how these values travel.
 * Input may carry a {@code 0x} prefix and mixed case.
 *
 * @since 1.0
 */
public final class Hex {
    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    private Hex() {
    }

    /**
     * @param hexString even-length hex, optionally {@code 0x}-prefixed
     * @return the decoded bytes
     * @throws IllegalArgumentException on null, odd length or a non-hex character
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        final int offset = bodyOffset(hexString);
        if (((hexString.length() - offset) & 1) != 0) {
            throw new IllegalArgumentException("hex string must have even length: " + hexString);
        }
        final byte[] out = new byte[(hexString.length() - offset) >> 1];
        for (int i = 0, pos = offset; i < out.length; i++, pos += 2) {
            final int hi = digit(hexString.charAt(pos));
            final int lo = digit(hexString.charAt(pos + 1));
            if ((hi | lo) < 0) {
                throw new IllegalArgumentException("invalid hex character in: " + hexString);
            }
            out[i] = (byte) (hi << 4 | lo);
        }
        return out;
    }

    /**
     * @param bytes bytes to encode
     * @return lowercase hex, two characters per byte
     * @throws IllegalArgumentException if {@code bytes} is null
     */
    public static String encode(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        final StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (final byte b : bytes) {
            sb.append(DIGITS[(b >> 4) & 0xF]).append(DIGITS[b & 0xF]);
        }
        return sb.toString();
    }

    /**
     * Whether {@link #decode(String)} would accept {@code value}.
     *
     * @param value candidate, may be null
     * @return true for well-formed hex
     */
    public static boolean isValid(final String value) {
        if (value == null) {
            return false;
        }
        final int offset = bodyOffset(value);
        if (((value.length() - offset) & 1) != 0) {
            return false;
        }
        for (int i = offset; i < value.length(); i++) {
            if (digit(value.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }

    public static boolean hasPrefix(final String hexString) {
        return hexString != null && hexString.length() >= 2 && hexString.charAt(0) == '0'
                && (hexString.charAt(1) | 0x20) == 'x';
    }

    private static int bodyOffset(final String hexString) {
        return hasPrefix(hexString) ? 2 : 0;
    }

    private static int digit(final char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        final int lower = c | 0x20;
        if (lower >= 'a' && lower <= 'f') {
            return lower - 'a' + 10;
        }
        return -1;
    }
}
