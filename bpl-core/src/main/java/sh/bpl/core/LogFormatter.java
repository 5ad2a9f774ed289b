// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core;

/**
 * Renders one-line debug messages for transaction events.
 *
 * <p>Long hex values (ids, keys, signatures) are shortened to
 * {@code first6...last4} so lines stay readable.
 *
 * @since 1.0
 */
public final class LogFormatter {

    private static final int HASH_PREFIX_LENGTH = 6;

    private static final int HASH_SUFFIX_LENGTH = 4;

    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    public static String formatSign(final String id, final Object type, final String publicKey) {
        return String.format("[TX-SIGN] id=%s type=%s signer=%s",
                shortenHash(id), type, shortenHash(publicKey));
    }

    public static String formatSecondSign(final String id, final String publicKey) {
        return String.format("[TX-SECOND-SIGN] id=%s signer=%s",
                shortenHash(id), shortenHash(publicKey));
    }

    public static String formatVerify(final String id, final String publicKey, final boolean valid) {
        return String.format("[TX-VERIFY] id=%s key=%s valid=%s",
                shortenHash(id), shortenHash(publicKey), valid);
    }

    public static String formatSecondVerify(final String id, final String publicKey, final boolean valid) {
        return String.format("[TX-SECOND-VERIFY] id=%s key=%s valid=%s",
                shortenHash(id), shortenHash(publicKey), valid);
    }

    public static String formatEncode(final Object type, final int length, final boolean signature,
            final boolean secondSignature) {
        return String.format("[TX-ENCODE] type=%s bytes=%d signature=%s secondSignature=%s",
                type, length, signature, secondSignature);
    }

    /**
     * Shortens a hex string to {@code abcdef...1234}; short or null values pass through.
     *
     * @param value value to shorten
     * @return the shortened value, or {@code "null"}
     */
    public static String shortenHash(final String value) {
        if (value == null) {
            return "null";
        }
        if (value.length() <= HASH_SHORTEN_THRESHOLD + 3) {
            return value;
        }
        return value.substring(0, HASH_PREFIX_LENGTH) + "..." + value.substring(value.length() - HASH_SUFFIX_LENGTH);
    }
}
