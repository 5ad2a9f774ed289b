// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core;

import java.util.regex.Pattern;

/**
 * Scrubs secrets from log lines and caps their length.
 *
 * <p>JSON-style values of {@code "passphrase"}, {@code "secret"} and {@code "privateKey"}
 * are replaced with {@value #REDACTED}; the same keys in {@code key=value} form are
 * redacted up to the next comma, space or bracket. Lines longer than 2000 characters are
 * truncated.
 *
 * @since 1.0
 */
public final class LogSanitizer {

    static final String REDACTED = "***[REDACTED]***";

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final Pattern JSON_SECRET_PATTERN =
            Pattern.compile("\"(passphrase|secret|privateKey)\"\\s*:\\s*\"[^\"]*\"");

    private static final Pattern INLINE_SECRET_PATTERN =
            Pattern.compile("\\b(passphrase|secret|privateKey)=[^,\\s\\]}]+");

    private LogSanitizer() {}

    /**
     * Returns {@code input} with secrets redacted and length capped.
     *
     * @param input raw log line, may be null
     * @return the sanitized line, {@code "null"} for null input
     */
    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("\"passphrase\"") || sanitized.contains("\"secret\"")
                || sanitized.contains("\"privateKey\"")) {
            sanitized = JSON_SECRET_PATTERN.matcher(sanitized).replaceAll("\"$1\":\"" + REDACTED + "\"");
        }

        if (sanitized.contains("=")) {
            sanitized = INLINE_SECRET_PATTERN.matcher(sanitized).replaceAll("$1=" + REDACTED);
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            final int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
