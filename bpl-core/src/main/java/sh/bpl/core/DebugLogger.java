// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes opt-in debug lines to the {@code sh.bpl.debug} logger.
 *
 * <p>Each entry point is gated by its {@link BplDebug} category. Templates use
 * {@link String#formatted(Object...)} syntax and are only expanded once the category is
 * on. Every line is run through {@link LogSanitizer} before it is logged.
 *
 * @since 1.0
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.bpl.debug");

    private DebugLogger() {
    }

    /** Signing and verification events. */
    public static void logTx(final String template, final Object... args) {
        emit(BplDebug.isTxLoggingEnabled(), template, args);
    }

    /** Byte-level encoding events. */
    public static void logCodec(final String template, final Object... args) {
        emit(BplDebug.isCodecLoggingEnabled(), template, args);
    }

    /** Lines that belong to no category; emitted when any category is on. */
    public static void log(final String template, final Object... args) {
        emit(BplDebug.isEnabled(), template, args);
    }

    private static void emit(final boolean enabled, final String template, final Object[] args) {
        if (!enabled) {
            return;
        }
        final String line = args == null || args.length == 0 ? template : template.formatted(args);
        LOG.info(LogSanitizer.sanitize(line));
    }
}
