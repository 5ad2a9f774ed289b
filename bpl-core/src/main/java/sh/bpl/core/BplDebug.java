// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core;

/**
 * Global switches for the SDK's opt-in debug output.
 *
 * <p>Everything is off by default. When transaction logging is on, every sign and
 * verify call emits one sanitized line on the {@code sh.bpl.debug} logger:
 *
 * <pre>{@code
 * BplDebug.setTxLogging(true);
 * TransactionSigner.sign(tx, signer); // logs [TX-SIGN] id=... type=TRANSFER
 * }</pre>
 *
 * @see DebugLogger
 * @since 1.0
 */
public final class BplDebug {

    private static volatile boolean txLogging = false;
    private static volatile boolean codecLogging = false;

    private BplDebug() {
    }

    public static boolean isEnabled() {
        return txLogging || codecLogging;
    }

    /**
     * Turns every debug category on or off at once.
     */
    public static void setEnabled(final boolean enabled) {
        txLogging = enabled;
        codecLogging = enabled;
    }

    public static void setTxLogging(final boolean enabled) {
        txLogging = enabled;
    }

    public static boolean isTxLoggingEnabled() {
        return txLogging;
    }

    public static void setCodecLogging(final boolean enabled) {
        codecLogging = enabled;
    }

    public static boolean isCodecLoggingEnabled() {
        return codecLogging;
    }
}
