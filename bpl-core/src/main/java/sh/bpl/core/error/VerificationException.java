// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.error;

/**
 * Raised when verification inputs are malformed (bad public key, non-DER signature,
 * missing signature).
 *
 * <p>Distinct from a mismatched signature, which verifies to {@code false}.
 *
 * @since 1.0
 */
public final class VerificationException extends BplException {

    public VerificationException(final String message) {
        super(message);
    }

    public VerificationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
