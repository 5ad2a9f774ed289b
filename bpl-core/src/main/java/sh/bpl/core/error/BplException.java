// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.error;

/**
 * Base runtime exception for all BPL SDK failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * BplException
 * ├── {@link EncodingException} - canonical byte encoding failures
 * │   ├── {@link MalformedHexException}
 * │   ├── {@link MalformedKeyException}
 * │   ├── {@link InvalidAddressException}
 * │   ├── {@link MissingFeeException}
 * │   ├── {@link MissingSignatureException}
 * │   └── {@link UnrecognizedTypeException}
 * ├── {@link VerificationException} - malformed verification inputs
 * └── {@link TxnException} - transaction construction and signing failures
 * </pre>
 *
 * <p>
 * A signature that is well-formed but does not match is not an exception; verification
 * returns {@code false} for it.
 *
 * @since 1.0
 */
public sealed class BplException extends RuntimeException
        permits EncodingException, VerificationException, TxnException {

    public BplException(final String message) {
        super(message);
    }

    public BplException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
