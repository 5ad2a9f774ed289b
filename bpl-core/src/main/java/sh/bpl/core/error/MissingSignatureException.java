// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.error;

/** A signature section was requested for encoding before it was computed. */
public final class MissingSignatureException extends EncodingException {

    public MissingSignatureException(final String message) {
        super(message);
    }

    public MissingSignatureException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
