// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.error;

/** A transaction type code has no registered asset layout. */
public final class UnrecognizedTypeException extends EncodingException {

    public UnrecognizedTypeException(final String message) {
        super(message);
    }

    public UnrecognizedTypeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
