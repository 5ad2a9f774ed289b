// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.error;

/** The fee was never set on a transaction that is being built or encoded. */
public final class MissingFeeException extends EncodingException {

    public MissingFeeException(final String message) {
        super(message);
    }

    public MissingFeeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
