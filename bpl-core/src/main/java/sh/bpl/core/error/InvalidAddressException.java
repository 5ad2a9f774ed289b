// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.error;

/** A recipient address failed Base58Check decoding or has the wrong length. */
public final class InvalidAddressException extends EncodingException {

    public InvalidAddressException(final String message) {
        super(message);
    }

    public InvalidAddressException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
