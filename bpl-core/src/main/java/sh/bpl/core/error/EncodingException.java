// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.error;

/**
 * Raised when a transaction field cannot be turned into canonical bytes.
 *
 * <p>Encoding either yields the complete byte sequence or throws one of these; no
 * truncated or partially padded buffer is ever returned.
 */
public sealed class EncodingException extends BplException
        permits MalformedHexException,
        MalformedKeyException,
        InvalidAddressException,
        MissingFeeException,
        MissingSignatureException,
        UnrecognizedTypeException {

    public EncodingException(final String message) {
        super(message);
    }

    public EncodingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
