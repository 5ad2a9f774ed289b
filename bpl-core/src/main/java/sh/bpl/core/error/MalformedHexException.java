// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.error;

/** A hex payload (vendor field, signature, asset key) is not valid hex or is too long. */
public final class MalformedHexException extends EncodingException {

    public MalformedHexException(final String message) {
        super(message);
    }

    public MalformedHexException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
