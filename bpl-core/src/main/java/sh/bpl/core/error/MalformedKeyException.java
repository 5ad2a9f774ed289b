// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.error;

/** A public key string is not valid hex or not a valid curve point. */
public final class MalformedKeyException extends EncodingException {

    public MalformedKeyException(final String message) {
        super(message);
    }

    public MalformedKeyException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
