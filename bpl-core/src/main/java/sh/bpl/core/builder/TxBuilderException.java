// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.builder;

import sh.bpl.core.error.TxnException;

/** Runtime exception thrown when a transaction builder is in an invalid state. */
public final class TxBuilderException extends TxnException {
    public TxBuilderException(final String message) {
        super(message);
    }

    public TxBuilderException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
