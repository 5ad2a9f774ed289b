// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.error;

/**
 * Base class for transaction construction and signing failures.
 * <p>
 * Left {@code non-sealed} so applications can add their own failure types;
 * {@link BplException} stays exhaustive at the top level.
 * <p>
 * <strong>SDK-provided subclasses:</strong>
 * <ul>
 * <li>{@link sh.bpl.core.builder.TxBuilderException} - Transaction building failures</li>
 * </ul>
 *
 * @since 1.0
 */
public non-sealed class TxnException extends BplException {

    public TxnException(final String message) {
        super(message);
    }

    public TxnException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
