// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.tx;

import sh.bpl.core.error.UnrecognizedTypeException;

/**
 * Transaction kinds and their one-byte wire codes.
 */
public enum TransactionType {
    TRANSFER(0),
    SECOND_SIGNATURE(1),
    DELEGATE(2),
    VOTE(3),
    MULTI_SIGNATURE(4);

    private final int code;

    TransactionType(final int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Resolves a wire code.
     *
     * @param code the type byte
     * @return the matching type
     * @throws UnrecognizedTypeException if no kind uses this code
     */
    public static TransactionType fromCode(final int code) {
        for (TransactionType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new UnrecognizedTypeException("Unrecognized transaction type: " + code);
    }
}
