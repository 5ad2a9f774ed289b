// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.chain;

import sh.bpl.core.tx.TransactionType;

/**
 * Default fees, in the smallest currency unit, per transaction type.
 *
 * @param transfer          fee for a transfer
 * @param secondSignature   fee for registering a second signature
 * @param delegate          fee for registering a delegate
 * @param vote              fee for a vote
 * @param multiSignatureKey fee per keysgroup member of a multisignature registration
 */
public record FeeSchedule(long transfer, long secondSignature, long delegate, long vote, long multiSignatureKey) {

    public FeeSchedule {
        requireNonNegative("transfer", transfer);
        requireNonNegative("secondSignature", secondSignature);
        requireNonNegative("delegate", delegate);
        requireNonNegative("vote", vote);
        requireNonNegative("multiSignatureKey", multiSignatureKey);
    }

    /**
     * Returns the flat fee for {@code type}. Multisignature registrations are charged per
     * key, see {@link #multiSignature(int)}.
     *
     * @param type the transaction type
     * @return the fee
     */
    public long feeFor(final TransactionType type) {
        return switch (type) {
            case TRANSFER -> transfer;
            case SECOND_SIGNATURE -> secondSignature;
            case DELEGATE -> delegate;
            case VOTE -> vote;
            case MULTI_SIGNATURE -> multiSignatureKey;
        };
    }

    /**
     * Fee for a multisignature registration with {@code keyCount} members.
     *
     * @param keyCount number of keys in the keysgroup
     * @return {@code (keyCount + 1) * multiSignatureKey}
     */
    public long multiSignature(final int keyCount) {
        if (keyCount <= 0) {
            throw new IllegalArgumentException("keyCount must be positive, got: " + keyCount);
        }
        return Math.multiplyExact(keyCount + 1L, multiSignatureKey);
    }

    private static void requireNonNegative(final String name, final long value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " fee must be >= 0, got: " + value);
        }
    }
}
