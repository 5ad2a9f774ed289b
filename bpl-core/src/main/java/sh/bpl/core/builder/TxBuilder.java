// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.builder;

import java.util.List;
import java.util.Objects;

import sh.bpl.core.chain.NetworkProfile;
import sh.bpl.core.crypto.Signer;
import sh.bpl.core.tx.DelegateAsset;
import sh.bpl.core.tx.MultiSignatureAsset;
import sh.bpl.core.tx.SecondSignatureAsset;
import sh.bpl.core.tx.Transaction;
import sh.bpl.core.tx.TransactionType;
import sh.bpl.core.tx.VoteAsset;
import sh.bpl.core.types.Address;

/**
 * Typed entry points for each transaction kind.
 *
 * <p>Each factory returns a {@link Transaction.Builder} with the type, asset, fee,
 * timestamp and sender key already set. The fee comes from the profile's
 * {@link sh.bpl.core.chain.FeeSchedule} and the timestamp from the profile's clock,
 * read when the factory is called. Everything stays overridable before {@code build()}.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * Transaction tx = TxBuilder.transfer(NetworkProfiles.MAINNET, signer, recipient, 100_000_000L)
 *     .vendorFieldText("invoice 42")
 *     .build();
 * Transaction signed = TransactionSigner.sign(tx, signer);
 * }</pre>
 *
 * @since 1.0
 */
public final class TxBuilder {

    private TxBuilder() {
    }

    /**
     * Starts a transfer of {@code amount} to {@code recipient}.
     *
     * @param profile   network the transaction targets
     * @param signer    the sender
     * @param recipient recipient address
     * @param amount    amount in the smallest unit
     * @return a pre-filled builder
     */
    public static Transaction.Builder transfer(final NetworkProfile profile, final Signer signer,
            final Address recipient, final long amount) {
        Objects.requireNonNull(recipient, "recipient cannot be null");
        if (recipient.version() != profile.addressVersion()) {
            throw new TxBuilderException("Recipient " + recipient + " belongs to another network than "
                    + profile.name());
        }
        return base(profile, signer, TransactionType.TRANSFER)
                .recipientId(recipient.value())
                .amount(amount);
    }

    /**
     * Starts a second-signature registration for {@code secondSigner}'s key.
     */
    public static Transaction.Builder secondSignature(final NetworkProfile profile, final Signer signer,
            final Signer secondSigner) {
        Objects.requireNonNull(secondSigner, "secondSigner cannot be null");
        return base(profile, signer, TransactionType.SECOND_SIGNATURE)
                .asset(new SecondSignatureAsset(secondSigner.publicKey().toHex()));
    }

    /**
     * Starts a delegate registration. The username is lowercased.
     */
    public static Transaction.Builder delegate(final NetworkProfile profile, final Signer signer,
            final String username) {
        return base(profile, signer, TransactionType.DELEGATE)
                .asset(DelegateAsset.of(username));
    }

    /**
     * Starts a vote. Each entry is a delegate key prefixed with {@code +} or {@code -}.
     * Votes are addressed to the sender's own account.
     */
    public static Transaction.Builder vote(final NetworkProfile profile, final Signer signer,
            final List<String> votes) {
        return base(profile, signer, TransactionType.VOTE)
                .asset(new VoteAsset(votes))
                .recipientId(Address.fromPublicKey(signer.publicKey(), profile.addressVersion()).value());
    }

    /**
     * Starts a multisignature registration. The fee scales with the number of keys.
     *
     * @param min       signatures required
     * @param lifetime  hours a pending transaction stays valid
     * @param keysgroup {@code +}-prefixed member keys
     */
    public static Transaction.Builder multiSignature(final NetworkProfile profile, final Signer signer,
            final int min, final int lifetime, final List<String> keysgroup) {
        final MultiSignatureAsset asset = new MultiSignatureAsset(min, lifetime, keysgroup);
        return base(profile, signer, TransactionType.MULTI_SIGNATURE)
                .asset(asset)
                .fee(profile.fees().multiSignature(asset.keysgroup().size()));
    }

    private static Transaction.Builder base(final NetworkProfile profile, final Signer signer,
            final TransactionType type) {
        Objects.requireNonNull(profile, "profile cannot be null");
        Objects.requireNonNull(signer, "signer cannot be null");
        return Transaction.builder()
                .type(type)
                .timestamp(profile.clock())
                .sender(signer)
                .fee(profile.fees().feeFor(type));
    }
}
