// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.builder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import sh.bpl.core.chain.FeeSchedule;
import sh.bpl.core.chain.NetworkProfile;
import sh.bpl.core.chain.NetworkProfiles;
import sh.bpl.core.crypto.PassphraseSigner;
import sh.bpl.core.tx.DelegateAsset;
import sh.bpl.core.tx.MultiSignatureAsset;
import sh.bpl.core.tx.SecondSignatureAsset;
import sh.bpl.core.tx.Transaction;
import sh.bpl.core.tx.TransactionSigner;
import sh.bpl.core.tx.TransactionType;
import sh.bpl.core.tx.VoteAsset;
import sh.bpl.core.types.Address;

class TxBuilderTest {

    private static final PassphraseSigner SENDER = new PassphraseSigner("builder sender");
    private static final PassphraseSigner OTHER = new PassphraseSigner("builder other");

    @Test
    void transferPresetsFeeTimestampAndSender() {
        Address recipient = Address.fromPublicKey(OTHER.publicKey(), NetworkProfiles.MAINNET.addressVersion());

        Transaction tx = TxBuilder.transfer(NetworkProfiles.MAINNET, SENDER, recipient, 250L).build();

        assertEquals(TransactionType.TRANSFER, tx.type());
        assertEquals(10_000_000L, tx.fee());
        assertEquals(250L, tx.amount());
        assertEquals(recipient.value(), tx.recipientId());
        assertEquals(SENDER.publicKey().toHex(), tx.senderPublicKey());
        assertTrue(tx.timestamp() > 0);
        assertTrue(TransactionSigner.verify(TransactionSigner.sign(tx, SENDER)));
    }

    @Test
    void transferRejectsRecipientFromAnotherNetwork() {
        Address testnet = Address.fromPublicKey(OTHER.publicKey(), NetworkProfiles.TESTNET.addressVersion());
        assertThrows(TxBuilderException.class,
                () -> TxBuilder.transfer(NetworkProfiles.MAINNET, SENDER, testnet, 1L));
    }

    @Test
    void feesComeFromTheProfile() {
        NetworkProfile cheap = NetworkProfiles.TESTNET.withFees(new FeeSchedule(1, 2, 3, 4, 5));
        Address recipient = Address.fromPublicKey(OTHER.publicKey(), cheap.addressVersion());

        assertEquals(1L, TxBuilder.transfer(cheap, SENDER, recipient, 1L).build().fee());
        assertEquals(3L, TxBuilder.delegate(cheap, SENDER, "cheap").build().fee());
    }

    @Test
    void secondSignatureRegistersSecondKey() {
        Transaction tx = TxBuilder.secondSignature(NetworkProfiles.MAINNET, SENDER, OTHER).build();

        SecondSignatureAsset asset = assertInstanceOf(SecondSignatureAsset.class, tx.asset());
        assertEquals(OTHER.publicKey().toHex(), asset.publicKey());
        assertEquals(500_000_000L, tx.fee());
    }

    @Test
    void delegateLowercasesUsername() {
        Transaction tx = TxBuilder.delegate(NetworkProfiles.MAINNET, SENDER, "Alice").build();

        assertEquals(new DelegateAsset("alice"), tx.asset());
        assertEquals(2_500_000_000L, tx.fee());
    }

    @Test
    void voteIsAddressedToSender() {
        List<String> votes = List.of("+" + OTHER.publicKey().toHex());

        Transaction tx = TxBuilder.vote(NetworkProfiles.MAINNET, SENDER, votes).build();

        assertEquals(new VoteAsset(votes), tx.asset());
        assertEquals(Address.fromPublicKey(SENDER.publicKey(), 0x19).value(), tx.recipientId());
        assertEquals(100_000_000L, tx.fee());
    }

    @Test
    void multiSignatureFeeScalesWithKeysgroup() {
        List<String> keys = List.of("+" + SENDER.publicKey().toHex(), "+" + OTHER.publicKey().toHex());

        Transaction tx = TxBuilder.multiSignature(NetworkProfiles.MAINNET, SENDER, 2, 24, keys).build();

        assertEquals(new MultiSignatureAsset(2, 24, keys), tx.asset());
        assertEquals(1_500_000_000L, tx.fee());
    }

    @Test
    void presetsRemainOverridable() {
        Transaction tx = TxBuilder.delegate(NetworkProfiles.MAINNET, SENDER, "bob").fee(1L).timestamp(5L).build();

        assertEquals(1L, tx.fee());
        assertEquals(5L, tx.timestamp());
    }

    @Test
    void invalidAssetsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> TxBuilder.delegate(NetworkProfiles.MAINNET, SENDER, "way_too_long_for_a_delegate"));
        assertThrows(IllegalArgumentException.class,
                () -> TxBuilder.vote(NetworkProfiles.MAINNET, SENDER, List.of("*" + OTHER.publicKey().toHex())));
        assertThrows(IllegalArgumentException.class,
                () -> TxBuilder.multiSignature(NetworkProfiles.MAINNET, SENDER, 2, 24,
                        List.of("+" + OTHER.publicKey().toHex())));
    }
}
