// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.tx;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import sh.bpl.core.builder.TxBuilderException;
import sh.bpl.core.crypto.PassphraseSigner;
import sh.bpl.core.error.MissingFeeException;
import sh.bpl.core.error.TxnException;
import sh.bpl.core.error.UnrecognizedTypeException;

class TransactionJsonTest {

    private static final PassphraseSigner SENDER = new PassphraseSigner("json sender");
    private static final PassphraseSigner SECOND = new PassphraseSigner("json second");

    private static Transaction.Builder base(TransactionType type) {
        return Transaction.builder()
                .type(type)
                .timestamp(12_345L)
                .sender(SENDER)
                .fee(100_000_000L);
    }

    @Test
    void signedTransferSurvivesRoundTripAndReverifies() {
        Transaction tx = TransactionSigner.secondSign(
                TransactionSigner.sign(base(TransactionType.TRANSFER).amount(7L).vendorFieldText("x").build(), SENDER),
                SECOND);

        Transaction parsed = TransactionJson.fromJson(TransactionJson.toJson(tx));

        assertEquals(tx, parsed);
        assertTrue(TransactionSigner.verify(parsed));
        assertTrue(TransactionSigner.secondVerify(parsed, SECOND.publicKey().toHex()));
    }

    @Test
    void assetsSurviveRoundTrip() {
        String key = SECOND.publicKey().toHex();
        List<Transaction> txs = List.of(
                base(TransactionType.SECOND_SIGNATURE).asset(new SecondSignatureAsset(key)).build(),
                base(TransactionType.DELEGATE).asset(DelegateAsset.of("delegate_1")).build(),
                base(TransactionType.VOTE).asset(VoteAsset.upvote(key)).build(),
                base(TransactionType.MULTI_SIGNATURE)
                        .asset(new MultiSignatureAsset(1, 48, List.of("+" + key))).build());

        for (Transaction tx : txs) {
            assertEquals(tx, TransactionJson.fromJson(TransactionJson.toJson(tx)), tx.type().name());
        }
    }

    @Test
    void writesTransportFieldNames() {
        String json = TransactionJson.toJson(base(TransactionType.TRANSFER).build());

        assertTrue(json.contains("\"vendorField\""), json);
        assertTrue(json.contains("\"secondSignature\""), json);
        assertTrue(json.startsWith("{\"type\":0,"), json);
    }

    @Test
    void acceptsLegacyFieldNamesAndStringAmounts() {
        String json = "{\"type\":0,\"amount\":\"15\",\"fee\":\"10000000\",\"timestamp\":99,"
                + "\"senderPublicKey\":\"" + SENDER.publicKey().toHex() + "\","
                + "\"venderField\":\"6869\",\"unknownField\":true}";

        Transaction tx = TransactionJson.fromJson(json);

        assertEquals(15L, tx.amount());
        assertEquals(10_000_000L, tx.fee());
        assertEquals("6869", tx.vendorField());
    }

    @Test
    void emptyRecipientFromNodeJsonEncodesAsNoRecipient() {
        String json = "{\"type\":0,\"amount\":1,\"fee\":10000000,\"timestamp\":99,"
                + "\"senderPublicKey\":\"" + SENDER.publicKey().toHex() + "\",\"recipientId\":\"\"}";

        Transaction tx = TransactionJson.fromJson(json);

        assertEquals(base(TransactionType.TRANSFER).timestamp(99L).fee(10_000_000L).amount(1L).build().id(),
                tx.id());
    }

    @Test
    void rejectsIdThatDoesNotMatchContent() {
        Transaction tx = base(TransactionType.TRANSFER).build();
        String json = TransactionJson.toJson(tx).replace(tx.id(), "00".repeat(32));

        assertThrows(TxnException.class, () -> TransactionJson.fromJson(json));
    }

    @Test
    void reportsMissingOrInvalidContent() {
        String key = SENDER.publicKey().toHex();
        assertThrows(TxnException.class, () -> TransactionJson.fromJson("not json"));
        assertThrows(TxnException.class, () -> TransactionJson.fromJson("[1,2]"));
        assertThrows(TxBuilderException.class, () -> TransactionJson.fromJson("{\"timestamp\":1}"));
        assertThrows(UnrecognizedTypeException.class, () -> TransactionJson.fromJson("{\"type\":7}"));
        assertThrows(TxBuilderException.class, () -> TransactionJson.fromJson(
                "{\"type\":0,\"fee\":1,\"senderPublicKey\":\"" + key + "\"}"));
        assertThrows(MissingFeeException.class, () -> TransactionJson.fromJson(
                "{\"type\":0,\"timestamp\":1,\"senderPublicKey\":\"" + key + "\"}"));
        assertThrows(TxBuilderException.class, () -> TransactionJson.fromJson(
                "{\"type\":2,\"timestamp\":1,\"fee\":1,\"senderPublicKey\":\"" + key + "\",\"asset\":{}}"));
        assertThrows(TxnException.class, () -> TransactionJson.fromJson(
                "{\"type\":0,\"timestamp\":1,\"fee\":\"ten\",\"senderPublicKey\":\"" + key + "\"}"));
    }
}
