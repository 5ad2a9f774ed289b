// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.tx;

import java.util.Arrays;
import java.util.Objects;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.bpl.core.BplDebug;
import sh.bpl.core.DebugLogger;
import sh.bpl.core.LogFormatter;
import sh.bpl.core.crypto.PassphraseSigner;
import sh.bpl.core.crypto.PublicKey;
import sh.bpl.core.crypto.Signature;
import sh.bpl.core.crypto.Signer;
import sh.bpl.core.error.MalformedKeyException;
import sh.bpl.core.error.MissingSignatureException;
import sh.bpl.core.error.TxnException;
import sh.bpl.core.error.VerificationException;

/**
 * Signs transactions and verifies their signatures.
 *
 * <h2>Signed bytes</h2>
 * <ul>
 * <li>First signature: SHA-256 of the encoding with no signature sections. This is also
 * the hash behind {@link Transaction#id()}.</li>
 * <li>Second signature: SHA-256 of the encoding including the first signature and
 * excluding the second.</li>
 * </ul>
 *
 * <p>The first signature is always made and checked with the sender key; a requester key
 * only contributes its bytes to the signed encoding. Verification returns {@code false} for a
 * signature that does not match (including bytes that are not valid DER) and throws
 * {@link VerificationException} when the inputs cannot be interpreted at all.
 *
 * <pre>{@code
 * Transaction signed = TransactionSigner.sign(tx, "first passphrase");
 * Transaction doubly = TransactionSigner.secondSign(signed, "second passphrase");
 *
 * boolean ok = TransactionSigner.verify(doubly)
 *         && TransactionSigner.secondVerify(doubly, secondPublicKeyHex);
 * }</pre>
 *
 * @since 1.0
 */
public final class TransactionSigner {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionSigner.class);

    private TransactionSigner() {
        // Utility class
    }

    /**
     * Signs {@code tx} with {@code signer}. Any existing signatures are replaced.
     *
     * @param tx     the transaction
     * @param signer signer holding the sender key
     * @return the signed copy
     * @throws TxnException if the signer's key is not the sender key
     */
    public static Transaction sign(final Transaction tx, final Signer signer) {
        Objects.requireNonNull(tx, "tx cannot be null");
        Objects.requireNonNull(signer, "signer cannot be null");

        final PublicKey signerKey = signer.publicKey();
        if (!Arrays.equals(FieldCodec.publicKeyBytes(tx.senderPublicKey()), signerKey.toBytes())) {
            throw new TxnException("Signer key " + signerKey.toHex()
                    + " does not match sender key " + tx.senderPublicKey());
        }

        final Signature signature = signer.sign(signingHash(tx));
        if (BplDebug.isTxLoggingEnabled()) {
            DebugLogger.logTx(LogFormatter.formatSign(tx.id(), tx.type(), signerKey.toHex()));
        }
        return tx.withSignature(signature.toHex());
    }

    /**
     * Derives a key from {@code passphrase} and signs with it.
     *
     * @see #sign(Transaction, Signer)
     */
    public static Transaction sign(final Transaction tx, final String passphrase) {
        final PassphraseSigner signer = new PassphraseSigner(passphrase);
        try {
            return sign(tx, signer);
        } finally {
            signer.destroy();
        }
    }

    /**
     * Adds a second signature over the first-signed bytes.
     *
     * @param tx     a transaction that already carries its first signature
     * @param signer the second-passphrase signer
     * @return the doubly signed copy
     * @throws MissingSignatureException if {@code tx} has no first signature
     */
    public static Transaction secondSign(final Transaction tx, final Signer signer) {
        Objects.requireNonNull(tx, "tx cannot be null");
        Objects.requireNonNull(signer, "signer cannot be null");
        if (tx.signature() == null) {
            throw new MissingSignatureException("Second signing requires a first signature");
        }

        final Signature signature = signer.sign(secondSigningHash(tx));
        if (BplDebug.isTxLoggingEnabled()) {
            DebugLogger.logTx(LogFormatter.formatSecondSign(tx.id(), signer.publicKey().toHex()));
        }
        return tx.withSecondSignature(signature.toHex());
    }

    /**
     * Derives a key from {@code secondPassphrase} and second-signs with it.
     *
     * @see #secondSign(Transaction, Signer)
     */
    public static Transaction secondSign(final Transaction tx, final String secondPassphrase) {
        final PassphraseSigner signer = new PassphraseSigner(secondPassphrase);
        try {
            return secondSign(tx, signer);
        } finally {
            signer.destroy();
        }
    }

    /**
     * Verifies the first signature against the sender key.
     *
     * @param tx the transaction
     * @return whether the signature matches the sender key
     * @throws VerificationException if the transaction is unsigned or its sender key
     *                               is not a valid public key
     */
    public static boolean verify(final Transaction tx) {
        Objects.requireNonNull(tx, "tx cannot be null");
        final String keyHex = tx.senderPublicKey();
        final boolean valid = check(signingHash(tx), tx.signature(), keyHex, "signature");
        if (BplDebug.isTxLoggingEnabled()) {
            DebugLogger.logTx(LogFormatter.formatVerify(tx.id(), keyHex, valid));
        }
        return valid;
    }

    /**
     * Verifies the second signature against the sender key.
     *
     * @param tx the doubly signed transaction
     * @return whether the second signature matches the sender key
     * @throws VerificationException if a signature is missing or the key is not a valid point
     */
    public static boolean secondVerify(final Transaction tx) {
        Objects.requireNonNull(tx, "tx cannot be null");
        return secondVerify(tx, tx.senderPublicKey());
    }

    /**
     * Verifies the second signature against the account's registered second public key.
     *
     * @param tx              the doubly signed transaction
     * @param secondPublicKey hex second public key
     * @return whether the second signature matches
     * @throws VerificationException if a signature is missing or the key is not a valid point
     */
    public static boolean secondVerify(final Transaction tx, final String secondPublicKey) {
        Objects.requireNonNull(tx, "tx cannot be null");
        Objects.requireNonNull(secondPublicKey, "secondPublicKey cannot be null");
        if (tx.signature() == null) {
            throw new VerificationException("Transaction has no first signature");
        }
        final boolean valid = check(secondSigningHash(tx), tx.secondSignature(), secondPublicKey,
                "second signature");
        if (BplDebug.isTxLoggingEnabled()) {
            DebugLogger.logTx(LogFormatter.formatSecondVerify(tx.id(), secondPublicKey, valid));
        }
        return valid;
    }

    /**
     * Hash covered by the first signature.
     *
     * @return 32-byte hash
     */
    public static byte[] signingHash(final Transaction tx) {
        return TransactionEncoder.hash(tx, false, false);
    }

    /**
     * Hash covered by the second signature.
     *
     * @return 32-byte hash
     * @throws MissingSignatureException if {@code tx} has no first signature
     */
    public static byte[] secondSigningHash(final Transaction tx) {
        return TransactionEncoder.hash(tx, true, false);
    }

    private static boolean check(final byte[] hash, final @Nullable String signatureHex, final String keyHex,
            final String what) {
        if (signatureHex == null) {
            throw new VerificationException("Transaction has no " + what);
        }
        final PublicKey key;
        try {
            key = PublicKey.fromHex(keyHex);
        } catch (MalformedKeyException e) {
            throw new VerificationException("Cannot verify " + what + ": malformed public key", e);
        }
        final Signature signature;
        try {
            signature = Signature.fromHex(signatureHex);
        } catch (IllegalArgumentException e) {
            LOG.debug("Rejecting {} that is not strict DER: {}", what, e.getMessage());
            return false;
        }
        return key.verify(hash, signature);
    }
}
