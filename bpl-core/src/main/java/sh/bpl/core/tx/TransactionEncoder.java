// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.tx;

import java.util.Objects;

import sh.bpl.core.BplDebug;
import sh.bpl.core.DebugLogger;
import sh.bpl.core.LogFormatter;
import sh.bpl.core.crypto.Sha256;
import sh.bpl.core.error.MissingSignatureException;
import sh.bpl.core.error.UnrecognizedTypeException;
import sh.bpl.primitives.ByteWriter;

/**
 * Produces the canonical byte sequence of a transaction.
 *
 * <h2>Layout</h2>
 *
 * <pre>
 * offset  width  field
 * 0       1      type
 * 1       4      timestamp (LE)
 * 5       33     sender public key
 * ..      33     requester public key (only when present)
 * ..      21     recipient (zeros when absent)
 * ..      64     vendor field (zero padded)
 * ..      8      amount (LE)
 * ..      8      fee (LE)
 * ..      *      asset bytes
 * ..      *      signature (when requested)
 * ..      *      second signature (when requested)
 * </pre>
 *
 * <p>
 * The requester key is the only optional section before the asset; everything else has a
 * fixed width, so the amount of every transaction without a requester sits at the same
 * offset.
 *
 * <p>
 * The sequence is built into a private buffer and copied out once complete. Any failure
 * surfaces as an exception and nothing is returned.
 */
public final class TransactionEncoder {

    private TransactionEncoder() {
        // Utility class
    }

    /**
     * Encodes {@code tx}.
     *
     * @param tx                     the transaction
     * @param includeSignature       append the first signature
     * @param includeSecondSignature append the second signature
     * @return canonical bytes
     * @throws MissingSignatureException  if a requested signature has not been computed
     * @throws UnrecognizedTypeException if the asset does not belong to the transaction type
     */
    public static byte[] encode(final Transaction tx, final boolean includeSignature,
                                final boolean includeSecondSignature) {
        Objects.requireNonNull(tx, "tx cannot be null");

        final ByteWriter writer = new ByteWriter();
        FieldCodec.writeType(writer, tx.type());
        FieldCodec.writeTimestamp(writer, tx.timestamp());
        FieldCodec.writePublicKey(writer, tx.senderPublicKey());
        if (tx.requesterPublicKey() != null) {
            FieldCodec.writePublicKey(writer, tx.requesterPublicKey());
        }
        FieldCodec.writeRecipient(writer, tx.recipientId());
        FieldCodec.writeVendorField(writer, tx.vendorField());
        FieldCodec.writeAmount(writer, tx.amount());
        FieldCodec.writeFee(writer, tx.fee());

        writeAsset(writer, tx);

        if (includeSignature) {
            if (tx.signature() == null) {
                throw new MissingSignatureException("Signature requested but the transaction is not signed");
            }
            FieldCodec.writeSignature(writer, tx.signature());
        }
        if (includeSecondSignature) {
            if (tx.secondSignature() == null) {
                throw new MissingSignatureException(
                        "Second signature requested but the transaction has no second signature");
            }
            FieldCodec.writeSignature(writer, tx.secondSignature());
        }
        if (BplDebug.isCodecLoggingEnabled()) {
            DebugLogger.logCodec(LogFormatter.formatEncode(tx.type(), writer.size(), includeSignature,
                    includeSecondSignature));
        }
        return writer.toBytes();
    }

    /**
     * SHA-256 of {@link #encode(Transaction, boolean, boolean)}.
     *
     * @return 32-byte hash
     */
    public static byte[] hash(final Transaction tx, final boolean includeSignature,
                              final boolean includeSecondSignature) {
        return Sha256.hash(encode(tx, includeSignature, includeSecondSignature));
    }

    private static void writeAsset(final ByteWriter writer, final Transaction tx) {
        final TransactionAsset asset = tx.asset();
        if (asset.type() != tx.type()) {
            throw new UnrecognizedTypeException(
                    "Asset " + asset.getClass().getSimpleName() + " is not recognized for type " + tx.type());
        }
        asset.encodeTo(writer);
    }
}
