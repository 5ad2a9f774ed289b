// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.tx;

import java.util.Map;

import sh.bpl.primitives.ByteWriter;

/**
 * Type-specific payload of a transaction.
 *
 * <p>
 * The encoder calls {@link #encodeTo(ByteWriter)} after the fee and before any signature
 * section. Implementations may append zero or more bytes; the writer offers no way to
 * remove or reorder what is already there.
 *
 * <table border="1">
 * <tr><th>Kind</th><th>Bytes</th></tr>
 * <tr><td>{@link TransferAsset}</td><td>none</td></tr>
 * <tr><td>{@link SecondSignatureAsset}</td><td>the new public key</td></tr>
 * <tr><td>{@link DelegateAsset}</td><td>UTF-8 username</td></tr>
 * <tr><td>{@link VoteAsset}</td><td>UTF-8 of the concatenated votes</td></tr>
 * <tr><td>{@link MultiSignatureAsset}</td><td>min, lifetime, UTF-8 of the concatenated keysgroup</td></tr>
 * </table>
 *
 * @since 1.0
 */
public sealed interface TransactionAsset
        permits TransferAsset, SecondSignatureAsset, DelegateAsset, VoteAsset, MultiSignatureAsset {

    /**
     * Returns the transaction type this asset belongs to.
     *
     * @return the type
     */
    TransactionType type();

    /**
     * Appends this asset's canonical bytes.
     *
     * @param writer the buffer holding the transaction prefix
     */
    void encodeTo(ByteWriter writer);

    /**
     * Returns the JSON-ready projection of this asset ({@code {}} when there is none).
     *
     * @return nested map of plain values
     */
    Map<String, Object> toMap();
}
