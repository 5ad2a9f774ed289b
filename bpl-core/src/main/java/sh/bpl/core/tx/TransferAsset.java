// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.tx;

import java.util.Map;

import sh.bpl.primitives.ByteWriter;

/**
 * Plain value transfer; contributes no asset bytes.
 */
public record TransferAsset() implements TransactionAsset {

    public static final TransferAsset INSTANCE = new TransferAsset();

    @Override
    public TransactionType type() {
        return TransactionType.TRANSFER;
    }

    @Override
    public void encodeTo(final ByteWriter writer) {
        // no asset bytes
    }

    @Override
    public Map<String, Object> toMap() {
        return Map.of();
    }
}
