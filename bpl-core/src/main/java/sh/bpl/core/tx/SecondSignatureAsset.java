// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.tx;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import sh.bpl.primitives.ByteWriter;

/**
 * Registers a second public key whose signature is required on every later transaction.
 *
 * @param publicKey hex-encoded second public key
 */
public record SecondSignatureAsset(String publicKey) implements TransactionAsset {

    public SecondSignatureAsset {
        Objects.requireNonNull(publicKey, "publicKey cannot be null");
        FieldCodec.publicKeyBytes(publicKey);
    }

    @Override
    public TransactionType type() {
        return TransactionType.SECOND_SIGNATURE;
    }

    @Override
    public void encodeTo(final ByteWriter writer) {
        writer.writeBytes(FieldCodec.publicKeyBytes(publicKey));
    }

    @Override
    public Map<String, Object> toMap() {
        final Map<String, Object> signature = new LinkedHashMap<>();
        signature.put("publicKey", publicKey);
        final Map<String, Object> asset = new LinkedHashMap<>();
        asset.put("signature", signature);
        return asset;
    }
}
