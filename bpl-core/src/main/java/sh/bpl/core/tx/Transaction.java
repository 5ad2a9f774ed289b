// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.tx;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.bpl.core.builder.TxBuilderException;
import sh.bpl.core.chain.SlotClock;
import sh.bpl.core.crypto.Signer;
import sh.bpl.core.error.UnrecognizedTypeException;
import sh.bpl.primitives.Hex;

/**
 * Immutable transaction.
 *
 * <p>
 * Instances come from {@link Builder#build()}, which validates every field through
 * {@link FieldCodec}; a {@code Transaction} that exists can always be encoded without
 * signatures. Signing returns a new instance via {@link #withSignature(String)} and
 * {@link #withSecondSignature(String)}.
 *
 * <pre>{@code
 * Transaction tx = Transaction.builder()
 *         .type(TransactionType.TRANSFER)
 *         .timestamp(clock.now())
 *         .senderPublicKey(signer.publicKey().toHex())
 *         .recipientId("B...")
 *         .amount(100_000_000L)
 *         .fee(10_000_000L)
 *         .build();
 *
 * Transaction signed = TransactionSigner.sign(tx, signer);
 * String id = signed.id();
 * }</pre>
 *
 * @since 1.0
 */
public final class Transaction {

    private final TransactionType type;
    private final long timestamp;
    private final String senderPublicKey;
    private final @Nullable String requesterPublicKey;
    private final @Nullable String recipientId;
    private final @Nullable String vendorField;
    private final long amount;
    private final long fee;
    private final TransactionAsset asset;
    private final @Nullable String signature;
    private final @Nullable String secondSignature;

    private Transaction(final Builder b, final TransactionType type, final TransactionAsset asset, final long fee) {
        this.type = type;
        this.timestamp = b.timestamp;
        this.senderPublicKey = b.senderPublicKey;
        this.requesterPublicKey = b.requesterPublicKey;
        this.recipientId = b.recipientId;
        this.vendorField = b.vendorField;
        this.amount = b.amount;
        this.fee = fee;
        this.asset = asset;
        this.signature = b.signature;
        this.secondSignature = b.secondSignature;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this transaction's fields.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        return new Builder()
                .type(type)
                .timestamp(timestamp)
                .senderPublicKey(senderPublicKey)
                .requesterPublicKey(requesterPublicKey)
                .recipientId(recipientId)
                .vendorField(vendorField)
                .amount(amount)
                .fee(fee)
                .asset(asset)
                .signature(signature)
                .secondSignature(secondSignature);
    }

    // -------------------- getters --------------------
    public TransactionType type() { return type; }
    public long timestamp() { return timestamp; }
    public String senderPublicKey() { return senderPublicKey; }
    public @Nullable String requesterPublicKey() { return requesterPublicKey; }
    public @Nullable String recipientId() { return recipientId; }
    public @Nullable String vendorField() { return vendorField; }
    public long amount() { return amount; }
    public long fee() { return fee; }
    public TransactionAsset asset() { return asset; }
    public @Nullable String signature() { return signature; }
    public @Nullable String secondSignature() { return secondSignature; }

    /**
     * Content identifier: hex SHA-256 of the canonical bytes without any signature section.
     * Signing does not change it.
     *
     * @return 64-char lowercase hex id
     */
    public String id() {
        return Hex.encode(TransactionEncoder.hash(this, false, false));
    }

    /**
     * Returns a copy carrying {@code signatureHex} as its first signature. An existing
     * first signature is replaced and any second signature is dropped, since it covered
     * the old first signature.
     *
     * @param signatureHex DER signature hex
     * @return the signed copy
     */
    public Transaction withSignature(final String signatureHex) {
        Objects.requireNonNull(signatureHex, "signature cannot be null");
        return toBuilder().signature(signatureHex).secondSignature(null).build();
    }

    /**
     * Returns a copy carrying {@code signatureHex} as its second signature.
     *
     * @param signatureHex DER signature hex
     * @return the doubly signed copy
     * @throws TxBuilderException if this transaction has no first signature
     */
    public Transaction withSecondSignature(final String signatureHex) {
        Objects.requireNonNull(signatureHex, "second signature cannot be null");
        return toBuilder().secondSignature(signatureHex).build();
    }

    /**
     * Key/value snapshot for transport and display. Not used for hashing.
     *
     * @return ordered map of plain values
     */
    public Map<String, Object> toMap() {
        final Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type.code());
        map.put("amount", amount);
        map.put("fee", fee);
        map.put("asset", asset.toMap());
        map.put("id", id());
        map.put("recipientId", recipientId);
        map.put("vendorField", vendorField);
        map.put("timestamp", timestamp);
        map.put("senderPublicKey", senderPublicKey);
        if (requesterPublicKey != null) {
            map.put("requesterPublicKey", requesterPublicKey);
        }
        map.put("signature", signature);
        map.put("secondSignature", secondSignature);
        return map;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Transaction other)) {
            return false;
        }
        return type == other.type
                && timestamp == other.timestamp
                && amount == other.amount
                && fee == other.fee
                && senderPublicKey.equals(other.senderPublicKey)
                && Objects.equals(requesterPublicKey, other.requesterPublicKey)
                && Objects.equals(recipientId, other.recipientId)
                && Objects.equals(vendorField, other.vendorField)
                && asset.equals(other.asset)
                && Objects.equals(signature, other.signature)
                && Objects.equals(secondSignature, other.secondSignature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, timestamp, senderPublicKey, requesterPublicKey, recipientId, vendorField,
                amount, fee, asset, signature, secondSignature);
    }

    @Override
    public String toString() {
        return "Transaction[id=" + id() + ", type=" + type + ", amount=" + amount + ", fee=" + fee
                + ", signed=" + (signature != null) + ", secondSigned=" + (secondSignature != null) + "]";
    }

    /**
     * Collects fields and produces a validated {@link Transaction}.
     *
     * <p>Required: type, timestamp, sender public key, fee. The asset defaults to
     * {@link TransferAsset} for transfers and is required for every other type.
     */
    public static final class Builder {
        private @Nullable Integer typeCode;
        private @Nullable Long timestamp;
        private @Nullable String senderPublicKey;
        private @Nullable String requesterPublicKey;
        private @Nullable String recipientId;
        private @Nullable String vendorField;
        private long amount;
        private @Nullable Long fee;
        private @Nullable TransactionAsset asset;
        private @Nullable String signature;
        private @Nullable String secondSignature;

        private Builder() {
        }

        public Builder type(final TransactionType type) {
            this.typeCode = Objects.requireNonNull(type, "type cannot be null").code();
            return this;
        }

        /**
         * Sets the type from its wire code; unknown codes fail at {@link #build()}.
         */
        public Builder type(final int code) {
            this.typeCode = code;
            return this;
        }

        public Builder timestamp(final long ts) { this.timestamp = ts; return this; }

        /**
         * Stamps the transaction with {@code clock.now()}, read once.
         */
        public Builder timestamp(final SlotClock clock) {
            this.timestamp = Objects.requireNonNull(clock, "clock cannot be null").now();
            return this;
        }

        public Builder senderPublicKey(final String pk) { this.senderPublicKey = pk; return this; }

        /**
         * Uses the signer's public key as sender key.
         */
        public Builder sender(final Signer signer) {
            this.senderPublicKey = Objects.requireNonNull(signer, "signer cannot be null").publicKey().toHex();
            return this;
        }

        public Builder requesterPublicKey(final @Nullable String pk) { this.requesterPublicKey = pk; return this; }
        public Builder recipientId(final @Nullable String r) { this.recipientId = r; return this; }
        public Builder vendorField(final @Nullable String hex) { this.vendorField = hex; return this; }

        /**
         * Sets the vendor field from UTF-8 text.
         */
        public Builder vendorFieldText(final String text) {
            this.vendorField = FieldCodec.vendorFieldFromText(text);
            return this;
        }

        public Builder amount(final long a) { this.amount = a; return this; }
        public Builder fee(final @Nullable Long f) { this.fee = f; return this; }
        public Builder asset(final @Nullable TransactionAsset a) { this.asset = a; return this; }
        public Builder signature(final @Nullable String s) { this.signature = s; return this; }
        public Builder secondSignature(final @Nullable String s) { this.secondSignature = s; return this; }

        /**
         * Validates and builds.
         *
         * @return the transaction
         * @throws TxBuilderException                   if a required field is missing
         * @throws sh.bpl.core.error.MissingFeeException if the fee is unset
         * @throws UnrecognizedTypeException            if the type code is unknown or the
         *                                              asset belongs to another type
         * @throws sh.bpl.core.error.EncodingException  if any field fails to encode
         */
        public Transaction build() {
            if (typeCode == null) {
                throw new TxBuilderException("Transaction type is required");
            }
            final TransactionType resolvedType = TransactionType.fromCode(typeCode);
            if (timestamp == null) {
                throw new TxBuilderException("Transaction timestamp is required");
            }
            FieldCodec.requireTimestamp(timestamp);
            if (senderPublicKey == null) {
                throw new TxBuilderException("Sender public key is required");
            }
            FieldCodec.requireNonNegative("amount", amount);
            final long resolvedFee = FieldCodec.requireFee(fee);

            final TransactionAsset resolvedAsset;
            if (asset != null) {
                resolvedAsset = asset;
            } else if (resolvedType == TransactionType.TRANSFER) {
                resolvedAsset = TransferAsset.INSTANCE;
            } else {
                throw new TxBuilderException("Asset is required for type " + resolvedType);
            }
            if (resolvedAsset.type() != resolvedType) {
                throw new UnrecognizedTypeException("Asset " + resolvedAsset.getClass().getSimpleName()
                        + " is not recognized for type " + resolvedType);
            }
            if (secondSignature != null && signature == null) {
                throw new TxBuilderException("A second signature requires a first signature");
            }

            final Transaction tx = new Transaction(this, resolvedType, resolvedAsset, resolvedFee);
            // Full encode validates keys, recipient, vendor field and signature hex.
            TransactionEncoder.encode(tx, signature != null, secondSignature != null);
            return tx;
        }
    }
}
