// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.tx;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.jspecify.annotations.Nullable;

import sh.bpl.core.builder.TxBuilderException;
import sh.bpl.core.error.TxnException;

/**
 * JSON projection of {@link Transaction#toMap()} and the reverse parse.
 *
 * <p>The JSON form is for transport and display only; hashing always goes through
 * {@link TransactionEncoder}. Parsing rebuilds the transaction through its builder, so
 * a parsed transaction is validated exactly like a constructed one and can be handed
 * straight to {@link TransactionSigner#verify(Transaction)}.
 *
 * <p>The older field names {@code venderField} and {@code signSignature} are accepted
 * on input; output always uses {@code vendorField} and {@code secondSignature}.
 *
 * @since 1.0
 */
public final class TransactionJson {
    private static final ObjectMapper MAPPER = createMapper();

    private TransactionJson() {}

    /**
     * Serializes {@code tx} as a JSON object.
     *
     * @param tx the transaction
     * @return JSON text
     * @throws TxnException if serialization fails
     */
    public static String toJson(final Transaction tx) {
        Objects.requireNonNull(tx, "tx cannot be null");
        try {
            return MAPPER.writeValueAsString(tx.toMap());
        } catch (JsonProcessingException e) {
            throw new TxnException("Cannot serialize transaction: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a transaction from JSON.
     *
     * @param json JSON object text
     * @return the transaction
     * @throws TxnException        if the text is not a JSON object, or its {@code id}
     *                             disagrees with the parsed content
     * @throws TxBuilderException  if a required field or asset entry is missing
     * @throws sh.bpl.core.error.BplException for any field that fails validation
     * @throws IllegalArgumentException     if an asset entry is invalid
     */
    public static Transaction fromJson(final String json) {
        Objects.requireNonNull(json, "json cannot be null");
        final JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TxnException("Invalid transaction JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new TxnException("Transaction JSON must be an object");
        }

        final JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.canConvertToInt()) {
            throw new TxBuilderException("Transaction JSON has no integer 'type'");
        }
        final TransactionType type = TransactionType.fromCode(typeNode.intValue());

        final Transaction tx = Transaction.builder()
                .type(type)
                .timestamp(requireLong(root, "timestamp"))
                .senderPublicKey(text(root, "senderPublicKey"))
                .requesterPublicKey(text(root, "requesterPublicKey"))
                .recipientId(text(root, "recipientId"))
                .vendorField(firstText(root, "vendorField", "venderField"))
                .amount(optionalLong(root, "amount", 0L))
                .fee(nullableLong(root, "fee"))
                .asset(parseAsset(type, root.path("asset")))
                .signature(text(root, "signature"))
                .secondSignature(firstText(root, "secondSignature", "signSignature"))
                .build();

        final String declaredId = text(root, "id");
        if (declaredId != null && !declaredId.equalsIgnoreCase(tx.id())) {
            throw new TxnException("Transaction id " + declaredId + " does not match content id " + tx.id());
        }
        return tx;
    }

    private static TransactionAsset parseAsset(final TransactionType type, final JsonNode asset) {
        return switch (type) {
            case TRANSFER -> TransferAsset.INSTANCE;
            case SECOND_SIGNATURE -> new SecondSignatureAsset(
                    requireText(asset.path("signature"), "asset.signature.publicKey", "publicKey"));
            case DELEGATE -> new DelegateAsset(
                    requireText(asset.path("delegate"), "asset.delegate.username", "username"));
            case VOTE -> new VoteAsset(requireTextList(asset.path("votes"), "asset.votes"));
            case MULTI_SIGNATURE -> {
                final JsonNode multi = asset.path("multisignature");
                if (!multi.isObject()) {
                    throw new TxBuilderException("Transaction JSON has no 'asset.multisignature'");
                }
                yield new MultiSignatureAsset(
                        requireInt(multi, "min", "asset.multisignature.min"),
                        requireInt(multi, "lifetime", "asset.multisignature.lifetime"),
                        requireTextList(multi.path("keysgroup"), "asset.multisignature.keysgroup"));
            }
        };
    }

    private static @Nullable String text(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new TxnException("Field '" + field + "' must be a string");
        }
        return value.textValue();
    }

    private static @Nullable String firstText(final JsonNode node, final String field, final String legacyField) {
        final String value = text(node, field);
        return value != null ? value : text(node, legacyField);
    }

    private static String requireText(final JsonNode node, final String path, final String field) {
        final String value = node.isObject() ? text(node, field) : null;
        if (value == null) {
            throw new TxBuilderException("Transaction JSON has no '" + path + "'");
        }
        return value;
    }

    private static List<String> requireTextList(final JsonNode node, final String path) {
        if (!node.isArray()) {
            throw new TxBuilderException("Transaction JSON has no array '" + path + "'");
        }
        final List<String> values = new ArrayList<>(node.size());
        for (final JsonNode element : node) {
            if (!element.isTextual()) {
                throw new TxnException("Entries of '" + path + "' must be strings");
            }
            values.add(element.textValue());
        }
        return values;
    }

    private static int requireInt(final JsonNode node, final String field, final String path) {
        final JsonNode value = node.get(field);
        if (value == null || !value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new TxBuilderException("Transaction JSON has no integer '" + path + "'");
        }
        return value.intValue();
    }

    private static long requireLong(final JsonNode node, final String field) {
        final Long value = nullableLong(node, field);
        if (value == null) {
            throw new TxBuilderException("Transaction JSON has no '" + field + "'");
        }
        return value;
    }

    private static long optionalLong(final JsonNode node, final String field, final long fallback) {
        final Long value = nullableLong(node, field);
        return value != null ? value : fallback;
    }

    // Amounts and fees may arrive as numbers or as decimal strings.
    private static @Nullable Long nullableLong(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            return value.longValue();
        }
        if (value.isTextual()) {
            try {
                return Long.parseLong(value.textValue());
            } catch (NumberFormatException e) {
                throw new TxnException("Field '" + field + "' is not an integer: " + value.textValue(), e);
            }
        }
        throw new TxnException("Field '" + field + "' must be an integer");
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
