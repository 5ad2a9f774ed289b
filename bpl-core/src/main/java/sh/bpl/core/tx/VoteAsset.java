// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.tx;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import sh.bpl.primitives.ByteWriter;

/**
 * Adds ({@code +key}) or removes ({@code -key}) votes for delegates.
 *
 * @param votes signed delegate public keys, at least one
 */
public record VoteAsset(List<String> votes) implements TransactionAsset {

    public VoteAsset {
        Objects.requireNonNull(votes, "votes cannot be null");
        if (votes.isEmpty()) {
            throw new IllegalArgumentException("votes cannot be empty");
        }
        votes = List.copyOf(votes);
        for (String vote : votes) {
            SignedKeys.requireSignedKey(vote, "+-", "vote");
        }
    }

    public static VoteAsset upvote(final String delegatePublicKey) {
        return new VoteAsset(List.of("+" + delegatePublicKey));
    }

    public static VoteAsset unvote(final String delegatePublicKey) {
        return new VoteAsset(List.of("-" + delegatePublicKey));
    }

    @Override
    public TransactionType type() {
        return TransactionType.VOTE;
    }

    @Override
    public void encodeTo(final ByteWriter writer) {
        writer.writeBytes(String.join("", votes).getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public Map<String, Object> toMap() {
        final Map<String, Object> asset = new LinkedHashMap<>();
        asset.put("votes", votes);
        return asset;
    }
}
