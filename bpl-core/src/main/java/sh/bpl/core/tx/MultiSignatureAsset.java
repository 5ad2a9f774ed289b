// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.tx;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import sh.bpl.primitives.ByteWriter;

/**
 * Converts the sender into a multisignature account.
 *
 * <p>
 * <strong>Constraints:</strong>
 * <ul>
 * <li>{@code keysgroup} - 1 to 16 {@code +}-prefixed public keys</li>
 * <li>{@code min} - signatures required, {@code 1..keysgroup.size()}</li>
 * <li>{@code lifetime} - hours a pending transaction stays valid, {@code 1..72}</li>
 * </ul>
 *
 * @param min       minimum number of signatures
 * @param lifetime  pending lifetime in hours
 * @param keysgroup member keys, each prefixed with {@code +}
 */
public record MultiSignatureAsset(int min, int lifetime, List<String> keysgroup) implements TransactionAsset {

    public static final int MAX_KEYS = 16;
    public static final int MAX_LIFETIME_HOURS = 72;

    public MultiSignatureAsset {
        Objects.requireNonNull(keysgroup, "keysgroup cannot be null");
        if (keysgroup.isEmpty() || keysgroup.size() > MAX_KEYS) {
            throw new IllegalArgumentException("keysgroup must hold 1.." + MAX_KEYS + " keys, got " + keysgroup.size());
        }
        keysgroup = List.copyOf(keysgroup);
        for (String key : keysgroup) {
            SignedKeys.requireSignedKey(key, "+", "keysgroup entry");
        }
        if (keysgroup.stream().distinct().count() != keysgroup.size()) {
            throw new IllegalArgumentException("keysgroup contains duplicate keys");
        }
        if (min < 1 || min > keysgroup.size()) {
            throw new IllegalArgumentException("min must be in 1.." + keysgroup.size() + ", got " + min);
        }
        if (lifetime < 1 || lifetime > MAX_LIFETIME_HOURS) {
            throw new IllegalArgumentException("lifetime must be in 1.." + MAX_LIFETIME_HOURS + ", got " + lifetime);
        }
    }

    @Override
    public TransactionType type() {
        return TransactionType.MULTI_SIGNATURE;
    }

    @Override
    public void encodeTo(final ByteWriter writer) {
        writer.writeByte(min);
        writer.writeByte(lifetime);
        writer.writeBytes(String.join("", keysgroup).getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public Map<String, Object> toMap() {
        final Map<String, Object> multisignature = new LinkedHashMap<>();
        multisignature.put("min", min);
        multisignature.put("lifetime", lifetime);
        multisignature.put("keysgroup", keysgroup);
        final Map<String, Object> asset = new LinkedHashMap<>();
        asset.put("multisignature", multisignature);
        return asset;
    }
}
