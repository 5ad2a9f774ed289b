// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.tx;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.bpl.primitives.ByteWriter;

/**
 * Registers the sender as a delegate under {@code username}.
 *
 * <p>Usernames are 1-20 characters of lowercase letters, digits and {@code !@$&_.}.
 *
 * @param username delegate name
 */
public record DelegateAsset(String username) implements TransactionAsset {

    private static final Pattern USERNAME = Pattern.compile("^[a-z0-9!@$&_.]{1,20}$");

    public DelegateAsset {
        Objects.requireNonNull(username, "username cannot be null");
        if (!USERNAME.matcher(username).matches()) {
            throw new IllegalArgumentException("Invalid delegate username: '" + username
                    + "' (expected 1-20 chars of [a-z0-9!@$&_.])");
        }
    }

    /**
     * Lowercases {@code username} before validating it.
     *
     * @param username delegate name in any case
     * @return the asset
     */
    public static DelegateAsset of(final String username) {
        Objects.requireNonNull(username, "username cannot be null");
        return new DelegateAsset(username.toLowerCase(Locale.ROOT));
    }

    @Override
    public TransactionType type() {
        return TransactionType.DELEGATE;
    }

    @Override
    public void encodeTo(final ByteWriter writer) {
        writer.writeBytes(username.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public Map<String, Object> toMap() {
        final Map<String, Object> delegate = new LinkedHashMap<>();
        delegate.put("username", username);
        final Map<String, Object> asset = new LinkedHashMap<>();
        asset.put("delegate", delegate);
        return asset;
    }
}
