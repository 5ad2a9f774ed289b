// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.tx;

import java.util.Objects;

import sh.bpl.primitives.Hex;

/**
 * Validation for {@code +key} / {@code -key} strings used by votes and keysgroups.
 */
final class SignedKeys {

    private static final int KEY_HEX_LENGTH = 66;

    private SignedKeys() {
        // Utility class
    }

    static void requireSignedKey(final String entry, final String allowedSigns, final String what) {
        Objects.requireNonNull(entry, what + " cannot be null");
        if (entry.length() != KEY_HEX_LENGTH + 1 || allowedSigns.indexOf(entry.charAt(0)) < 0) {
            throw new IllegalArgumentException("Invalid " + what + ": '" + entry
                    + "' (expected one of '" + allowedSigns + "' followed by a 33-byte hex key)");
        }
        final String key = entry.substring(1);
        if (Hex.hasPrefix(key) || !Hex.isValid(key)) {
            throw new IllegalArgumentException("Invalid " + what + ": '" + entry + "' is not hex after the sign");
        }
    }
}
