// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.crypto;

import javax.security.auth.Destroyable;

/**
 * Signer backed by a key derived from a secret passphrase.
 */
public final class PassphraseSigner implements Signer, Destroyable {

    private final PrivateKey privateKey;
    private final PublicKey publicKey;

    /**
     * Derives the signing key from {@code passphrase}.
     *
     * @param passphrase the secret passphrase
     */
    public PassphraseSigner(final String passphrase) {
        this.privateKey = PrivateKey.fromPassphrase(passphrase);
        this.publicKey = privateKey.publicKey();
    }

    @Override
    public PublicKey publicKey() {
        return publicKey;
    }

    @Override
    public Signature sign(final byte[] hash) {
        return privateKey.sign(hash);
    }

    @Override
    public void destroy() {
        privateKey.destroy();
    }

    @Override
    public boolean isDestroyed() {
        return privateKey.isDestroyed();
    }

    @Override
    public String toString() {
        return "PassphraseSigner[publicKey=" + publicKey.toHex() + "]";
    }
}
