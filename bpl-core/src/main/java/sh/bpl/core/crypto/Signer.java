// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bpl.core.crypto;

/**
 * Signs 32-byte transaction hashes and exposes the matching public key.
 * <p>
 * Implementations may hold a local key, delegate to a KMS, or wrap a hardware wallet.
 */
public interface Signer {

    /**
     * Returns the public key whose signatures this signer produces.
     *
     * @return the public key
     */
    PublicKey publicKey();

    /**
     * Signs a 32-byte hash.
     *
     * @param hash the hash to sign
     * @return the signature
     */
    Signature sign(byte[] hash);
}
