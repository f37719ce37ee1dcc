package com.platform.governance.crypto;

/**
 * Authenticated encryption of policy rule content.
 * The associated data binds a ciphertext to the policy key and version it was written for.
 */
public interface PolicyCipher {
    
    String encrypt(String plaintext, String associatedData);
    
    /**
     * @throws com.platform.governance.error.PolicyIntegrityException if the ciphertext
     *         fails authentication or is malformed
     */
    String decrypt(String ciphertext, String associatedData);
}
