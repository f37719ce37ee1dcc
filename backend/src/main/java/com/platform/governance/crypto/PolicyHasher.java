package com.platform.governance.crypto;

/**
 * Integrity hash over canonical policy plaintext.
 */
public interface PolicyHasher {
    
    String hash(String plaintext);
    
    /**
     * Constant-time comparison of the plaintext's hash with an expected hex digest.
     */
    boolean matches(String plaintext, String expectedHash);
}
