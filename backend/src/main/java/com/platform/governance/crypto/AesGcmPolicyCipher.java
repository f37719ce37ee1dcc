package com.platform.governance.crypto;

import com.platform.governance.config.GovernanceProperties;
import com.platform.governance.error.ErrorCode;
import com.platform.governance.error.PolicyEncryptionException;
import com.platform.governance.error.PolicyIntegrityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM policy cipher.
 *
 * Encrypted values are stored as Base64-encoded strings containing:
 * [12-byte IV][ciphertext][16-byte auth tag]
 *
 * The key is the SHA-256 digest of the configured passphrase. A missing key does
 * not prevent startup; every encrypt or decrypt then fails closed.
 */
@Slf4j
@Component
public class AesGcmPolicyCipher implements PolicyCipher {
    
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128; // bits
    private static final int MIN_PAYLOAD_LENGTH = GCM_IV_LENGTH + GCM_TAG_LENGTH / 8;
    
    private final SecretKey secretKey;
    private final SecureRandom secureRandom = new SecureRandom();
    
    public AesGcmPolicyCipher(GovernanceProperties properties) {
        this.secretKey = deriveKey(properties.getEncryption().getKey());
        if (secretKey == null) {
            log.error("governance.encryption.key is not set. Policy reads and writes will fail.");
        } else {
            log.info("Policy cipher initialized (AES-256-GCM)");
        }
    }
    
    @Override
    public String encrypt(String plaintext, String associatedData) {
        requireKey();
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);
            
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            cipher.updateAAD(aad(associatedData));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            
            ByteBuffer buffer = ByteBuffer.allocate(iv.length + ciphertext.length);
            buffer.put(iv);
            buffer.put(ciphertext);
            return Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new PolicyEncryptionException("Failed to encrypt policy rule logic", e);
        }
    }
    
    @Override
    public String decrypt(String encryptedValue, String associatedData) {
        requireKey();
        if (encryptedValue == null) {
            throw new PolicyIntegrityException(null, "Encrypted policy payload is missing");
        }
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(encryptedValue);
        } catch (IllegalArgumentException e) {
            throw new PolicyIntegrityException(null, "Encrypted policy payload is not valid Base64", e);
        }
        if (decoded.length < MIN_PAYLOAD_LENGTH) {
            throw new PolicyIntegrityException(null, "Encrypted policy payload is truncated");
        }
        
        try {
            ByteBuffer buffer = ByteBuffer.wrap(decoded);
            byte[] iv = new byte[GCM_IV_LENGTH];
            buffer.get(iv);
            byte[] ciphertext = new byte[buffer.remaining()];
            buffer.get(ciphertext);
            
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            cipher.updateAAD(aad(associatedData));
            return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new PolicyIntegrityException(null, "Policy ciphertext failed authentication", e);
        } catch (GeneralSecurityException e) {
            throw new PolicyEncryptionException(ErrorCode.POLICY_DECRYPTION_FAILED, 
                "Failed to decrypt policy rule logic", e);
        }
    }
    
    private void requireKey() {
        if (secretKey == null) {
            throw new PolicyEncryptionException("Policy encryption key not configured. Set governance.encryption.key.");
        }
    }
    
    private static byte[] aad(String associatedData) {
        return (associatedData != null ? associatedData : "").getBytes(StandardCharsets.UTF_8);
    }
    
    private static SecretKey deriveKey(String passphrase) {
        if (passphrase == null || passphrase.isBlank()) {
            return null;
        }
        try {
            byte[] keyBytes = MessageDigest.getInstance("SHA-256").digest(passphrase.getBytes(StandardCharsets.UTF_8));
            return new SecretKeySpec(keyBytes, "AES");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
