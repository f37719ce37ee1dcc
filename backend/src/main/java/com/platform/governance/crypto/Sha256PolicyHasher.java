package com.platform.governance.crypto;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

@Component
public class Sha256PolicyHasher implements PolicyHasher {
    
    private static final String ALGORITHM = "SHA-256";
    
    @Override
    public String hash(String plaintext) {
        return HexFormat.of().formatHex(digest(plaintext));
    }
    
    @Override
    public boolean matches(String plaintext, String expectedHash) {
        if (plaintext == null || expectedHash == null) {
            return false;
        }
        byte[] actual = hash(plaintext).getBytes(StandardCharsets.US_ASCII);
        byte[] expected = expectedHash.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(actual, expected);
    }
    
    private static byte[] digest(String plaintext) {
        try {
            return MessageDigest.getInstance(ALGORITHM).digest(plaintext.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
