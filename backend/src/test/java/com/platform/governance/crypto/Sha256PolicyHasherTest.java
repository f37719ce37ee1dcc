package com.platform.governance.crypto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Sha256PolicyHasher")
class Sha256PolicyHasherTest {
    
    private final Sha256PolicyHasher hasher = new Sha256PolicyHasher();
    
    @Test
    @DisplayName("Should produce the lowercase hex SHA-256 digest")
    void shouldProduceHexDigest() {
        assertThat(hasher.hash("abc"))
            .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }
    
    @Test
    @DisplayName("Should match only the exact plaintext")
    void shouldMatchOnlyExactPlaintext() {
        String hash = hasher.hash("{\"rules\":[]}");
        
        assertThat(hasher.matches("{\"rules\":[]}", hash)).isTrue();
        assertThat(hasher.matches("{\"rules\":[] }", hash)).isFalse();
        assertThat(hasher.matches("{\"rules\":[]}", hash.toUpperCase())).isTrue();
        assertThat(hasher.matches("{\"rules\":[]}", null)).isFalse();
    }
    
    @Test
    @DisplayName("Should match an uppercase hash independently of the default locale")
    void shouldMatchUnderTurkishLocale() {
        Locale original = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            String hash = hasher.hash("{\"rules\":[]}");
            
            assertThat(hasher.matches("{\"rules\":[]}", hash.toUpperCase(Locale.ROOT))).isTrue();
        } finally {
            Locale.setDefault(original);
        }
    }
}
