package org.cloudfiles.storage.infrastructure.security;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BCryptCredentialHasherTest {

    private final BCryptCredentialHasher hasher = new BCryptCredentialHasher();

    @Test
    void hash_isSaltedAndVerifiable() {
        String first = hasher.hash("secret_123");
        String second = hasher.hash("secret_123");

        assertNotEquals("secret_123", first);
        assertNotEquals(first, second);
        assertTrue(hasher.verify("secret_123", first));
        assertTrue(hasher.verify("secret_123", second));
    }

    @Test
    void verify_wrongPassword_returnsFalse() {
        String hash = hasher.hash("secret_123");

        assertFalse(hasher.verify("secret_124", hash));
    }
}
