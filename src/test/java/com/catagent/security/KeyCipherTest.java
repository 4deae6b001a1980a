package com.catagent.security;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeyCipherTest {

    private final KeyCipher cipher = new KeyCipher("test-master-key");

    @Test
    void decryptsWhatItEncrypted() {
        var encoded = cipher.encrypt("sk-or-v1-abc");
        assertNotEquals("sk-or-v1-abc", encoded);
        assertEquals("sk-or-v1-abc", cipher.decrypt(encoded));
    }

    @Test
    void usesFreshIvPerEncryption() {
        assertNotEquals(cipher.encrypt("same"), cipher.encrypt("same"));
    }

    @Test
    void otherMasterKeyCannotDecrypt() {
        var encoded = cipher.encrypt("secret");
        var other = new KeyCipher("another-master-key");
        assertThrows(IllegalStateException.class, () -> other.decrypt(encoded));
    }

    @Test
    void malformedStoredValuesFailAsDecryptionErrors() {
        assertThrows(IllegalStateException.class, () -> cipher.decrypt("AAAA"));
        assertThrows(IllegalStateException.class, () -> cipher.decrypt("not base64!"));
    }

    @Test
    void rejectsBlankMasterKey() {
        assertThrows(IllegalArgumentException.class, () -> new KeyCipher(" "));
    }
}
