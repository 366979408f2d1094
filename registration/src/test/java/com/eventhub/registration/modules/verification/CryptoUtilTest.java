package com.eventhub.registration.modules.verification;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CryptoUtilTest {

    @Test
    @DisplayName("numeric code has the requested length and only digits")
    void numericCodeShape() {
        for (int i = 0; i < 50; i++) {
            String code = CryptoUtil.randomNumericCode(6);
            assertEquals(6, code.length());
            assertTrue(code.matches("\\d{6}"));
        }
    }

    @Test
    @DisplayName("numeric code length outside 4..10 is rejected")
    void numericCodeLengthBounds() {
        assertThrows(IllegalArgumentException.class, () -> CryptoUtil.randomNumericCode(3));
        assertThrows(IllegalArgumentException.class, () -> CryptoUtil.randomNumericCode(11));
    }

    @Test
    @DisplayName("random tokens are URL-safe and do not repeat")
    void tokensAreUrlSafeAndUnique() {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            String token = CryptoUtil.randomToken(32);
            assertTrue(token.matches("[A-Za-z0-9_\\-]+"));
            assertTrue(seen.add(token));
        }
    }

    @Test
    @DisplayName("salted hash depends on salt and value")
    void saltedHash() {
        String hash = CryptoUtil.sha256Hex("salt-a", "123456");

        assertEquals(64, hash.length());
        assertEquals(hash, CryptoUtil.sha256Hex("salt-a", "123456"));
        assertNotEquals(hash, CryptoUtil.sha256Hex("salt-b", "123456"));
        assertNotEquals(hash, CryptoUtil.sha256Hex("salt-a", "123457"));
    }

    @Test
    @DisplayName("HMAC differs per secret")
    void hmacDependsOnSecret() {
        String a = CryptoUtil.base64Url(CryptoUtil.hmacSha256("secret-1", "payload"));
        String b = CryptoUtil.base64Url(CryptoUtil.hmacSha256("secret-2", "payload"));

        assertNotEquals(a, b);
        assertEquals(a, CryptoUtil.base64Url(CryptoUtil.hmacSha256("secret-1", "payload")));
    }

    @Test
    @DisplayName("constantTimeEquals handles nulls")
    void constantTimeEquals() {
        assertTrue(CryptoUtil.constantTimeEquals("abc", "abc"));
        assertFalse(CryptoUtil.constantTimeEquals("abc", "abd"));
        assertFalse(CryptoUtil.constantTimeEquals(null, "abc"));
        assertFalse(CryptoUtil.constantTimeEquals("abc", null));
    }
}
