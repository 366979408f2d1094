package com.eventhub.registration.modules.verification;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Randomness, hashing and MAC helpers for codes, tokens and signed links.
 * <ul>
 * <li>Numeric codes and tokens come from a shared {@link SecureRandom}</li>
 * <li>Codes are stored as SHA-256(salt:code), hex-encoded</li>
 * <li>All comparisons of secrets are constant-time</li>
 * </ul>
 */
public final class CryptoUtil {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private CryptoUtil() {
        // utility class
    }

    /**
     * Uniformly distributed numeric code, left-padded with zeros.
     */
    public static String randomNumericCode(int length) {
        if (length < 4 || length > 10) {
            throw new IllegalArgumentException("Code length must be between 4 and 10, got " + length);
        }
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(SECURE_RANDOM.nextInt(10));
        }
        return sb.toString();
    }

    /**
     * URL-safe random token with {@code bytes} bytes of entropy.
     */
    public static String randomToken(int bytes) {
        byte[] buf = new byte[bytes];
        SECURE_RANDOM.nextBytes(buf);
        return URL_ENCODER.encodeToString(buf);
    }

    public static String sha256Hex(String salt, String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((salt + ":" + value).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static byte[] hmacSha256(String secret, String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
        } catch (Exception e) {
            throw new IllegalStateException("HMAC-SHA256 failed", e);
        }
    }

    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }

    public static String base64Url(byte[] data) {
        return URL_ENCODER.encodeToString(data);
    }
}
