package com.eventhub.registration.modules.qualification;

import java.util.Locale;

/**
 * Masks and normalizes e-mail addresses.
 * <p>
 * {@code maria.lopez@example.com} becomes {@code m*********z@e*****e.com}:
 * the first and last character of the local part and of the first domain label
 * stay visible, the top-level part is kept as is.
 * </p>
 */
public final class EmailMasker {

    private EmailMasker() {
        // utility class
    }

    public static String mask(String email) {
        if (email == null || email.isBlank()) {
            return email;
        }
        int at = email.lastIndexOf('@');
        if (at <= 0 || at == email.length() - 1) {
            return maskPart(email);
        }

        String local = email.substring(0, at);
        String domain = email.substring(at + 1);

        int dot = domain.indexOf('.');
        String label = dot > 0 ? domain.substring(0, dot) : domain;
        String rest = dot > 0 ? domain.substring(dot) : "";

        return maskPart(local) + "@" + maskPart(label) + rest;
    }

    /** Trimmed, lower-cased form used as the identity key. */
    public static String normalize(String email) {
        if (email == null) {
            return null;
        }
        String trimmed = email.trim();
        return trimmed.isEmpty() ? null : trimmed.toLowerCase(Locale.ROOT);
    }

    private static String maskPart(String part) {
        int len = part.length();
        if (len <= 1) {
            return "*";
        }
        if (len == 2) {
            return part.charAt(0) + "*";
        }
        return part.charAt(0) + "*".repeat(len - 2) + part.charAt(len - 1);
    }
}
