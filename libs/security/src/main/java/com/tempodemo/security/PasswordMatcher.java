package com.tempodemo.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Compares a presented password with the stored one.
 * <p>
 * Stored passwords are plaintext. Presented passwords come from strictly decoded UTF-8, so
 * comparing the UTF-8 encodings is byte-for-byte. The comparison runs in time
 * independent of where the first difference occurs.
 */
public final class PasswordMatcher {

    private PasswordMatcher() {
        // utility class
    }

    /**
     * @param presented the password from the request (null never matches)
     * @param stored    the password read from the credential store (null never matches)
     * @return true if both are non-null and byte-identical
     */
    public static boolean matches(String presented, String stored) {
        if (presented == null || stored == null) {
            return false;
        }
        return MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                stored.getBytes(StandardCharsets.UTF_8));
    }
}
