package com.tempodemo.security;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Extracts Basic credentials from HTTP Authorization header values.
 * <p>
 * Expects {@code "Basic " + base64(username ":" password)}. The scheme prefix is matched
 * case-sensitively, the payload must be standard Base64 with its {@code =} padding, the decoded
 * bytes must be valid UTF-8, and the decoded text must contain exactly one colon. A password
 * containing a colon is therefore rejected as malformed.
 */
public final class BasicCredentialsExtractor {

    /** Scheme prefix, including the separating space. */
    public static final String BASIC_PREFIX = "Basic ";

    private BasicCredentialsExtractor() {
        // utility class
    }

    /**
     * Decodes the credentials carried by an Authorization header value.
     *
     * @param authorizationHeader the full header value (may be null)
     * @return the decoded credentials, or empty if the header is missing or malformed
     */
    public static Optional<BasicCredentials> extract(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BASIC_PREFIX)) {
            return Optional.empty();
        }
        String encoded = authorizationHeader.substring(BASIC_PREFIX.length());
        // the JDK decoder tolerates missing padding, a padded payload is always whole quanta
        if (encoded.length() % 4 != 0) {
            return Optional.empty();
        }

        String decoded;
        try {
            decoded = decodeUtf8(Base64.getDecoder().decode(encoded));
        } catch (IllegalArgumentException | CharacterCodingException e) {
            return Optional.empty();
        }

        // limit -1 keeps trailing empty segments, so "alice:" yields an empty password
        String[] parts = decoded.split(":", -1);
        if (parts.length != 2) {
            return Optional.empty();
        }
        return Optional.of(new BasicCredentials(parts[0], parts[1]));
    }

    /**
     * Builds a header value for the given pair. Used by clients and tests.
     */
    public static String encode(String username, String password) {
        String raw = username + ":" + password;
        return BASIC_PREFIX + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    private static String decodeUtf8(byte[] bytes) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }
}
