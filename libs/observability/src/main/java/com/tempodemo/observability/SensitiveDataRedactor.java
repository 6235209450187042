package com.tempodemo.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Masks credential-bearing entries of a header map before it is logged.
 * <p>
 * A name is sensitive when it contains, ignoring case, one of: password, authorization, cookie,
 * token, secret, credential. {@code proxy-authorization} and {@code set-cookie} are therefore
 * masked as well.
 */
public final class SensitiveDataRedactor {

    /** Replacement for masked values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Pattern SENSITIVE_NAME =
            Pattern.compile("password|authorization|cookie|token|secret|credential", Pattern.CASE_INSENSITIVE);

    /**
     * Copies {@code data}, in iteration order, with sensitive values replaced by {@value #REDACTED}.
     * Null input yields an empty map.
     */
    public <V> Map<String, Object> redact(Map<String, V> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        data.forEach((name, value) -> result.put(name, isSensitive(name) ? REDACTED : value));
        return result;
    }

    public boolean isSensitive(String name) {
        return name != null && SENSITIVE_NAME.matcher(name).find();
    }
}
