package com.atlas.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks credentials before they reach a log line.
 * <p>
 * Field names are matched case-insensitively by substring, so {@code X-Hub-Signature-256} and
 * {@code Authorization} headers as well as {@code apiKey} or {@code jwt_secret} keys are all caught.
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    static final Set<String> DEFAULT_PATTERNS = Set.of(
            "authorization", "token", "secret", "apikey", "api_key", "api-key",
            "password", "signature", "credential");

    private final Pattern pattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_PATTERNS);
    }

    public SensitiveDataRedactor(Set<String> patterns) {
        this.pattern = Pattern.compile(
                String.join("|", patterns.stream().map(Pattern::quote).toList()),
                Pattern.CASE_INSENSITIVE);
    }

    public boolean isSensitive(String fieldName) {
        return fieldName != null && pattern.matcher(fieldName).find();
    }

    /** Copy of {@code data} with sensitive values replaced by {@value #REDACTED}. */
    public <V> Map<String, Object> redact(Map<String, V> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>(data.size());
        data.forEach((key, value) -> copy.put(key, isSensitive(key) ? REDACTED : value));
        return copy;
    }

    /**
     * Keeps the first four characters of a secret value, enough to tell keys apart in logs.
     * Values of eight characters or fewer are fully masked.
     */
    public static String mask(String secret) {
        if (secret == null || secret.isEmpty()) {
            return "";
        }
        if (secret.length() <= 8) {
            return REDACTED;
        }
        return secret.substring(0, 4) + "****";
    }
}
