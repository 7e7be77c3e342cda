package com.todochat.observability;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keeps credentials out of request logs.
 * <p>
 * A query parameter or header is treated as sensitive when its lower-cased name contains any of
 * the configured fragments; its value is then logged as {@value #REDACTED}. The default
 * fragments are {@link #DEFAULT_FRAGMENTS}.
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    public static final Set<String> DEFAULT_FRAGMENTS = Set.of(
            "password", "token", "secret", "authorization",
            "apikey", "api_key", "credential", "signature");

    private final Set<String> fragments;

    public SensitiveDataRedactor() {
        this(DEFAULT_FRAGMENTS);
    }

    /**
     * @param fragments name fragments that mark a field as sensitive, matched case-insensitively
     */
    public SensitiveDataRedactor(Set<String> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            throw new IllegalArgumentException("fragments must not be null or empty");
        }
        this.fragments = fragments.stream()
                .map(fragment -> fragment.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Loggable view of a query string. A parameter given once is shown as its bare value
     * ({@code page=2}), repeated ones as the list of values.
     *
     * @return insertion-ordered copy, empty for {@code null} input
     */
    public Map<String, Object> redactParameters(Map<String, List<String>> parameters) {
        Map<String, Object> loggable = new LinkedHashMap<>();
        if (parameters == null) {
            return loggable;
        }
        for (Map.Entry<String, List<String>> parameter : parameters.entrySet()) {
            String name = parameter.getKey();
            List<String> values = parameter.getValue();
            Object shown;
            if (isSensitive(name)) {
                shown = REDACTED;
            } else if (values != null && values.size() == 1) {
                shown = values.get(0);
            } else {
                shown = values;
            }
            loggable.put(name, shown);
        }
        return loggable;
    }

    public String redactValue(String fieldName, String value) {
        return isSensitive(fieldName) ? REDACTED : value;
    }

    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        String lowered = fieldName.toLowerCase(Locale.ROOT);
        return fragments.stream().anyMatch(lowered::contains);
    }
}
