package com.todochat.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Case-insensitive, single-valued HTTP header map that keeps the first-seen spelling and
 * insertion order of each name.
 * <p>
 * Not thread-safe; a header map belongs to one request or one response.
 */
public final class HttpHeaders {

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    private record Entry(String name, String value) {}

    public HttpHeaders() {
    }

    /** Creates a header map holding a copy of the given name/value pairs. */
    public static HttpHeaders of(Map<String, String> values) {
        HttpHeaders headers = new HttpHeaders();
        if (values != null) {
            values.forEach(headers::set);
        }
        return headers;
    }

    /** Returns an independent copy of this header map. */
    public HttpHeaders copy() {
        HttpHeaders copy = new HttpHeaders();
        copy.entries.putAll(entries);
        return copy;
    }

    /**
     * Sets a header, replacing any existing value under the same name (ignoring case).
     *
     * @throws IllegalArgumentException if the name is blank or the value is null
     */
    public HttpHeaders set(String name, String value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("header name must not be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("header value must not be null: " + name);
        }
        String key = key(name);
        Entry existing = entries.get(key);
        entries.put(key, new Entry(existing != null ? existing.name() : name, value));
        return this;
    }

    /** Returns the value of a header, if present. */
    public Optional<String> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Entry entry = entries.get(key(name));
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    /** Returns true if the header is present. */
    public boolean contains(String name) {
        return name != null && entries.containsKey(key(name));
    }

    /** Removes a header; returns true if it was present. */
    public boolean remove(String name) {
        return name != null && entries.remove(key(name)) != null;
    }

    /** Returns an unmodifiable name → value view, names in their original spelling. */
    public Map<String, String> asMap() {
        Map<String, String> view = new LinkedHashMap<>();
        entries.values().forEach(e -> view.put(e.name(), e.value()));
        return Collections.unmodifiableMap(view);
    }

    public int size() {
        return entries.size();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
