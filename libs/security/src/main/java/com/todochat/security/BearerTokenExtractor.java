package com.todochat.security;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the credential out of an {@code Authorization: Bearer <token>} header.
 * <p>
 * The scheme is case-insensitive. Anything other than the scheme, whitespace and a single
 * whitespace-free token (for example {@code "Bearerabc"}, {@code "Basic xyz"} or
 * {@code "Bearer a b"}) yields no token.
 */
public final class BearerTokenExtractor {

    private static final Pattern BEARER = Pattern.compile("(?i)bearer\\s+(\\S+)");

    private BearerTokenExtractor() {
    }

    /**
     * @param authorizationHeader raw header value, possibly {@code null}
     * @return the token, or empty when the header is absent or not a bearer credential
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null) {
            return Optional.empty();
        }
        Matcher matcher = BEARER.matcher(authorizationHeader.strip());
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
