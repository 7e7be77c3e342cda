package com.todochat.security;

/**
 * A principal whose bearer token verified and who exists in the principal directory.
 *
 * @param id          principal identifier (the token's {@code sub} claim)
 * @param displayName optional human-readable name
 */
public record AuthenticatedPrincipal(String id, String displayName) {

    public AuthenticatedPrincipal {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
    }

    /** Creates a principal known only by its id. */
    public static AuthenticatedPrincipal of(String id) {
        return new AuthenticatedPrincipal(id, null);
    }
}
