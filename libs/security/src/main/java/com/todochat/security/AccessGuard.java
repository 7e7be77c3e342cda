package com.todochat.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticates requests from bearer tokens and enforces resource ownership.
 * <p>
 * Per request: no credential or a bad token ends in {@link UnauthorizedException}; a verified
 * token whose subject is not in the {@link PrincipalLookup} ends the same way, so callers cannot
 * probe which principal ids exist. Once authenticated, {@link #authorize} is a plain equality
 * check between the principal id and the resource owner id. There are no roles or scopes, and
 * nothing is retried.
 */
public final class AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

    private final TokenAuthority tokenAuthority;
    private final PrincipalLookup principalLookup;

    public AccessGuard(TokenAuthority tokenAuthority, PrincipalLookup principalLookup) {
        if (tokenAuthority == null) {
            throw new IllegalArgumentException("tokenAuthority must not be null");
        }
        if (principalLookup == null) {
            throw new IllegalArgumentException("principalLookup must not be null");
        }
        this.tokenAuthority = tokenAuthority;
        this.principalLookup = principalLookup;
    }

    /**
     * Authenticates the credential in an {@code Authorization} header value.
     *
     * @param authorizationHeader raw header value, may be null
     * @return the authenticated principal
     * @throws UnauthorizedException if the header is missing, not a bearer credential, or the
     *                               token does not authenticate
     */
    public AuthenticatedPrincipal authenticateHeader(String authorizationHeader) {
        String token = BearerTokenExtractor.extract(authorizationHeader)
                .orElseThrow(() -> new UnauthorizedException(AuthFailureReason.MISSING_CREDENTIALS));
        return authenticate(token);
    }

    /**
     * Verifies the token and resolves its principal.
     *
     * @throws UnauthorizedException if the token is invalid or expired, or the principal does
     *                               not exist
     */
    public AuthenticatedPrincipal authenticate(String token) {
        String principalId = tokenAuthority.verify(token);
        return principalLookup.findById(principalId)
                .orElseThrow(() -> {
                    log.debug("Token subject has no principal record");
                    return new UnauthorizedException(AuthFailureReason.UNKNOWN_PRINCIPAL);
                });
    }

    /**
     * Fails unless the principal owns the resource.
     *
     * @param principal       the authenticated principal
     * @param resourceOwnerId id of the resource's owner
     * @throws ForbiddenException if the ids differ
     */
    public void authorize(AuthenticatedPrincipal principal, String resourceOwnerId) {
        if (principal == null) {
            throw new IllegalArgumentException("principal must not be null");
        }
        if (!principal.id().equals(resourceOwnerId)) {
            throw new ForbiddenException(principal.id(), resourceOwnerId);
        }
    }
}
