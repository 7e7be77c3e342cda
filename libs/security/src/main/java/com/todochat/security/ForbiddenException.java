package com.todochat.security;

/**
 * Thrown when an authenticated principal requests a resource owned by someone else. The message
 * names both ids for logs; callers only ever see {@link #PUBLIC_MESSAGE}.
 */
public class ForbiddenException extends RuntimeException {

    /** Message exposed to callers. */
    public static final String PUBLIC_MESSAGE = "Not authorized to access this resource";

    private final String principalId;
    private final String resourceOwnerId;

    public ForbiddenException(String principalId, String resourceOwnerId) {
        super("Principal '%s' cannot access resource owned by '%s'"
                .formatted(principalId, resourceOwnerId));
        this.principalId = principalId;
        this.resourceOwnerId = resourceOwnerId;
    }

    public String principalId() {
        return principalId;
    }

    public String resourceOwnerId() {
        return resourceOwnerId;
    }
}
