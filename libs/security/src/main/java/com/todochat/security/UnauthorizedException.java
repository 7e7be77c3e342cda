package com.todochat.security;

/**
 * Thrown when a request cannot be authenticated.
 * <p>
 * The message is the same for every {@link AuthFailureReason} so that callers cannot tell a bad
 * signature from an expired token or an unknown principal. The reason is kept for diagnostics.
 */
public class UnauthorizedException extends RuntimeException {

    /** Message exposed to callers for every authentication failure. */
    public static final String PUBLIC_MESSAGE = "Invalid or expired token";

    private final AuthFailureReason reason;

    public UnauthorizedException(AuthFailureReason reason) {
        this(reason, null);
    }

    public UnauthorizedException(AuthFailureReason reason, Throwable cause) {
        super(PUBLIC_MESSAGE, cause);
        if (reason == null) {
            throw new IllegalArgumentException("reason must not be null");
        }
        this.reason = reason;
    }

    public AuthFailureReason reason() {
        return reason;
    }
}
