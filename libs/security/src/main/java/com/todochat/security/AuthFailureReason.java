package com.todochat.security;

/**
 * Internal cause of an authentication failure.
 * <p>
 * Only for logs and tests: every reason produces the same externally visible
 * {@link UnauthorizedException#PUBLIC_MESSAGE}.
 */
public enum AuthFailureReason {

    /** No Authorization header, or not a {@code Bearer} credential. */
    MISSING_CREDENTIALS,

    /** The token is not a parseable signed JWT. */
    MALFORMED_TOKEN,

    /** The signature does not match the signing secret. */
    INVALID_SIGNATURE,

    /** The token's expiry is in the past. */
    EXPIRED,

    /** The {@code sub} claim is missing or not a principal id. */
    MALFORMED_SUBJECT,

    /** The token verified but no principal exists with its subject. */
    UNKNOWN_PRINCIPAL
}
