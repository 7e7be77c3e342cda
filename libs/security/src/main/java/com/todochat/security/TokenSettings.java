package com.todochat.security;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Signing and lifetime settings for {@link TokenAuthority}.
 *
 * @param signingSecret process-wide HMAC secret; required, and at least as long as the
 *                      algorithm's digest (32 bytes for HS256)
 * @param algorithm     JWS algorithm name: HS256 (default), HS384 or HS512
 * @param lifetime      how long an issued token stays valid (default 24 hours)
 */
public record TokenSettings(String signingSecret, String algorithm, Duration lifetime) {

    /** Algorithm used when none is configured. */
    public static final String DEFAULT_ALGORITHM = "HS256";

    /** Token lifetime used when none is configured. */
    public static final Duration DEFAULT_LIFETIME = Duration.ofHours(24);

    private static final Map<String, Integer> MIN_SECRET_BYTES = Map.of(
            "HS256", 32,
            "HS384", 48,
            "HS512", 64);

    public TokenSettings {
        if (algorithm == null || algorithm.isBlank()) {
            algorithm = DEFAULT_ALGORITHM;
        }
        if (lifetime == null) {
            lifetime = DEFAULT_LIFETIME;
        }
        if (signingSecret == null || signingSecret.isBlank()) {
            throw new IllegalArgumentException("signingSecret must not be null or blank");
        }
        Integer minBytes = MIN_SECRET_BYTES.get(algorithm);
        if (minBytes == null) {
            throw new IllegalArgumentException(
                    "Unsupported signing algorithm '%s', expected one of HS256, HS384, HS512"
                            .formatted(algorithm));
        }
        if (signingSecret.getBytes(StandardCharsets.UTF_8).length < minBytes) {
            throw new IllegalArgumentException(
                    "signingSecret must be at least %d bytes for %s".formatted(minBytes, algorithm));
        }
        if (lifetime.isNegative() || lifetime.isZero()) {
            throw new IllegalArgumentException("lifetime must be positive");
        }
    }

    /** Settings with the default algorithm and lifetime. */
    public static TokenSettings withSecret(String signingSecret) {
        return new TokenSettings(signingSecret, DEFAULT_ALGORITHM, DEFAULT_LIFETIME);
    }
}
