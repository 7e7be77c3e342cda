package com.todochat.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.regex.Pattern;

/**
 * Issues and verifies stateless bearer tokens (HMAC-signed JWTs).
 * <p>
 * A token carries {@code sub} (principal id), {@code iat} and {@code exp}. Nothing is stored on
 * the server; verification only needs the shared secret and the current time, which comes from
 * the injected {@link Clock}. Clock skew is not compensated.
 * <p>
 * Principal ids are canonical non-negative decimal integers ({@code "42"}, not {@code "042"}).
 * <p>
 * Thread-safe: all state is immutable after construction.
 */
public final class TokenAuthority {

    private static final Logger log = LoggerFactory.getLogger(TokenAuthority.class);

    private static final Pattern PRINCIPAL_ID = Pattern.compile("0|[1-9][0-9]{0,17}");

    private final SecretKey key;
    private final SignatureAlgorithm algorithm;
    private final Duration lifetime;
    private final Clock clock;
    private final JwtParser parser;

    public TokenAuthority(TokenSettings settings, Clock clock) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.key = Keys.hmacShaKeyFor(settings.signingSecret().getBytes(StandardCharsets.UTF_8));
        this.algorithm = SignatureAlgorithm.forName(settings.algorithm());
        this.lifetime = settings.lifetime();
        this.clock = clock;
        this.parser = Jwts.parserBuilder()
                .setSigningKey(key)
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    /**
     * Issues a token for the given principal, valid from now for the configured lifetime.
     *
     * @param principalId canonical principal id
     * @return the compact JWT string
     * @throws IllegalArgumentException if the id is not a canonical principal id
     */
    public String issue(String principalId) {
        if (!isPrincipalId(principalId)) {
            throw new IllegalArgumentException("principalId must be a canonical decimal id: " + principalId);
        }
        Instant now = clock.instant();
        return Jwts.builder()
                .setSubject(principalId)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plus(lifetime)))
                .signWith(key, algorithm)
                .compact();
    }

    /**
     * Verifies signature and expiry and returns the token's principal id.
     *
     * @param token compact JWT string
     * @return the principal id from the {@code sub} claim
     * @throws UnauthorizedException if the token is malformed, badly signed, expired, or has a
     *                               missing or malformed subject
     */
    public String verify(String token) {
        if (token == null || token.isBlank()) {
            throw reject(AuthFailureReason.MALFORMED_TOKEN, null);
        }
        Claims claims;
        try {
            claims = parser.parseClaimsJws(token).getBody();
        } catch (ExpiredJwtException e) {
            throw reject(AuthFailureReason.EXPIRED, e);
        } catch (io.jsonwebtoken.security.SecurityException e) {
            throw reject(AuthFailureReason.INVALID_SIGNATURE, e);
        } catch (JwtException | IllegalArgumentException e) {
            throw reject(AuthFailureReason.MALFORMED_TOKEN, e);
        }
        String subject = claims.getSubject();
        if (!isPrincipalId(subject)) {
            throw reject(AuthFailureReason.MALFORMED_SUBJECT, null);
        }
        return subject;
    }

    /** Returns the configured token lifetime. */
    public Duration lifetime() {
        return lifetime;
    }

    private static boolean isPrincipalId(String value) {
        return value != null && PRINCIPAL_ID.matcher(value).matches();
    }

    private static UnauthorizedException reject(AuthFailureReason reason, Throwable cause) {
        log.debug("Token rejected: reason={}", reason);
        return new UnauthorizedException(reason, cause);
    }
}
