package com.todochat.pipeline.headers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.todochat.pipeline.HttpRequest;
import com.todochat.pipeline.HttpResponse;
import com.todochat.pipeline.RequestContext;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SecurityHeadersMiddleware")
class SecurityHeadersMiddlewareTest {

    private final HttpRequest request = HttpRequest.builder("GET", "/api/42/profile").build();
    private final RequestContext context = new RequestContext(Instant.parse("2026-01-15T10:00:00Z"));

    @Nested
    @DisplayName("Default policy")
    class DefaultPolicy {

        private final SecurityHeadersMiddleware middleware =
                new SecurityHeadersMiddleware(SecurityHeaderPolicy.defaults());

        @Test
        @DisplayName("stamps hardening and CORS headers")
        void stampsHeaders() throws Exception {
            HttpResponse response = middleware.handle(request, context, (r, c) -> HttpResponse.ok("ok"));

            assertThat(response.headers().asMap())
                    .containsEntry("Access-Control-Allow-Origin", "*")
                    .containsEntry("Access-Control-Allow-Methods", "GET, POST, PUT, DELETE, PATCH, OPTIONS")
                    .containsEntry("Access-Control-Allow-Headers", "Content-Type, Authorization, X-Correlation-ID")
                    .containsEntry("Access-Control-Expose-Headers",
                            "X-Correlation-ID, X-RateLimit-Limit, X-RateLimit-Remaining")
                    .containsEntry("Access-Control-Max-Age", "3600")
                    .containsEntry("X-Content-Type-Options", "nosniff")
                    .containsEntry("X-Frame-Options", "DENY")
                    .containsEntry("X-XSS-Protection", "1; mode=block")
                    .containsEntry("Strict-Transport-Security", "max-age=31536000; includeSubDomains")
                    .containsEntry("Referrer-Policy", "strict-origin-when-cross-origin");
        }

        @Test
        @DisplayName("joins the CSP directives in order")
        void contentSecurityPolicy() throws Exception {
            HttpResponse response = middleware.handle(request, context, (r, c) -> HttpResponse.ok("ok"));

            assertThat(response.headers().get("Content-Security-Policy")).contains(
                    "default-src 'self'; script-src 'self' 'unsafe-inline' 'unsafe-eval'; "
                            + "style-src 'self' 'unsafe-inline'; img-src 'self' data: https:; "
                            + "font-src 'self' data:; connect-src 'self'; frame-ancestors 'none'; "
                            + "base-uri 'self'; form-action 'self'");
        }

        @Test
        @DisplayName("removes Server and overrides weaker values set downstream")
        void overridesDownstream() throws Exception {
            HttpResponse response = middleware.handle(request, context, (r, c) -> HttpResponse.withStatus(500)
                    .header("server", "jetty")
                    .header("X-Frame-Options", "SAMEORIGIN"));

            assertThat(response.headers().contains("Server")).isFalse();
            assertThat(response.headers().get("X-Frame-Options")).contains("DENY");
            assertThat(response.status()).isEqualTo(500);
        }
    }

    @Test
    @DisplayName("uses the configured CORS origin")
    void configuredOrigin() throws Exception {
        SecurityHeadersMiddleware middleware =
                new SecurityHeadersMiddleware(SecurityHeaderPolicy.forOrigin("https://app.todochat.dev"));

        HttpResponse response = middleware.handle(request, context, (r, c) -> HttpResponse.ok("ok"));

        assertThat(response.headers().get("Access-Control-Allow-Origin")).contains("https://app.todochat.dev");
    }

    @Test
    @DisplayName("rejects a blank origin")
    void blankOrigin() {
        assertThatThrownBy(() -> SecurityHeaderPolicy.forOrigin(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
