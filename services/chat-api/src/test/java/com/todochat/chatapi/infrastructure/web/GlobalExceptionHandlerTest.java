package com.todochat.chatapi.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.todochat.chatapi.config.ServiceProperties;
import com.todochat.observability.CorrelationContext;
import com.todochat.observability.CorrelationContextHolder;
import com.todochat.pipeline.error.ErrorBody;
import com.todochat.security.AuthFailureReason;
import com.todochat.security.ForbiddenException;
import com.todochat.security.UnauthorizedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Unit tests for {@link GlobalExceptionHandler}, without a Spring context.
 */
@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler(new ServiceProperties("svc", "production"));

    @BeforeEach
    void bindCorrelation() {
        CorrelationContextHolder.set(CorrelationContext.of("corr-9"));
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("maps UnauthorizedException to 401 with a bearer challenge")
    void unauthorized() {
        ResponseEntity<ErrorBody> result = handler.handleUnauthorized(new UnauthorizedException(AuthFailureReason.EXPIRED));

        assertThat(result.getStatusCode().value()).isEqualTo(401);
        assertThat(result.getHeaders().getFirst("WWW-Authenticate")).isEqualTo("Bearer");
        assertThat(result.getBody().message()).isEqualTo("Invalid or expired token");
        assertThat(result.getBody().correlationId()).isEqualTo("corr-9");
    }

    @Test
    @DisplayName("maps ForbiddenException to 403 without the ids")
    void forbidden() {
        ResponseEntity<ErrorBody> result = handler.handleForbidden(new ForbiddenException("42", "43"));

        assertThat(result.getStatusCode().value()).isEqualTo(403);
        assertThat(result.getBody().error()).isEqualTo("forbidden");
        assertThat(result.getBody().message()).doesNotContain("43");
    }

    @Test
    @DisplayName("hides exception detail outside development")
    void genericInProduction() {
        ResponseEntity<ErrorBody> result = handler.handleGeneric(new RuntimeException("db password wrong"));

        assertThat(result.getStatusCode().value()).isEqualTo(500);
        assertThat(result.getBody().error()).isEqualTo("internal_error");
        assertThat(result.getBody().detail()).isNull();
    }

    @Test
    @DisplayName("shows exception detail in development")
    void genericInDevelopment() {
        GlobalExceptionHandler development = new GlobalExceptionHandler(new ServiceProperties("svc", null));

        ResponseEntity<ErrorBody> result = development.handleGeneric(new RuntimeException("something broke"));

        assertThat(result.getBody().detail()).isEqualTo("java.lang.RuntimeException: something broke");
    }

    @Test
    @DisplayName("keeps the status of framework client errors")
    void frameworkClientError() {
        ResponseEntity<ErrorBody> result = handler.handleGeneric(new NoResourceFoundException(HttpMethod.GET, "nowhere"));

        assertThat(result.getStatusCode().value()).isEqualTo(404);
        assertThat(result.getBody().error()).isEqualTo("not_found");
        assertThat(result.getBody().message()).isEqualTo("Not Found");
    }
}
