package com.todochat.chatapi.infrastructure.web;

import com.todochat.observability.CorrelationContextHolder;
import com.todochat.security.AccessGuard;
import com.todochat.security.AuthenticatedPrincipal;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Authenticates the bearer token of the current request and records the principal on the
 * pipeline context and in the logging context.
 */
@Component
public class RequestAuthenticator {

    private final AccessGuard accessGuard;

    public RequestAuthenticator(AccessGuard accessGuard) {
        this.accessGuard = accessGuard;
    }

    /**
     * @throws com.todochat.security.UnauthorizedException if the request has no valid credential
     */
    public AuthenticatedPrincipal authenticate(HttpServletRequest request) {
        AuthenticatedPrincipal principal = accessGuard.authenticateHeader(request.getHeader(HttpHeaders.AUTHORIZATION));
        PipelineFilter.requestContext(request).ifPresent(context -> context.setPrincipal(principal));
        CorrelationContextHolder.bindUser(principal.id());
        return principal;
    }

    /**
     * Authenticates the request and checks that the principal owns {@code ownerId}.
     *
     * @throws com.todochat.security.UnauthorizedException if the request has no valid credential
     * @throws com.todochat.security.ForbiddenException     if the resource belongs to someone else
     */
    public AuthenticatedPrincipal requireOwner(HttpServletRequest request, String ownerId) {
        AuthenticatedPrincipal principal = authenticate(request);
        accessGuard.authorize(principal, ownerId);
        return principal;
    }
}
