package com.todochat.chatapi.api;

import com.todochat.chatapi.infrastructure.web.RequestAuthenticator;
import com.todochat.observability.CorrelationContextHolder;
import com.todochat.security.AuthenticatedPrincipal;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Owner-scoped resource: only the principal whose id matches {@code ownerId} may read it.
 */
@RestController
@RequestMapping("/api/{ownerId}")
public class ProfileController {

    private final RequestAuthenticator authenticator;

    public ProfileController(RequestAuthenticator authenticator) {
        this.authenticator = authenticator;
    }

    @GetMapping("/profile")
    public ProfileResponse profile(@PathVariable String ownerId, HttpServletRequest request) {
        AuthenticatedPrincipal principal = authenticator.requireOwner(request, ownerId);
        return new ProfileResponse(
                ownerId,
                principal.id(),
                principal.displayName(),
                CorrelationContextHolder.currentCorrelationId().orElse(null));
    }
}
