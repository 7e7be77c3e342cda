package com.todochat.chatapi.infrastructure.directory;

import com.todochat.chatapi.config.DirectoryProperties;
import com.todochat.security.AuthenticatedPrincipal;
import com.todochat.security.PrincipalLookup;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link PrincipalLookup} over the principals listed in {@code todochat.directory.principals}.
 * Read-only after construction.
 */
@Component
public class InMemoryPrincipalDirectory implements PrincipalLookup {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPrincipalDirectory.class);

    private final Map<String, AuthenticatedPrincipal> principals;

    public InMemoryPrincipalDirectory(DirectoryProperties properties) {
        Map<String, AuthenticatedPrincipal> byId = new LinkedHashMap<>();
        for (DirectoryProperties.Principal entry : properties.principals()) {
            AuthenticatedPrincipal previous =
                    byId.put(entry.id(), new AuthenticatedPrincipal(entry.id(), entry.displayName()));
            if (previous != null) {
                throw new IllegalArgumentException("duplicate principal id: " + entry.id());
            }
        }
        this.principals = Map.copyOf(byId);
        log.info("Principal directory loaded with {} principals", principals.size());
    }

    @Override
    public Optional<AuthenticatedPrincipal> findById(String principalId) {
        return principalId == null ? Optional.empty() : Optional.ofNullable(principals.get(principalId));
    }

    public int size() {
        return principals.size();
    }
}
