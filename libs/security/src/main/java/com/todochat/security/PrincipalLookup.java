package com.todochat.security;

import java.util.Optional;

/**
 * Resolves a verified principal id to a principal record owned by the hosting service
 * (a user table, a remote directory, an in-memory fixture).
 */
@FunctionalInterface
public interface PrincipalLookup {

    /**
     * Finds the principal with the given id.
     *
     * @param principalId id taken from a verified token
     * @return the principal, or empty if it does not exist
     */
    Optional<AuthenticatedPrincipal> findById(String principalId);
}
