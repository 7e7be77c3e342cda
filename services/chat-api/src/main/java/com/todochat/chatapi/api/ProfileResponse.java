package com.todochat.chatapi.api;

/**
 * Body of {@code GET /api/{ownerId}/profile}.
 */
public record ProfileResponse(String ownerId, String principalId, String displayName, String correlationId) {
}
