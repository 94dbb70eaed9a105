package com.ariia.authgateway.api;

/**
 * Result of {@code POST /users/{id}/revoke-sessions}. {@code revoked} is false when the marker
 * could not be written; outstanding tokens then only end at their expiry.
 */
public record RevokeSessionsResponse(long userId, long tenantId, boolean revoked) {
}
