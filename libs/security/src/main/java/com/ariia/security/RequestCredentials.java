package com.ariia.security;

/**
 * Everything a transport can present as credentials for one request. Any field may be null.
 *
 * @param authorizationHeader raw {@code Authorization} header value
 * @param cookieToken         value of the access-token cookie
 * @param legacyUserId        {@code X-User-Id} header (legacy fallback only)
 * @param legacyTenantId      {@code X-Tenant-Id} header (legacy fallback only)
 * @param legacyRole          {@code X-Role} header (legacy fallback only)
 */
public record RequestCredentials(
        String authorizationHeader,
        String cookieToken,
        String legacyUserId,
        String legacyTenantId,
        String legacyRole
) {

    public static RequestCredentials bearer(String authorizationHeader) {
        return new RequestCredentials(authorizationHeader, null, null, null, null);
    }

    public static RequestCredentials cookie(String cookieToken) {
        return new RequestCredentials(null, cookieToken, null, null, null);
    }
}
