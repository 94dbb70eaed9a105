package com.ariia.security.token;

import com.ariia.security.Role;

/**
 * Identity a token is issued for.
 *
 * @param userId     becomes the {@code sub} claim
 * @param email      user's email
 * @param tenantId   user's tenant at issuance time
 * @param tenantSlug user's tenant slug at issuance time
 * @param role       user's role at issuance time
 */
public record TokenSubject(long userId, String email, long tenantId, String tenantSlug, Role role) {
}
