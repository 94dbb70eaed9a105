package com.ariia.security.principal;

import java.util.Optional;

/**
 * Read port onto the system-of-record for users and tenants.
 * <p>
 * A row whose stored role is outside the closed set is reported as absent.
 */
public interface PrincipalDirectory {

    Optional<UserAccount> findUserById(long userId);

    /**
     * @param email normalized email
     */
    Optional<UserAccount> findUserByEmail(String email);

    Optional<Tenant> findTenantById(long tenantId);
}
