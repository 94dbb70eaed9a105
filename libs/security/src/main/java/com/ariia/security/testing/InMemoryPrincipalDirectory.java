package com.ariia.security.testing;

import com.ariia.security.Role;
import com.ariia.security.principal.PrincipalDirectory;
import com.ariia.security.principal.Tenant;
import com.ariia.security.principal.UserAccount;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link PrincipalDirectory} for tests.
 */
public final class InMemoryPrincipalDirectory implements PrincipalDirectory {

    /** Precomputed hash usable for fixture users that never sign in. */
    public static final String NO_PASSWORD = "pbkdf2_sha256$200000$AAAAAAAAAAAAAAAAAAAAAA$AAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA";

    private final Map<Long, UserAccount> users = new ConcurrentHashMap<>();
    private final Map<Long, Tenant> tenants = new ConcurrentHashMap<>();

    public Tenant addTenant(long id, String slug, boolean active) {
        Tenant tenant = new Tenant(id, slug, slug, active);
        tenants.put(id, tenant);
        return tenant;
    }

    public UserAccount addUser(long id, long tenantId, String email, Role role, boolean active) {
        return addUser(new UserAccount(id, tenantId, email, null, role, NO_PASSWORD, active));
    }

    public UserAccount addUser(UserAccount user) {
        users.put(user.id(), user);
        return user;
    }

    public void putTenant(Tenant tenant) {
        tenants.put(tenant.id(), tenant);
    }

    @Override
    public Optional<UserAccount> findUserById(long userId) {
        return Optional.ofNullable(users.get(userId));
    }

    @Override
    public Optional<UserAccount> findUserByEmail(String email) {
        return users.values().stream()
                .filter(user -> user.email().equals(email))
                .findFirst();
    }

    @Override
    public Optional<Tenant> findTenantById(long tenantId) {
        return Optional.ofNullable(tenants.get(tenantId));
    }
}
