package com.ariia.security.principal;

import com.ariia.security.Role;

/**
 * User row as read from the system-of-record. Read-only to the auth core.
 *
 * @param id           user ID
 * @param tenantId     tenant the user currently belongs to
 * @param email        normalized (lower-case) email, unique
 * @param fullName     display name, may be null
 * @param role         role, always one of the closed set
 * @param passwordHash stored {@code pbkdf2_sha256$...} hash
 * @param active       whether the account may sign in
 */
public record UserAccount(
        long id,
        long tenantId,
        String email,
        String fullName,
        Role role,
        String passwordHash,
        boolean active
) {

    /** Keeps the password hash out of logs. */
    @Override
    public String toString() {
        return "UserAccount[id=%d, tenantId=%d, email=%s, role=%s, active=%s]"
                .formatted(id, tenantId, email, role, active);
    }
}
