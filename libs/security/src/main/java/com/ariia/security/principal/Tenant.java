package com.ariia.security.principal;

/**
 * Tenant row as read from the system-of-record.
 *
 * @param id     tenant ID
 * @param slug   unique slug
 * @param name   display name
 * @param active whether members of the tenant may sign in
 */
public record Tenant(long id, String slug, String name, boolean active) {
}
