/**
 * Schema ownership for the ARIIA platform: tenants, users and the audit log.
 *
 * <p>Migrations follow Flyway's {@code V{n}__{desc}.sql} naming under
 * {@code db/migration/auth}.
 *
 * @see com.ariia.database.migration.AuthSchemaMigrationConfig
 */
package com.ariia.database;
