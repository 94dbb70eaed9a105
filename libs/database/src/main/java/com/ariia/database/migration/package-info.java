/**
 * Flyway migration configuration for the auth schema.
 *
 * <ul>
 *   <li>{@link com.ariia.database.migration.FlywayConfigProperties}: externalized settings
 *   <li>{@link com.ariia.database.migration.AuthSchemaMigrationConfig}: Spring
 *       {@code @Configuration} that migrates on startup
 * </ul>
 */
package com.ariia.database.migration;
