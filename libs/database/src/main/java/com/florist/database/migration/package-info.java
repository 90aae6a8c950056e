/**
 * Flyway wiring and migration status reporting.
 *
 * <ul>
 *   <li>{@link com.florist.database.migration.FlywayConfigProperties} binds {@code
 *       florist.flyway.*}
 *   <li>{@link com.florist.database.migration.FlywayMigrationConfig} creates the Flyway instance and
 *       migrates before JDBC consumers start
 *   <li>{@link com.florist.database.migration.MigrationService} reports applied and pending
 *       migrations
 * </ul>
 */
package com.florist.database.migration;
