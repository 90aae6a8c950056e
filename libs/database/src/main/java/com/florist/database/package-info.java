/**
 * Database support for the flower catalog.
 *
 * <p>Schema changes ship as Flyway migrations under {@code classpath:db/migration/flowers}:
 *
 * <ul>
 *   <li>{@code V1__create_flowers_table.sql} creates the {@code flowers} table, its three indexes
 *       and the ten seed flowers
 *   <li>{@code V2__flowers_updated_at_trigger.sql} keeps {@code updated_at} current on every update
 * </ul>
 *
 * <p>Run them from the command line with {@code mvn -pl libs/database flyway:migrate} (or {@code
 * flyway:info}), or let the service apply them at startup through {@link
 * com.florist.database.migration.FlywayMigrationConfig}.
 */
package com.florist.database;
