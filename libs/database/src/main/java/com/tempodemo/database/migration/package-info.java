/**
 * Flyway schema migration.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.tempodemo.database.migration.DatabaseProperties}: externalized connection and
 *       migration settings ({@code tempo.database.*})
 *   <li>{@link com.tempodemo.database.migration.SchemaMigrator}: brings the schema up to date once
 *       at startup
 *   <li>{@link com.tempodemo.database.migration.MigrationOutcome}: what a migration run did
 * </ul>
 */
package com.tempodemo.database.migration;
