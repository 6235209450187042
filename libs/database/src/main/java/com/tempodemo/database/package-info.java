/**
 * Database utilities shared by services that own the {@code users} table.
 *
 * @see com.tempodemo.database.migration
 */
package com.tempodemo.database;
