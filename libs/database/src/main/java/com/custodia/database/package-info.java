/**
 * PostgreSQL persistence for the audit chain.
 *
 * <p>{@link com.custodia.database.JdbcAuditStore} stores entries in {@code audit_entry} through
 * Spring JDBC, {@link com.custodia.database.JdbcSequenceReferenceGenerator} keeps the
 * per-tenant reference counters in {@code audit_sequence_counter}, and
 * {@link com.custodia.database.migration.AuditSchemaMigrator} applies the Flyway migrations under
 * {@code classpath:db/migration/audit}.
 *
 * <p>Immutability is enforced twice: by the store's guard, and by a table trigger that rejects
 * updates of hashed columns and deletes unless the transaction has set
 * {@code custodia.maintenance_mode} to {@code on}. Only a store created with
 * {@code JdbcAuditStore.withMaintenanceMode} sets it.
 */
package com.custodia.database;
