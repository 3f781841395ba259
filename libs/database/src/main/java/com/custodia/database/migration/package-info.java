/**
 * Flyway migration of the audit schema ({@code classpath:db/migration/audit}).
 */
package com.custodia.database.migration;
