/**
 * Backend dialect handling and connection provisioning.
 *
 * <p>
 * Dialect handlers isolate what differs between the embedded H2 backend and the networked
 * PostgreSQL and MySQL backends: DBUnit metadata settings, DDL grammar and whether indexes are
 * managed.
 * </p>
 */
package io.github.yok.tabload.db;
