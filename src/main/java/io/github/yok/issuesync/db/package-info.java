/**
 * Store access package.
 *
 * <p>
 * Catalog introspection, the process access lock and the session that owns the single JDBC
 * connection opened per process.
 * </p>
 */
package io.github.yok.issuesync.db;
