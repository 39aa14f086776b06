/**
 * Schema evolution package.
 *
 * <p>
 * Migrations are idempotent and re-derive their applicability from the live catalog through
 * {@link io.github.yok.issuesync.db.SchemaIntrospector}; there is no table of applied migrations.
 * </p>
 */
package io.github.yok.issuesync.migration;
