/**
 * Referential-integrity checks over the implicit issue hierarchy.
 *
 * <p>
 * Detection only: this package reports orphaned child issues and leaves repair to external
 * tooling.
 * </p>
 */
package io.github.yok.issuesync.integrity;
