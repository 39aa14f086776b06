/**
 * Configuration model package for IssueSync.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml} (or equivalent
 * sources): the store connection, the metadata directory and the sync settings.
 * </p>
 *
 * <p>
 * This package primarily holds configuration data; execution logic is implemented in
 * {@code migration}, {@code integrity} and {@code sync}.
 * </p>
 */
package io.github.yok.issuesync.config;
