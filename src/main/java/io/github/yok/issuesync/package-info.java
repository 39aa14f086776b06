/**
 * Root package of IssueSync.
 *
 * <p>
 * Provides a CLI that evolves the issue store schema, reports orphaned child issues, and
 * synchronizes the versioned store with its JSONL export and remote.
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.issuesync.config}: configuration models</li>
 * <li>{@code io.github.yok.issuesync.db}: catalog introspection and the store session</li>
 * <li>{@code io.github.yok.issuesync.migration}: schema migrations</li>
 * <li>{@code io.github.yok.issuesync.integrity}: orphan detection</li>
 * <li>{@code io.github.yok.issuesync.store}: versioned store operations</li>
 * <li>{@code io.github.yok.issuesync.export}: JSONL export</li>
 * <li>{@code io.github.yok.issuesync.sync}: the sync workflow</li>
 * </ul>
 */
package io.github.yok.issuesync;
