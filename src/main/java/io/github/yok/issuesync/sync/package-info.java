/**
 * The {@code sync} workflow.
 *
 * <p>
 * {@link io.github.yok.issuesync.sync.SyncOrchestrator} runs a short pipeline of named steps and
 * collects their tagged results into a {@link io.github.yok.issuesync.sync.SyncReport}.
 * </p>
 */
package io.github.yok.issuesync.sync;
