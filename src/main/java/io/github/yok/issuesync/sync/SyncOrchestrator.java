package io.github.yok.issuesync.sync;

import com.google.common.collect.ImmutableList;
import io.github.yok.issuesync.config.PathsConfig;
import io.github.yok.issuesync.config.SyncConfig;
import io.github.yok.issuesync.export.IssueExporter;
import io.github.yok.issuesync.store.CommitErrors;
import io.github.yok.issuesync.store.VersionedStore;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs the {@code sync} workflow: commit, export (mirror mode only), push.
 *
 * <p>
 * <strong>Pipeline:</strong>
 * </p>
 * <ol>
 * <li>{@code commit}: commits pending changes. "Nothing to commit" counts as success.</li>
 * <li>{@code export}: writes the JSONL export; skipped in {@code native} mode.</li>
 * <li>{@code push}: pushes to the configured remote when it exists; skipped otherwise.</li>
 * </ol>
 *
 * <p>
 * Steps never throw. Each returns a {@link StepResult}; a {@code WARNING} is recorded and the next
 * step runs, only a {@code FATAL} result halts the pipeline. Running without an open store is a
 * no-op.
 * </p>
 *
 * <p>
 * Precondition: the caller holds the process access lock; at most one sync runs at a time against
 * the store handle.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncOrchestrator {

    static final String COMMIT_STEP = "commit";
    static final String EXPORT_STEP = "export";
    static final String PUSH_STEP = "push";

    static final String APP_NAME = "issuesync";

    private final SyncConfig syncConfig;

    private final PathsConfig pathsConfig;

    private final IssueExporter exporter;

    /**
     * One named step of the pipeline.
     */
    @FunctionalInterface
    interface SyncStep {

        StepResult run(VersionedStore store);
    }

    /**
     * Runs the pipeline against an open store.
     *
     * @param store open store, or {@code null} when none is open
     * @return results of the steps that ran
     */
    public SyncReport sync(VersionedStore store) {
        if (store == null) {
            log.info("No store open; nothing to sync");
            return SyncReport.empty();
        }
        if (!pathsConfig.isConfigured()) {
            log.info("No metadata directory configured; nothing to sync");
            return SyncReport.empty();
        }

        List<StepResult> results = new ArrayList<>();
        for (SyncStep step : pipeline()) {
            StepResult result = step.run(store);
            results.add(result);
            logResult(result);
            if (result.getStatus() == StepStatus.FATAL) {
                log.error("[{}] halted the sync pipeline", result.getStep());
                break;
            }
        }
        return new SyncReport(ImmutableList.copyOf(results));
    }

    List<SyncStep> pipeline() {
        return ImmutableList.of(this::commit, this::export, this::push);
    }

    StepResult commit(VersionedStore store) {
        String message = commitMessage();
        try {
            store.commit(message);
            return StepResult.success(COMMIT_STEP, "committed: " + message);
        } catch (SQLException | RuntimeException e) {
            if (CommitErrors.isNothingToCommit(e)) {
                return StepResult.success(COMMIT_STEP, "nothing to commit");
            }
            log.debug("[{}] commit error", COMMIT_STEP, e);
            return StepResult.warning(COMMIT_STEP, "Dolt commit failed: " + e.getMessage());
        }
    }

    StepResult export(VersionedStore store) {
        if (syncConfig.isNative()) {
            return StepResult.skipped(EXPORT_STEP, "native mode: store is the source of truth");
        }
        Path target = pathsConfig.getExportFile();
        try {
            int count = exporter.export(store.getConnection(), target);
            return StepResult.success(EXPORT_STEP,
                    "exported " + count + " issue(s) to " + target);
        } catch (Exception e) {
            log.debug("[{}] export error", EXPORT_STEP, e);
            return StepResult.warning(EXPORT_STEP, "export failed: " + e.getMessage());
        }
    }

    StepResult push(VersionedStore store) {
        String remote = syncConfig.getRemote();
        boolean hasRemote;
        try {
            hasRemote = store.hasRemote(remote);
        } catch (SQLException | RuntimeException e) {
            log.debug("[{}] remote probe for [{}] failed", PUSH_STEP, remote, e);
            return StepResult.skipped(PUSH_STEP,
                    "remote " + remote + " could not be checked: " + e.getMessage());
        }
        if (!hasRemote) {
            return StepResult.skipped(PUSH_STEP, "no remote " + remote + " configured");
        }
        try {
            store.push(remote);
            return StepResult.success(PUSH_STEP, "Pushed to Dolt remote " + remote);
        } catch (SQLException | RuntimeException e) {
            log.debug("[{}] push error", PUSH_STEP, e);
            return StepResult.warning(PUSH_STEP, "Dolt push failed: " + e.getMessage());
        }
    }

    String commitMessage() {
        return APP_NAME + " sync (auto-commit) by " + syncConfig.resolveActor();
    }

    private static void logResult(StepResult result) {
        switch (result.getStatus()) {
            case WARNING:
                log.warn("[{}] {}", result.getStep(), result.getMessage());
                break;
            case FATAL:
                log.error("[{}] {}", result.getStep(), result.getMessage());
                break;
            default:
                log.info("[{}] {}: {}", result.getStep(), result.getStatus(), result.getMessage());
        }
    }
}
