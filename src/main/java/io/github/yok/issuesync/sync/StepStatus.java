package io.github.yok.issuesync.sync;

/**
 * Outcome tag of one sync step.
 */
public enum StepStatus {
    // Step did its work (or found nothing to do)
    SUCCESS,
    // Step was not applicable (mode, missing remote)
    SKIPPED,
    // Step failed; later steps still run
    WARNING,
    // Step failed and the pipeline stops
    FATAL
}
