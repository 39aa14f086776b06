package io.github.yok.issuesync.sync;

import lombok.Value;

/**
 * Result of one named sync step.
 */
@Value
public class StepResult {

    String step;

    StepStatus status;

    String message;

    /**
     * Step completed.
     *
     * @param step step name
     * @param message human-readable outcome
     * @return result with status {@link StepStatus#SUCCESS}
     */
    public static StepResult success(String step, String message) {
        return new StepResult(step, StepStatus.SUCCESS, message);
    }

    /**
     * Step did not apply and was not run.
     *
     * @param step step name
     * @param message human-readable outcome
     * @return result with status {@link StepStatus#SKIPPED}
     */
    public static StepResult skipped(String step, String message) {
        return new StepResult(step, StepStatus.SKIPPED, message);
    }

    /**
     * Step failed; later steps still run.
     *
     * @param step step name
     * @param message human-readable outcome
     * @return result with status {@link StepStatus#WARNING}
     */
    public static StepResult warning(String step, String message) {
        return new StepResult(step, StepStatus.WARNING, message);
    }

    /**
     * Step failed and halts the pipeline.
     *
     * @param step step name
     * @param message human-readable outcome
     * @return result with status {@link StepStatus#FATAL}
     */
    public static StepResult fatal(String step, String message) {
        return new StepResult(step, StepStatus.FATAL, message);
    }
}
