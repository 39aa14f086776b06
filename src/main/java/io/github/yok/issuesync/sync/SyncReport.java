package io.github.yok.issuesync.sync;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Value;

/**
 * Step results of one {@code sync} run, in execution order.
 */
@Value
public class SyncReport {

    List<StepResult> steps;

    /**
     * Report of a run that had nothing to sync.
     *
     * @return empty report
     */
    public static SyncReport empty() {
        return new SyncReport(ImmutableList.of());
    }

    /**
     * Returns the steps that ended with {@link StepStatus#WARNING}.
     *
     * @return warning results
     */
    @JsonIgnore
    public List<StepResult> getWarnings() {
        return steps.stream().filter(s -> s.getStatus() == StepStatus.WARNING)
                .collect(Collectors.toList());
    }

    /**
     * Returns whether a step ended with {@link StepStatus#FATAL}.
     *
     * @return {@code true} when the pipeline was halted
     */
    public boolean isHalted() {
        return steps.stream().anyMatch(s -> s.getStatus() == StepStatus.FATAL);
    }

    /**
     * Returns whether the run produced no step results.
     *
     * @return {@code true} for a no-op run
     */
    public boolean isEmpty() {
        return steps.isEmpty();
    }
}
