package io.github.yok.issuesync.store;

import lombok.Generated;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Classifies errors raised by {@link VersionedStore#commit(String)}.
 */
public final class CommitErrors {

    static final String NOTHING_TO_COMMIT = "nothing to commit";

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private CommitErrors() {
        throw new AssertionError("No io.github.yok.issuesync.store.CommitErrors instances for you!");
    }

    /**
     * Returns whether the error means the working set was clean.
     *
     * <p>
     * Every throwable in the cause chain is inspected; the match is case-insensitive.
     * </p>
     *
     * @param error commit error, may be {@code null}
     * @return {@code true} for the benign "nothing to commit" condition
     */
    public static boolean isNothingToCommit(Throwable error) {
        if (error == null) {
            return false;
        }
        return ExceptionUtils.getThrowableList(error).stream()
                .anyMatch(t -> StringUtils.containsIgnoreCase(t.getMessage(), NOTHING_TO_COMMIT));
    }
}
