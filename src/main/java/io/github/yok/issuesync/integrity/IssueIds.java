package io.github.yok.issuesync.integrity;

import java.util.Optional;
import lombok.Generated;

/**
 * Parsing of hierarchical issue IDs.
 *
 * <p>
 * A root issue ID contains no {@value #SEPARATOR}; a child ID has the form
 * {@code <parent-id>.<suffix>}. The parent is only encoded in the string; there is no foreign key.
 * </p>
 */
public final class IssueIds {

    /** Separator between a parent ID and a child suffix. */
    public static final char SEPARATOR = '.';

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private IssueIds() {
        throw new AssertionError("No io.github.yok.issuesync.integrity.IssueIds instances for you!");
    }

    /**
     * Returns the text before the first separator.
     *
     * <p>
     * For {@code bd-abc.1.2} this is {@code bd-abc}, the root ancestor, not the immediate parent
     * {@code bd-abc.1}. Orphan detection relies on exactly this single-level rule.
     * </p>
     *
     * @param id issue ID
     * @return prefix before the first separator, or empty for IDs without one (or {@code null})
     */
    public static Optional<String> firstSeparatorPrefix(String id) {
        if (id == null) {
            return Optional.empty();
        }
        int idx = id.indexOf(SEPARATOR);
        if (idx < 0) {
            return Optional.empty();
        }
        return Optional.of(id.substring(0, idx));
    }

    /**
     * Returns whether the ID denotes a child issue.
     *
     * @param id issue ID
     * @return {@code true} when the ID contains the separator
     */
    public static boolean isChild(String id) {
        return firstSeparatorPrefix(id).isPresent();
    }
}
