package io.github.yok.issuesync.config;

/**
 * Synchronization modes of the {@code sync} command.
 *
 * <ul>
 * <li>NATIVE: the versioned store is authoritative; no flat-file mirror is maintained</li>
 * <li>MIRROR: a JSONL export is kept alongside the store as an interchange artifact</li>
 * </ul>
 */
public enum SyncMode {
    // Store only; export is skipped
    NATIVE,
    // Store plus JSONL export
    MIRROR
}
