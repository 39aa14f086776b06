package io.github.yok.issuesync.db;

import io.github.yok.issuesync.store.VersionedStore;
import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * The single store handle of the process: the JDBC connection, the {@link VersionedStore} over
 * it, and the access lock guarding both.
 *
 * <p>
 * Closing the session closes the connection first and then releases the lock.
 * </p>
 */
@Slf4j
@Getter
public class StoreSession implements AutoCloseable {

    private final Connection connection;
    private final VersionedStore store;
    // null when no metadata directory is configured
    private final AccessLock lock;

    /**
     * Creates a session.
     *
     * @param connection open connection
     * @param store versioned store over {@code connection}
     * @param lock held access lock, or {@code null}
     */
    public StoreSession(Connection connection, VersionedStore store, AccessLock lock) {
        this.connection = connection;
        this.store = store;
        this.lock = lock;
    }

    /**
     * Closes the connection and releases the lock.
     *
     * @throws SQLException if the connection cannot be closed
     * @throws IOException if the lock cannot be released
     */
    @Override
    public void close() throws SQLException, IOException {
        try {
            connection.close();
            log.debug("Store connection closed");
        } finally {
            if (lock != null) {
                lock.close();
            }
        }
    }
}
