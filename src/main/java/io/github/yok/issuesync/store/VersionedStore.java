package io.github.yok.issuesync.store;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Versioning operations of the relational store used by the {@code sync} command.
 *
 * <p>
 * Implementations wrap one open JDBC connection. They are not thread-safe: callers serialize
 * access through the process access lock.
 * </p>
 */
public interface VersionedStore {

    /**
     * Returns the JDBC connection backing this store.
     *
     * @return open connection
     */
    Connection getConnection();

    /**
     * Commits all pending working-set changes.
     *
     * @param message commit message
     * @throws SQLException if the commit fails, including when there is nothing to commit
     */
    void commit(String message) throws SQLException;

    /**
     * Checks whether a remote with the given name is configured.
     *
     * @param name remote name
     * @return {@code true} when configured
     * @throws SQLException if the remote list cannot be read
     */
    boolean hasRemote(String name) throws SQLException;

    /**
     * Pushes the active branch to the given remote.
     *
     * @param remote remote name
     * @throws SQLException if the push fails
     */
    void push(String remote) throws SQLException;
}
