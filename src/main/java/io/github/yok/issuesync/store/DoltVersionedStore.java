package io.github.yok.issuesync.store;

import com.google.common.base.Preconditions;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link VersionedStore} backed by Dolt's SQL procedures.
 *
 * <ul>
 * <li>commit: {@code CALL DOLT_COMMIT('-Am', ?)}</li>
 * <li>remote probe: {@code SELECT name FROM dolt_remotes WHERE name = ?}</li>
 * <li>push: {@code CALL DOLT_PUSH(?, ?)} with the active branch</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DoltVersionedStore implements VersionedStore {

    static final String COMMIT_SQL = "CALL DOLT_COMMIT('-Am', ?)";
    static final String REMOTE_SQL = "SELECT name FROM dolt_remotes WHERE name = ?";
    static final String ACTIVE_BRANCH_SQL = "SELECT ACTIVE_BRANCH()";
    static final String PUSH_SQL = "CALL DOLT_PUSH(?, ?)";

    private final Connection connection;

    /**
     * Creates a store over an open connection.
     *
     * @param connection JDBC connection to a Dolt database
     */
    public DoltVersionedStore(Connection connection) {
        this.connection = Preconditions.checkNotNull(connection, "connection must not be null");
    }

    @Override
    public Connection getConnection() {
        return connection;
    }

    @Override
    public void commit(String message) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(COMMIT_SQL)) {
            ps.setString(1, message);
            ps.execute();
        }
        log.info("Committed working set: {}", message);
    }

    @Override
    public boolean hasRemote(String name) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(REMOTE_SQL)) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public void push(String remote) throws SQLException {
        String branch = activeBranch();
        try (PreparedStatement ps = connection.prepareStatement(PUSH_SQL)) {
            ps.setString(1, remote);
            ps.setString(2, branch);
            ps.execute();
        }
        log.info("Pushed branch [{}] to remote [{}]", branch, remote);
    }

    /**
     * Returns the branch checked out in the current session.
     *
     * @return branch name
     * @throws SQLException if the branch cannot be determined
     */
    String activeBranch() throws SQLException {
        try (Statement stmt = connection.createStatement();
                ResultSet rs = stmt.executeQuery(ACTIVE_BRANCH_SQL)) {
            if (!rs.next() || rs.getString(1) == null) {
                throw new SQLException("No active branch in the current session");
            }
            return rs.getString(1);
        }
    }
}
