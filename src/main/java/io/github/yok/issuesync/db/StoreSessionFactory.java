package io.github.yok.issuesync.db;

import io.github.yok.issuesync.config.ConnectionConfig;
import io.github.yok.issuesync.config.PathsConfig;
import io.github.yok.issuesync.store.DoltVersionedStore;
import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Opens the process-wide {@link StoreSession}.
 *
 * <p>
 * The access lock is taken before the connection is opened, so a second process fails before
 * touching the store. When {@code store.url} is not configured, no session is opened.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StoreSessionFactory {

    private final ConnectionConfig connectionConfig;

    private final PathsConfig pathsConfig;

    /**
     * Opens the session.
     *
     * @return open session, or empty when no store is configured
     * @throws SQLException if the connection cannot be opened
     * @throws IOException if the lock file cannot be opened
     * @throws ClassNotFoundException if the configured driver class is missing
     * @throws IllegalStateException if the store is locked by another process
     */
    public Optional<StoreSession> open() throws SQLException, IOException, ClassNotFoundException {
        if (!connectionConfig.isConfigured()) {
            log.info("No store configured (store.url is blank)");
            return Optional.empty();
        }
        AccessLock lock = pathsConfig.isConfigured() ? AccessLock.acquire(pathsConfig.getLockFile())
                : null;
        try {
            loadDriverIfConfigured(connectionConfig.getDriverClass());
            Connection conn = DriverManager.getConnection(connectionConfig.getUrl(),
                    connectionConfig.getUser(), connectionConfig.getPassword());
            log.info("Store opened: {}", connectionConfig.getUrl());
            return Optional.of(new StoreSession(conn, new DoltVersionedStore(conn), lock));
        } catch (SQLException | ClassNotFoundException | RuntimeException e) {
            if (lock != null) {
                lock.close();
            }
            throw e;
        }
    }

    /**
     * Loads the JDBC driver class only when one is configured.
     *
     * @param driverClass fully qualified class name, or {@code null}/blank for JDBC 4 auto-loading
     * @throws ClassNotFoundException when the class cannot be found
     */
    static void loadDriverIfConfigured(String driverClass) throws ClassNotFoundException {
        if (StringUtils.isBlank(driverClass)) {
            return;
        }
        Class.forName(driverClass.trim());
    }
}
