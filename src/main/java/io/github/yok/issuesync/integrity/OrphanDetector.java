package io.github.yok.issuesync.integrity;

import io.github.yok.issuesync.db.SchemaIntrospector;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Read-only integrity scan over the issue hierarchy.
 *
 * <p>
 * A child issue is orphaned when the prefix before the first separator of its ID (see
 * {@link IssueIds#firstSeparatorPrefix(String)}) is not the ID of any row in {@code issues}.
 * Only that root-level prefix is checked: {@code P.1.1} is not reported while {@code P} exists,
 * even if {@code P.1} is missing.
 * </p>
 *
 * <p>
 * The prefix rule is evaluated by the database, so only orphaned rows are transferred. The query
 * uses {@code LOCATE} and {@code SUBSTRING}, which MySQL-compatible servers and H2 both provide.
 * </p>
 *
 * <p>
 * Findings are reported through the log only; nothing is repaired and no data is modified.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrphanDetector {

    static final String ISSUES_TABLE = "issues";

    static final String ORPHAN_SQL = "SELECT id, title, status FROM issues"
            + " WHERE LOCATE('" + IssueIds.SEPARATOR + "', id) > 0"
            + " AND SUBSTRING(id, 1, LOCATE('" + IssueIds.SEPARATOR + "', id) - 1)"
            + " NOT IN (SELECT id FROM issues)"
            + " ORDER BY id";

    static final String REMEDIATION_HINT =
            "orphan detection: run 'doctor --fix' to repair orphaned children";

    private final SchemaIntrospector introspector;

    /**
     * Detects orphaned children and logs a report.
     *
     * <p>
     * Returns normally when the {@code issues} table does not exist yet, and regardless of how
     * many orphans are found.
     * </p>
     *
     * @param conn JDBC connection
     * @throws SQLException if the catalog lookup or the orphan query fails
     */
    public void detectOrphanedChildren(Connection conn) throws SQLException {
        if (!introspector.tableExists(conn, ISSUES_TABLE)) {
            log.debug("Table[{}] does not exist; orphan detection skipped", ISSUES_TABLE);
            return;
        }

        List<OrphanInfo> orphans;
        try {
            orphans = queryOrphanedChildren(conn);
        } catch (SQLException e) {
            throw new SQLException("Failed to detect orphaned children", e.getSQLState(), e);
        }
        if (orphans.isEmpty()) {
            log.debug("orphan detection: no orphaned child issues");
            return;
        }

        log.warn("orphan detection: found {} orphaned child issue(s):", orphans.size());
        for (OrphanInfo o : orphans) {
            log.warn("  orphan: {} (missing parent {}, title=\"{}\", status={})", o.getId(),
                    IssueIds.firstSeparatorPrefix(o.getId()).orElse(""), o.getTitle(),
                    o.getStatus());
        }
        log.warn(REMEDIATION_HINT);
    }

    /**
     * Returns all child issues whose first-separator prefix is not an existing ID.
     *
     * @param conn JDBC connection
     * @return orphans ordered by ID ascending (empty if none)
     * @throws SQLException if the query fails
     */
    public List<OrphanInfo> queryOrphanedChildren(Connection conn) throws SQLException {
        List<OrphanInfo> orphans = new ArrayList<>();
        try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery(ORPHAN_SQL)) {
            while (rs.next()) {
                orphans.add(new OrphanInfo(rs.getString(1), rs.getString(2), rs.getString(3)));
            }
        } catch (SQLException e) {
            throw new SQLException("Orphan query failed", e.getSQLState(), e);
        }
        return orphans;
    }
}
