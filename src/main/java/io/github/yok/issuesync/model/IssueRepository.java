package io.github.yok.issuesync.model;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads {@link Issue} rows.
 */
@Slf4j
@Component
public class IssueRepository {

    static final String SELECT_ALL_SQL = "SELECT * FROM issues ORDER BY id";

    /**
     * Returns every issue ordered by ID.
     *
     * <p>
     * Works before and after the {@code wisp_type} migration: the column is read only when the
     * result set has it.
     * </p>
     *
     * @param conn JDBC connection
     * @return all issues (empty if none)
     * @throws SQLException on SQL error
     */
    public List<Issue> findAll(Connection conn) throws SQLException {
        List<Issue> issues = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(SELECT_ALL_SQL)) {
            boolean hasWispType = hasColumn(rs.getMetaData(), "wisp_type");
            while (rs.next()) {
                issues.add(Issue.builder().id(rs.getString("id")).title(rs.getString("title"))
                        .status(rs.getString("status")).ephemeral(rs.getBoolean("ephemeral"))
                        .pinned(rs.getBoolean("pinned"))
                        .wispType(hasWispType ? rs.getString("wisp_type") : null).build());
            }
        }
        log.debug("Table[issues] read {} row(s)", issues.size());
        return issues;
    }

    private static boolean hasColumn(ResultSetMetaData md, String column) throws SQLException {
        for (int i = 1; i <= md.getColumnCount(); i++) {
            if (column.equalsIgnoreCase(md.getColumnLabel(i))) {
                return true;
            }
        }
        return false;
    }
}
