package io.github.yok.issuesync.db;

import com.google.common.base.Preconditions;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Answers table and column existence questions against the live catalog.
 *
 * <p>
 * Lookups go through {@link DatabaseMetaData} restricted to the connection's active catalog and
 * schema. Names are compared case-insensitively, so {@code issues} matches engines that fold
 * unquoted identifiers to upper case.
 * </p>
 *
 * <p>
 * Absence is never an error: both methods return {@code false}. Catalog failures are rethrown as
 * {@link SQLException} carrying the probed object in the message and the original SQL state.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class SchemaIntrospector {

    /**
     * Checks whether a table named {@code table} exists.
     *
     * @param conn JDBC connection
     * @param table table name (case-insensitive)
     * @return {@code true} when the table exists
     * @throws SQLException if the catalog lookup fails
     */
    public boolean tableExists(Connection conn, String table) throws SQLException {
        Preconditions.checkNotNull(conn, "conn must not be null");
        Preconditions.checkNotNull(table, "table must not be null");
        try {
            boolean exists = resolveTableName(conn, table).isPresent();
            log.debug("Table[{}] exists={}", table, exists);
            return exists;
        } catch (SQLException e) {
            throw new SQLException("Failed to check existence of table [" + table + "]",
                    e.getSQLState(), e);
        }
    }

    /**
     * Checks whether {@code column} exists on {@code table}.
     *
     * @param conn JDBC connection
     * @param table table name (case-insensitive)
     * @param column column name (case-insensitive)
     * @return {@code true} when both the table and the column exist
     * @throws SQLException if the catalog lookup fails
     */
    public boolean columnExists(Connection conn, String table, String column)
            throws SQLException {
        Preconditions.checkNotNull(conn, "conn must not be null");
        Preconditions.checkNotNull(table, "table must not be null");
        Preconditions.checkNotNull(column, "column must not be null");
        try {
            Optional<String> actualTable = resolveTableName(conn, table);
            if (actualTable.isEmpty()) {
                log.debug("Table[{}] not found while probing column [{}]", table, column);
                return false;
            }
            DatabaseMetaData meta = conn.getMetaData();
            try (ResultSet rs = meta.getColumns(conn.getCatalog(), conn.getSchema(),
                    actualTable.get(), "%")) {
                while (rs.next()) {
                    // the table pattern may also match other tables ("_" is a wildcard)
                    if (actualTable.get().equals(rs.getString("TABLE_NAME"))
                            && column.equalsIgnoreCase(rs.getString("COLUMN_NAME"))) {
                        log.debug("Table[{}] column [{}] exists=true", table, column);
                        return true;
                    }
                }
            }
            log.debug("Table[{}] column [{}] exists=false", table, column);
            return false;
        } catch (SQLException e) {
            throw new SQLException(
                    "Failed to check existence of column [" + table + "." + column + "]",
                    e.getSQLState(), e);
        }
    }

    /**
     * Looks up the catalog spelling of a table name.
     *
     * @param conn JDBC connection
     * @param table table name (case-insensitive)
     * @return table name as stored in the catalog, or empty when absent
     * @throws SQLException on metadata access error
     */
    private Optional<String> resolveTableName(Connection conn, String table) throws SQLException {
        DatabaseMetaData meta = conn.getMetaData();
        try (ResultSet rs = meta.getTables(conn.getCatalog(), conn.getSchema(), "%", null)) {
            while (rs.next()) {
                String name = rs.getString("TABLE_NAME");
                if (table.equalsIgnoreCase(name)) {
                    return Optional.of(name);
                }
            }
        }
        return Optional.empty();
    }
}
