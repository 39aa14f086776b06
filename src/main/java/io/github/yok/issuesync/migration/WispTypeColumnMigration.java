package io.github.yok.issuesync.migration;

import io.github.yok.issuesync.db.SchemaIntrospector;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Adds the optional {@code wisp_type} column to {@code issues}.
 *
 * <p>
 * The column is additive with an empty-string default, so existing rows stay valid. Nothing is
 * done when the column is already there or when {@code issues} does not exist.
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class WispTypeColumnMigration implements SchemaMigration {

    static final String ALTER_SQL =
            "ALTER TABLE issues ADD COLUMN wisp_type VARCHAR(32) DEFAULT ''";

    private final SchemaIntrospector introspector;

    @Override
    public String getName() {
        return "wisp_type_column";
    }

    @Override
    public void apply(Connection conn) throws SQLException {
        if (introspector.columnExists(conn, "issues", "wisp_type")) {
            log.debug("Table[issues] column [wisp_type] already exists");
            return;
        }
        if (!introspector.tableExists(conn, "issues")) {
            log.debug("Table[issues] does not exist; nothing to alter");
            return;
        }
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(ALTER_SQL);
        }
        log.info("Table[issues] column [wisp_type] added");
    }
}
