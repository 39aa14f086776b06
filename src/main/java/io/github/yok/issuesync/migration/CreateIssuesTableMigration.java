package io.github.yok.issuesync.migration;

import io.github.yok.issuesync.db.SchemaIntrospector;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates the base {@code issues} table when it does not exist.
 */
@Slf4j
@RequiredArgsConstructor
public class CreateIssuesTableMigration implements SchemaMigration {

    static final String CREATE_SQL = "CREATE TABLE issues ("
            + "id VARCHAR(255) PRIMARY KEY, "
            + "title VARCHAR(500) NOT NULL, "
            + "status VARCHAR(32) NOT NULL DEFAULT 'open', "
            + "ephemeral BOOLEAN DEFAULT FALSE, "
            + "pinned BOOLEAN DEFAULT FALSE)";

    private final SchemaIntrospector introspector;

    @Override
    public String getName() {
        return "create_issues_table";
    }

    @Override
    public void apply(Connection conn) throws SQLException {
        if (introspector.tableExists(conn, "issues")) {
            log.debug("Table[issues] already exists");
            return;
        }
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_SQL);
        }
        log.info("Table[issues] created");
    }
}
