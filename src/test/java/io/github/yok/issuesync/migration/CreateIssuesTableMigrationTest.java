package io.github.yok.issuesync.migration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.issuesync.db.SchemaIntrospector;
import io.github.yok.issuesync.support.IssueDatabaseSupport;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import org.junit.jupiter.api.Test;

class CreateIssuesTableMigrationTest {

    private final SchemaIntrospector introspector = new SchemaIntrospector();

    @Test
    void apply_正常ケース_テーブルがない_issuesテーブルが作成されること() throws Exception {
        try (Connection conn = IssueDatabaseSupport.openEmpty()) {
            assertFalse(introspector.tableExists(conn, "issues"));

            new CreateIssuesTableMigration(introspector).apply(conn);

            assertTrue(introspector.tableExists(conn, "issues"));
            assertTrue(introspector.columnExists(conn, "issues", "pinned"));
            assertFalse(introspector.columnExists(conn, "issues", "wisp_type"));
        }
    }

    @Test
    void apply_正常ケース_既存データがある_データを保持したまま何もしないこと() throws Exception {
        try (Connection conn = IssueDatabaseSupport.openWithLegacyIssues()) {
            IssueDatabaseSupport.insertIssue(conn, "bd-1", "Keep me", "open");

            new CreateIssuesTableMigration(introspector).apply(conn);

            assertEquals(1, IssueDatabaseSupport.countIssues(conn));
        }
    }

    @Test
    void apply_正常ケース_作成したテーブルに行を追加する_既定値が設定されること() throws Exception {
        try (Connection conn = IssueDatabaseSupport.openEmpty()) {
            new CreateIssuesTableMigration(introspector).apply(conn);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("INSERT INTO issues (id, title) VALUES ('bd-1', 'New')");
            }
            try (Statement stmt = conn.createStatement(); ResultSet rs = stmt
                    .executeQuery("SELECT status, ephemeral, pinned FROM issues")) {
                assertTrue(rs.next());
                assertEquals("open", rs.getString(1));
                assertFalse(rs.getBoolean(2));
                assertFalse(rs.getBoolean(3));
            }
        }
    }
}
