package io.github.yok.issuesync.migration;

import io.github.yok.issuesync.integrity.OrphanDetector;
import java.sql.Connection;
import java.sql.SQLException;
import lombok.RequiredArgsConstructor;

/**
 * Advisory step: reports orphaned child issues and never changes schema or data.
 */
@RequiredArgsConstructor
public class OrphanDetectionMigration implements SchemaMigration {

    private final OrphanDetector detector;

    @Override
    public String getName() {
        return "orphan_detection";
    }

    @Override
    public void apply(Connection conn) throws SQLException {
        detector.detectOrphanedChildren(conn);
    }
}
