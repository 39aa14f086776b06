package io.github.yok.issuesync.migration;

import com.google.common.collect.ImmutableList;
import io.github.yok.issuesync.db.SchemaIntrospector;
import io.github.yok.issuesync.integrity.OrphanDetector;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Applies the schema migrations in a fixed order, once per process startup.
 *
 * <p>
 * <strong>Order:</strong>
 * </p>
 * <ol>
 * <li>{@link CreateIssuesTableMigration}</li>
 * <li>{@link WispTypeColumnMigration}</li>
 * <li>{@link OrphanDetectionMigration} (advisory)</li>
 * </ol>
 *
 * <p>
 * Each migration probes the live schema itself, so running the whole sequence again is a no-op.
 * The first failure stops the sequence; a partially applied DDL statement is not rolled back.
 * Callers must not run two sequences concurrently against the same connection.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class MigrationRunner {

    @Getter
    private final List<SchemaMigration> migrations;

    /**
     * Creates the runner with the standard migration sequence.
     *
     * @param introspector catalog introspector shared by the migrations
     * @param orphanDetector detector used by the advisory step
     */
    @Autowired
    public MigrationRunner(SchemaIntrospector introspector, OrphanDetector orphanDetector) {
        this(ImmutableList.of(new CreateIssuesTableMigration(introspector),
                new WispTypeColumnMigration(introspector),
                new OrphanDetectionMigration(orphanDetector)));
    }

    /**
     * Creates the runner with an explicit migration sequence.
     *
     * @param migrations migrations in application order
     */
    public MigrationRunner(List<SchemaMigration> migrations) {
        this.migrations = ImmutableList.copyOf(migrations);
    }

    /**
     * Applies every migration in order.
     *
     * @param conn JDBC connection
     * @throws MigrationException if a migration fails; later migrations are not applied
     */
    public void runAll(Connection conn) throws MigrationException {
        log.info("Schema bring-up started: {} migration(s)", migrations.size());
        for (SchemaMigration migration : migrations) {
            log.debug("Migration[{}] applying", migration.getName());
            try {
                migration.apply(conn);
            } catch (SQLException e) {
                log.error("Migration[{}] failed: {}", migration.getName(), e.getMessage());
                throw new MigrationException(migration.getName(), e);
            }
            log.debug("Migration[{}] done", migration.getName());
        }
        log.info("Schema bring-up completed");
    }
}
