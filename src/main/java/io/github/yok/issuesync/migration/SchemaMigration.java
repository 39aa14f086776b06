package io.github.yok.issuesync.migration;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * One schema-evolution step.
 *
 * <p>
 * Implementations decide whether to act by probing the live schema, never by consulting a log of
 * applied migrations. {@link #apply(Connection)} must therefore be safe to call any number of
 * times, in any order relative to the other migrations, and must issue no DDL when the probe
 * itself fails.
 * </p>
 */
public interface SchemaMigration {

    /**
     * Returns a short, stable name used in logs and error messages.
     *
     * @return migration name
     */
    String getName();

    /**
     * Applies the migration when the schema still needs it.
     *
     * @param conn JDBC connection
     * @throws SQLException if introspection or DDL fails
     */
    void apply(Connection conn) throws SQLException;
}
