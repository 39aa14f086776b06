package io.github.yok.issuesync.export;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Writes the whole {@code issues} table to a flat interchange file.
 */
public interface IssueExporter {

    /**
     * Exports all issues to {@code target}, replacing it atomically.
     *
     * @param conn JDBC connection
     * @param target destination file
     * @return number of exported issues
     * @throws SQLException if the issues cannot be read
     * @throws IOException if the file cannot be written
     */
    int export(Connection conn, Path target) throws SQLException, IOException;
}
