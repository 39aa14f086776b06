package io.github.yok.issuesync.migration;

import lombok.Getter;

/**
 * Raised when a migration fails and the schema bring-up has to stop.
 */
@Getter
public class MigrationException extends Exception {

    private static final long serialVersionUID = 1L;

    // Name of the failed migration
    private final String migrationName;

    /**
     * Creates the exception.
     *
     * @param migrationName name of the failed migration
     * @param cause underlying error
     */
    public MigrationException(String migrationName, Throwable cause) {
        super("Migration [" + migrationName + "] failed: " + cause.getMessage(), cause);
        this.migrationName = migrationName;
    }
}
