package io.github.yok.issuesync.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that reads the {@code metadata-path} property from the application root
 * configuration and composes the paths of the files kept next to the store.
 *
 * <p>
 * The {@code metadata-path} points to the project's metadata directory. The JSONL export
 * ({@code issues.jsonl}) and the process access lock ({@code access.lock}) are placed directly
 * under it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties
@Data
public class PathsConfig {

    /** File name of the flat-file export. */
    public static final String EXPORT_FILE_NAME = "issues.jsonl";

    /** File name of the process access lock. */
    public static final String LOCK_FILE_NAME = "access.lock";

    // Project metadata directory (e.g. ".issues")
    private String metadataPath;

    /**
     * Returns whether a metadata directory has been configured.
     *
     * @return {@code true} when {@code metadata-path} is non-blank
     */
    public boolean isConfigured() {
        return StringUtils.isNotBlank(metadataPath);
    }

    /**
     * Returns the absolute, normalized metadata directory.
     *
     * @return metadata directory
     * @throws IllegalStateException if {@code metadataPath} has not been set
     */
    public Path getMetadataDir() {
        if (!isConfigured()) {
            throw new IllegalStateException(
                    "metadata-path is not configured. Please set 'metadata-path' in application.yml.");
        }
        return Paths.get(metadataPath).toAbsolutePath().normalize();
    }

    /**
     * Returns the path of the JSONL export file.
     *
     * @return export file path
     * @throws IllegalStateException if {@code metadataPath} has not been set
     */
    public Path getExportFile() {
        return getMetadataDir().resolve(EXPORT_FILE_NAME);
    }

    /**
     * Returns the path of the access lock file.
     *
     * @return lock file path
     * @throws IllegalStateException if {@code metadataPath} has not been set
     */
    public Path getLockFile() {
        return getMetadataDir().resolve(LOCK_FILE_NAME);
    }
}
