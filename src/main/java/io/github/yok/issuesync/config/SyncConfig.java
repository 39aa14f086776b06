package io.github.yok.issuesync.config;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that holds settings of the {@code sync} command.
 *
 * <ul>
 * <li>{@code sync.mode}: {@code native} or {@code mirror} (default {@code mirror})</li>
 * <li>{@code sync.actor}: name recorded in auto-commit messages (default: {@code user.name})</li>
 * <li>{@code sync.remote}: name of the remote to push to (default {@code origin})</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "sync")
@Data
public class SyncConfig {

    /** Remote pushed to when none is configured. */
    public static final String DEFAULT_REMOTE = "origin";

    private SyncMode mode = SyncMode.MIRROR;

    private String actor;

    private String remote = DEFAULT_REMOTE;

    /**
     * Resolves the actor recorded in commit messages.
     *
     * @return configured actor, else the {@code user.name} system property, else {@code unknown}
     */
    public String resolveActor() {
        if (StringUtils.isNotBlank(actor)) {
            return actor.trim();
        }
        return StringUtils.defaultIfBlank(System.getProperty("user.name"), "unknown");
    }

    /**
     * Returns whether the JSONL export is skipped in the configured mode.
     *
     * @return {@code true} in {@link SyncMode#NATIVE}
     */
    public boolean isNative() {
        return mode == SyncMode.NATIVE;
    }
}
