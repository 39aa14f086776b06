package io.github.yok.issuesync.config;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that holds the JDBC settings of the versioned store.
 *
 * <pre>
 * store:
 *   url: jdbc:mysql://127.0.0.1:3306/issues
 *   user: root
 *   password:
 *   driver-class: com.mysql.cj.jdbc.Driver
 * </pre>
 *
 * <p>
 * Only one store is opened per process. When {@code store.url} is blank no store is opened and
 * commands that need one become no-ops.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "store")
@Data
public class ConnectionConfig {

    // JDBC connection URL (e.g., jdbc:mysql://127.0.0.1:3306/issues)
    private String url;
    // Database user name
    private String user;
    // Database password
    private String password;
    // Fully qualified JDBC driver class name; blank means JDBC 4 auto-loading
    private String driverClass;

    /**
     * Returns whether a store URL has been configured.
     *
     * @return {@code true} when {@code url} is non-blank
     */
    public boolean isConfigured() {
        return StringUtils.isNotBlank(url);
    }
}
