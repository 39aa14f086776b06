package io.github.yok.issuesync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableSet;
import io.github.yok.issuesync.config.ConnectionConfig;
import io.github.yok.issuesync.config.PathsConfig;
import io.github.yok.issuesync.config.SyncConfig;
import io.github.yok.issuesync.db.StoreSession;
import io.github.yok.issuesync.db.StoreSessionFactory;
import io.github.yok.issuesync.migration.MigrationException;
import io.github.yok.issuesync.migration.MigrationRunner;
import io.github.yok.issuesync.sync.StepResult;
import io.github.yok.issuesync.sync.StepStatus;
import io.github.yok.issuesync.sync.SyncOrchestrator;
import io.github.yok.issuesync.sync.SyncReport;
import io.github.yok.issuesync.util.ErrorHandler;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Opens the store session, brings the schema up through {@link MigrationRunner}, and then runs the
 * requested command.
 * </p>
 *
 * <p>
 * Commands:
 * </p>
 * <ul>
 * <li>{@code sync}: runs {@link SyncOrchestrator}. Warnings are printed to {@code System.err} and
 * the command still completes normally. {@code --json} prints the step report as JSON on
 * {@code System.out}.</li>
 * <li>{@code migrate} (default when no command is given): schema bring-up only.</li>
 * </ul>
 *
 * <p>
 * The {@code sync} flags {@code --message}/{@code -m <value>}, {@code --dry-run},
 * {@code --no-push}, {@code --import}, {@code --import-only}, {@code --export},
 * {@code --flush-only}, {@code --pull} and {@code --no-git-history} are deprecated; they are
 * accepted and ignored so that older invocations keep working.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see PathsConfig
 * @see ConnectionConfig
 * @see SyncConfig
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({PathsConfig.class, ConnectionConfig.class, SyncConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    static final Set<String> DEPRECATED_FLAGS = ImmutableSet.of("--dry-run", "--no-push",
            "--import", "--import-only", "--export", "--flush-only", "--pull", "--no-git-history");

    private final StoreSessionFactory sessionFactory;
    private final MigrationRunner migrationRunner;
    private final SyncOrchestrator syncOrchestrator;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        String command = "migrate";
        boolean json = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "sync":
                case "migrate":
                    command = arg;
                    break;
                case "--json":
                    json = true;
                    break;
                case "--message":
                case "-m":
                    log.warn("Deprecated flag ignored: {}", arg);
                    i++;
                    break;
                default:
                    if (DEPRECATED_FLAGS.contains(arg)) {
                        log.warn("Deprecated flag ignored: {}", arg);
                    } else {
                        log.warn("Unknown argument: {}", arg);
                    }
            }
        }
        log.info("Command: {}", command);

        Optional<StoreSession> opened;
        try {
            opened = sessionFactory.open();
        } catch (Exception e) {
            throw ErrorHandler.fatal("Failed to open the store: " + e.getMessage(), e);
        }

        try {
            if (opened.isPresent()) {
                migrationRunner.runAll(opened.get().getConnection());
            }
            if ("sync".equals(command)) {
                SyncReport report =
                        syncOrchestrator.sync(opened.map(StoreSession::getStore).orElse(null));
                printReport(report, json);
            }
        } catch (MigrationException e) {
            throw ErrorHandler.fatal("Schema bring-up failed (" + e.getMigrationName() + ")", e);
        } finally {
            if (opened.isPresent()) {
                closeQuietly(opened.get());
            }
        }
        log.info("Command completed: {}", command);
    }

    /**
     * Prints warnings and informational lines of a sync report.
     *
     * @param report report to print
     * @param json whether to print the report as JSON on {@code System.out}
     */
    void printReport(SyncReport report, boolean json) {
        for (StepResult step : report.getSteps()) {
            if (step.getStatus() == StepStatus.WARNING) {
                ErrorHandler.warn(step.getMessage());
            } else if (step.getStatus() == StepStatus.SUCCESS
                    && "push".equals(step.getStep())) {
                ErrorHandler.info(step.getMessage());
            }
        }
        if (json) {
            try {
                System.out.println(new ObjectMapper().writerWithDefaultPrettyPrinter()
                        .writeValueAsString(report));
            } catch (JsonProcessingException e) {
                ErrorHandler.warn("failed to render JSON report: " + e.getMessage());
            }
        }
    }

    private static void closeQuietly(StoreSession session) {
        try {
            session.close();
        } catch (Exception e) {
            log.warn("Failed to close the store session: {}", e.getMessage(), e);
        }
    }
}
