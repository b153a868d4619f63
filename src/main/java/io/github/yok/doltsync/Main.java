package io.github.yok.doltsync;

import io.github.yok.doltsync.config.ConnectionConfig;
import io.github.yok.doltsync.config.DoltConfig;
import io.github.yok.doltsync.config.SyncConfig;
import io.github.yok.doltsync.core.SyncJob;
import io.github.yok.doltsync.core.SyncJobRunner;
import io.github.yok.doltsync.core.SyncJobRunner.JobOutcome;
import io.github.yok.doltsync.core.SyncService;
import io.github.yok.doltsync.model.SyncDirection;
import io.github.yok.doltsync.util.ErrorHandler;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --sync [t1,t2,…]} or {@code -s [t1,t2,…]}: tables to synchronize. If omitted, all
 * tables of {@code sync.tables} are synchronized.</li>
 * <li>{@code --target [db1,db2,…]} or {@code -t [db1,db2,…]}: target connection IDs. If omitted,
 * all connections are targeted.</li>
 * <li>{@code --direction forward|reverse} or {@code -d …}: {@code forward} copies Dolt commits to
 * the targets (default), {@code reverse} records target changes as Dolt commits.</li>
 * <li>{@code --to <ref>}: commit, branch or tag the forward sync stops at, or the Dolt branch the
 * reverse sync writes to (default {@code HEAD}).</li>
 * <li>{@code --batch-size <n>}: overrides {@code sync.batch-size}.</li>
 * <li>{@code --reset}: deletes the selected cursors instead of synchronizing.</li>
 * </ul>
 *
 * <p>
 * The process exits with {@code 0} when every job completed, {@code 1} when a job failed or was
 * cancelled and {@code 2} on invalid arguments or configuration.
 * </p>
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({DoltConfig.class, ConnectionConfig.class, SyncConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_SYNC_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private final ConnectionConfig connectionConfig;
    private final SyncConfig syncConfig;
    private final SyncService syncService;
    private final SyncJobRunner jobRunner;

    private int exitCode = EXIT_OK;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        List<String> tables = new ArrayList<>();
        List<String> targets = new ArrayList<>();
        SyncDirection direction = SyncDirection.FORWARD;
        String toRef = null;
        Integer batchSize = null;
        boolean reset = false;
        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--sync":
                    case "-s":
                        if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                            tables = splitList(args[++i]);
                        }
                        break;
                    case "--target":
                    case "-t":
                        if (i + 1 < args.length) {
                            targets = splitList(args[++i]);
                        }
                        break;
                    case "--direction":
                    case "-d":
                        direction = SyncDirection.parse(requireValue(args, ++i, "--direction"));
                        break;
                    case "--to":
                        toRef = requireValue(args, ++i, "--to");
                        break;
                    case "--batch-size":
                        batchSize = Integer.valueOf(requireValue(args, ++i, "--batch-size"));
                        if (batchSize <= 0) {
                            throw new IllegalArgumentException(
                                    "--batch-size must be positive: " + batchSize);
                        }
                        break;
                    case "--reset":
                        reset = true;
                        break;
                    default:
                        log.warn("Unknown argument: {}", args[i]);
                }
            }
            syncConfig.validate();
        } catch (IllegalArgumentException | IllegalStateException e) {
            exitCode = EXIT_USAGE;
            ErrorHandler.errorAndExit("Invalid arguments or configuration: " + e.getMessage());
            return;
        }

        if (tables.isEmpty()) {
            tables = syncConfig.getTables().stream().map(SyncConfig.TableEntry::getName)
                    .collect(Collectors.toList());
        }
        if (targets.isEmpty()) {
            targets = connectionConfig.getConnections().stream()
                    .map(ConnectionConfig.Entry::getId).collect(Collectors.toList());
        }
        log.info("Tables: {}, Targets: {}, Direction: {}, To: {}, Reset: {}", tables, targets,
                direction, toRef == null ? "HEAD" : toRef, reset);

        try {
            if (reset) {
                for (String table : tables) {
                    for (String target : targets) {
                        syncService.resetCursor(table, target, direction);
                    }
                }
                return;
            }
            List<SyncJob> jobs = new ArrayList<>();
            for (String table : tables) {
                for (String target : targets) {
                    jobs.add(new SyncJob(table, target, direction, toRef, batchSize));
                }
            }
            List<JobOutcome> outcomes = jobRunner.runAll(jobs);
            for (JobOutcome outcome : outcomes) {
                if (outcome.getError() != null) {
                    exitCode = EXIT_SYNC_FAILED;
                    ErrorHandler.errorAndExit("Sync job " + outcome.getJob() + " failed",
                            outcome.getError());
                } else if (!outcome.isSuccess()) {
                    exitCode = EXIT_SYNC_FAILED;
                    log.warn("Sync job {} ended with {}", outcome.getJob(),
                            outcome.getResult().getPhase());
                }
            }
        } catch (Exception e) {
            exitCode = EXIT_SYNC_FAILED;
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length || args[index].isBlank()) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }
}
