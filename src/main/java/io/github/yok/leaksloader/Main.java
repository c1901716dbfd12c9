package io.github.yok.leaksloader;

import io.github.yok.leaksloader.config.CheckpointMode;
import io.github.yok.leaksloader.config.ConnectionConfig;
import io.github.yok.leaksloader.config.CredentialsConfig;
import io.github.yok.leaksloader.config.IngestConfig;
import io.github.yok.leaksloader.config.LoadSettings;
import io.github.yok.leaksloader.config.PathsConfig;
import io.github.yok.leaksloader.core.IngestionOrchestrator;
import io.github.yok.leaksloader.core.IngestionSummary;
import io.github.yok.leaksloader.db.ConnectionFactory;
import io.github.yok.leaksloader.db.CredentialResolver;
import io.github.yok.leaksloader.util.ErrorHandler;
import java.util.Arrays;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line options, applies them over the configuration bound from
 * {@code application.yml}, and runs {@link IngestionOrchestrator}.
 * </p>
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --data-dir <dir>} or {@code -d <dir>}: directory holding the CSV files.</li>
 * <li>{@code --wallet-dir <dir>} or {@code -w <dir>}: Oracle wallet directory.</li>
 * <li>{@code --service <name>} or {@code -s <name>}: TNS service name.</li>
 * <li>{@code --url <jdbc-url>}: explicit JDBC URL.</li>
 * <li>{@code --user <user>} or {@code -u <user>}: database user.</li>
 * <li>{@code --password <pw>} or {@code -p <pw>}: database password.</li>
 * <li>{@code --batch-size <n>} or {@code -b <n>}: rows per batch.</li>
 * <li>{@code --tables <a,b>} or {@code -t <a,b>}: subset of tables to process.</li>
 * <li>{@code --strict-checkpoint}: verify skipped tables against the source row count.</li>
 * </ul>
 *
 * <p>
 * Unknown arguments are logged and ignored. The process exits with {@code 0} when the run
 * completes (even with skipped tables or batches) and {@code 1} on a fatal error.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see PathsConfig
 * @see ConnectionConfig
 * @see IngestConfig
 * @see CredentialsConfig
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({PathsConfig.class, ConnectionConfig.class, IngestConfig.class,
        CredentialsConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final PathsConfig pathsConfig;
    private final ConnectionConfig connectionConfig;
    private final IngestConfig ingestConfig;
    private final CredentialsConfig credentialsConfig;

    private int exitCode;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        System.exit(launch(args));
    }

    /**
     * Runs the application and returns the process exit code.
     *
     * @param args command-line arguments
     * @return {@code 0} on completion, {@code 1} after a fatal error
     */
    static int launch(String... args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        ConfigurableApplicationContext context = app.run(args);
        return SpringApplication.exit(context);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", maskPassword(args));

        try {
            applyArguments(args);

            LoadSettings settings = LoadSettings.from(pathsConfig, ingestConfig, connectionConfig);
            log.info("Settings: {}", settings);

            ConnectionFactory connectionFactory = new ConnectionFactory(connectionConfig,
                    new CredentialResolver(credentialsConfig));
            IngestionSummary summary =
                    new IngestionOrchestrator(settings, connectionFactory).execute();

            if (summary.hasGaps()) {
                log.warn("Ingestion completed with skipped batches. Total rows: {}",
                        summary.getTotal());
            } else {
                log.info("Ingestion completed. Total rows: {}", summary.getTotal());
            }
        } catch (IllegalArgumentException e) {
            exitCode = ErrorHandler.errorAndExit("Invalid arguments: " + e.getMessage());
        } catch (Exception e) {
            log.error("Fatal error occurred: {}", e.getMessage(), e);
            exitCode = ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Applies command-line options over the bound configuration.
     *
     * @param args command-line arguments
     * @throws IllegalArgumentException if an option value is missing or malformed
     */
    void applyArguments(String... args) {
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--data-dir":
                case "-d":
                    pathsConfig.setDataPath(requireValue(args, ++i));
                    break;
                case "--wallet-dir":
                case "-w":
                    connectionConfig.setWalletDir(requireValue(args, ++i));
                    break;
                case "--service":
                case "-s":
                    connectionConfig.setService(requireValue(args, ++i));
                    break;
                case "--url":
                    connectionConfig.setUrl(requireValue(args, ++i));
                    break;
                case "--user":
                case "-u":
                    connectionConfig.setUser(requireValue(args, ++i));
                    break;
                case "--password":
                case "-p":
                    connectionConfig.setPassword(requireValue(args, ++i));
                    break;
                case "--batch-size":
                case "-b":
                    String size = requireValue(args, ++i);
                    try {
                        ingestConfig.setBatchSize(Integer.parseInt(size.trim()));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid --batch-size: " + size, e);
                    }
                    break;
                case "--tables":
                case "-t":
                    ingestConfig.setTables(Arrays.stream(requireValue(args, ++i).split(","))
                            .map(String::trim).collect(Collectors.toList()));
                    break;
                case "--strict-checkpoint":
                    ingestConfig.setCheckpointMode(CheckpointMode.STRICT);
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }
    }

    private static String requireValue(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for option " + args[index - 1]);
        }
        return args[index];
    }

    // Hides the value following --password/-p
    static String maskPassword(String... args) {
        String[] masked = args.clone();
        for (int i = 0; i + 1 < masked.length; i++) {
            if ("--password".equals(masked[i]) || "-p".equals(masked[i])) {
                masked[i + 1] = "****";
            }
        }
        return Arrays.toString(masked);
    }
}
