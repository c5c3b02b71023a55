package io.github.yok.chunkload;

import io.github.yok.chunkload.config.ChunkLoadConfig;
import io.github.yok.chunkload.config.PathsConfig;
import io.github.yok.chunkload.config.RechunkPolicy;
import io.github.yok.chunkload.core.ChunkSplitter;
import io.github.yok.chunkload.core.ImportCoordinator;
import io.github.yok.chunkload.core.ImportRequest;
import io.github.yok.chunkload.core.ImportRunSummary;
import io.github.yok.chunkload.core.ProgressQuery;
import io.github.yok.chunkload.core.ProgressSummary;
import io.github.yok.chunkload.core.strategy.ImportMethod;
import io.github.yok.chunkload.ledger.ChunkRecord;
import io.github.yok.chunkload.ledger.ChunkStatus;
import io.github.yok.chunkload.util.ErrorHandler;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Provides the application entry point.
 *
 * <p>
 * The first argument selects the command; options follow it:
 * </p>
 * <ul>
 * <li>{@code chunk --table T --date D [--file F] [--chunk-size N] [--rechunk-policy P]} splits
 * {@code {data-path}/T-D.csv} (or {@code F}) into chunks.</li>
 * <li>{@code import --table T --date D [--method M] [--max-retries N] [--resume|--no-resume]
 * [--chunks 1,2,3]} imports planned chunks.</li>
 * <li>{@code progress --table T --date D [--expected-total N] [--detailed]} prints progress.</li>
 * <li>{@code reset --table T --date D} sets every chunk back to pending.</li>
 * <li>{@code delete --table T --date D [--delete-files]} removes the chunk records.</li>
 * <li>{@code skip --table T --date D --chunks 1,2} marks chunks skipped.</li>
 * </ul>
 *
 * <p>
 * The process exits with status 1 when a command fails or an import leaves failed chunks.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see ChunkSplitter
 * @see ImportCoordinator
 * @see ProgressQuery
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final PathsConfig pathsConfig;
    private final ChunkLoadConfig chunkLoadConfig;
    private final ChunkSplitter splitter;
    private final ImportCoordinator coordinator;
    private final ProgressQuery progressQuery;

    private int exitCode;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        ConfigurableApplicationContext context = app.run(args);
        int code = context == null ? 0 : SpringApplication.exit(context);
        if (code != 0) {
            System.exit(code);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));
        if (args.length == 0) {
            fail("A command is required: chunk, import, progress, reset, delete or skip.");
            return;
        }

        String command = args[0];
        Options options;
        try {
            options = Options.parse(Arrays.copyOfRange(args, 1, args.length));
            if (StringUtils.isBlank(options.table) || StringUtils.isBlank(options.date)) {
                fail("--table and --date are required.");
                return;
            }
        } catch (IllegalArgumentException e) {
            fail(e.getMessage());
            return;
        }

        try {
            switch (command) {
                case "chunk":
                    runChunk(options);
                    break;
                case "import":
                    runImport(options);
                    break;
                case "progress":
                    runProgress(options);
                    break;
                case "reset":
                    coordinator.resetChunks(options.table, options.date);
                    break;
                case "delete":
                    coordinator.deleteChunks(options.table, options.date, options.deleteFiles);
                    break;
                case "skip":
                    if (options.chunks.isEmpty()) {
                        fail("--chunks is required for skip.");
                        return;
                    }
                    coordinator.skipChunks(options.table, options.date, options.chunks);
                    break;
                default:
                    fail("Unknown command: " + command);
            }
        } catch (Exception e) {
            log.error("Fatal error occurred (command={}): {}", command, e.getMessage(), e);
            exitCode = 1;
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }

    private void runChunk(Options options) {
        Path source = options.file != null ? Paths.get(options.file)
                : pathsConfig.resolveSourceFile(options.table, options.date);
        int chunkSize = options.chunkSize != null ? options.chunkSize
                : chunkLoadConfig.getDefaultChunkSize();
        RechunkPolicy policy = options.rechunkPolicy != null ? options.rechunkPolicy
                : chunkLoadConfig.getRechunkPolicy();
        List<ChunkRecord> chunks =
                splitter.split(source, options.table, options.date, chunkSize, policy);
        log.info("Chunking completed. {} chunks planned for {}-{}", chunks.size(), options.table,
                options.date);
    }

    private void runImport(Options options) {
        ImportRequest request = ImportRequest.builder().table(options.table).date(options.date)
                .method(options.method != null ? options.method
                        : chunkLoadConfig.getDefaultMethod())
                .maxRetries(options.maxRetries != null ? options.maxRetries
                        : chunkLoadConfig.getMaxRetries())
                .resume(options.resume).chunkNumbers(options.chunks).build();
        ImportRunSummary summary = coordinator.importChunks(request);
        if (summary.hasFailures()) {
            exitCode = 1;
        }
    }

    private void runProgress(Options options) {
        ProgressSummary p = progressQuery.query(options.table, options.date,
                options.expectedTotal != null ? options.expectedTotal : 0L);
        log.info("=== Progress: {}-{} ===", p.getTable(), p.getDate());
        log.info("  status            : {}", p.getOverallStatus().getValue());
        log.info("  chunks            : {} total, {} completed, {} failed, {} processing,"
                + " {} pending, {} skipped", p.getTotalChunks(), p.count(ChunkStatus.COMPLETED),
                p.count(ChunkStatus.FAILED), p.count(ChunkStatus.PROCESSING),
                p.count(ChunkStatus.PENDING), p.count(ChunkStatus.SKIPPED));
        log.info("  rows              : {} imported, {} skipped, {} planned",
                p.getRowsImported(), p.getRowsSkipped(), p.getPlannedRows());
        log.info("  progress          : {}% of {} rows ({}% of chunks)",
                String.format("%.2f", p.getPercentComplete()), p.getExpectedTotal(),
                String.format("%.2f", p.getChunkPercent()));
        if (options.detailed) {
            for (ChunkRecord r : progressQuery.listChunks(options.table, options.date)) {
                log.info("  #{} {} rows {}-{} status={} imported={} skipped={} retries={}{}",
                        r.getChunkNumber(), r.getChunkFilename(), r.getChunkStartRow(),
                        r.getChunkEndRow(), r.getStatus().getValue(), r.getRowsImported(),
                        r.getRowsSkipped(), r.getRetryCount(),
                        r.getErrorMessage() == null ? "" : " error=" + r.getErrorMessage());
            }
        }
    }

    private void fail(String message) {
        exitCode = 1;
        ErrorHandler.errorAndExit(message);
    }

    /**
     * Parsed command options.
     */
    static final class Options {
        String table;
        String date;
        String file;
        Integer chunkSize;
        RechunkPolicy rechunkPolicy;
        ImportMethod method;
        Integer maxRetries;
        boolean resume = true;
        Set<Integer> chunks = new LinkedHashSet<>();
        Long expectedTotal;
        boolean detailed;
        boolean deleteFiles;

        /**
         * Parses options.
         *
         * @param args arguments after the command
         * @return parsed options
         * @throws IllegalArgumentException if an option is unknown or its value is invalid
         */
        static Options parse(String[] args) {
            Options o = new Options();
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--table":
                    case "-t":
                        o.table = value(args, ++i, "--table");
                        break;
                    case "--date":
                    case "-d":
                        o.date = value(args, ++i, "--date");
                        break;
                    case "--file":
                    case "-f":
                        o.file = value(args, ++i, "--file");
                        break;
                    case "--chunk-size":
                        o.chunkSize = parseInt(value(args, ++i, "--chunk-size"), "--chunk-size");
                        break;
                    case "--rechunk-policy":
                        o.rechunkPolicy =
                                RechunkPolicy.fromValue(value(args, ++i, "--rechunk-policy"));
                        break;
                    case "--method":
                    case "-m":
                        o.method = ImportMethod.fromValue(value(args, ++i, "--method"));
                        break;
                    case "--max-retries":
                        o.maxRetries =
                                parseInt(value(args, ++i, "--max-retries"), "--max-retries");
                        break;
                    case "--resume":
                        o.resume = true;
                        break;
                    case "--no-resume":
                        o.resume = false;
                        break;
                    case "--chunks":
                        o.chunks = Arrays.stream(value(args, ++i, "--chunks").split(","))
                                .map(String::trim).filter(StringUtils::isNotEmpty)
                                .map(v -> parseInt(v, "--chunks"))
                                .collect(Collectors.toCollection(LinkedHashSet::new));
                        break;
                    case "--expected-total":
                        o.expectedTotal = parseLong(value(args, ++i, "--expected-total"),
                                "--expected-total");
                        break;
                    case "--detailed":
                        o.detailed = true;
                        break;
                    case "--delete-files":
                        o.deleteFiles = true;
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown argument: " + args[i]);
                }
            }
            return o;
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException(option + " requires a value.");
            }
            return args[index];
        }

        private static int parseInt(String value, String option) {
            long parsed = parseLong(value, option);
            if (parsed < Integer.MIN_VALUE || parsed > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(option + " is out of range: " + value);
            }
            return (int) parsed;
        }

        private static long parseLong(String value, String option) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(option + " expects a number: " + value, e);
            }
        }
    }
}
