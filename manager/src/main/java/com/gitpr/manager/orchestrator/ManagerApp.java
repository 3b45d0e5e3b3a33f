package com.gitpr.manager.orchestrator;

import com.gitpr.manager.behavior.BehaviorManager;
import com.gitpr.manager.concurrent.BoundedExecutor;
import com.gitpr.manager.config.AppConfig;
import com.gitpr.manager.config.ConfigException;
import com.gitpr.manager.config.ConfigLoader;
import com.gitpr.manager.config.DurationParser;
import com.gitpr.manager.config.ManagerConfig;
import com.gitpr.manager.evaluation.EvaluatedPR;
import com.gitpr.manager.evaluation.Readiness;
import com.gitpr.manager.evaluation.ReadinessEvaluator;
import com.gitpr.manager.provider.Provider;
import com.gitpr.manager.provider.ProviderException;
import com.gitpr.manager.provider.ProviderFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Main entry point for the pull request manager.
 * Parses CLI arguments, wires the components, runs a check or merge pass,
 * and exits with appropriate status codes.
 *
 * <p>Usage:
 * <pre>
 *   java -jar manager.jar check [--config path] [--provider p] [--repo r] [--require-checks]
 *   java -jar manager.jar merge [--dry-run] [--force] [--delete-branches] [--message m] ...
 * </pre>
 *
 * <p>Exit codes: 0 success, 1 any repository, evaluation or merge failure (or a
 * fatal error), 2 usage error.</p>
 */
public class ManagerApp {

    private static final Logger logger = LoggerFactory.getLogger(ManagerApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private static volatile boolean finished;

    public static void main(String[] args) {
        installShutdownHook(Thread.currentThread());
        int exitCode = run(args, new AppConfig(), System.out);
        finished = true;
        System.exit(exitCode);
    }

    static int run(String[] args, AppConfig appConfig, PrintStream out) {
        CliOptions cli;
        try {
            cli = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
            printUsage(out);
            return EXIT_USAGE;
        }
        if (cli.help()) {
            printUsage(out);
            return EXIT_OK;
        }

        String configPath = cli.configPath() != null ? cli.configPath() : appConfig.getConfigPath();
        logger.info("Starting PR manager (command: {}, config: {})", cli.command(), configPath);

        try {
            ManagerConfig config = new ConfigLoader(appConfig).load(Path.of(configPath));
            Map<String, Provider> providers = new ProviderFactory().createProviders(config);
            BehaviorManager behavior = BehaviorManager.fromConfig(config);
            authenticate(providers, behavior);

            BoundedExecutor executor = new BoundedExecutor(config.behavior().effectiveConcurrency(), "pr-worker");
            PullRequestProcessor processor = new PullRequestProcessor(providers, config, behavior,
                    new ReadinessEvaluator(behavior), executor);

            long start = System.currentTimeMillis();
            List<ProcessResult> results = processor.processAll(cli.processOptions());
            ProcessSummary processSummary = new ProcessSummary(results, System.currentTimeMillis() - start);
            printProcessSummary(processSummary, out);
            if (Thread.currentThread().isInterrupted()) {
                logger.warn("Cancelled during processing");
                return EXIT_FAILURE;
            }

            if ("check".equals(cli.command())) {
                return processSummary.hasFailures() ? EXIT_FAILURE : EXIT_OK;
            }

            MergeOrchestrator orchestrator = new MergeOrchestrator(providers, config, behavior, executor);
            MergeSummary mergeSummary = orchestrator.mergeAll(results, cli.mergeOptions());
            printMergeSummary(mergeSummary, out);

            if (mergeSummary.hasFailures() || processSummary.hasFailures()) {
                logger.warn("PR manager completed with failures");
                return EXIT_FAILURE;
            }
            logger.info("PR manager finished successfully.");
            return EXIT_OK;

        } catch (ConfigException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            return EXIT_FAILURE;
        } catch (ProviderException e) {
            logger.error("Authentication failed: {}", e.toString());
            return EXIT_FAILURE;
        } catch (InterruptedException e) {
            logger.warn("Cancelled before processing started");
            Thread.currentThread().interrupt();
            return EXIT_FAILURE;
        } catch (Exception e) {
            logger.error("Fatal error", e);
            return EXIT_FAILURE;
        }
    }

    private static void authenticate(Map<String, Provider> providers, BehaviorManager behavior)
            throws ProviderException, InterruptedException {
        for (Map.Entry<String, Provider> entry : providers.entrySet()) {
            behavior.execute(entry.getKey(), "authenticate", entry.getValue()::authenticate);
        }
    }

    /**
     * Interrupts the worker thread on Ctrl-C so in-flight work is cancelled and the
     * partial summary still gets printed.
     */
    private static void installShutdownHook(Thread mainThread) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (finished || !mainThread.isAlive()) {
                return;
            }
            logger.warn("Shutdown requested, cancelling in-flight work");
            mainThread.interrupt();
            try {
                mainThread.join(Duration.ofSeconds(SHUTDOWN_GRACE_SECONDS).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "shutdown"));
    }

    // -------------------------------------------------------------------------
    // Output
    // -------------------------------------------------------------------------

    static void printProcessSummary(ProcessSummary summary, PrintStream out) {
        out.println();
        out.println("=== PR Processing Summary ===");
        out.println("Repositories: " + summary.repositoryCount() + " (" + summary.failedRepositoryCount()
                + " failed)");
        out.println("Pull requests: " + summary.pullRequestCount()
                + " | ready=" + summary.countOf(Readiness.READY)
                + " skipped=" + summary.countOf(Readiness.SKIPPED)
                + " blocked=" + summary.countOf(Readiness.BLOCKED)
                + " errors=" + summary.countOf(Readiness.ERRORED));

        for (ProcessResult result : summary.results()) {
            out.println();
            if (result.hasError()) {
                out.println("  " + result.provider() + "/" + result.repositoryName() + ": ERROR " + result.errorMessage());
                continue;
            }
            out.println("  " + result.provider() + "/" + result.repositoryName()
                    + " (" + result.pullRequests().size() + " PRs)");
            for (EvaluatedPR pr : result.pullRequests()) {
                out.printf("    #%-6d %-8s %s [%s]%n", pr.pullRequest().number(), pr.outcome(),
                        pr.pullRequest().title(), pr.reason());
            }
        }
        out.println();
    }

    static void printMergeSummary(MergeSummary summary, PrintStream out) {
        out.println("=== Merge Summary" + (summary.dryRun() ? " (dry run)" : "") + " ===");
        out.println("Duration: " + summary.totalDurationMs() + "ms");
        out.println("Results:  " + summary.successCount() + " merged, " + summary.failureCount()
                + " failed, " + summary.skippedCount() + " skipped");

        if (summary.hasFailures()) {
            out.println();
            out.println("Failures:");
            summary.results().stream()
                    .filter(MergeResult::failed)
                    .forEach(r -> out.println("  - " + r.repository() + " #" + r.prNumber() + ": " + r.reason()));
        }
        out.println();
    }

    static void printUsage(PrintStream out) {
        out.println("Usage: manager <check|merge> [options]");
        out.println();
        out.println("Common options:");
        out.println("  --config <path>       configuration file (default: config.yaml or $GITPR_CONFIG)");
        out.println("  --provider <name>     only process this provider (repeatable)");
        out.println("  --repo <text>         only process repositories whose name contains text (repeatable)");
        out.println("  --skip-label <label>  additional label to skip (repeatable)");
        out.println("  --require-checks      require passing status checks for every repository");
        out.println("  --max-age <duration>  override the configured maximum PR age, e.g. 7d");
        out.println();
        out.println("Merge options:");
        out.println("  --dry-run             show what would be merged without merging");
        out.println("  --force               also merge PRs blocked by status or checks");
        out.println("  --delete-branches     delete head branches after merging");
        out.println("  --message <text>      commit title to use instead of the generated one");
    }

    // -------------------------------------------------------------------------
    // Argument parsing
    // -------------------------------------------------------------------------

    record CliOptions(
            String command,
            boolean help,
            String configPath,
            List<String> providers,
            List<String> repositories,
            List<String> skipLabels,
            boolean requireChecks,
            Duration maxAge,
            boolean dryRun,
            boolean force,
            boolean deleteBranches,
            String message
    ) {

        static CliOptions parse(String[] args) {
            if (args.length == 0) {
                throw new IllegalArgumentException("missing command");
            }
            String command = args[0];
            if ("--help".equals(command) || "-h".equals(command) || "help".equals(command)) {
                return new CliOptions(null, true, null, List.of(), List.of(), List.of(),
                        false, null, false, false, false, null);
            }
            if (!"check".equals(command) && !"merge".equals(command)) {
                throw new IllegalArgumentException("unknown command: " + command);
            }

            boolean merge = "merge".equals(command);
            String configPath = null;
            List<String> providers = new ArrayList<>();
            List<String> repositories = new ArrayList<>();
            List<String> skipLabels = new ArrayList<>();
            boolean requireChecks = false;
            Duration maxAge = null;
            boolean dryRun = false;
            boolean force = false;
            boolean deleteBranches = false;
            String message = null;
            boolean help = false;

            for (int i = 1; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--config" -> configPath = value(args, ++i, arg);
                    case "--provider" -> providers.add(value(args, ++i, arg));
                    case "--repo" -> repositories.add(value(args, ++i, arg));
                    case "--skip-label" -> skipLabels.add(value(args, ++i, arg));
                    case "--require-checks" -> requireChecks = true;
                    case "--max-age" -> maxAge = DurationParser.parse(value(args, ++i, arg));
                    case "--help", "-h" -> help = true;
                    case "--dry-run" -> dryRun = requireMerge(merge, arg);
                    case "--force" -> force = requireMerge(merge, arg);
                    case "--delete-branches" -> deleteBranches = requireMerge(merge, arg);
                    case "--message" -> {
                        requireMerge(merge, arg);
                        message = value(args, ++i, arg);
                    }
                    default -> throw new IllegalArgumentException("unknown option: " + arg);
                }
            }

            return new CliOptions(command, help, configPath, providers, repositories, skipLabels,
                    requireChecks, maxAge, dryRun, force, deleteBranches, message);
        }

        ProcessOptions processOptions() {
            return new ProcessOptions(providers, repositories, skipLabels, requireChecks, maxAge);
        }

        MergeOptions mergeOptions() {
            return new MergeOptions(dryRun, force, deleteBranches, message);
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length || args[index].startsWith("--")) {
                throw new IllegalArgumentException(option + " requires a value");
            }
            return args[index];
        }

        private static boolean requireMerge(boolean merge, String option) {
            if (!merge) {
                throw new IllegalArgumentException(option + " is only valid for the merge command");
            }
            return true;
        }
    }
}
