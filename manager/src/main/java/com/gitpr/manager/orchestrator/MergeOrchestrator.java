package com.gitpr.manager.orchestrator;

import com.gitpr.manager.behavior.BehaviorManager;
import com.gitpr.manager.concurrent.BoundedExecutor;
import com.gitpr.manager.concurrent.Task;
import com.gitpr.manager.config.ManagerConfig;
import com.gitpr.manager.config.RepositoryConfig;
import com.gitpr.manager.evaluation.EvaluatedPR;
import com.gitpr.manager.model.MergeMethod;
import com.gitpr.manager.model.MergeRequest;
import com.gitpr.manager.model.PullRequest;
import com.gitpr.manager.model.Repository;
import com.gitpr.manager.provider.Provider;
import com.gitpr.manager.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merges the pull requests the evaluator found ready.
 *
 * <p>Every pull request in the input gets a result slot fixed by its position, so
 * results come back in input order regardless of completion order. Pull requests
 * that are not merged get an immediate skipped result; the rest are merged
 * concurrently through the {@link BoundedExecutor}, each call paced and retried by
 * the {@link BehaviorManager}. One failing merge never affects another.</p>
 */
public class MergeOrchestrator {

    static final String OP_MERGE = "merge_pull_request";

    private final Map<String, Provider> providers;
    private final ManagerConfig config;
    private final BehaviorManager behavior;
    private final BoundedExecutor executor;
    private final Clock clock;
    private final Logger logger;

    public MergeOrchestrator(Map<String, Provider> providers, ManagerConfig config,
                             BehaviorManager behavior, BoundedExecutor executor) {
        this(providers, config, behavior, executor, Clock.systemUTC(),
                LoggerFactory.getLogger(MergeOrchestrator.class));
    }

    public MergeOrchestrator(Map<String, Provider> providers, ManagerConfig config,
                             BehaviorManager behavior, BoundedExecutor executor,
                             Clock clock, Logger logger) {
        this.providers = providers;
        this.config = config;
        this.behavior = behavior;
        this.executor = executor;
        this.clock = clock;
        this.logger = logger;
    }

    /**
     * Merges every eligible pull request in {@code results}.
     *
     * <p>If the calling thread is interrupted, completed results are kept, merges that
     * never started are reported as failed and the interrupt flag is left set.</p>
     *
     * @throws IllegalStateException if no providers are configured
     */
    public MergeSummary mergeAll(List<ProcessResult> results, MergeOptions options) {
        if (providers.isEmpty()) {
            throw new IllegalStateException("no providers configured");
        }

        Instant start = clock.instant();
        int total = results.stream().mapToInt(r -> r.pullRequests().size()).sum();
        MergeResult[] slots = new MergeResult[total];
        List<Candidate> candidates = new ArrayList<>();

        int index = 0;
        for (ProcessResult result : results) {
            if (result.hasError()) {
                logger.warn("Skipping {} [{}]: {}", result.repositoryName(), result.provider(), result.errorMessage());
                continue;
            }
            for (EvaluatedPR evaluated : result.pullRequests()) {
                PullRequest pr = evaluated.pullRequest();
                if (evaluated.skipped() || evaluated.errored() || (evaluated.blocked() && !options.force())) {
                    slots[index] = MergeResult.skipped(result.provider(), result.repositoryName(),
                            pr.number(), pr.title(), pr.authorLogin(), evaluated.reason());
                } else {
                    if (evaluated.blocked()) {
                        logger.warn("Forcing merge of blocked PR #{} in {}: {}", pr.number(),
                                result.repositoryName(), evaluated.reason());
                    }
                    candidates.add(new Candidate(index, result.provider(), result.repositoryName(),
                            result.repository(), pr));
                }
                index++;
            }
        }

        if (options.dryRun()) {
            logger.info("[DRY RUN] Evaluating {} merge candidates", candidates.size());
        } else {
            logger.info("Merging {} pull requests with concurrency {}", candidates.size(), executor.getConcurrency());
        }

        List<Task> tasks = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            tasks.add(() -> slots[candidate.slot()] = merge(candidate, options));
        }

        boolean cancelled = false;
        try {
            executor.execute(tasks);
        } catch (InterruptedException e) {
            cancelled = true;
            logger.warn("Merge run cancelled; completed merges are kept");
        }

        for (Candidate candidate : candidates) {
            if (slots[candidate.slot()] == null) {
                PullRequest pr = candidate.pullRequest();
                String reason = cancelled ? "cancelled before merge" : "merge did not complete";
                slots[candidate.slot()] = MergeResult.failed(candidate.provider(), candidate.repositoryName(),
                        pr.number(), pr.title(), pr.authorLogin(), null, reason, new IllegalStateException(reason));
            }
        }
        if (cancelled) {
            Thread.currentThread().interrupt();
        }

        MergeSummary summary = new MergeSummary(List.copyOf(Arrays.asList(slots)),
                Duration.between(start, clock.instant()).toMillis(), options.dryRun());
        logSummary(summary);
        return summary;
    }

    MergeResult merge(Candidate candidate, MergeOptions options) throws InterruptedException {
        PullRequest pr = candidate.pullRequest();
        String providerName = candidate.provider();
        String repoName = candidate.repositoryName();

        try (MDC.MDCCloseable p = MDC.putCloseable("provider", providerName);
             MDC.MDCCloseable r = MDC.putCloseable("repo", repoName);
             MDC.MDCCloseable n = MDC.putCloseable("pr", String.valueOf(pr.number()))) {

            Provider provider = providers.get(providerName);
            if (provider == null) {
                String reason = "provider '" + providerName + "' is not configured";
                return MergeResult.failed(providerName, repoName, pr.number(), pr.title(), pr.authorLogin(),
                        null, reason, new IllegalStateException(reason));
            }

            Optional<RepositoryConfig> repoConfig = config.findRepository(providerName, repoName);
            if (repoConfig.isEmpty()) {
                String reason = "repository configuration not found";
                return MergeResult.failed(providerName, repoName, pr.number(), pr.title(), pr.authorLogin(),
                        null, reason, new IllegalStateException(reason));
            }

            MergeMethod method = repoConfig.get().mergeMethod();
            CommitMessages.CommitMessage message = CommitMessages.build(pr, method, options.customMessage());
            MergeRequest request = new MergeRequest(method, message.title(), message.message(), pr.headSha(),
                    options.deleteBranches() || repoConfig.get().deleteBranches());

            if (options.dryRun()) {
                logger.info("[DRY RUN] Would merge PR #{} with method {}", pr.number(), method.value());
                return MergeResult.succeeded(providerName, repoName, pr.number(), pr.title(), pr.authorLogin(),
                        method, "dry run - would merge", null);
            }

            logger.info("Merging PR #{} with method {}", pr.number(), method.value());
            Repository repository = candidate.repository();
            try {
                behavior.execute(providerName, OP_MERGE, () -> provider.mergePullRequest(repository, pr, request));
            } catch (ProviderException e) {
                logger.error("Failed to merge PR #{}: {}", pr.number(), e.getMessage());
                return MergeResult.failed(providerName, repoName, pr.number(), pr.title(), pr.authorLogin(),
                        method, "merge failed: " + e.getMessage(), e);
            }

            logger.info("Successfully merged PR #{}", pr.number());
            return MergeResult.succeeded(providerName, repoName, pr.number(), pr.title(), pr.authorLogin(),
                    method, "successfully merged", clock.instant());
        }
    }

    private void logSummary(MergeSummary summary) {
        logger.info("=== Merge Summary{} ===", summary.dryRun() ? " (dry run)" : "");
        logger.info("Total: {}, succeeded: {}, failed: {}, skipped: {} ({}ms)",
                summary.results().size(), summary.successCount(), summary.failureCount(),
                summary.skippedCount(), summary.totalDurationMs());

        if (summary.hasFailures()) {
            summary.results().stream()
                    .filter(MergeResult::failed)
                    .forEach(r -> logger.warn("  FAILED: {} [{}] #{}: {}", r.repository(), r.provider(),
                            r.prNumber(), r.reason()));
        }
    }

    record Candidate(int slot, String provider, String repositoryName, Repository repository,
                     PullRequest pullRequest) {}
}
