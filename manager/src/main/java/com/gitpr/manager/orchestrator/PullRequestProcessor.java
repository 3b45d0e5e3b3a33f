package com.gitpr.manager.orchestrator;

import com.gitpr.manager.behavior.BehaviorManager;
import com.gitpr.manager.concurrent.BoundedExecutor;
import com.gitpr.manager.concurrent.Task;
import com.gitpr.manager.config.ManagerConfig;
import com.gitpr.manager.config.RepositoryConfig;
import com.gitpr.manager.evaluation.EvaluatedPR;
import com.gitpr.manager.evaluation.EvaluationCriteria;
import com.gitpr.manager.evaluation.Readiness;
import com.gitpr.manager.evaluation.ReadinessEvaluator;
import com.gitpr.manager.model.ListPullRequestsOptions;
import com.gitpr.manager.model.PullRequest;
import com.gitpr.manager.model.Repository;
import com.gitpr.manager.model.RepositoryName;
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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fetches and evaluates the open pull requests of every configured repository.
 *
 * <p>Repositories are processed concurrently, one task each. A failure while
 * processing a repository is recorded on that repository's result only; the other
 * repositories are unaffected. Results come back in configuration order.</p>
 */
public class PullRequestProcessor {

    static final String OP_GET_REPOSITORY = "get_repository";
    static final String OP_LIST_PULL_REQUESTS = "list_pull_requests";

    private final Map<String, Provider> providers;
    private final ManagerConfig config;
    private final BehaviorManager behavior;
    private final ReadinessEvaluator evaluator;
    private final BoundedExecutor executor;
    private final Clock clock;
    private final Logger logger;

    public PullRequestProcessor(Map<String, Provider> providers, ManagerConfig config,
                                BehaviorManager behavior, ReadinessEvaluator evaluator,
                                BoundedExecutor executor) {
        this(providers, config, behavior, evaluator, executor, Clock.systemUTC(),
                LoggerFactory.getLogger(PullRequestProcessor.class));
    }

    public PullRequestProcessor(Map<String, Provider> providers, ManagerConfig config,
                                BehaviorManager behavior, ReadinessEvaluator evaluator,
                                BoundedExecutor executor, Clock clock, Logger logger) {
        this.providers = providers;
        this.config = config;
        this.behavior = behavior;
        this.evaluator = evaluator;
        this.executor = executor;
        this.clock = clock;
        this.logger = logger;
    }

    /**
     * Processes every configured repository that passes the option filters.
     *
     * <p>If the calling thread is interrupted, repositories that never ran are
     * reported with a cancellation error and the interrupt flag is left set.</p>
     *
     * @return one result per selected repository, in configuration order
     * @throws IllegalStateException if no repository is left after filtering
     */
    public List<ProcessResult> processAll(ProcessOptions options) {
        List<Target> targets = selectTargets(options);
        if (targets.isEmpty()) {
            throw new IllegalStateException("no repositories to process");
        }

        Instant start = clock.instant();
        logger.info("Processing {} repositories with concurrency {}", targets.size(), executor.getConcurrency());

        ProcessResult[] slots = new ProcessResult[targets.size()];
        List<Task> tasks = new ArrayList<>(targets.size());
        for (int i = 0; i < targets.size(); i++) {
            int index = i;
            Target target = targets.get(i);
            tasks.add(() -> slots[index] = processRepository(target, options));
        }

        boolean cancelled = false;
        try {
            executor.execute(tasks);
        } catch (InterruptedException e) {
            cancelled = true;
            logger.warn("Processing cancelled; unfinished repositories are reported as cancelled");
        }

        for (int i = 0; i < slots.length; i++) {
            if (slots[i] == null) {
                Target target = targets.get(i);
                String reason = cancelled ? "cancelled before processing" : "processing did not complete";
                slots[i] = ProcessResult.failure(target.provider(), target.repository().name(), null,
                        new IllegalStateException(reason), 0);
            }
        }
        if (cancelled) {
            Thread.currentThread().interrupt();
        }

        // snapshot, so a worker still draining after cancellation cannot change the returned results
        List<ProcessResult> results = List.copyOf(Arrays.asList(slots));
        logSummary(new ProcessSummary(results, Duration.between(start, clock.instant()).toMillis()));
        return results;
    }

    private List<Target> selectTargets(ProcessOptions options) {
        List<Target> targets = new ArrayList<>();
        config.repositories().forEach((provider, repos) -> {
            if (!options.includesProvider(provider)) {
                return;
            }
            for (RepositoryConfig repo : repos) {
                if (options.includesRepository(repo.name())) {
                    targets.add(new Target(provider, repo));
                }
            }
        });
        return targets;
    }

    ProcessResult processRepository(Target target, ProcessOptions options) throws InterruptedException {
        String providerName = target.provider();
        String name = target.repository().name();
        Instant start = clock.instant();

        try (MDC.MDCCloseable p = MDC.putCloseable("provider", providerName);
             MDC.MDCCloseable r = MDC.putCloseable("repo", name)) {
            Provider provider = providers.get(providerName);
            if (provider == null) {
                logger.error("Provider {} is not configured, skipping {}", providerName, name);
                return ProcessResult.failure(providerName, name, null,
                        new IllegalStateException("provider '" + providerName + "' is not configured"),
                        elapsed(start));
            }

            Repository repository;
            try {
                RepositoryName repoName = RepositoryName.parse(name);
                repository = behavior.executeWithResult(providerName, OP_GET_REPOSITORY,
                        () -> provider.getRepository(repoName.owner(), repoName.name()));
            } catch (ProviderException e) {
                logger.error("Failed to get repository {}: {}", name, e.getMessage());
                return ProcessResult.failure(providerName, name, null,
                        wrap("failed to get repository", e), elapsed(start));
            } catch (IllegalArgumentException e) {
                logger.error("Invalid repository name {}: {}", name, e.getMessage());
                return ProcessResult.failure(providerName, name, null, e, elapsed(start));
            }

            EvaluationCriteria criteria = criteriaFor(target.repository(), options);
            Instant since = criteria.maxAge() != null ? clock.instant().minus(criteria.maxAge()) : null;

            List<PullRequest> pullRequests;
            try {
                pullRequests = behavior.executeWithResult(providerName, OP_LIST_PULL_REQUESTS,
                        () -> provider.listPullRequests(repository, ListPullRequestsOptions.openSince(since)));
            } catch (ProviderException e) {
                logger.error("Failed to list pull requests for {}: {}", name, e.getMessage());
                return ProcessResult.failure(providerName, name, repository,
                        wrap("failed to list pull requests", e), elapsed(start));
            }
            logger.debug("Found {} open pull requests in {}", pullRequests.size(), name);

            List<EvaluatedPR> evaluated = new ArrayList<>(pullRequests.size());
            for (PullRequest pr : pullRequests) {
                try (MDC.MDCCloseable n = MDC.putCloseable("pr", String.valueOf(pr.number()))) {
                    evaluated.add(evaluator.evaluate(provider, repository, pr, criteria));
                }
            }
            return ProcessResult.success(providerName, name, repository, evaluated, elapsed(start));
        } catch (RuntimeException e) {
            logger.error("Unexpected failure while processing {}", name, e);
            return ProcessResult.failure(providerName, name, null, e, elapsed(start));
        }
    }

    EvaluationCriteria criteriaFor(RepositoryConfig repository, ProcessOptions options) {
        Set<String> skipLabels = new LinkedHashSet<>(config.prFilters().skipLabels());
        skipLabels.addAll(repository.skipLabels());
        skipLabels.addAll(options.skipLabels());

        Duration maxAge = options.maxAge() != null ? options.maxAge() : config.maxAge().orElse(null);
        return new EvaluationCriteria(
                config.prFilters().allowedActors(),
                List.copyOf(skipLabels),
                maxAge,
                options.requireChecks() || repository.requireChecks());
    }

    private static ProviderException wrap(String context, ProviderException e) {
        return new ProviderException(e.getProvider(), e.getType(), context + ": " + e.getMessage(),
                e.getStatusCode(), e.getRetryAfter(), e);
    }

    private long elapsed(Instant start) {
        return Duration.between(start, clock.instant()).toMillis();
    }

    private void logSummary(ProcessSummary summary) {
        logger.info("=== Processing Summary ===");
        logger.info("Repositories: {} ({} failed), pull requests: {}",
                summary.repositoryCount(), summary.failedRepositoryCount(), summary.pullRequestCount());
        logger.info("Ready: {}, skipped: {}, blocked: {}, errors: {}",
                summary.countOf(Readiness.READY), summary.countOf(Readiness.SKIPPED),
                summary.countOf(Readiness.BLOCKED), summary.countOf(Readiness.ERRORED));

        summary.results().stream()
                .filter(ProcessResult::hasError)
                .forEach(r -> logger.warn("  FAILED: {} [{}]: {}", r.provider(), r.repositoryName(),
                        r.errorMessage()));
    }

    record Target(String provider, RepositoryConfig repository) {}
}
