package com.gitpr.manager.evaluation;

import com.gitpr.manager.behavior.BehaviorManager;
import com.gitpr.manager.config.DurationParser;
import com.gitpr.manager.model.Check;
import com.gitpr.manager.model.PrStatus;
import com.gitpr.manager.model.PullRequest;
import com.gitpr.manager.model.Repository;
import com.gitpr.manager.provider.Provider;
import com.gitpr.manager.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Decides whether a pull request may be merged.
 *
 * <p>Rules run in a fixed order and the first match wins. The cheap, local rules
 * come first; the status and check lookups are the only ones that reach the
 * provider, and only when the repository requires checks:</p>
 * <ol>
 *   <li>author not allowed: skipped</li>
 *   <li>skip label present: skipped</li>
 *   <li>older than the max age: skipped</li>
 *   <li>not open, draft, conflicting or locked: blocked</li>
 *   <li>combined status not successful, a failed check or a running check: blocked</li>
 * </ol>
 * A provider failure while fetching status or checks yields
 * {@link Readiness#ERRORED}, never {@link Readiness#BLOCKED}.
 */
public class ReadinessEvaluator {

    static final String OP_GET_STATUS = "get_pr_status";
    static final String OP_GET_CHECKS = "get_checks";

    private final BehaviorManager behavior;
    private final Clock clock;
    private final Logger logger;

    public ReadinessEvaluator(BehaviorManager behavior) {
        this(behavior, Clock.systemUTC(), LoggerFactory.getLogger(ReadinessEvaluator.class));
    }

    public ReadinessEvaluator(BehaviorManager behavior, Clock clock, Logger logger) {
        this.behavior = behavior;
        this.clock = clock;
        this.logger = logger;
    }

    /**
     * Evaluates one pull request.
     *
     * @throws InterruptedException if cancelled while talking to the provider
     */
    public EvaluatedPR evaluate(Provider provider, Repository repository, PullRequest pr,
                                EvaluationCriteria criteria) throws InterruptedException {
        EvaluatedPR result = decide(provider, repository, pr, criteria);
        switch (result.outcome()) {
            case READY -> logger.info("PR #{} in {} is ready for merge", pr.number(), repository.fullName());
            case ERRORED -> logger.error("PR #{} in {}: {}", pr.number(), repository.fullName(),
                    result.reason(), result.error());
            default -> logger.debug("PR #{} in {} {}: {}", pr.number(), repository.fullName(),
                    result.outcome().name().toLowerCase(), result.reason());
        }
        return result;
    }

    private EvaluatedPR decide(Provider provider, Repository repository, PullRequest pr,
                               EvaluationCriteria criteria) throws InterruptedException {
        if (!criteria.isAllowedActor(pr.authorLogin())) {
            return EvaluatedPR.skipped(pr, "author '" + pr.authorLogin() + "' not in allowed actors");
        }

        List<String> matched = pr.matchingLabels(criteria.skipLabels());
        if (!matched.isEmpty()) {
            return EvaluatedPR.skipped(pr, "matched skip labels: " + String.join(", ", matched));
        }

        if (criteria.maxAge() != null && pr.isOlderThan(criteria.maxAge(), clock.instant())) {
            return EvaluatedPR.skipped(pr, "older than " + DurationParser.format(criteria.maxAge()));
        }

        if (!pr.isOpen()) {
            return EvaluatedPR.blocked(pr, "pull request is not open");
        }
        if (pr.isDraft()) {
            return EvaluatedPR.blocked(pr, "pull request is a draft");
        }
        if (pr.hasConflicts()) {
            return EvaluatedPR.blocked(pr, "merge conflicts");
        }
        if (pr.locked()) {
            return EvaluatedPR.blocked(pr, "pull request is locked");
        }

        if (!criteria.requireChecks()) {
            return EvaluatedPR.ready(pr, null, null);
        }
        return evaluateChecks(provider, repository, pr);
    }

    private EvaluatedPR evaluateChecks(Provider provider, Repository repository, PullRequest pr)
            throws InterruptedException {
        String providerName = provider.getProviderName();

        PrStatus status;
        try {
            status = behavior.executeWithResult(providerName, OP_GET_STATUS,
                    () -> provider.getPrStatus(repository, pr));
        } catch (ProviderException e) {
            return EvaluatedPR.errored(pr, "failed to get PR status: " + e.getMessage(), e);
        }
        if (!status.isSuccessful()) {
            String reason = "status checks not passing: " + status.state().value();
            if (status.description() != null && !status.description().isBlank()) {
                reason += " (" + status.description() + ")";
            }
            return EvaluatedPR.blocked(pr, reason, status, null);
        }

        List<Check> checks;
        try {
            checks = behavior.executeWithResult(providerName, OP_GET_CHECKS,
                    () -> provider.getChecks(repository, pr));
        } catch (ProviderException e) {
            return EvaluatedPR.errored(pr, "failed to get PR checks: " + e.getMessage(), e);
        }
        for (Check check : checks) {
            if (check.isFailed()) {
                return EvaluatedPR.blocked(pr, "check '" + check.name() + "' failed", status, checks);
            }
        }
        for (Check check : checks) {
            if (!check.isSuccessful()) {
                return EvaluatedPR.blocked(pr, "check '" + check.name() + "' not complete", status, checks);
            }
        }

        return EvaluatedPR.ready(pr, status, checks);
    }
}
