package com.gitpr.manager.orchestrator;

import com.gitpr.manager.behavior.BehaviorManager;
import com.gitpr.manager.behavior.RateLimitPolicy;
import com.gitpr.manager.behavior.RetryPolicy;
import com.gitpr.manager.concurrent.BoundedExecutor;
import com.gitpr.manager.config.AuthConfig;
import com.gitpr.manager.config.ManagerConfig;
import com.gitpr.manager.config.PrFilters;
import com.gitpr.manager.config.RepositoryConfig;
import com.gitpr.manager.evaluation.EvaluatedPR;
import com.gitpr.manager.model.Fixtures;
import com.gitpr.manager.model.MergeMethod;
import com.gitpr.manager.model.MergeRequest;
import com.gitpr.manager.model.PullRequest;
import com.gitpr.manager.model.Repository;
import com.gitpr.manager.provider.ErrorType;
import com.gitpr.manager.provider.Provider;
import com.gitpr.manager.provider.ProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link MergeOrchestrator} with a mocked provider and the real behavior
 * manager and executor.
 */
@ExtendWith(MockitoExtension.class)
class MergeOrchestratorTest {

    @Mock
    private Provider github;

    private final Clock clock = Clock.fixed(Fixtures.NOW, ZoneOffset.UTC);
    private final Repository repo = Fixtures.repository("acme/app");
    private ManagerConfig config;
    private MergeOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        config = new ManagerConfig(
                new PrFilters(List.of("dependabot[bot]"), List.of(), null),
                Map.of("github", List.of(
                        new RepositoryConfig("acme/app", "squash", false, List.of(), false),
                        new RepositoryConfig("acme/lib", "rebase", false, List.of(), true))),
                new AuthConfig(new AuthConfig.GitHubAuth("token", null)),
                null);
        orchestrator = orchestrator(Map.of("github", github));
    }

    private MergeOrchestrator orchestrator(Map<String, Provider> providers) {
        BehaviorManager behavior = new BehaviorManager(RateLimitPolicy.unlimited(),
                new RetryPolicy(1, Duration.ZERO, Duration.ZERO, false), List.of("github"));
        return new MergeOrchestrator(providers, config, behavior, new BoundedExecutor(3, "test"), clock,
                LoggerFactory.getLogger(MergeOrchestrator.class));
    }

    private ProcessResult processed(String name, EvaluatedPR... prs) {
        return ProcessResult.success("github", name, Fixtures.repository(name), List.of(prs), 10);
    }

    private static EvaluatedPR ready(int number) {
        return EvaluatedPR.ready(Fixtures.pullRequest(number, "dependabot[bot]"), null, null);
    }

    // =========================================================================
    // Dry run and isolation
    // =========================================================================

    @Test
    @DisplayName("Dry run reports would-merge results and never calls the provider")
    void dryRun_neverMerges() throws Exception {
        MergeSummary summary = orchestrator.mergeAll(
                List.of(processed("acme/app", ready(1), ready(2))),
                new MergeOptions(true, false, false, null));

        assertEquals(2, summary.results().size());
        summary.results().forEach(r -> {
            assertTrue(r.success());
            assertEquals("dry run - would merge", r.reason());
            assertNull(r.mergedAt());
        });
        assertTrue(summary.dryRun());
        verify(github, never()).mergePullRequest(any(), any(), any());
    }

    @Test
    @DisplayName("One failing merge among several leaves the others merged")
    void mergeFailure_isolated() throws Exception {
        lenient().doThrow(new ProviderException("github", ErrorType.CONFLICT, "Head branch was modified"))
                .when(github).mergePullRequest(any(), eq(Fixtures.pullRequest(2, "dependabot[bot]")), any());

        MergeSummary summary = orchestrator.mergeAll(
                List.of(processed("acme/app", ready(1), ready(2), ready(3))), MergeOptions.defaults());

        assertEquals(2, summary.successCount());
        assertEquals(1, summary.failureCount());
        assertTrue(summary.hasFailures());

        MergeResult failed = summary.results().get(1);
        assertEquals(2, failed.prNumber());
        assertEquals("merge failed: Head branch was modified", failed.reason());
        assertInstanceOf(ProviderException.class, failed.error());
        assertEquals("successfully merged", summary.results().get(0).reason());
        assertEquals(Fixtures.NOW, summary.results().get(2).mergedAt());
        verify(github, times(3)).mergePullRequest(any(), any(), any());
    }

    // =========================================================================
    // Candidate selection
    // =========================================================================

    @Test
    @DisplayName("Skipped, blocked and errored PRs are not merged and keep their reasons")
    void nonReady_skipped() throws Exception {
        PullRequest skippedPr = Fixtures.pullRequest(1, "octocat");
        PullRequest blockedPr = Fixtures.pullRequest(2, "dependabot[bot]");
        PullRequest erroredPr = Fixtures.pullRequest(3, "dependabot[bot]");

        MergeSummary summary = orchestrator.mergeAll(List.of(processed("acme/app",
                EvaluatedPR.skipped(skippedPr, "author 'octocat' not in allowed actors"),
                EvaluatedPR.blocked(blockedPr, "pull request is a draft"),
                EvaluatedPR.errored(erroredPr, "failed to get PR status: boom", new RuntimeException("boom")),
                ready(4))), MergeOptions.defaults());

        assertEquals(4, summary.results().size());
        assertEquals(3, summary.skippedCount());
        assertEquals(1, summary.successCount());
        assertEquals("author 'octocat' not in allowed actors", summary.results().get(0).reason());
        assertEquals("pull request is a draft", summary.results().get(1).reason());
        assertEquals("failed to get PR status: boom", summary.results().get(2).reason());
        assertNull(summary.results().get(2).error(), "skipped results never carry an error");
        verify(github, times(1)).mergePullRequest(any(), any(), any());
    }

    @Test
    @DisplayName("Force merges blocked PRs but never errored ones")
    void force_mergesBlocked() throws Exception {
        MergeSummary summary = orchestrator.mergeAll(List.of(processed("acme/app",
                EvaluatedPR.blocked(Fixtures.pullRequest(1, "dependabot[bot]"), "check 'build' failed"),
                EvaluatedPR.errored(Fixtures.pullRequest(2, "dependabot[bot]"), "failed to get PR checks: x",
                        new RuntimeException("x")))),
                new MergeOptions(false, true, false, null));

        assertTrue(summary.results().get(0).success());
        assertTrue(summary.results().get(1).skipped());
    }

    @Test
    @DisplayName("Repositories that failed processing contribute no results")
    void failedRepository_ignored() {
        ProcessResult failed = ProcessResult.failure("github", "acme/gone", null,
                new IllegalStateException("failed to get repository: Not Found"), 5);

        MergeSummary summary = orchestrator.mergeAll(List.of(failed, processed("acme/app", ready(1))),
                new MergeOptions(true, false, false, null));

        assertEquals(1, summary.results().size());
        assertEquals("acme/app", summary.results().get(0).repository());
    }

    @Test
    @DisplayName("Missing repository configuration fails the merge for that PR")
    void missingConfig_failed() {
        MergeSummary summary = orchestrator.mergeAll(List.of(processed("acme/unknown", ready(1))),
                MergeOptions.defaults());

        MergeResult result = summary.results().get(0);
        assertTrue(result.failed());
        assertEquals("repository configuration not found", result.reason());
    }

    @Test
    @DisplayName("No providers is a scheduling error")
    void noProviders() {
        MergeOrchestrator empty = orchestrator(Map.of());

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> empty.mergeAll(List.of(), MergeOptions.defaults()));
        assertEquals("no providers configured", ex.getMessage());
    }

    // =========================================================================
    // Merge request contents
    // =========================================================================

    @Test
    @DisplayName("Squash merge sends generated title, body and head SHA")
    void mergeRequest_squash() throws Exception {
        orchestrator.mergeAll(List.of(processed("acme/app", ready(7))), MergeOptions.defaults());

        ArgumentCaptor<MergeRequest> captor = ArgumentCaptor.forClass(MergeRequest.class);
        verify(github).mergePullRequest(eq(Fixtures.repository("acme/app")), any(), captor.capture());
        MergeRequest request = captor.getValue();
        assertEquals(MergeMethod.SQUASH, request.method());
        assertEquals("Bump library to 1.7 (#7)", request.commitTitle());
        assertEquals("Bumps the library.", request.commitMessage());
        assertEquals("sha7", request.sha());
        assertFalse(request.deleteBranch());
    }

    @Test
    @DisplayName("Repository strategy and branch deletion settings are applied")
    void mergeRequest_repositorySettings() throws Exception {
        orchestrator.mergeAll(List.of(processed("acme/lib", ready(3))), MergeOptions.defaults());

        ArgumentCaptor<MergeRequest> captor = ArgumentCaptor.forClass(MergeRequest.class);
        verify(github).mergePullRequest(any(), any(), captor.capture());
        assertEquals(MergeMethod.REBASE, captor.getValue().method());
        assertNull(captor.getValue().commitMessage());
        assertTrue(captor.getValue().deleteBranch());
    }

    // =========================================================================
    // Cancellation
    // =========================================================================

    @Test
    @DisplayName("Cancellation reports undispatched merges as failed and keeps skipped results")
    void cancelled_beforeMerge() {
        MergeSummary summary;
        Thread.currentThread().interrupt();
        try {
            summary = orchestrator.mergeAll(List.of(processed("acme/app",
                    ready(1), EvaluatedPR.skipped(Fixtures.pullRequest(2, "octocat"), "author not allowed"))),
                    MergeOptions.defaults());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }

        assertEquals("cancelled before merge", summary.results().get(0).reason());
        assertTrue(summary.results().get(0).failed());
        assertTrue(summary.results().get(1).skipped());
        List<MergeResult> returned = summary.results();
        assertThrows(UnsupportedOperationException.class, () -> returned.set(0, null),
                "results must not be backed by slots a late worker can still write");
        verifyNoInteractions(github);
    }
}
