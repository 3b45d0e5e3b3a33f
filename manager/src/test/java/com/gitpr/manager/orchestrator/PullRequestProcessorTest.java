package com.gitpr.manager.orchestrator;

import com.gitpr.manager.behavior.BehaviorManager;
import com.gitpr.manager.behavior.RateLimitPolicy;
import com.gitpr.manager.behavior.RetryPolicy;
import com.gitpr.manager.concurrent.BoundedExecutor;
import com.gitpr.manager.config.AuthConfig;
import com.gitpr.manager.config.ManagerConfig;
import com.gitpr.manager.config.PrFilters;
import com.gitpr.manager.config.RepositoryConfig;
import com.gitpr.manager.evaluation.EvaluationCriteria;
import com.gitpr.manager.evaluation.Readiness;
import com.gitpr.manager.evaluation.ReadinessEvaluator;
import com.gitpr.manager.model.Fixtures;
import com.gitpr.manager.model.ListPullRequestsOptions;
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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link PullRequestProcessor} with a mocked provider and the real
 * behavior manager, executor and evaluator.
 */
@ExtendWith(MockitoExtension.class)
class PullRequestProcessorTest {

    @Mock
    private Provider github;

    private final Clock clock = Clock.fixed(Fixtures.NOW, ZoneOffset.UTC);
    private BehaviorManager behavior;

    @BeforeEach
    void setUp() {
        lenient().when(github.getProviderName()).thenReturn("github");
        behavior = new BehaviorManager(RateLimitPolicy.unlimited(),
                new RetryPolicy(1, Duration.ZERO, Duration.ZERO, false), List.of("github", "gitlab"));
    }

    private static RepositoryConfig repo(String name) {
        return new RepositoryConfig(name, "squash", false, List.of(), false);
    }

    private static ManagerConfig config(Map<String, List<RepositoryConfig>> repositories) {
        return new ManagerConfig(
                new PrFilters(List.of("dependabot[bot]"), List.of("do-not-merge"), "30d"),
                repositories,
                new AuthConfig(new AuthConfig.GitHubAuth("token", null)),
                null);
    }

    private PullRequestProcessor processor(ManagerConfig config) {
        return new PullRequestProcessor(Map.of("github", github), config, behavior,
                new ReadinessEvaluator(behavior, clock, LoggerFactory.getLogger(ReadinessEvaluator.class)),
                new BoundedExecutor(4, "test"), clock, LoggerFactory.getLogger(PullRequestProcessor.class));
    }

    private void stubRepository(String fullName, int... prNumbers) throws Exception {
        Repository repository = Fixtures.repository(fullName);
        String[] parts = fullName.split("/");
        lenient().when(github.getRepository(parts[0], parts[1])).thenReturn(repository);
        List<PullRequest> prs = new ArrayList<>();
        for (int number : prNumbers) {
            prs.add(Fixtures.pullRequest(number, "dependabot[bot]"));
        }
        lenient().when(github.listPullRequests(eq(repository), any())).thenReturn(prs);
    }

    // =========================================================================
    // Isolation and ordering
    // =========================================================================

    @Test
    @DisplayName("A failing repository does not affect the others")
    void repositoryFailure_isolated() throws Exception {
        stubRepository("acme/one", 1, 2);
        stubRepository("acme/three", 5);
        when(github.getRepository("acme", "two"))
                .thenThrow(new ProviderException("github", ErrorType.NOT_FOUND, "Not Found"));

        List<ProcessResult> results = processor(config(Map.of("github",
                List.of(repo("acme/one"), repo("acme/two"), repo("acme/three")))))
                .processAll(ProcessOptions.defaults());

        assertEquals(3, results.size());
        assertFalse(results.get(0).hasError());
        assertEquals(2, results.get(0).pullRequests().size());
        assertTrue(results.get(1).hasError());
        assertTrue(results.get(1).pullRequests().isEmpty());
        assertEquals("failed to get repository: Not Found", results.get(1).errorMessage());
        assertFalse(results.get(2).hasError());
        assertEquals(1, results.get(2).countOf(Readiness.READY));
    }

    @Test
    @DisplayName("Results follow configuration order, not completion order")
    void results_orderStable() throws Exception {
        stubRepository("acme/slow", 1);
        stubRepository("acme/fast", 2);
        Repository slow = Fixtures.repository("acme/slow");
        when(github.listPullRequests(eq(slow), any())).thenAnswer(invocation -> {
            Thread.sleep(200);
            return List.of(Fixtures.pullRequest(1, "dependabot[bot]"));
        });

        List<ProcessResult> results = processor(config(Map.of("github",
                List.of(repo("acme/slow"), repo("acme/fast")))))
                .processAll(ProcessOptions.defaults());

        assertEquals(List.of("acme/slow", "acme/fast"),
                results.stream().map(ProcessResult::repositoryName).toList());
        assertEquals(1, results.get(0).pullRequests().get(0).pullRequest().number());
    }

    @Test
    @DisplayName("Lists open PRs created within the max age")
    void listsWithMaxAge() throws Exception {
        stubRepository("acme/one", 1);

        processor(config(Map.of("github", List.of(repo("acme/one"))))).processAll(ProcessOptions.defaults());

        ArgumentCaptor<ListPullRequestsOptions> captor = ArgumentCaptor.forClass(ListPullRequestsOptions.class);
        verify(github).listPullRequests(any(), captor.capture());
        assertEquals(Fixtures.NOW.minus(Duration.ofDays(30)), captor.getValue().since());
    }

    @Test
    @DisplayName("A provider with no client yields an error result for its repositories")
    void unknownProvider_errorResult() throws Exception {
        stubRepository("acme/one", 1);
        Map<String, List<RepositoryConfig>> repositories = new LinkedHashMap<>();
        repositories.put("github", List.of(repo("acme/one")));
        repositories.put("gitlab", List.of(repo("group/project")));

        List<ProcessResult> results = processor(config(repositories)).processAll(ProcessOptions.defaults());

        assertEquals(2, results.size());
        assertFalse(results.get(0).hasError());
        assertTrue(results.get(1).hasError());
        assertTrue(results.get(1).errorMessage().contains("gitlab"));
    }

    // =========================================================================
    // Options
    // =========================================================================

    @Test
    @DisplayName("Repository filter narrows the run case-insensitively")
    void repositoryFilter() throws Exception {
        stubRepository("acme/api", 1);

        List<ProcessResult> results = processor(config(Map.of("github",
                List.of(repo("acme/api"), repo("acme/web")))))
                .processAll(new ProcessOptions(List.of(), List.of("API"), List.of(), false, null));

        assertEquals(1, results.size());
        assertEquals("acme/api", results.get(0).repositoryName());
        verify(github, never()).getRepository("acme", "web");
    }

    @Test
    @DisplayName("Filtering everything out is a scheduling error")
    void nothingToProcess() {
        PullRequestProcessor processor = processor(config(Map.of("github", List.of(repo("acme/api")))));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> processor.processAll(new ProcessOptions(List.of("gitlab"), List.of(), List.of(), false, null)));
        assertEquals("no repositories to process", ex.getMessage());
    }

    @Test
    @DisplayName("Criteria merge global, repository and command-line settings")
    void criteria_merged() {
        ManagerConfig config = config(Map.of("github",
                List.of(new RepositoryConfig("acme/api", "merge", false, List.of("hold"), false))));
        PullRequestProcessor processor = processor(config);

        EvaluationCriteria criteria = processor.criteriaFor(config.repositories().get("github").get(0),
                new ProcessOptions(List.of(), List.of(), List.of("wip", "hold"), true, Duration.ofDays(7)));

        assertEquals(List.of("do-not-merge", "hold", "wip"), criteria.skipLabels());
        assertEquals(Duration.ofDays(7), criteria.maxAge());
        assertTrue(criteria.requireChecks());
        assertEquals(List.of("dependabot[bot]"), criteria.allowedActors());
    }

    @Test
    @DisplayName("An interrupted caller gets cancelled results for every repository")
    void cancelled_beforeProcessing() {
        PullRequestProcessor processor = processor(config(Map.of("github",
                List.of(repo("acme/one"), repo("acme/two")))));

        Thread.currentThread().interrupt();
        List<ProcessResult> results;
        try {
            results = processor.processAll(ProcessOptions.defaults());
            assertTrue(Thread.currentThread().isInterrupted(), "interrupt flag should be restored");
        } finally {
            Thread.interrupted();
        }

        assertEquals(2, results.size());
        results.forEach(r -> assertEquals("cancelled before processing", r.errorMessage()));
        List<ProcessResult> returned = results;
        assertThrows(UnsupportedOperationException.class, () -> returned.set(0, null),
                "results must not be backed by slots a late worker can still write");
        verifyNoInteractions(github);
    }
}
