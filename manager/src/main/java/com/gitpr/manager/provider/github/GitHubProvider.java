package com.gitpr.manager.provider.github;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gitpr.manager.model.Check;
import com.gitpr.manager.model.ListPullRequestsOptions;
import com.gitpr.manager.model.MergeRequest;
import com.gitpr.manager.model.PrState;
import com.gitpr.manager.model.PrStatus;
import com.gitpr.manager.model.PullRequest;
import com.gitpr.manager.model.RateLimit;
import com.gitpr.manager.model.Repository;
import com.gitpr.manager.provider.ErrorType;
import com.gitpr.manager.provider.Provider;
import com.gitpr.manager.provider.ProviderException;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GitHub REST v3 provider with Link-header pagination and status classification.
 *
 * <p>Every call is a single attempt: retries and request pacing belong to the
 * {@link com.gitpr.manager.behavior.BehaviorManager} wrapped around it. Failures
 * surface as {@link ProviderException} carrying the HTTP status and any
 * {@code Retry-After} the server sent.</p>
 *
 * <p>Thread-safe: the underlying {@link OkHttpClient} and {@link ObjectMapper}
 * are both thread-safe, and this class holds no mutable per-request state.</p>
 */
public class GitHubProvider implements Provider {

    private static final Logger logger = LoggerFactory.getLogger(GitHubProvider.class);

    public static final String NAME = "github";
    public static final String DEFAULT_BASE_URL = "https://api.github.com";

    private static final int RATE_LIMIT_THRESHOLD = 10;
    private static final int PER_PAGE = 100;
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    static final Pattern LINK_NEXT_PATTERN =
            Pattern.compile("<([^>]+)>;\\s*rel=\"next\"");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String token;
    private final String baseUrl;

    public GitHubProvider(String token, String baseUrl) {
        this(token, baseUrl, defaultHttpClient());
    }

    public GitHubProvider(String token, String baseUrl, OkHttpClient httpClient) {
        this.token = token;
        this.baseUrl = normalizeBaseUrl(baseUrl);
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private static OkHttpClient defaultHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build();
    }

    static String normalizeBaseUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            return DEFAULT_BASE_URL;
        }
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    @Override
    public String getProviderName() {
        return NAME;
    }

    // -------------------------------------------------------------------------
    // Provider operations
    // -------------------------------------------------------------------------

    /**
     * Endpoint: GET /user
     */
    @Override
    public void authenticate() throws ProviderException, InterruptedException {
        if (token == null || token.isBlank()) {
            throw new ProviderException(NAME, ErrorType.AUTH, "no GitHub token configured");
        }
        GitHubDtos.User user = fetchObject(baseUrl + "/user", GitHubDtos.User.class, "authenticate");
        logger.info("Authenticated as GitHub user: {}", user.login());
    }

    /**
     * Endpoint: GET /user/repos?per_page=100&sort=updated
     */
    @Override
    public List<Repository> listRepositories() throws ProviderException, InterruptedException {
        String url = baseUrl + "/user/repos?per_page=" + PER_PAGE + "&sort=updated";
        List<GitHubDtos.Repository> repos =
                fetchAllPages(url, new TypeReference<>() {}, "list repositories");
        return repos.stream().map(GitHubConverters::toRepository).toList();
    }

    /**
     * Endpoint: GET /repos/{owner}/{repo}
     */
    @Override
    public Repository getRepository(String owner, String name) throws ProviderException, InterruptedException {
        String url = baseUrl + "/repos/" + owner + "/" + name;
        GitHubDtos.Repository repo = fetchObject(url, GitHubDtos.Repository.class,
                "get repository " + owner + "/" + name);
        return GitHubConverters.toRepository(repo);
    }

    /**
     * Endpoint: GET /repos/{owner}/{repo}/pulls?state={state}&per_page=100
     *
     * <p>The API has no creation-time filter, so {@code since} is applied here.</p>
     */
    @Override
    public List<PullRequest> listPullRequests(Repository repository, ListPullRequestsOptions options)
            throws ProviderException, InterruptedException {
        int perPage = options.perPage() > 0 ? Math.min(options.perPage(), PER_PAGE) : PER_PAGE;
        String url = baseUrl + "/repos/" + repository.fullName() + "/pulls?state="
                + stateParam(options.state()) + "&per_page=" + perPage;
        List<GitHubDtos.PullRequest> prs =
                fetchAllPages(url, new TypeReference<>() {}, "list pull requests for " + repository.fullName());

        List<PullRequest> result = new ArrayList<>(prs.size());
        for (GitHubDtos.PullRequest pr : prs) {
            PullRequest converted = GitHubConverters.toPullRequest(pr);
            if (options.since() != null && converted.createdAt() != null
                    && converted.createdAt().isBefore(options.since())) {
                continue;
            }
            result.add(converted);
        }
        logger.debug("Listed {} pull requests for {}", result.size(), repository.fullName());
        return result;
    }

    /**
     * Endpoint: GET /repos/{owner}/{repo}/pulls/{number}
     */
    @Override
    public PullRequest getPullRequest(Repository repository, int number)
            throws ProviderException, InterruptedException {
        String url = baseUrl + "/repos/" + repository.fullName() + "/pulls/" + number;
        GitHubDtos.PullRequest pr = fetchObject(url, GitHubDtos.PullRequest.class,
                "get pull request #" + number);
        return GitHubConverters.toPullRequest(pr);
    }

    /**
     * Endpoint: PUT /repos/{owner}/{repo}/pulls/{number}/merge, followed by
     * DELETE /repos/{owner}/{repo}/git/refs/heads/{branch} when branch deletion is requested.
     * A failed branch deletion is logged and does not fail the merge.
     */
    @Override
    public void mergePullRequest(Repository repository, PullRequest pullRequest, MergeRequest request)
            throws ProviderException, InterruptedException {
        String url = baseUrl + "/repos/" + repository.fullName() + "/pulls/" + pullRequest.number() + "/merge";
        GitHubDtos.MergeBody body = new GitHubDtos.MergeBody(
                request.commitTitle(), request.commitMessage(), request.sha(), request.method().value());

        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(NAME, ErrorType.UNKNOWN, "failed to encode merge request", e);
        }

        Request httpRequest = requestBuilder(url).put(RequestBody.create(json, JSON)).build();
        execute(httpRequest, "merge pull request #" + pullRequest.number());
        logger.info("Merged PR #{} in {} using {}", pullRequest.number(), repository.fullName(),
                request.method().value());

        if (request.deleteBranch() && pullRequest.headBranch() != null) {
            deleteBranch(repository, pullRequest.headBranch());
        }
    }

    void deleteBranch(Repository repository, String branch) throws InterruptedException {
        String url = baseUrl + "/repos/" + repository.fullName() + "/git/refs/heads/" + branch;
        try {
            execute(requestBuilder(url).delete().build(), "delete branch " + branch);
            logger.info("Deleted branch {} in {}", branch, repository.fullName());
        } catch (ProviderException e) {
            logger.warn("Failed to delete branch {} in {}: {}", branch, repository.fullName(), e.getMessage());
        }
    }

    /**
     * Endpoint: GET /repos/{owner}/{repo}/commits/{sha}/status
     */
    @Override
    public PrStatus getPrStatus(Repository repository, PullRequest pullRequest)
            throws ProviderException, InterruptedException {
        String url = baseUrl + "/repos/" + repository.fullName() + "/commits/" + headRef(pullRequest) + "/status";
        GitHubDtos.CombinedStatus status = fetchObject(url, GitHubDtos.CombinedStatus.class,
                "get status for PR #" + pullRequest.number());
        return GitHubConverters.toStatus(status);
    }

    /**
     * Endpoint: GET /repos/{owner}/{repo}/commits/{sha}/check-runs?per_page=100
     */
    @Override
    public List<Check> getChecks(Repository repository, PullRequest pullRequest)
            throws ProviderException, InterruptedException {
        String url = baseUrl + "/repos/" + repository.fullName() + "/commits/" + headRef(pullRequest)
                + "/check-runs?per_page=" + PER_PAGE;
        String operation = "get checks for PR #" + pullRequest.number();
        List<Check> checks = new ArrayList<>();

        // check-runs pages wrap the list in an object, so fetchAllPages does not apply
        while (url != null) {
            PageResult result = execute(requestBuilder(url).get().build(), operation);
            GitHubDtos.CheckRuns runs = decodeObject(result.body(), GitHubDtos.CheckRuns.class, operation);
            if (runs.checkRuns() != null) {
                runs.checkRuns().stream().map(GitHubConverters::toCheck).forEach(checks::add);
            }
            url = result.nextUrl();
        }

        return List.copyOf(checks);
    }

    /**
     * Endpoint: GET /rate_limit
     */
    @Override
    public RateLimit getRateLimit() throws ProviderException, InterruptedException {
        GitHubDtos.RateLimitResponse response = fetchObject(baseUrl + "/rate_limit",
                GitHubDtos.RateLimitResponse.class, "get rate limit");
        return GitHubConverters.toRateLimit(response);
    }

    // -------------------------------------------------------------------------
    // Core HTTP execution with pagination and error classification
    // -------------------------------------------------------------------------

    /**
     * Fetches all pages for a paginated endpoint and deserializes each page
     * into a list of {@code T}, concatenating them.
     */
    <T> List<T> fetchAllPages(String initialUrl, TypeReference<List<T>> typeRef, String operation)
            throws ProviderException, InterruptedException {
        List<T> allResults = new ArrayList<>();
        String url = initialUrl;

        while (url != null) {
            PageResult result = execute(requestBuilder(url).get().build(), operation);
            if (result.body() != null && !result.body().isEmpty()) {
                List<T> page = decode(result.body(), typeRef, operation);
                allResults.addAll(page);
                logger.debug("Fetched page with {} items from {}", page.size(), url);
            }
            url = result.nextUrl();
        }

        return allResults;
    }

    <T> T fetchObject(String url, Class<T> type, String operation)
            throws ProviderException, InterruptedException {
        PageResult result = execute(requestBuilder(url).get().build(), operation);
        return decodeObject(result.body(), type, operation);
    }

    private <T> T decodeObject(String body, Class<T> type, String operation) throws ProviderException {
        if (body == null || body.isEmpty()) {
            throw new ProviderException(NAME, ErrorType.UNKNOWN, operation + ": empty response body");
        }
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ProviderException(NAME, ErrorType.UNKNOWN, operation + ": malformed response", e);
        }
    }

    private <T> List<T> decode(String body, TypeReference<List<T>> typeRef, String operation)
            throws ProviderException {
        try {
            return objectMapper.readValue(body, typeRef);
        } catch (JsonProcessingException e) {
            throw new ProviderException(NAME, ErrorType.UNKNOWN, operation + ": malformed response", e);
        }
    }

    /**
     * Builds a request with authentication and the GitHub API version headers.
     */
    Request.Builder requestBuilder(String url) {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", "2022-11-28");
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder;
    }

    /**
     * Executes a single request. Non-2xx responses and transport failures are
     * classified into {@link ProviderException}; an interrupted call surfaces as
     * {@link InterruptedException}.
     */
    PageResult execute(Request request, String operation) throws ProviderException, InterruptedException {
        try (Response response = httpClient.newCall(request).execute()) {
            int statusCode = response.code();
            logResponse(request, statusCode, response);

            ResponseBody body = response.body();
            String bodyString = body != null ? body.string() : null;

            if (statusCode < 200 || statusCode >= 300) {
                throw errorFor(response, statusCode, bodyString, operation);
            }

            handleRateLimitPause(response);
            return new PageResult(bodyString, parseNextPageUrl(response.header("Link")));
        } catch (InterruptedIOException e) {
            if (Thread.currentThread().isInterrupted()) {
                InterruptedException interrupted = new InterruptedException(operation + " interrupted");
                interrupted.initCause(e);
                throw interrupted;
            }
            throw new ProviderException(NAME, ErrorType.NETWORK, operation + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ProviderException(NAME, ErrorType.NETWORK, operation + ": " + e.getMessage(), e);
        }
    }

    ProviderException errorFor(Response response, int statusCode, String body, String operation) {
        ErrorType type = ErrorType.fromHttpStatus(statusCode);
        if (statusCode == 403 && "0".equals(response.header("X-RateLimit-Remaining"))) {
            type = ErrorType.RATE_LIMIT;
        }

        String message = operation + ": HTTP " + statusCode;
        String detail = errorMessage(body);
        if (detail != null) {
            message += " - " + detail;
        }
        return new ProviderException(NAME, type, message, statusCode, retryAfter(response), null);
    }

    private String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            GitHubDtos.ErrorBody error = objectMapper.readValue(body, GitHubDtos.ErrorBody.class);
            return error.message();
        } catch (JsonProcessingException e) {
            logger.debug("Unparseable GitHub error body: {}", e.getMessage());
            return null;
        }
    }

    // -------------------------------------------------------------------------
    // Rate limit handling
    // -------------------------------------------------------------------------

    /**
     * Reads the server's requested wait: {@code Retry-After} seconds, or the time
     * until {@code X-RateLimit-Reset} when the quota is spent.
     *
     * @return the wait, or {@code null} if the response carries none
     */
    static Duration retryAfter(Response response) {
        String retryAfter = response.header("Retry-After");
        if (retryAfter != null) {
            try {
                return Duration.ofSeconds(Long.parseLong(retryAfter.trim()));
            } catch (NumberFormatException e) {
                logger.debug("Ignoring non-numeric Retry-After header: {}", retryAfter);
            }
        }
        String remaining = response.header("X-RateLimit-Remaining");
        String reset = response.header("X-RateLimit-Reset");
        if ("0".equals(remaining) && reset != null) {
            try {
                long seconds = Long.parseLong(reset.trim()) - Instant.now().getEpochSecond();
                return Duration.ofSeconds(Math.max(seconds, 1));
            } catch (NumberFormatException e) {
                logger.debug("Ignoring non-numeric X-RateLimit-Reset header: {}", reset);
            }
        }
        return null;
    }

    /**
     * If remaining rate limit is below the threshold, sleep until the reset time.
     */
    void handleRateLimitPause(Response response) throws InterruptedException {
        String remainingHeader = response.header("X-RateLimit-Remaining");
        String resetHeader = response.header("X-RateLimit-Reset");

        if (remainingHeader == null || resetHeader == null) {
            return;
        }

        int remaining;
        long resetEpoch;
        try {
            remaining = Integer.parseInt(remainingHeader.trim());
            resetEpoch = Long.parseLong(resetHeader.trim());
        } catch (NumberFormatException e) {
            logger.debug("Ignoring malformed rate-limit headers: {}/{}", remainingHeader, resetHeader);
            return;
        }

        if (remaining < RATE_LIMIT_THRESHOLD) {
            long nowEpoch = Instant.now().getEpochSecond();
            long sleepSeconds = Math.max(resetEpoch - nowEpoch + 1, 1);

            logger.warn("Rate limit low ({} remaining). Pausing for {}s until reset.",
                    remaining, sleepSeconds);
            Thread.sleep(Duration.ofSeconds(sleepSeconds).toMillis());
        }
    }

    // -------------------------------------------------------------------------
    // Pagination parsing
    // -------------------------------------------------------------------------

    /**
     * Parses the "next" URL from the GitHub Link header.
     *
     * <p>Example header:
     * {@code <https://api.github.com/user/repos?page=2>; rel="next", <...>; rel="last"}
     *
     * @return the next page URL, or {@code null} if there is no next page
     */
    static String parseNextPageUrl(String linkHeader) {
        if (linkHeader == null || linkHeader.isEmpty()) {
            return null;
        }
        Matcher matcher = LINK_NEXT_PATTERN.matcher(linkHeader);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static String headRef(PullRequest pullRequest) {
        return pullRequest.headSha() != null ? pullRequest.headSha() : pullRequest.headBranch();
    }

    static String stateParam(PrState state) {
        if (state == null) {
            return "all";
        }
        return state == PrState.OPEN ? "open" : "closed";
    }

    // -------------------------------------------------------------------------
    // Logging
    // -------------------------------------------------------------------------

    private void logResponse(Request request, int statusCode, Response response) {
        String remaining = response.header("X-RateLimit-Remaining");
        logger.debug("GitHub API {} {} {} | rate-limit-remaining: {}",
                request.method(), statusCode, request.url(), remaining != null ? remaining : "n/a");
    }

    // -------------------------------------------------------------------------
    // Internal result holder
    // -------------------------------------------------------------------------

    record PageResult(String body, String nextUrl) {}
}
