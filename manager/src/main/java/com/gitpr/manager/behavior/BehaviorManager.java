package com.gitpr.manager.behavior;

import com.gitpr.manager.config.ManagerConfig;
import com.gitpr.manager.provider.ErrorType;
import com.gitpr.manager.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Wraps every outbound provider call with per-provider rate limiting and
 * retry with exponential backoff.
 *
 * <p>Only {@link ErrorType#RATE_LIMIT} and {@link ErrorType#NETWORK} failures are
 * retried. Everything else is returned to the caller on the first failure, already
 * classified as a {@link ProviderException}.</p>
 *
 * <p>Cancellation is thread interruption: an interrupt during the limiter wait,
 * the call itself or a backoff sleep surfaces as {@link InterruptedException}.</p>
 *
 * <p>Thread-safe.</p>
 */
public class BehaviorManager {

    private static final List<String> NETWORK_PATTERNS = List.of(
            "connection reset", "connection refused", "no such host", "temporary failure",
            "timeout", "timed out", "server error", "service unavailable", "bad gateway",
            "gateway timeout");
    private static final List<String> RATE_LIMIT_PATTERNS = List.of(
            "rate limit", "rate limited", "too many requests");

    private final RateLimiterRegistry limiters;
    private final RetryPolicy retryPolicy;
    private final Logger logger;

    public BehaviorManager(RateLimitPolicy rateLimitPolicy, RetryPolicy retryPolicy,
                           Collection<String> providers) {
        this(rateLimitPolicy, retryPolicy, providers, LoggerFactory.getLogger(BehaviorManager.class));
    }

    public BehaviorManager(RateLimitPolicy rateLimitPolicy, RetryPolicy retryPolicy,
                           Collection<String> providers, Logger logger) {
        this.limiters = new RateLimiterRegistry(rateLimitPolicy, providers);
        this.retryPolicy = retryPolicy;
        this.logger = logger;
    }

    /**
     * Builds a manager with one bucket per configured provider.
     */
    public static BehaviorManager fromConfig(ManagerConfig config) {
        return new BehaviorManager(
                RateLimitPolicy.from(config.behavior().rateLimit()),
                RetryPolicy.from(config.behavior().retry()),
                config.repositories().keySet());
    }

    public void execute(String provider, String operation, ProviderCall call)
            throws ProviderException, InterruptedException {
        executeWithResult(provider, operation, () -> {
            call.call();
            return null;
        });
    }

    /**
     * Runs {@code call} under the provider's rate limit, retrying transient failures.
     *
     * @return the call's result
     * @throws ProviderException    the classified failure; after exhausted retries its
     *                              message carries the attempt count and its cause is the last error
     * @throws InterruptedException if cancelled while waiting, sleeping or calling
     */
    public <T> T executeWithResult(String provider, String operation, ProviderSupplier<T> call)
            throws ProviderException, InterruptedException {
        int maxAttempts = retryPolicy.maxAttempts();
        ProviderException last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (Thread.interrupted()) {
                throw new InterruptedException("cancelled before " + operation + " on " + provider);
            }
            try {
                limiters.acquire(provider);
                logger.debug("Executing {} operation for provider {} (attempt {}/{})",
                        operation, provider, attempt, maxAttempts);
                T result = call.get();
                if (attempt > 1) {
                    logger.info("{} for provider {} succeeded on attempt {}", operation, provider, attempt);
                }
                return result;
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                ProviderException classified = classify(provider, operation, e);
                if (!classified.isRetryable()) {
                    logger.debug("{} for provider {} failed with non-retryable {} error: {}",
                            operation, provider, classified.getType().label(), classified.getMessage());
                    throw classified;
                }
                last = classified;
                if (attempt == maxAttempts) {
                    break;
                }
                Duration delay = backoffFor(attempt, classified);
                logger.warn("{} for provider {} failed (attempt {}/{}), retrying in {}ms: {}",
                        operation, provider, attempt, maxAttempts, delay.toMillis(), classified.getMessage());
                Thread.sleep(delay.toMillis());
            }
        }

        logger.warn("All {} attempts of {} for provider {} failed", maxAttempts, operation, provider);
        throw new ProviderException(provider, last.getType(),
                "operation " + operation + " failed after " + maxAttempts + " attempts: " + last.getMessage(),
                last.getStatusCode(), last.getRetryAfter(), last);
    }

    /**
     * Available tokens per provider bucket.
     */
    public Map<String, Long> limiterStats() {
        return limiters.availableTokens();
    }

    Duration backoffFor(int attempt, ProviderException error) {
        Duration delay = retryPolicy.delayFor(attempt);
        if (retryPolicy.jitter() && delay.toMillis() >= 10) {
            delay = delay.plusMillis(ThreadLocalRandom.current().nextLong(delay.toMillis() / 10));
        }
        Duration retryAfter = error.getRetryAfter();
        if (retryAfter != null && retryAfter.compareTo(delay) > 0) {
            delay = retryAfter.compareTo(retryPolicy.maxBackoff()) > 0 ? retryPolicy.maxBackoff() : retryAfter;
        }
        return delay;
    }

    /**
     * Maps an arbitrary failure onto the provider error taxonomy.
     *
     * @throws InterruptedException if the failure is an interrupted I/O call on an
     *                              interrupted thread
     */
    static ProviderException classify(String provider, String operation, Exception e) throws InterruptedException {
        if (e instanceof ProviderException pe) {
            return pe;
        }
        if (e instanceof InterruptedIOException && Thread.currentThread().isInterrupted()) {
            Thread.interrupted();
            InterruptedException cancelled = new InterruptedException(operation + " on " + provider + " cancelled");
            cancelled.initCause(e);
            throw cancelled;
        }
        String message = operation + ": " + e.getMessage();
        if (e instanceof IOException) {
            return new ProviderException(provider, ErrorType.NETWORK, message, e);
        }
        String text = String.valueOf(e.getMessage()).toLowerCase(Locale.ROOT);
        if (RATE_LIMIT_PATTERNS.stream().anyMatch(text::contains)) {
            return new ProviderException(provider, ErrorType.RATE_LIMIT, message, e);
        }
        if (NETWORK_PATTERNS.stream().anyMatch(text::contains)) {
            return new ProviderException(provider, ErrorType.NETWORK, message, e);
        }
        return new ProviderException(provider, ErrorType.UNKNOWN, message, e);
    }
}
