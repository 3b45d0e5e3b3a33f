package com.gitpr.manager.behavior;

import com.gitpr.manager.provider.ErrorType;
import com.gitpr.manager.provider.ProviderException;
import io.github.bucket4j.Bucket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * One Bucket4j token bucket per provider, plus a {@code global} bucket used for
 * providers that were not registered up front. Buckets live for the lifetime of
 * the registry and refill continuously.
 *
 * <p>Bucket4j buckets account tokens with lock-free CAS, so concurrent callers
 * need no extra synchronization here.</p>
 */
class RateLimiterRegistry {

    private static final Logger logger = LoggerFactory.getLogger(RateLimiterRegistry.class);

    static final String GLOBAL = "global";

    private final RateLimitPolicy policy;
    private final ConcurrentMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    RateLimiterRegistry(RateLimitPolicy policy, Collection<String> providers) {
        this.policy = policy;
        if (policy.enabled()) {
            providers.forEach(p -> buckets.put(p, newBucket()));
            buckets.put(GLOBAL, newBucket());
        }
    }

    /**
     * Blocks until the provider's bucket yields a token.
     *
     * @throws ProviderException    if no token became available within the policy timeout
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    void acquire(String provider) throws ProviderException, InterruptedException {
        if (!policy.enabled()) {
            return;
        }
        String key = provider != null && buckets.containsKey(provider) ? provider : GLOBAL;
        Bucket bucket = buckets.get(key);

        long start = System.nanoTime();
        Duration maxWait = policy.timeout().isZero() ? Duration.ofDays(1) : policy.timeout();
        if (!bucket.asBlocking().tryConsume(1, maxWait)) {
            throw new ProviderException(provider, ErrorType.RATE_LIMIT,
                    "rate limiter " + key + ": timeout after " + maxWait.toMillis() + "ms");
        }
        long waitedMs = (System.nanoTime() - start) / 1_000_000;
        if (waitedMs > 0) {
            logger.debug("Rate limiter {}: waited {}ms for permission", key, waitedMs);
        }
    }

    /**
     * Currently available tokens per bucket, for diagnostics.
     */
    Map<String, Long> availableTokens() {
        Map<String, Long> stats = new TreeMap<>();
        buckets.forEach((name, bucket) -> stats.put(name, bucket.getAvailableTokens()));
        return stats;
    }

    private Bucket newBucket() {
        return Bucket.builder()
                .addLimit(limit -> limit.capacity(policy.effectiveBurst())
                        .refillGreedy(1, policy.refillPeriod()))
                .build();
    }
}
