package com.findstaffing.api.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-client token buckets for the admin API.
 */
@Configuration
public class RateLimitConfig {

    static final int DEFAULT_PER_MINUTE = 100;
    static final int STRICT_PER_MINUTE = 10;

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    /**
     * Default rate limit: 100 requests per minute per client.
     */
    public Bucket resolveBucket(String clientId) {
        return buckets.computeIfAbsent(clientId, key -> createBucket(DEFAULT_PER_MINUTE));
    }

    /**
     * Strict rate limit for document upload and removal: 10 requests per minute.
     */
    public Bucket resolveStrictBucket(String clientId) {
        return buckets.computeIfAbsent(clientId + ":strict", key -> createBucket(STRICT_PER_MINUTE));
    }

    private Bucket createBucket(int perMinute) {
        Bandwidth limit = Bandwidth.classic(perMinute, Refill.greedy(perMinute, Duration.ofMinutes(1)));
        return Bucket.builder().addLimit(limit).build();
    }
}
