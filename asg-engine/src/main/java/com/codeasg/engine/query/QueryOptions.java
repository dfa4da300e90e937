package com.codeasg.engine.query;

import java.time.Duration;

/**
 * Result bound and deadline for one query.
 */
public record QueryOptions(int maxResults, Duration timeout) {

    public static final int DEFAULT_MAX_RESULTS = 10_000;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    public QueryOptions {
        if (maxResults <= 0) throw new IllegalArgumentException("maxResults must be positive: " + maxResults);
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
    }

    public static QueryOptions defaults() {
        return new QueryOptions(DEFAULT_MAX_RESULTS, DEFAULT_TIMEOUT);
    }
}
