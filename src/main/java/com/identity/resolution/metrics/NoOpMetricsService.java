package com.identity.resolution.metrics;

import com.identity.resolution.platform.LookupResult;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 * All methods are empty, ensuring the library works without any metrics dependencies.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordLookup(LookupResult.Outcome outcome, Duration duration) {
    }

    @Override
    public void recordEnvironmentFallback() {
    }

    @Override
    public void recordApiUsage(String api) {
    }
}
