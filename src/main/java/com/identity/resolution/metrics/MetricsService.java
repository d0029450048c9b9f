package com.identity.resolution.metrics;

import com.identity.resolution.platform.LookupResult;

import java.time.Duration;

/**
 * Interface for recording identity resolution metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordCacheHit();

    void recordCacheMiss();

    void recordLookup(LookupResult.Outcome outcome, Duration duration);

    void recordEnvironmentFallback();

    /**
     * Records a call to a public API entry point.
     */
    void recordApiUsage(String api);
}
