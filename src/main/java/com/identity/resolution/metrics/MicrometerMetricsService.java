package com.identity.resolution.metrics;

import com.identity.resolution.platform.LookupResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code identity.cache.hit} - Counter</li>
 *   <li>{@code identity.cache.miss} - Counter</li>
 *   <li>{@code identity.lookup.duration} - Timer (tag: outcome)</li>
 *   <li>{@code identity.fallback.environment} - Counter</li>
 *   <li>{@code identity.api.usage} - Counter (tag: api)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<LookupResult.Outcome, Timer> lookupTimers = new ConcurrentHashMap<>();
    private final Map<String, Counter> usageCounters = new ConcurrentHashMap<>();
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter environmentFallbackCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.cacheHitCounter = Counter.builder("identity.cache.hit")
                .description("Number of current-user calls answered from the cache")
                .register(registry);
        this.cacheMissCounter = Counter.builder("identity.cache.miss")
                .description("Number of current-user calls that required a system lookup")
                .register(registry);
        this.environmentFallbackCounter = Counter.builder("identity.fallback.environment")
                .description("Number of resolutions that fell back to the environment")
                .register(registry);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordLookup(LookupResult.Outcome outcome, Duration duration) {
        Timer timer = lookupTimers.computeIfAbsent(outcome, o ->
                Timer.builder("identity.lookup.duration")
                        .description("Duration of uid to account name lookups")
                        .tag("outcome", o.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordEnvironmentFallback() {
        environmentFallbackCounter.increment();
    }

    @Override
    public void recordApiUsage(String api) {
        Counter counter = usageCounters.computeIfAbsent(api, a ->
                Counter.builder("identity.api.usage")
                        .description("Number of calls per public API entry point")
                        .tag("api", a)
                        .register(registry));
        counter.increment();
    }
}
