package com.identity.resolution.metrics;

import com.identity.resolution.platform.LookupResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
                noOp.recordLookup(LookupResult.Outcome.FOUND, Duration.ofMillis(2));
                noOp.recordEnvironmentFallback();
                noOp.recordApiUsage("currentUser");
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should count cache hits and misses")
        void cacheCounters() {
            metrics.recordCacheHit();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();

            assertEquals(2.0, registry.find("identity.cache.hit").counter().count());
            assertEquals(1.0, registry.find("identity.cache.miss").counter().count());
        }

        @Test
        @DisplayName("Should time lookups per outcome")
        void lookupTimers() {
            metrics.recordLookup(LookupResult.Outcome.FOUND, Duration.ofMillis(3));
            metrics.recordLookup(LookupResult.Outcome.FOUND, Duration.ofMillis(5));
            metrics.recordLookup(LookupResult.Outcome.FAILED, Duration.ofSeconds(5));

            Timer found = registry.find("identity.lookup.duration").tag("outcome", "FOUND").timer();
            Timer failed = registry.find("identity.lookup.duration").tag("outcome", "FAILED").timer();

            assertNotNull(found);
            assertEquals(2, found.count());
            assertNotNull(failed);
            assertEquals(1, failed.count());
            assertNull(registry.find("identity.lookup.duration").tag("outcome", "NOT_FOUND").timer());
        }

        @Test
        @DisplayName("Should count environment fallbacks")
        void fallbackCounter() {
            metrics.recordEnvironmentFallback();

            assertEquals(1.0, registry.find("identity.fallback.environment").counter().count());
        }

        @Test
        @DisplayName("Should count API usage per entry point")
        void apiUsage() {
            metrics.recordApiUsage("currentUser");
            metrics.recordApiUsage("currentUser");
            metrics.recordApiUsage("detectEnvironment");

            Counter currentUser = registry.find("identity.api.usage").tag("api", "currentUser").counter();
            Counter detect = registry.find("identity.api.usage").tag("api", "detectEnvironment").counter();

            assertNotNull(currentUser);
            assertEquals(2.0, currentUser.count());
            assertNotNull(detect);
            assertEquals(1.0, detect.count());
        }
    }
}
