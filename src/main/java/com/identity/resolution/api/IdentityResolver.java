package com.identity.resolution.api;

import com.identity.resolution.cache.CacheStats;
import com.identity.resolution.cache.IdentityCache;
import com.identity.resolution.env.EnvironmentSource;
import com.identity.resolution.logging.LogContext;
import com.identity.resolution.metrics.MetricsService;
import com.identity.resolution.metrics.NoOpMetricsService;
import com.identity.resolution.platform.IdentityPlatform;
import com.identity.resolution.platform.IdentityPlatforms;
import com.identity.resolution.platform.LookupResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves the lowercase name of the user the current process effectively runs as.
 *
 * <h2>Resolution order</h2>
 * <ol>
 *   <li>Cached name, if it was resolved for the current effective uid</li>
 *   <li>System lookup of the effective uid, skipped where the platform cannot map uids;
 *       a found name is cached for that uid</li>
 *   <li>Fallback environment variable ({@code USERNAME} by default), never cached</li>
 *   <li>Empty string</li>
 * </ol>
 *
 * <p>Resolution never throws. A failed lookup is logged and falls through to the
 * environment; an empty result means "unknown user".</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * IdentityResolver resolver = IdentityResolver.builder()
 *     .options(IdentityOptions.builder().fallbackVariable("USER").build())
 *     .build();
 *
 * String user = resolver.resolveCurrentUser();
 * </pre>
 */
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final IdentityPlatform platform;
    private final boolean uidLookupSupported;
    private final EnvironmentSource environment;
    private final IdentityCache cache;
    private final MetricsService metricsService;
    private final IdentityOptions options;

    private IdentityResolver(Builder builder) {
        this.options = builder.options;
        this.platform = builder.platform != null
                ? builder.platform
                : IdentityPlatforms.create(options.getPasswdFile(), options.getLookupTimeout());
        this.uidLookupSupported = platform.supportsUidLookup();
        this.environment = builder.environment != null ? builder.environment : EnvironmentSource.system();
        this.cache = new IdentityCache();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        log.debug("IdentityResolver initialized: platform={}, uidLookup={}, fallbackVariable={}",
                platform.getClass().getSimpleName(), uidLookupSupported, options.getFallbackVariable());
    }

    private static class Holder {
        static final IdentityResolver DEFAULT = builder().build();
    }

    /**
     * Returns the process-wide resolver using the detected platform and the real environment.
     */
    public static IdentityResolver getDefault() {
        return Holder.DEFAULT;
    }

    /**
     * Returns the lowercase name of the effective user, or an empty string if unknown.
     */
    public String resolveCurrentUser() {
        return resolve().name();
    }

    /**
     * Returns the lowercase name of the effective user, or empty if unknown.
     */
    public Optional<String> findCurrentUser() {
        IdentityResolution resolution = resolve();
        return resolution.isKnown() ? Optional.of(resolution.name()) : Optional.empty();
    }

    /**
     * Resolves the effective user and reports where the name came from.
     */
    public IdentityResolution resolve() {
        recordMetric(() -> metricsService.recordApiUsage("currentUser"));
        long uid = currentEffectiveUid();

        IdentityCache.Result result = cache.getOrLookup(uid, this::lookupName);
        if (result.hit()) {
            recordMetric(metricsService::recordCacheHit);
            return new IdentityResolution(result.name(), ResolutionSource.CACHE, uid);
        }
        recordMetric(metricsService::recordCacheMiss);
        if (result.name() != null) {
            return new IdentityResolution(result.name(), ResolutionSource.SYSTEM_LOOKUP, uid);
        }

        String fallback = environment.get(options.getFallbackVariable());
        if (fallback != null && !fallback.isBlank()) {
            recordMetric(metricsService::recordEnvironmentFallback);
            log.debug("identity.fallback variable={} uid={}", options.getFallbackVariable(), uid);
            return new IdentityResolution(fallback.toLowerCase(Locale.ROOT), ResolutionSource.ENVIRONMENT, uid);
        }
        log.debug("identity.unknown uid={}", uid);
        return IdentityResolution.unknown(uid);
    }

    /**
     * Discards the cached name; the next resolution performs a fresh lookup.
     */
    public void invalidate() {
        cache.invalidate();
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public IdentityPlatform getPlatform() {
        return platform;
    }

    public IdentityOptions getOptions() {
        return options;
    }

    private long currentEffectiveUid() {
        try {
            return platform.effectiveUid();
        } catch (RuntimeException | LinkageError e) {
            log.debug("identity.uid unavailable, using {}", IdentityPlatform.UNKNOWN_UID, e);
            return IdentityPlatform.UNKNOWN_UID;
        }
    }

    private Optional<String> lookupName(long uid) {
        if (!uidLookupSupported) {
            return Optional.empty();
        }
        try (LogContext ctx = LogContext.forLookup(LogContext.generateCorrelationId(), uid)) {
            long start = System.nanoTime();
            LookupResult lookup;
            try {
                lookup = platform.lookupAccountName(uid);
            } catch (RuntimeException e) {
                lookup = LookupResult.failed(e);
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            LookupResult.Outcome outcome = lookup.outcome();
            recordMetric(() -> metricsService.recordLookup(outcome, elapsed));

            if (lookup.isFailed()) {
                log.debug("identity.lookup.failed uid={}", uid, lookup.failure());
            } else {
                log.debug("identity.lookup outcome={} uid={}", lookup.outcome(), uid);
            }
            return lookup.nameIfFound().map(name -> name.toLowerCase(Locale.ROOT));
        }
    }

    private static void recordMetric(Runnable metric) {
        try {
            metric.run();
        } catch (RuntimeException e) {
            log.debug("identity.metrics recording failed", e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private IdentityPlatform platform;
        private EnvironmentSource environment;
        private MetricsService metricsService;
        private IdentityOptions options = IdentityOptions.defaults();

        /**
         * Sets the identity platform. Defaults to the one detected for the running OS.
         */
        public Builder platform(IdentityPlatform platform) {
            this.platform = platform;
            return this;
        }

        /**
         * Sets the environment read for the fallback variable. Defaults to the process environment.
         */
        public Builder environment(EnvironmentSource environment) {
            this.environment = environment;
            return this;
        }

        /**
         * Sets a metrics service for recording lookups and cache activity.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder options(IdentityOptions options) {
            this.options = Objects.requireNonNull(options, "options must not be null");
            return this;
        }

        public IdentityResolver build() {
            return new IdentityResolver(this);
        }
    }
}
