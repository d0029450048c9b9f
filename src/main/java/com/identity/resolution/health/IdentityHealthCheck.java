package com.identity.resolution.health;

import com.identity.resolution.api.IdentityResolution;
import com.identity.resolution.api.IdentityResolver;
import com.identity.resolution.cache.CacheStats;

import java.util.Objects;

/**
 * Reports whether the current user can be resolved from the system account database.
 * UP for a system (or cached) name, DEGRADED when only the environment fallback works,
 * DOWN when the user is unknown.
 */
public class IdentityHealthCheck implements HealthCheck {

    private final IdentityResolver resolver;

    public IdentityHealthCheck(IdentityResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    @Override
    public String getName() {
        return "identity";
    }

    @Override
    public HealthStatus check() {
        IdentityResolution resolution = resolver.resolve();
        HealthStatus status = switch (resolution.source()) {
            case CACHE, SYSTEM_LOOKUP -> HealthStatus.of(HealthStatus.Status.UP, "Current user resolved from account database");
            case ENVIRONMENT -> HealthStatus.of(HealthStatus.Status.DEGRADED, "Current user resolved from environment only");
            case NONE -> HealthStatus.of(HealthStatus.Status.DOWN, "Current user cannot be resolved");
        };
        CacheStats stats = resolver.getCacheStats();
        return status
                .withDetail("user", resolution.name())
                .withDetail("source", resolution.source().name())
                .withDetail("effectiveUid", resolution.effectiveUid())
                .withDetail("cacheHitRate", stats.hitRate());
    }
}
