package com.identity.resolution.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongFunction;

/**
 * Single-slot cache of the account name for the process's effective uid.
 *
 * <p>The cached name is valid only while the uid it was resolved for is still the
 * effective uid; a different uid discards it. Failed lookups are never cached, so the
 * next call with the same uid looks up again.</p>
 *
 * <p>The check-then-lookup sequence runs under a lock, so concurrent first callers
 * trigger at most one lookup per uid.</p>
 */
public class IdentityCache {
    private static final Logger log = LoggerFactory.getLogger(IdentityCache.class);

    private final ReentrantLock lock = new ReentrantLock();

    private boolean uidSet;
    private long cachedUid;
    private String cachedName;

    private long hitCount;
    private long missCount;
    private long invalidationCount;

    /**
     * Returns the cached name for {@code currentUid}, or runs {@code lookup} and caches what it returns.
     *
     * @param currentUid the effective uid observed by the caller
     * @param lookup     resolves a name for the uid; empty means nothing to cache
     * @return the name and whether it came from the cache
     */
    public Result getOrLookup(long currentUid, LongFunction<Optional<String>> lookup) {
        lock.lock();
        try {
            if (cachedName != null && uidSet && cachedUid == currentUid) {
                hitCount++;
                return new Result(cachedName, true);
            }
            missCount++;
            if (cachedName != null) {
                invalidationCount++;
                log.debug("identity.cache.invalidated previousUid={} currentUid={}", cachedUid, currentUid);
            }
            cachedName = null;
            cachedUid = currentUid;
            uidSet = true;

            Optional<String> resolved = lookup.apply(currentUid);
            resolved.ifPresent(name -> cachedName = name);
            return new Result(resolved.orElse(null), false);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discards the cached name. The uid stays recorded.
     */
    public void invalidate() {
        lock.lock();
        try {
            if (cachedName != null) {
                invalidationCount++;
                cachedName = null;
                log.debug("identity.cache.cleared uid={}", cachedUid);
            }
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> getCachedName() {
        lock.lock();
        try {
            return Optional.ofNullable(cachedName);
        } finally {
            lock.unlock();
        }
    }

    public OptionalLong getCachedUid() {
        lock.lock();
        try {
            return uidSet ? OptionalLong.of(cachedUid) : OptionalLong.empty();
        } finally {
            lock.unlock();
        }
    }

    public CacheStats getStats() {
        lock.lock();
        try {
            return new CacheStats(hitCount, missCount, invalidationCount);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Outcome of {@link #getOrLookup}.
     *
     * @param name the resolved name, or null if the lookup produced none
     * @param hit  true if answered from the cache
     */
    public record Result(String name, boolean hit) {}
}
