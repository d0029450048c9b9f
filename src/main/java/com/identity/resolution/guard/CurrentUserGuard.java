package com.identity.resolution.guard;

import com.identity.resolution.api.IdentityResolver;
import com.identity.resolution.platform.IdentityPlatform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Sanity check for scripts and services that must run under a specific account.
 * Fails fast instead of proceeding with the wrong privileges.
 */
public class CurrentUserGuard {
    private static final Logger log = LoggerFactory.getLogger(CurrentUserGuard.class);

    private final IdentityResolver resolver;

    public CurrentUserGuard(IdentityResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    /**
     * Ensures the effective user name equals {@code expectedUser}, ignoring case.
     *
     * @throws IdentityMismatchException if the user differs or cannot be determined
     */
    public void requireUser(String expectedUser) {
        if (expectedUser == null || expectedUser.isBlank()) {
            throw new IllegalArgumentException("expectedUser must not be blank");
        }
        String actual = resolver.resolveCurrentUser();
        if (!actual.equals(expectedUser.toLowerCase(Locale.ROOT))) {
            log.warn("guard.mismatch expected={} actual={}", expectedUser, actual);
            throw new IdentityMismatchException(expectedUser, actual);
        }
    }

    /**
     * Ensures the effective uid equals {@code expectedUid}.
     *
     * @throws IdentityMismatchException if the uid differs or cannot be determined
     */
    public void requireUid(long expectedUid) {
        if (expectedUid < 0) {
            throw new IllegalArgumentException("expectedUid must be >= 0");
        }
        long actual = resolver.getPlatform().effectiveUid();
        if (actual == IdentityPlatform.UNKNOWN_UID || actual != expectedUid) {
            log.warn("guard.mismatch expectedUid={} actualUid={}", expectedUid, actual);
            throw new IdentityMismatchException(Long.toString(expectedUid), Long.toString(actual));
        }
    }
}
