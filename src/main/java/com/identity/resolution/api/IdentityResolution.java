package com.identity.resolution.api;

import java.util.Objects;

/**
 * Result of resolving the current user.
 *
 * @param name         lowercase user name; empty when unknown, never null
 * @param source       where the name came from
 * @param effectiveUid effective uid observed during resolution
 */
public record IdentityResolution(String name, ResolutionSource source, long effectiveUid) {

    public IdentityResolution {
        name = name == null ? "" : name;
        Objects.requireNonNull(source, "source must not be null");
    }

    public static IdentityResolution unknown(long effectiveUid) {
        return new IdentityResolution("", ResolutionSource.NONE, effectiveUid);
    }

    public boolean isKnown() {
        return !name.isEmpty();
    }
}
