package com.identity.resolution.api;

/**
 * Where a resolved user name came from.
 */
public enum ResolutionSource {
    /** Cached result of an earlier system lookup for the same effective uid. */
    CACHE,
    /** Fresh uid to account name lookup. */
    SYSTEM_LOOKUP,
    /** Fallback environment variable. */
    ENVIRONMENT,
    /** No source produced a name. */
    NONE
}
