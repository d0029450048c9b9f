package com.identity.resolution.platform;

/**
 * Platform seam for process identity.
 * Abstracts how the effective uid is read and how a uid maps to an account name,
 * so the resolver can be exercised without touching the real OS.
 */
public interface IdentityPlatform {

    /**
     * Uid reported when the platform cannot determine one.
     */
    long UNKNOWN_UID = -1L;

    /**
     * Returns the effective user id of the current process,
     * or {@link #UNKNOWN_UID} if it cannot be determined.
     */
    long effectiveUid();

    /**
     * Whether this platform can map a uid to an account name.
     * When false, {@link #lookupAccountName(long)} is never called by the resolver.
     */
    boolean supportsUidLookup();

    /**
     * Looks up the account name owning the given uid.
     *
     * @param uid the user id
     * @return the lookup outcome; implementations report errors as {@link LookupResult#failed(Throwable)}
     */
    LookupResult lookupAccountName(long uid);
}
