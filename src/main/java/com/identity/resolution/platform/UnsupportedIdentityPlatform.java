package com.identity.resolution.platform;

/**
 * Platform without POSIX uid-to-name mapping (e.g. Windows).
 * Reports an unknown uid and never performs a lookup.
 */
public class UnsupportedIdentityPlatform implements IdentityPlatform {

    @Override
    public long effectiveUid() {
        return UNKNOWN_UID;
    }

    @Override
    public boolean supportsUidLookup() {
        return false;
    }

    @Override
    public LookupResult lookupAccountName(long uid) {
        return LookupResult.failed(new UnsupportedOperationException("uid lookup is not supported on this platform"));
    }
}
