package com.identity.resolution.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Factory for the {@link IdentityPlatform} matching the running OS.
 * The OS family is decided once per JVM.
 */
public final class IdentityPlatforms {
    private static final Logger log = LoggerFactory.getLogger(IdentityPlatforms.class);

    private IdentityPlatforms() {
    }

    private static class Holder {
        static final boolean POSIX = isPosix(System.getProperty("os.name", ""));
    }

    /**
     * Returns a platform with default passwd file and lookup timeout.
     */
    public static IdentityPlatform detect() {
        return create(PasswdFileAccountDatabase.DEFAULT_PASSWD_FILE, GetentAccountDatabase.DEFAULT_TIMEOUT);
    }

    /**
     * Returns a platform for the running OS.
     *
     * @param passwdFile    passwd file consulted on POSIX systems
     * @param lookupTimeout timeout for name service lookups on POSIX systems
     */
    public static IdentityPlatform create(Path passwdFile, Duration lookupTimeout) {
        if (Holder.POSIX) {
            return new PosixIdentityPlatform(passwdFile, lookupTimeout);
        }
        log.info("platform.detected os={} uidLookup=false", System.getProperty("os.name"));
        return new UnsupportedIdentityPlatform();
    }

    /**
     * Whether uid lookup is available on the running OS.
     */
    static boolean supportsUidLookup() {
        return Holder.POSIX;
    }

    static boolean isPosix(String osName) {
        return !osName.toLowerCase(Locale.ROOT).startsWith("windows");
    }
}
