package com.identity.resolution.platform;

import com.sun.security.auth.module.UnixSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Identity platform for POSIX systems.
 *
 * <p>The effective uid comes from {@code /proc/self/status} where procfs exists (Linux).
 * Elsewhere it falls back to {@link UnixSystem#getUid()}, which reports the real uid
 * because the JDK exposes nothing closer to {@code geteuid(2)}.</p>
 *
 * <p>Names are resolved through an {@link AccountDatabase}; by default the local passwd
 * file first, then {@code getent}.</p>
 */
public class PosixIdentityPlatform implements IdentityPlatform {
    private static final Logger log = LoggerFactory.getLogger(PosixIdentityPlatform.class);

    private final AccountDatabase accountDatabase;
    private final Path procStatus;
    private final LongSupplier fallbackUid;

    public PosixIdentityPlatform() {
        this(PasswdFileAccountDatabase.DEFAULT_PASSWD_FILE, GetentAccountDatabase.DEFAULT_TIMEOUT);
    }

    public PosixIdentityPlatform(Path passwdFile, Duration lookupTimeout) {
        this(new ChainedAccountDatabase(List.of(
                        new PasswdFileAccountDatabase(passwdFile),
                        new GetentAccountDatabase(lookupTimeout))),
                ProcessCredentials.SELF_STATUS,
                PosixIdentityPlatform::unixSystemUid);
    }

    public PosixIdentityPlatform(AccountDatabase accountDatabase, Path procStatus, LongSupplier fallbackUid) {
        this.accountDatabase = Objects.requireNonNull(accountDatabase, "accountDatabase must not be null");
        this.procStatus = Objects.requireNonNull(procStatus, "procStatus must not be null");
        this.fallbackUid = Objects.requireNonNull(fallbackUid, "fallbackUid must not be null");
    }

    @Override
    public long effectiveUid() {
        try {
            Optional<ProcessCredentials> credentials = ProcessCredentials.read(procStatus);
            if (credentials.isPresent()) {
                return credentials.get().effectiveUid();
            }
            log.debug("platform.uid no Uid line in {}", procStatus);
        } catch (IOException e) {
            log.trace("platform.uid cannot read {}: {}", procStatus, e.toString());
        }
        try {
            return fallbackUid.getAsLong();
        } catch (LinkageError e) {
            log.debug("platform.uid UnixSystem unavailable: {}", e.toString());
            return UNKNOWN_UID;
        }
    }

    @Override
    public boolean supportsUidLookup() {
        return true;
    }

    @Override
    public LookupResult lookupAccountName(long uid) {
        if (uid < 0) {
            return LookupResult.notFound();
        }
        try {
            return accountDatabase.findNameByUid(uid)
                    .filter(name -> !name.isBlank())
                    .map(LookupResult::found)
                    .orElseGet(LookupResult::notFound);
        } catch (IOException e) {
            return LookupResult.failed(e);
        }
    }

    // Throws NoClassDefFoundError without the jdk.security.auth module, UnsatisfiedLinkError without its native library.
    static long unixSystemUid() {
        return new UnixSystem().getUid();
    }
}
