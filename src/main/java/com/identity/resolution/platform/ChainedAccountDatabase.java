package com.identity.resolution.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Consults several account databases in order; the first one that knows the uid wins.
 * If none knows it and at least one failed, the first failure is rethrown
 * with later failures attached as suppressed exceptions.
 */
public class ChainedAccountDatabase implements AccountDatabase {
    private static final Logger log = LoggerFactory.getLogger(ChainedAccountDatabase.class);

    private final List<AccountDatabase> databases;

    public ChainedAccountDatabase(List<AccountDatabase> databases) {
        if (databases == null || databases.isEmpty()) {
            throw new IllegalArgumentException("at least one account database is required");
        }
        this.databases = List.copyOf(databases);
    }

    @Override
    public Optional<String> findNameByUid(long uid) throws IOException {
        IOException failure = null;
        for (AccountDatabase database : databases) {
            try {
                Optional<String> name = database.findNameByUid(uid);
                if (name.isPresent()) {
                    return name;
                }
            } catch (IOException e) {
                log.debug("account.database.failed database={} uid={}", database.getClass().getSimpleName(), uid, e);
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        return Optional.empty();
    }
}
