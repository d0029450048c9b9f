package com.identity.resolution.platform;

import java.io.IOException;
import java.util.Optional;

/**
 * Source of uid-to-account-name mappings.
 */
public interface AccountDatabase {

    /**
     * Finds the account name for a uid.
     *
     * @param uid the user id
     * @return the account name, or empty if the database has no such account
     * @throws IOException if the database could not be consulted
     */
    Optional<String> findNameByUid(long uid) throws IOException;
}
