package com.identity.resolution.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads accounts from a passwd(5) formatted file, {@code /etc/passwd} by default.
 * Only local accounts are visible here; directory-backed accounts need {@link GetentAccountDatabase}.
 */
public class PasswdFileAccountDatabase implements AccountDatabase {
    private static final Logger log = LoggerFactory.getLogger(PasswdFileAccountDatabase.class);

    public static final Path DEFAULT_PASSWD_FILE = Path.of("/etc/passwd");

    private final Path passwdFile;

    public PasswdFileAccountDatabase() {
        this(DEFAULT_PASSWD_FILE);
    }

    public PasswdFileAccountDatabase(Path passwdFile) {
        this.passwdFile = Objects.requireNonNull(passwdFile, "passwdFile must not be null");
    }

    @Override
    public Optional<String> findNameByUid(long uid) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(passwdFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                Optional<String> name = matchEntry(line, uid);
                if (name.isPresent()) {
                    return name;
                }
            }
        }
        log.debug("passwd.miss file={} uid={}", passwdFile, uid);
        return Optional.empty();
    }

    /**
     * Returns the account name if the line is a well-formed passwd entry for the uid.
     */
    static Optional<String> matchEntry(String line, long uid) {
        if (line.isBlank() || line.startsWith("#")) {
            return Optional.empty();
        }
        String[] fields = line.split(":", -1);
        if (fields.length < 3 || fields[0].isEmpty()) {
            return Optional.empty();
        }
        try {
            return Long.parseLong(fields[2].trim()) == uid ? Optional.of(fields[0]) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
