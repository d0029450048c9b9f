package com.identity.resolution.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Resolves accounts through the system's name service switch by running {@code getent passwd <uid>}.
 * Sees accounts from LDAP, SSSD and other NSS modules that are absent from {@code /etc/passwd}.
 */
public class GetentAccountDatabase implements AccountDatabase {
    private static final Logger log = LoggerFactory.getLogger(GetentAccountDatabase.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    // getent(1): "One or more supplied key could not be found in the database."
    static final int EXIT_KEY_NOT_FOUND = 2;

    private final List<String> command;
    private final Duration timeout;

    public GetentAccountDatabase() {
        this(DEFAULT_TIMEOUT);
    }

    public GetentAccountDatabase(Duration timeout) {
        this(List.of("getent", "passwd"), timeout);
    }

    /**
     * @param command command prefix; the uid is appended as the last argument
     * @param timeout maximum time to wait for the command
     */
    public GetentAccountDatabase(List<String> command, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    @Override
    public Optional<String> findNameByUid(long uid) throws IOException {
        List<String> args = new ArrayList<>(command);
        args.add(Long.toString(uid));

        Process process = new ProcessBuilder(args)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException("'" + String.join(" ", args) + "' did not finish within " + timeout.toMillis() + "ms");
            }
            String output;
            try (InputStream in = process.getInputStream()) {
                output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            int exitCode = process.exitValue();
            if (exitCode == EXIT_KEY_NOT_FOUND) {
                log.debug("getent.miss uid={}", uid);
                return Optional.empty();
            }
            if (exitCode != 0) {
                throw new IOException("'" + String.join(" ", args) + "' exited with code " + exitCode);
            }
            return parseEntry(output);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted while running getent for uid " + uid);
            interrupted.initCause(e);
            throw interrupted;
        }
    }

    /**
     * Extracts the account name from the first line of getent output.
     */
    static Optional<String> parseEntry(String output) {
        String firstLine = output.lines().findFirst().orElse("");
        int colon = firstLine.indexOf(':');
        if (colon <= 0) {
            return Optional.empty();
        }
        return Optional.of(firstLine.substring(0, colon));
    }
}
