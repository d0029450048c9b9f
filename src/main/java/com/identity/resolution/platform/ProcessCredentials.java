package com.identity.resolution.platform;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * User ids of a process as reported by the {@code Uid:} line of {@code /proc/<pid>/status}.
 *
 * @param realUid       the real uid
 * @param effectiveUid  the effective uid
 * @param savedUid      the saved set-user-id
 * @param filesystemUid the filesystem uid
 */
public record ProcessCredentials(long realUid, long effectiveUid, long savedUid, long filesystemUid) {

    public static final Path SELF_STATUS = Path.of("/proc/self/status");

    private static final String UID_PREFIX = "Uid:";

    /**
     * Reads credentials from the given status file.
     *
     * @throws IOException if the file cannot be read
     */
    public static Optional<ProcessCredentials> read(Path statusFile) throws IOException {
        return parse(Files.readAllLines(statusFile, StandardCharsets.UTF_8));
    }

    /**
     * Parses credentials from the lines of a status file.
     * Returns empty if no well-formed {@code Uid:} line is present.
     */
    public static Optional<ProcessCredentials> parse(List<String> lines) {
        for (String line : lines) {
            if (!line.startsWith(UID_PREFIX)) {
                continue;
            }
            String[] fields = line.substring(UID_PREFIX.length()).trim().split("\\s+");
            if (fields.length < 4) {
                return Optional.empty();
            }
            try {
                return Optional.of(new ProcessCredentials(
                        Long.parseLong(fields[0]),
                        Long.parseLong(fields[1]),
                        Long.parseLong(fields[2]),
                        Long.parseLong(fields[3])));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
