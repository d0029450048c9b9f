package com.identity.resolution.platform;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProcessCredentials Tests")
class ProcessCredentialsTest {

    @Test
    @DisplayName("Should parse real, effective, saved and filesystem uids")
    void parsesUidLine() {
        Optional<ProcessCredentials> credentials = ProcessCredentials.parse(List.of(
                "Name:\tjava",
                "Umask:\t0022",
                "State:\tS (sleeping)",
                "Uid:\t1000\t0\t1000\t0",
                "Gid:\t1000\t1000\t1000\t1000"));

        assertTrue(credentials.isPresent());
        assertEquals(1000, credentials.get().realUid());
        assertEquals(0, credentials.get().effectiveUid());
        assertEquals(1000, credentials.get().savedUid());
        assertEquals(0, credentials.get().filesystemUid());
    }

    @Test
    @DisplayName("Should return empty without a Uid line")
    void emptyWithoutUidLine() {
        assertTrue(ProcessCredentials.parse(List.of("Name:\tjava", "Gid:\t0\t0\t0\t0")).isEmpty());
    }

    @Test
    @DisplayName("Should return empty for a malformed Uid line")
    void emptyForMalformedLine() {
        assertTrue(ProcessCredentials.parse(List.of("Uid:\t1000\t0")).isEmpty());
        assertTrue(ProcessCredentials.parse(List.of("Uid:\ta\tb\tc\td")).isEmpty());
    }

    @Test
    @DisplayName("Should read a status file")
    void readsStatusFile(@TempDir Path dir) throws IOException {
        Path status = dir.resolve("status");
        Files.writeString(status, "Name:\tjava\nUid:\t501\t501\t501\t501\n");

        assertEquals(501, ProcessCredentials.read(status).orElseThrow().effectiveUid());
    }

    @Test
    @DisplayName("Should propagate a missing status file")
    void missingFileThrows(@TempDir Path dir) {
        assertThrows(NoSuchFileException.class, () -> ProcessCredentials.read(dir.resolve("absent")));
    }
}
