package com.github.stormino.relay.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StagingArea")
class StagingAreaTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("create")
    class CreateTests {

        @Test
        @DisplayName("creates a private directory with an empty staging file")
        void createsDirectoryAndFile() throws IOException {
            try (StagingArea staging = StagingArea.create(tempDir, "chan_42", "42.mkv")) {
                assertTrue(Files.isDirectory(staging.getFile().getParent()));
                assertTrue(staging.getFile().getParent().getFileName().toString().startsWith("relay_chan_42_"));
                assertEquals("42.mkv", staging.getFile().getFileName().toString());
                assertEquals(0, Files.size(staging.getFile()));
            }
        }

        @Test
        @DisplayName("creates a missing root directory")
        void createsMissingRoot() throws IOException {
            Path root = tempDir.resolve("nested/staging");

            try (StagingArea staging = StagingArea.create(root, "t1", "a.mkv")) {
                assertTrue(staging.getFile().getParent().startsWith(root));
            }
        }

        @Test
        @DisplayName("sanitizes unsafe file names")
        void sanitizesFileNames() throws IOException {
            try (StagingArea staging = StagingArea.create(tempDir, "t1", "bad/name: part?.mkv")) {
                assertEquals("bad_name__part_.mkv", staging.getFile().getFileName().toString());
            }
        }

        @Test
        @DisplayName("two areas for the same task do not collide")
        void areasDoNotCollide() throws IOException {
            try (StagingArea first = StagingArea.create(tempDir, "t1", "a.mkv");
                 StagingArea second = StagingArea.create(tempDir, "t1", "a.mkv")) {
                assertNotEquals(first.getFile().getParent(), second.getFile().getParent());
            }
        }
    }

    @Nested
    @DisplayName("close")
    class CloseTests {

        @Test
        @DisplayName("deletes the directory and everything staged in it")
        void deletesEverything() throws IOException {
            StagingArea staging = StagingArea.create(tempDir, "t1", "a.mkv");
            try (OutputStream out = staging.openOutput()) {
                out.write("partial".getBytes(StandardCharsets.UTF_8));
            }
            Files.createFile(staging.getFile().getParent().resolve("stray.tmp"));

            staging.close();

            assertFalse(Files.exists(staging.getFile().getParent()));
        }

        @Test
        @DisplayName("is idempotent")
        void isIdempotent() throws IOException {
            StagingArea staging = StagingArea.create(tempDir, "t1", "a.mkv");

            staging.close();
            assertDoesNotThrow(staging::close);
        }

        @Test
        @DisplayName("tolerates a directory already removed")
        void toleratesMissingDirectory() throws IOException {
            StagingArea staging = StagingArea.create(tempDir, "t1", "a.mkv");
            Files.delete(staging.getFile());
            Files.delete(staging.getFile().getParent());

            assertDoesNotThrow(staging::close);
        }
    }

    @Test
    @DisplayName("output appends across openings")
    void outputAppends() throws IOException {
        try (StagingArea staging = StagingArea.create(tempDir, "t1", "a.mkv")) {
            try (OutputStream out = staging.openOutput()) {
                out.write(new byte[10]);
            }
            try (OutputStream out = staging.openOutput()) {
                out.write(new byte[5]);
            }
            assertEquals(15, Files.size(staging.getFile()));
        }
    }
}
