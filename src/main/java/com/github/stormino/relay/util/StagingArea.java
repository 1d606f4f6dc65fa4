package com.github.stormino.relay.util;

import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Ephemeral local storage for one transfer run: a private directory holding a single staging file.
 * Closing deletes the directory and everything in it, whatever state the run ended in.
 */
@Slf4j
public class StagingArea implements Closeable {

    private final Path directory;
    private final Path file;
    private volatile boolean closed = false;

    private StagingArea(Path directory, Path file) {
        this.directory = directory;
        this.file = file;
    }

    /**
     * Create a staging area under the given root.
     *
     * @param root Parent directory, created if missing
     * @param taskId Task the area belongs to, used as directory prefix
     * @param fileName Name of the staging file inside the area
     */
    public static StagingArea create(Path root, String taskId, String fileName) throws IOException {
        Files.createDirectories(root);
        Path directory = Files.createTempDirectory(root, "relay_" + sanitize(taskId) + "_");
        Path file = directory.resolve(sanitize(fileName));
        Files.createFile(file);
        log.debug("Created staging area {} for task {}", directory, taskId);
        return new StagingArea(directory, file);
    }

    public OutputStream openOutput() throws IOException {
        return Files.newOutputStream(file, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    public Path getFile() {
        return file;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(StagingArea::deleteQuietly);
            log.debug("Deleted staging area: {}", directory);
        } catch (IOException e) {
            log.warn("Failed to delete staging area: {}", directory, e);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete: {}", path, e);
        }
    }

    private static String sanitize(String name) {
        if (name == null || name.isBlank()) {
            return "unnamed";
        }
        return name.replaceAll("[<>:\"/\\\\|?*\\s]", "_");
    }
}
