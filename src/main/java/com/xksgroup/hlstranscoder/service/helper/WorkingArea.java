package com.xksgroup.hlstranscoder.service.helper;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Per-job scratch directory, removed with everything in it on close.
 */
@Slf4j
public class WorkingArea implements AutoCloseable {

    @Getter
    private final Path root;

    private WorkingArea(Path root) {
        this.root = root;
    }

    public static WorkingArea create(Path baseDir, String jobId) throws IOException {
        Files.createDirectories(baseDir);
        Path root = Files.createTempDirectory(baseDir, "job-" + jobId + "-");
        log.debug("Working area for job {}: {}", jobId, root);
        return new WorkingArea(root);
    }

    public Path resolve(String other) {
        return root.resolve(other);
    }

    public Path directory(String name) throws IOException {
        return Files.createDirectories(root.resolve(name));
    }

    @Override
    public void close() {
        deleteDirectoryRecursively(root);
    }

    private static void deleteDirectoryRecursively(Path directory) {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()) // files before their directories
                    .forEach(WorkingArea::deleteFile);
        } catch (IOException e) {
            log.warn("Error deleting directory {}: {}", directory, e.getMessage());
        }
    }

    private static void deleteFile(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Error deleting {}: {}", path, e.getMessage());
        }
    }
}
