package com.cscript.compiler.build;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Private scratch space for one build: a randomly named directory for
 * intermediates plus a staging file next to the output. Closing removes
 * everything that is still there.
 */
public class TempWorkspace implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TempWorkspace.class);

    static final String DIRECTORY_PREFIX = "cscript-";

    private final Path directory;
    private final Path stagingFile;

    private TempWorkspace(Path directory, Path stagingFile) {
        this.directory = directory;
        this.stagingFile = stagingFile;
    }

    /**
     * Creates the private directory under {@code tempRoot} and reserves a
     * staging name beside {@code output}, so the final rename stays on one file system.
     */
    public static TempWorkspace create(Path tempRoot, Path output) throws IOException {
        Files.createDirectories(tempRoot);
        Path directory = Files.createTempDirectory(tempRoot, DIRECTORY_PREFIX);
        String token = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        Path parent = output.toAbsolutePath().getParent();
        Path staging = parent.resolve("." + output.getFileName() + "." + token + ".tmp");
        log.debug("Created workspace {} with staging file {}", directory, staging);
        return new TempWorkspace(directory, staging);
    }

    public Path getStagingFile() {
        return stagingFile;
    }

    public Path resolve(String name) {
        return directory.resolve(name);
    }

    /**
     * Moves the staging file onto {@code output}, atomically where the file system allows.
     */
    public void publish(Path output) throws IOException {
        try {
            Files.move(stagingFile, output, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic rename not supported for {}, replacing instead", output);
            Files.move(stagingFile, output, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Deletes the directory tree and the staging file. Failures
     * are logged; closing never throws.
     */
    @Override
    public void close() {
        deleteQuietly(stagingFile);
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.sorted(Comparator.reverseOrder()).forEach(TempWorkspace::deleteQuietly);
        } catch (IOException e) {
            log.warn("Could not clean up workspace {}: {}", directory, e.getMessage());
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", path, e.getMessage());
        }
    }
}
