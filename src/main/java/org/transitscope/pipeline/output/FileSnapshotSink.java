package org.transitscope.pipeline.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Writes the snapshot to a file in an output directory.
 * <p>
 * Each document is written to a sibling temp file ({@code <name>.<uuid>.tmp}) and then
 * moved over the target with {@link StandardCopyOption#ATOMIC_MOVE}. On file systems that
 * do not support atomic moves the sink falls back to a plain replacing move.
 */
public class FileSnapshotSink implements ISnapshotSink {

    private static final Logger log = LoggerFactory.getLogger(FileSnapshotSink.class);

    private final Path directory;
    private final Path target;

    /**
     * @param directory The output directory; created on first write if missing.
     * @param fileName  The snapshot file name, e.g. {@code telemetry.json}.
     */
    public FileSnapshotSink(Path directory, String fileName) {
        if (fileName == null || fileName.isBlank() || fileName.contains("/") || fileName.contains("\\")) {
            throw new IllegalArgumentException("Invalid snapshot file name: " + fileName);
        }
        this.directory = directory;
        this.target = directory.resolve(fileName);
    }

    @Override
    public void write(String document) throws IOException {
        replaceAtomically(target, document);
    }

    @Override
    public void writeDiagnostics(String name, String report) throws IOException {
        replaceAtomically(directory.resolve(name), report);
    }

    public Path target() {
        return target;
    }

    private void replaceAtomically(Path file, String content) throws IOException {
        Files.createDirectories(directory);
        Path tempFile = file.resolveSibling(file.getFileName() + "." + UUID.randomUUID() + ".tmp");
        Files.writeString(tempFile, content, StandardCharsets.UTF_8);
        try {
            try {
                Files.move(tempFile, file, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, replacing non-atomically", file);
                Files.move(tempFile, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after move failure: {}", tempFile, cleanupEx);
            }
            throw e;
        }
    }
}
