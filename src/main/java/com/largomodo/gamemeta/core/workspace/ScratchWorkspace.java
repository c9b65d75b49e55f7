package com.largomodo.gamemeta.core.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Scratch location for the canonical copy written during a closure check.
 * <p>
 * For {@code <dir>/metadata.pegasus.txt} the scratch file is
 * {@code <dir>/_norm_test/metadata.pegasus.txt.norm}. AutoCloseable enables
 * try-with-resources: {@link #close()} removes the scratch file, then the scratch
 * directory if nothing else is left in it.
 * <p>
 * A workspace created with {@code keep = true} leaves everything in place for debugging.
 * <p>
 * If the thread is interrupted before cleanup, logs a warning and skips deletion.
 */
public class ScratchWorkspace implements AutoCloseable {

    public static final String SCRATCH_DIR_NAME = "_norm_test";
    public static final String SCRATCH_SUFFIX = ".norm";

    private static final Logger log = LoggerFactory.getLogger(ScratchWorkspace.class);

    private final Path scratchDir;
    private final Path scratchFile;
    private final boolean keep;
    private boolean dirCreated;
    private boolean closed;

    /**
     * Creates a scratch workspace next to the source file. Nothing touches the disk until
     * {@link #prepare()}.
     *
     * @param source metadata file under verification
     * @param keep   leave scratch artifacts on close
     */
    public ScratchWorkspace(Path source, boolean keep) {
        Path parent = source.toAbsolutePath().getParent();
        this.scratchDir = parent.resolve(SCRATCH_DIR_NAME);
        this.scratchFile = scratchDir.resolve(source.getFileName() + SCRATCH_SUFFIX);
        this.keep = keep;
    }

    /**
     * Create the scratch directory.
     *
     * @return path of the scratch file to write
     * @throws IOException if the directory cannot be created
     */
    public Path prepare() throws IOException {
        if (!Files.isDirectory(scratchDir)) {
            Files.createDirectories(scratchDir);
            dirCreated = true;
        }
        return scratchFile;
    }

    public Path getScratchFile() {
        return scratchFile;
    }

    public Path getScratchDir() {
        return scratchDir;
    }

    /**
     * Deletes the scratch file, then the scratch directory when empty.
     * <p>
     * The directory is only removed when this workspace created it or it is empty; a
     * directory still holding other files is left alone without error. Repeated calls are
     * no-ops.
     *
     * @throws CleanupException if any deletion fails
     */
    @Override
    public void close() throws CleanupException {
        if (closed) {
            return;
        }
        closed = true;

        if (keep) {
            log.info("Keeping scratch file: {}", scratchFile);
            return;
        }
        // Check interruption status WITHOUT clearing flag (non-destructive read)
        if (Thread.currentThread().isInterrupted()) {
            log.warn("Thread interrupted, skipping cleanup for scratch file: {}", scratchFile);
            return;
        }

        List<IOException> failures = new ArrayList<>();
        try {
            Files.deleteIfExists(scratchFile);
        } catch (IOException e) {
            failures.add(e);
            log.warn("Cleanup failed for scratch file: {}", scratchFile, e);
        }

        if (Files.isDirectory(scratchDir)) {
            try {
                Files.delete(scratchDir);
            } catch (DirectoryNotEmptyException e) {
                log.debug("Scratch directory not empty, leaving it: {}", scratchDir);
            } catch (IOException e) {
                if (dirCreated) {
                    failures.add(e);
                    log.warn("Cleanup failed for scratch directory: {}", scratchDir, e);
                } else {
                    log.debug("Pre-existing scratch directory not removed: {}", scratchDir, e);
                }
            }
        }

        if (!failures.isEmpty()) {
            throw new CleanupException(
                    "Scratch cleanup encountered " + failures.size() + " failure(s) in: " + scratchDir,
                    failures);
        }
    }
}
