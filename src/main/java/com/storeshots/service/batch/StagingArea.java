package com.storeshots.service.batch;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

/**
 * Per-run scratch tree created as a hidden sibling of the canonical output directory so that
 * promotion is a rename within one file system. The canonical directory is only ever replaced
 * as a whole.
 */
public class StagingArea {

    private static final Logger log = LoggerFactory.getLogger(StagingArea.class);

    private final Path outputRoot;
    private final Path root;
    private final String runId;

    private StagingArea(Path outputRoot, Path root, String runId) {
        this.outputRoot = outputRoot;
        this.root = root;
        this.runId = runId;
    }

    public static StagingArea create(Path outputRoot, String runId) throws IOException {
        Path canonical = outputRoot.toAbsolutePath().normalize();
        Path parent = canonical.getParent();
        Files.createDirectories(parent);
        Path root = parent.resolve("." + canonical.getFileName() + ".staging-" + runId);
        Files.createDirectories(root);
        log.debug("Staging run {} in {}", runId, root);
        return new StagingArea(canonical, root, runId);
    }

    public Path root() {
        return root;
    }

    public Path outputRoot() {
        return outputRoot;
    }

    public Path localeDirectory(String locale) throws IOException {
        return Files.createDirectories(root.resolve(locale));
    }

    /**
     * Replaces the canonical tree with the staging tree as it is.
     */
    public void promoteAll() throws IOException {
        replaceCanonical(root);
    }

    /**
     * Builds the next canonical tree from a copy of the current one with the given staged files
     * laid over it, then swaps it in.
     *
     * @param relativePaths paths relative to the staging root, {@code <locale>/<file>}
     */
    public void promoteOverlay(Collection<Path> relativePaths) throws IOException {
        Path next = sibling(".next-" + runId);
        FileSystemUtils.deleteRecursively(next);
        if (Files.isDirectory(outputRoot)) {
            FileSystemUtils.copyRecursively(outputRoot, next);
        } else {
            Files.createDirectories(next);
        }
        for (Path relative : relativePaths) {
            Path target = next.resolve(relative);
            Files.createDirectories(target.getParent());
            Files.copy(root.resolve(relative), target, StandardCopyOption.REPLACE_EXISTING);
        }
        try {
            replaceCanonical(next);
        } finally {
            FileSystemUtils.deleteRecursively(next);
        }
    }

    /**
     * Removes the staging tree and anything a failed promotion left behind.
     */
    public void discard() {
        for (Path leftover : new Path[] {root, sibling(".next-" + runId)}) {
            try {
                FileSystemUtils.deleteRecursively(leftover);
            } catch (IOException ex) {
                log.warn("Unable to remove {}: {}", leftover, ex.getMessage());
            }
        }
    }

    private void replaceCanonical(Path candidate) throws IOException {
        Path previous = sibling(".previous-" + runId);
        boolean hadPrevious = Files.exists(outputRoot);
        if (hadPrevious) {
            rename(outputRoot, previous);
        }
        try {
            rename(candidate, outputRoot);
        } catch (IOException ex) {
            if (hadPrevious) {
                try {
                    rename(previous, outputRoot);
                } catch (IOException rollback) {
                    ex.addSuppressed(rollback);
                    log.error("Rollback failed; previous output remains at {}", previous);
                }
            }
            throw ex;
        }
        if (hadPrevious) {
            FileSystemUtils.deleteRecursively(previous);
        }
        log.info("Promoted run {} to {}", runId, outputRoot);
    }

    private Path sibling(String suffix) {
        return outputRoot.resolveSibling("." + outputRoot.getFileName() + suffix);
    }

    private static void rename(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(source, target);
        }
    }
}
