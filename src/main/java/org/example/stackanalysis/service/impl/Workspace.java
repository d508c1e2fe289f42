package org.example.stackanalysis.service.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Private temporary directory owned by a single pipeline run. Every file the run
 * writes is created through this object and lives inside {@link #path()}.
 */
public class Workspace implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Workspace.class);

    private final Path dir;
    private final Set<Path> files = new LinkedHashSet<>();
    private boolean disposed;

    private Workspace(Path dir) {
        this.dir = dir;
    }

    /**
     * @param parent directory to create the workspace in, or null for the system temp directory
     */
    public static Workspace create(Path parent, String prefix) throws IOException {
        Path dir;
        if (parent == null) {
            dir = Files.createTempDirectory(prefix);
        } else {
            Files.createDirectories(parent);
            dir = Files.createTempDirectory(parent, prefix);
        }
        logger.debug("Created workspace {}", dir);
        return new Workspace(dir);
    }

    public Path path() {
        return dir;
    }

    /** Path for a named file inside the workspace, tracked for removal. */
    public Path newFile(String name) {
        Path p = dir.resolve(name).normalize();
        if (!p.getParent().equals(dir)) {
            throw new IllegalArgumentException("Not a plain file name: " + name);
        }
        files.add(p);
        return p;
    }

    /** Creates an empty uniquely named file inside the workspace. */
    public Path newTempFile(String prefix, String suffix) throws IOException {
        Path p = Files.createTempFile(dir, prefix, suffix);
        files.add(p);
        return p;
    }

    /** Removes a tracked file now instead of at disposal. */
    public void delete(Path file) {
        try {
            Files.deleteIfExists(file);
            files.remove(file);
        } catch (IOException e) {
            logger.warn("Cannot delete {}: {}", file, e.getMessage());
        }
    }

    public boolean isDisposed() {
        return disposed;
    }

    /**
     * Deletes the tracked files, then the directory with anything left behind in it.
     * Never throws; problems are logged.
     */
    public void dispose() {
        if (disposed) return;
        disposed = true;
        for (Path f : files) {
            try {
                Files.deleteIfExists(f);
            } catch (IOException e) {
                logger.warn("Cannot delete workspace file {}: {}", f, e.getMessage());
            }
        }
        files.clear();
        try {
            List<Path> leftovers = listLeftovers();
            if (!leftovers.isEmpty()) {
                logger.warn("Workspace {} holds {} untracked file(s), removing anyway: {}",
                        dir, leftovers.size(), leftovers);
            }
            FileSystemUtils.deleteRecursively(dir);
        } catch (IOException e) {
            logger.warn("Cannot remove workspace {}: {}", dir, e.getMessage());
        }
    }

    private List<Path> listLeftovers() throws IOException {
        if (!Files.isDirectory(dir)) return List.of();
        try (Stream<Path> s = Files.list(dir)) {
            return new ArrayList<>(s.map(Path::getFileName).toList());
        }
    }

    @Override
    public void close() {
        dispose();
    }
}
