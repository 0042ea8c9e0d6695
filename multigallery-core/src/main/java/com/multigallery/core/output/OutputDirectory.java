package com.multigallery.core.output;

import com.multigallery.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;

/**
 * Output directory of one run, with the previous contents kept aside until the run
 * succeeds.
 *
 * <p>Unless existing contents are kept, {@link #prepare(Path, boolean)} moves an existing
 * directory to a sibling backup directory and creates an empty one in its place.
 * {@link #commit()} deletes the backup; {@link #rollback()} deletes whatever the run wrote
 * and moves the backup back.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * OutputDirectory out = OutputDirectory.prepare(Paths.get("out"), false);
 * try {
 *     renderer.render(output, out.path());
 *     out.commit();
 * } catch (RuntimeException e) {
 *     out.rollback();
 *     throw e;
 * }
 * }</pre>
 */
public final class OutputDirectory {

    private static final Logger log = LoggerFactory.getLogger(OutputDirectory.class);

    private final Path path;
    private final Path backupRoot;
    private boolean finished;

    private OutputDirectory(Path path, Path backupRoot) {
        this.path = path;
        this.backupRoot = backupRoot;
    }

    /**
     * Prepares an output directory.
     *
     * @param path output directory; created if missing
     * @param keepExisting true to write next to existing contents instead of replacing them
     * @return prepared directory
     * @throws IOException if the path is a regular file or the directory cannot be set up
     */
    public static OutputDirectory prepare(Path path, boolean keepExisting) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        Path absolute = path.toAbsolutePath().normalize();
        if (Files.exists(absolute) && !Files.isDirectory(absolute)) {
            throw new IOException("Output path exists and is not a directory: " + path);
        }

        Path backupRoot = null;
        if (!keepExisting && Files.isDirectory(absolute)) {
            // Sibling of the output directory, so the move is a rename on the same file system.
            backupRoot = Files.createTempDirectory(absolute.getParent(), "." + absolute.getFileName() + "-old-");
            Files.move(absolute, backupRoot.resolve(absolute.getFileName()));
            log.debug("Moved previous contents of {} to {}", absolute, backupRoot);
        }
        Files.createDirectories(absolute);
        return new OutputDirectory(absolute, backupRoot);
    }

    /**
     * Returns the output directory.
     *
     * @return absolute path
     */
    public Path path() {
        return path;
    }

    /**
     * Copies files into the output directory, keeping their names.
     *
     * @param files files to copy
     * @throws IOException if copying fails
     */
    public void copyFiles(List<Path> files) throws IOException {
        for (Path file : files) {
            Path target = path.resolve(file.getFileName());
            Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("Copied file: {}", file.getFileName());
        }
    }

    /**
     * Marks the run successful and discards the previous contents.
     *
     * @throws IOException if the backup cannot be deleted
     */
    public void commit() throws IOException {
        if (finished) {
            return;
        }
        finished = true;
        if (backupRoot != null) {
            FileUtils.deleteRecursively(backupRoot);
        }
    }

    /**
     * Discards what the run wrote and restores the previous contents.
     *
     * <p>Without a backup (new directory, or existing contents kept) the directory is left
     * as it is.
     *
     * @throws IOException if the previous contents cannot be restored
     */
    public void rollback() throws IOException {
        if (finished) {
            return;
        }
        finished = true;
        if (backupRoot != null) {
            FileUtils.deleteRecursively(path);
            Files.move(backupRoot.resolve(path.getFileName()), path);
            Files.delete(backupRoot);
            log.info("Restored previous contents of {}", path);
        }
    }
}
