package br.edu.ifba.favorites.delivery;

import br.edu.ifba.favorites.core.ExportFormat;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Writes export documents into the application's private export directory.
 *
 * <p>There is one file per format, {@code <directory>/<baseName>.<ext>}. Each
 * write replaces the previous export of that format. Content goes to a temporary
 * file first and is moved into place, so a failed write never leaves a partial
 * document behind.</p>
 */
public class ExportFileWriter {

    private static final Logger LOG = Logger.getLogger(ExportFileWriter.class);

    private final Path directory;
    private final String baseName;

    /**
     * @param directory export directory, created on first write
     * @param baseName file name without extension
     */
    public ExportFileWriter(@NotNull Path directory, @NotNull String baseName) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.baseName = Objects.requireNonNull(baseName, "baseName must not be null");
        if (baseName.isBlank()) {
            throw new IllegalArgumentException("baseName must not be blank");
        }
    }

    /**
     * @return the path the export of the given format is written to
     */
    @NotNull
    public Path targetFor(@NotNull ExportFormat format) {
        return directory.resolve(baseName + "." + format.getExtension());
    }

    /**
     * Writes the document, replacing any previous export of the same format.
     *
     * @param format document format
     * @param content encoded document
     * @return the written file
     * @throws IOException if the file cannot be written
     */
    @NotNull
    public Path write(@NotNull ExportFormat format, @NotNull byte[] content) throws IOException {
        Files.createDirectories(directory);
        Path target = targetFor(format);
        Path temp = Files.createTempFile(directory, baseName + "-", ".tmp");
        try {
            Files.write(temp, content);
            move(temp, target);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(temp);
            throw e;
        }
        LOG.debugf("Wrote %d bytes to %s", content.length, target);
        return target;
    }

    private void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debugf("Atomic move not supported in %s, falling back to replace", directory);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warnf(e, "Failed to delete partial export %s", file);
        }
    }
}
