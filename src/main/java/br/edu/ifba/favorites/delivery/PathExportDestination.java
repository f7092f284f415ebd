package br.edu.ifba.favorites.delivery;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Destination backed by a file path. Existing content is truncated.
 */
public class PathExportDestination implements ExportDestination {

    private final Path path;

    public PathExportDestination(@NotNull Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
    }

    @Override
    @NotNull
    public OutputStream open() throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.newOutputStream(path);
    }

    @Override
    @NotNull
    public URI location() {
        return path.toUri();
    }

    @Override
    @NotNull
    public String displayName() {
        return path.getFileName().toString();
    }
}
