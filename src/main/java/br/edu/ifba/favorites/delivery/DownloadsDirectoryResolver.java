package br.edu.ifba.favorites.delivery;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Locates the public Downloads directory used by {@link LegacyDownloadsPromoter}.
 */
@FunctionalInterface
public interface DownloadsDirectoryResolver {

    /**
     * @throws IOException if there is no usable Downloads directory
     */
    @NotNull
    Path resolveDownloadsDirectory() throws IOException;

    static DownloadsDirectoryResolver of(@NotNull Path directory) {
        Objects.requireNonNull(directory, "directory must not be null");
        return () -> directory;
    }

    /**
     * @return resolver for {@code ~/Downloads}
     */
    static DownloadsDirectoryResolver userHome() {
        return () -> Path.of(System.getProperty("user.home"), "Downloads");
    }
}
