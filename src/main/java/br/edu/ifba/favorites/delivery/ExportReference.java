package br.edu.ifba.favorites.delivery;

import br.edu.ifba.favorites.core.ExportFormat;
import org.jetbrains.annotations.NotNull;

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Reference to a written export document.
 *
 * @param location where the document lives
 * @param displayName name shown to the user
 * @param format document format
 */
public record ExportReference(
    @NotNull URI location,
    @NotNull String displayName,
    @NotNull ExportFormat format
) {

    public ExportReference {
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(displayName, "displayName must not be null");
        Objects.requireNonNull(format, "format must not be null");
    }

    public static ExportReference ofFile(@NotNull Path file, @NotNull ExportFormat format) {
        return new ExportReference(file.toUri(), file.getFileName().toString(), format);
    }

    @NotNull
    public String mimeType() {
        return format.getMimeType();
    }

    /**
     * @return the local file, or empty when the location is not a file URI
     */
    @NotNull
    public Optional<Path> file() {
        if (!"file".equalsIgnoreCase(location.getScheme())) {
            return Optional.empty();
        }
        return Optional.of(Path.of(location));
    }
}
