package br.edu.ifba.favorites.delivery;

import br.edu.ifba.favorites.core.ExportFormat;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Objects;

/**
 * Promotes exports by copying them straight into the Downloads directory.
 */
public class LegacyDownloadsPromoter extends DownloadsPromoter {

    private final DownloadsDirectoryResolver resolver;

    public LegacyDownloadsPromoter(@NotNull String baseName,
                                   @NotNull Clock clock,
                                   @NotNull DownloadsDirectoryResolver resolver) {
        super(baseName, clock);
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    @Override
    @NotNull
    protected String copy(@NotNull Path file, @NotNull String fileName, @NotNull ExportFormat format)
            throws IOException {
        Path downloads = resolver.resolveDownloadsDirectory();
        Files.createDirectories(downloads);
        Path target = downloads.resolve(fileName);
        Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
        return target.toString();
    }
}
