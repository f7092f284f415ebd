package br.edu.ifba.favorites.delivery;

import br.edu.ifba.favorites.core.ExportFormat;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * Promotes exports by registering an entry in the shared media index and
 * streaming the file into it.
 */
public class SharedIndexDownloadsPromoter extends DownloadsPromoter {

    private final SharedIndexRegistrar registrar;

    public SharedIndexDownloadsPromoter(@NotNull String baseName,
                                        @NotNull Clock clock,
                                        @NotNull SharedIndexRegistrar registrar) {
        super(baseName, clock);
        this.registrar = Objects.requireNonNull(registrar, "registrar must not be null");
    }

    @Override
    @NotNull
    protected String copy(@NotNull Path file, @NotNull String fileName, @NotNull ExportFormat format)
            throws IOException {
        URI entry = registrar.register(
            new SharedIndexEntry(fileName, format.getMimeType(), SharedIndexEntry.DOWNLOADS));
        try (OutputStream out = registrar.openOutputStream(entry)) {
            Files.copy(file, out);
        }
        return "Downloads/" + fileName;
    }
}
