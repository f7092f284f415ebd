package br.edu.ifba.favorites.delivery;

import br.edu.ifba.favorites.core.ExportFormat;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

/**
 * Copies a finished export into the user's public Downloads collection under a
 * timestamped name, e.g. {@code favorites-export-2024-05-01_1830.csv}.
 *
 * <p>Promotion is best effort. Failures are logged and reported as an empty
 * result; they never affect the export that produced the file.</p>
 */
public abstract class DownloadsPromoter {

    private static final Logger LOG = Logger.getLogger(DownloadsPromoter.class);
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HHmm");

    private final String baseName;
    private final Clock clock;

    protected DownloadsPromoter(@NotNull String baseName, @NotNull Clock clock) {
        this.baseName = Objects.requireNonNull(baseName, "baseName must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Creates the promoter matching the storage era.
     */
    public static DownloadsPromoter forEra(@NotNull StorageEra era,
                                           @NotNull String baseName,
                                           @NotNull Clock clock,
                                           @NotNull SharedIndexRegistrar registrar,
                                           @NotNull DownloadsDirectoryResolver resolver) {
        return switch (era) {
            case MODERN -> new SharedIndexDownloadsPromoter(baseName, clock, registrar);
            case LEGACY -> new LegacyDownloadsPromoter(baseName, clock, resolver);
        };
    }

    /**
     * Copies the file into Downloads.
     *
     * @param file the written export
     * @param format its format
     * @return user-visible location of the copy, or empty if promotion failed
     */
    @NotNull
    public Optional<String> promote(@NotNull Path file, @NotNull ExportFormat format) {
        String fileName = timestampedName(format);
        try {
            String location = copy(file, fileName, format);
            LOG.infof("Saved export to Downloads: %s", location);
            return Optional.of(location);
        } catch (IOException | RuntimeException e) {
            LOG.warnf(e, "Failed to save %s to Downloads", fileName);
            return Optional.empty();
        }
    }

    /**
     * @return {@code <baseName>-yyyy-MM-dd_HHmm.<ext>} for the current clock time
     */
    @NotNull
    public String timestampedName(@NotNull ExportFormat format) {
        return baseName + "-" + FILE_TIMESTAMP.format(clock.instant().atZone(clock.getZone()))
            + "." + format.getExtension();
    }

    /**
     * Performs the copy.
     *
     * @return user-visible location of the copy
     */
    @NotNull
    protected abstract String copy(@NotNull Path file, @NotNull String fileName, @NotNull ExportFormat format)
        throws IOException;
}
