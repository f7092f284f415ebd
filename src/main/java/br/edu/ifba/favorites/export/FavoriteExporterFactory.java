package br.edu.ifba.favorites.export;

import br.edu.ifba.favorites.core.ExportFormat;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Factory for selecting the FavoriteExporter for a format.
 *
 * <p>Uses CDI to discover all available FavoriteExporter implementations.</p>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * @Inject
 * FavoriteExporterFactory factory;
 *
 * FavoriteExporter exporter = factory.getExporter(ExportFormat.CSV);
 * exporter.export(items, config, outputStream);
 * }</pre>
 */
@ApplicationScoped
public class FavoriteExporterFactory {

    private final Map<ExportFormat, FavoriteExporter> exporters;

    /**
     * Default constructor for CDI proxy.
     */
    public FavoriteExporterFactory() {
        this.exporters = new EnumMap<>(ExportFormat.class);
    }

    /**
     * Constructs the factory with CDI-discovered exporters.
     *
     * @param exporterInstances All FavoriteExporter implementations
     */
    @Inject
    public FavoriteExporterFactory(Instance<FavoriteExporter> exporterInstances) {
        this(exporterInstances.stream().toList());
    }

    /**
     * Constructs the factory from an explicit set of exporters.
     *
     * @param exporterList exporters; a later one replaces an earlier one of the same format
     */
    public FavoriteExporterFactory(@NotNull Iterable<? extends FavoriteExporter> exporterList) {
        this.exporters = new EnumMap<>(ExportFormat.class);
        for (FavoriteExporter exporter : exporterList) {
            exporters.put(exporter.getFormat(), exporter);
        }
    }

    /**
     * @return factory holding one exporter per built-in format
     */
    public static FavoriteExporterFactory withBuiltInExporters() {
        return new FavoriteExporterFactory(List.of(
            new CsvFavoriteExporter(),
            new TextFavoriteExporter(),
            new HtmlFavoriteExporter(),
            new MarkdownFavoriteExporter(),
            new JsonFavoriteExporter()));
    }

    /**
     * Gets the exporter for the specified format.
     *
     * @param format The export format
     * @return FavoriteExporter implementation
     * @throws IllegalArgumentException if no exporter is registered for the format
     */
    @NotNull
    public FavoriteExporter getExporter(@NotNull ExportFormat format) {
        FavoriteExporter exporter = exporters.get(format);

        if (exporter == null) {
            throw new IllegalArgumentException(
                "No exporter registered for format: " + format
                    + ". Available formats: " + exporters.keySet());
        }

        return exporter;
    }

    @NotNull
    public FavoriteExporter getExporter(@NotNull ExportConfig config) {
        return getExporter(config.format());
    }

    public boolean hasExporter(@NotNull ExportFormat format) {
        return exporters.containsKey(format);
    }

    @NotNull
    public Set<ExportFormat> availableFormats() {
        return Set.copyOf(exporters.keySet());
    }
}
