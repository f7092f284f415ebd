package br.edu.ifba.favorites.export;

import br.edu.ifba.favorites.core.ExportFormat;
import br.edu.ifba.favorites.core.SavedItem;
import org.jetbrains.annotations.NotNull;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Serializes saved items into one document format.
 *
 * <h2>Contract:</h2>
 * <ul>
 *   <li>MUST write one record block per item, in the given order</li>
 *   <li>MUST write UTF-8</li>
 *   <li>MUST NOT close the output stream (caller responsibility)</li>
 *   <li>MUST NOT keep state between calls; everything comes from {@link ExportConfig}</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * FavoriteExporter exporter = factory.getExporter(ExportFormat.MARKDOWN);
 * String document = exporter.render(items, ExportConfig.defaultFor(ExportFormat.MARKDOWN));
 * }</pre>
 *
 * @see FavoriteExporterFactory
 */
public interface FavoriteExporter {

    /**
     * Writes the document for the given items.
     *
     * @param items items to export, in store order
     * @param config export configuration
     * @param outputStream stream to write the document to
     * @throws IOException if writing fails
     */
    void export(
        @NotNull List<SavedItem> items,
        @NotNull ExportConfig config,
        @NotNull OutputStream outputStream
    ) throws IOException;

    /**
     * Gets the export format this exporter handles.
     *
     * @return the export format
     */
    ExportFormat getFormat();

    /**
     * Renders the document as a string.
     *
     * @param items items to export
     * @param config export configuration
     * @return the whole document
     */
    @NotNull
    default String render(@NotNull List<SavedItem> items, @NotNull ExportConfig config) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            export(items, config, buffer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render " + getFormat() + " export", e);
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }

    default String getMimeType() {
        return getFormat().getMimeType();
    }

    default String getFileExtension() {
        return getFormat().getExtension();
    }
}
