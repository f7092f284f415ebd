package br.edu.ifba.favorites.export;

import br.edu.ifba.favorites.core.ExportFormat;
import br.edu.ifba.favorites.core.SavedItem;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Markdown exporter for saved items.
 *
 * <h2>Output Format:</h2>
 * <pre>
 * # Saved Stories
 *
 * ## Kotlin 2.0 released
 *
 * - **URL:** [Link](https://example.com)
 * - **HN:** [Discussion](https://news.ycombinator.com/item?id=42)
 * - **Saved:** 2024-05-01 18:30
 *
 * ---
 *
 * </pre>
 */
@ApplicationScoped
public class MarkdownFavoriteExporter implements FavoriteExporter {

    @Override
    public void export(
            @NotNull List<SavedItem> items,
            @NotNull ExportConfig config,
            @NotNull OutputStream outputStream) throws IOException {

        BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8));
        ExportFields.writeLine(writer, "# Saved Stories");
        ExportFields.writeLine(writer, "");

        for (SavedItem item : items) {
            ExportFields.writeLine(writer, "## " + ExportFields.singleLine(ExportFields.title(item, config)));
            ExportFields.writeLine(writer, "");
            ExportFields.writeLine(writer, "- **URL:** [Link](" + item.url() + ")");
            ExportFields.writeLine(writer, "- **HN:** [Discussion](" + ExportFields.discussionLink(item, config) + ")");
            ExportFields.writeLine(writer, "- **Saved:** " + ExportFields.savedDate(item, config));
            ExportFields.writeLine(writer, "");
            ExportFields.writeLine(writer, "---");
            ExportFields.writeLine(writer, "");
        }

        writer.flush();
    }

    @Override
    public ExportFormat getFormat() {
        return ExportFormat.MARKDOWN;
    }
}
