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
 * Plain-text exporter producing a numbered list.
 *
 * <h2>Output Format:</h2>
 * <pre>
 * === Saved Stories ===
 *
 * 1. Kotlin 2.0 released
 *    URL: https://example.com
 *    HN: https://news.ycombinator.com/item?id=42
 *    Saved: 2024-05-01 18:30
 *
 * </pre>
 */
@ApplicationScoped
public class TextFavoriteExporter implements FavoriteExporter {

    static final String HEADER = "=== Saved Stories ===";

    @Override
    public void export(
            @NotNull List<SavedItem> items,
            @NotNull ExportConfig config,
            @NotNull OutputStream outputStream) throws IOException {

        BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8));
        ExportFields.writeLine(writer, HEADER);
        ExportFields.writeLine(writer, "");

        int number = 1;
        for (SavedItem item : items) {
            ExportFields.writeLine(writer, number + ". " + ExportFields.singleLine(ExportFields.title(item, config)));
            ExportFields.writeLine(writer, "   URL: " + item.url());
            ExportFields.writeLine(writer, "   HN: " + ExportFields.discussionLink(item, config));
            ExportFields.writeLine(writer, "   Saved: " + ExportFields.savedDate(item, config));
            ExportFields.writeLine(writer, "");
            number++;
        }

        writer.flush();
    }

    @Override
    public ExportFormat getFormat() {
        return ExportFormat.TXT;
    }
}
