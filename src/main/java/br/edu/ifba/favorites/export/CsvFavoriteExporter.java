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
 * CSV exporter for saved items.
 *
 * <h2>Output Format:</h2>
 * <pre>
 * Title,URL,Hacker News Link,Saved Date
 * "Show HN: a ""quoted"" title",https://example.com,https://news.ycombinator.com/item?id=42,2024-05-01 18:30
 * </pre>
 *
 * <p>The title is always quoted. Other fields are quoted only when they need it.</p>
 */
@ApplicationScoped
public class CsvFavoriteExporter implements FavoriteExporter {

    static final String HEADER = "Title,URL,Hacker News Link,Saved Date";

    @Override
    public void export(
            @NotNull List<SavedItem> items,
            @NotNull ExportConfig config,
            @NotNull OutputStream outputStream) throws IOException {

        BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8));
        ExportFields.writeLine(writer, HEADER);

        for (SavedItem item : items) {
            writer.write(quote(ExportFields.title(item, config)));
            writer.write(",");
            writer.write(escapeCsv(item.url()));
            writer.write(",");
            writer.write(escapeCsv(ExportFields.discussionLink(item, config)));
            writer.write(",");
            ExportFields.writeLine(writer, ExportFields.savedDate(item, config));
        }

        writer.flush();
    }

    private String quote(String value) {
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }

    /**
     * RFC 4180: quotes fields containing commas, newlines or quotes and doubles
     * embedded quotes.
     */
    private String escapeCsv(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }

        boolean needsQuoting = value.contains(",")
            || value.contains("\"")
            || value.contains("\n")
            || value.contains("\r");

        return needsQuoting ? quote(value) : value;
    }

    @Override
    public ExportFormat getFormat() {
        return ExportFormat.CSV;
    }
}
