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
 * HTML exporter producing a standalone styled page.
 *
 * <p>Each item becomes a {@code div.story} holding a title link to the item URL,
 * a link to its discussion page and the saved date. Titles and URLs are
 * HTML-escaped.</p>
 */
@ApplicationScoped
public class HtmlFavoriteExporter implements FavoriteExporter {

    private static final String STYLE = String.join("\n",
        "body { font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, sans-serif; "
            + "max-width: 800px; margin: 0 auto; padding: 20px; }",
        "h1 { color: #ff6600; }",
        ".story { margin-bottom: 20px; padding: 10px; border-bottom: 1px solid #eee; }",
        ".story a { color: #000; text-decoration: none; font-weight: bold; }",
        ".story a:hover { text-decoration: underline; }",
        ".meta { color: #666; font-size: 0.9em; margin-top: 5px; }",
        ".meta a { color: #666; font-weight: normal; }");

    @Override
    public void export(
            @NotNull List<SavedItem> items,
            @NotNull ExportConfig config,
            @NotNull OutputStream outputStream) throws IOException {

        BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8));
        ExportFields.writeLine(writer, "<!DOCTYPE html>");
        ExportFields.writeLine(writer, "<html>");
        ExportFields.writeLine(writer, "<head>");
        ExportFields.writeLine(writer, "<meta charset=\"UTF-8\">");
        ExportFields.writeLine(writer, "<title>Saved Stories</title>");
        ExportFields.writeLine(writer, "<style>");
        ExportFields.writeLine(writer, STYLE);
        ExportFields.writeLine(writer, "</style>");
        ExportFields.writeLine(writer, "</head>");
        ExportFields.writeLine(writer, "<body>");
        ExportFields.writeLine(writer, "<h1>Saved Stories</h1>");

        for (SavedItem item : items) {
            writeStory(writer, item, config);
        }

        ExportFields.writeLine(writer, "</body>");
        ExportFields.writeLine(writer, "</html>");
        writer.flush();
    }

    private void writeStory(BufferedWriter writer, SavedItem item, ExportConfig config) throws IOException {
        ExportFields.writeLine(writer, "<div class=\"story\">");
        ExportFields.writeLine(writer, "<a href=\"" + escapeHtml(item.url()) + "\">"
            + escapeHtml(ExportFields.title(item, config)) + "</a>");
        ExportFields.writeLine(writer, "<div class=\"meta\">");
        ExportFields.writeLine(writer, "<a href=\"" + escapeHtml(ExportFields.discussionLink(item, config))
            + "\">HN Discussion</a> | Saved: " + ExportFields.savedDate(item, config));
        ExportFields.writeLine(writer, "</div>");
        ExportFields.writeLine(writer, "</div>");
    }

    static String escapeHtml(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#39;");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }

    @Override
    public ExportFormat getFormat() {
        return ExportFormat.HTML;
    }
}
