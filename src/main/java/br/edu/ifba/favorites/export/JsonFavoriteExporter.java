package br.edu.ifba.favorites.export;

import br.edu.ifba.favorites.core.ExportFormat;
import br.edu.ifba.favorites.core.SavedItem;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON exporter for saved items.
 *
 * <h2>Output Format:</h2>
 * <pre>
 * {
 *   "exported" : "2024-05-01T18:30:00",
 *   "stories" : [ {
 *     "id" : "42",
 *     "title" : "Kotlin 2.0 released",
 *     "url" : "https://example.com",
 *     "hnUrl" : "https://news.ycombinator.com/item?id=42",
 *     "savedAt" : "2024-05-01T18:30:00"
 *   } ]
 * }
 * </pre>
 */
@ApplicationScoped
public class JsonFavoriteExporter implements FavoriteExporter {

    private final ObjectWriter writer;

    public JsonFavoriteExporter() {
        JsonFactory factory = JsonFactory.builder()
            .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
            .build();
        this.writer = new ObjectMapper(factory).writerWithDefaultPrettyPrinter();
    }

    @Override
    public void export(
            @NotNull List<SavedItem> items,
            @NotNull ExportConfig config,
            @NotNull OutputStream outputStream) throws IOException {

        List<Story> stories = new ArrayList<>(items.size());
        for (SavedItem item : items) {
            stories.add(new Story(
                item.id(),
                ExportFields.title(item, config),
                item.url(),
                ExportFields.discussionLink(item, config),
                ExportFields.timestamp(Instant.ofEpochSecond(item.savedAtEpochSeconds()), config.zone())));
        }

        writer.writeValue(outputStream, new Document(
            ExportFields.timestamp(config.exportedAt(), config.zone()), stories));
        outputStream.flush();
    }

    @Override
    public ExportFormat getFormat() {
        return ExportFormat.JSON;
    }

    @JsonPropertyOrder({"exported", "stories"})
    record Document(
        @JsonProperty("exported") String exported,
        @JsonProperty("stories") List<Story> stories
    ) {
    }

    @JsonPropertyOrder({"id", "title", "url", "hnUrl", "savedAt"})
    record Story(
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("url") String url,
        @JsonProperty("hnUrl") String hnUrl,
        @JsonProperty("savedAt") String savedAt
    ) {
    }
}
