package br.edu.ifba.favorites.export;

import br.edu.ifba.favorites.core.SavedItem;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.Writer;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Field rendering shared by all exporters, so every format derives titles,
 * discussion links and dates the same way.
 */
public final class ExportFields {

    private static final DateTimeFormatter SAVED_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private ExportFields() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Title to export: the resolved display title, else the stored title, else the
     * URL, else the id.
     */
    @NotNull
    public static String title(@NotNull SavedItem item, @NotNull ExportConfig config) {
        String display = config.titleResolver().displayTitle(item);
        if (display != null && !display.isBlank()) {
            return display;
        }
        return item.displayTitle();
    }

    @NotNull
    public static String discussionLink(@NotNull SavedItem item, @NotNull ExportConfig config) {
        return String.format(config.discussionUrlTemplate(), item.id());
    }

    /**
     * @return saved time as {@code yyyy-MM-dd HH:mm} in the configured zone
     */
    @NotNull
    public static String savedDate(@NotNull SavedItem item, @NotNull ExportConfig config) {
        return SAVED_DATE.format(Instant.ofEpochSecond(item.savedAtEpochSeconds()).atZone(config.zone()));
    }

    /**
     * @return instant as {@code yyyy-MM-dd'T'HH:mm:ss} in the given zone
     */
    @NotNull
    public static String timestamp(@NotNull Instant instant, @NotNull ZoneId zone) {
        return TIMESTAMP.format(instant.atZone(zone));
    }

    /**
     * Writes text followed by a line feed. Exports always use {@code \n}.
     */
    public static void writeLine(@NotNull Writer writer, @NotNull String text) throws IOException {
        writer.write(text);
        writer.write('\n');
    }

    /**
     * Collapses line breaks so a value stays on one line.
     */
    @NotNull
    public static String singleLine(@NotNull String text) {
        return text.replace("\r", "").replace('\n', ' ');
    }
}
