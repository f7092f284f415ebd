package br.edu.ifba.favorites.export;

import br.edu.ifba.favorites.core.ExportFormat;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Settings for one export invocation.
 *
 * <p>Built once when an export starts and handed through every stage, so
 * concurrent exports never read each other's format.</p>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * ExportConfig config = ExportConfig.builder()
 *     .format(ExportFormat.JSON)
 *     .zone(ZoneOffset.UTC)
 *     .build();
 * }</pre>
 *
 * @param format the document format
 * @param discussionUrlTemplate format string turning an item id into its discussion link
 * @param zone zone dates are rendered in
 * @param exportedAt time of the export, written by formats that carry it
 * @param titleResolver display-title source
 */
public record ExportConfig(
    @NotNull ExportFormat format,
    @NotNull String discussionUrlTemplate,
    @NotNull ZoneId zone,
    @NotNull Instant exportedAt,
    @NotNull DisplayTitleResolver titleResolver
) {

    /**
     * Discussion page of an item on Hacker News.
     */
    public static final String DEFAULT_DISCUSSION_URL_TEMPLATE = "https://news.ycombinator.com/item?id=%s";

    public ExportConfig {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(discussionUrlTemplate, "discussionUrlTemplate must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(exportedAt, "exportedAt must not be null");
        Objects.requireNonNull(titleResolver, "titleResolver must not be null");
        if (!discussionUrlTemplate.contains("%s")) {
            throw new IllegalArgumentException(
                "discussionUrlTemplate must contain %s, got: " + discussionUrlTemplate);
        }
    }

    /**
     * Creates a default configuration for the specified format.
     *
     * @param format the export format
     * @return config with the default template, system zone and current time
     */
    public static ExportConfig defaultFor(@NotNull ExportFormat format) {
        return builder().format(format).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ExportConfig.
     */
    public static class Builder {
        private ExportFormat format = ExportFormat.CSV;
        private String discussionUrlTemplate = DEFAULT_DISCUSSION_URL_TEMPLATE;
        private ZoneId zone = ZoneId.systemDefault();
        private Instant exportedAt;
        private DisplayTitleResolver titleResolver = DisplayTitleResolver.STORED_TITLE;

        public Builder format(@NotNull ExportFormat format) {
            this.format = format;
            return this;
        }

        public Builder format(@NotNull String format) {
            this.format = ExportFormat.fromString(format);
            return this;
        }

        public Builder discussionUrlTemplate(@NotNull String discussionUrlTemplate) {
            this.discussionUrlTemplate = discussionUrlTemplate;
            return this;
        }

        public Builder zone(@NotNull ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder exportedAt(@NotNull Instant exportedAt) {
            this.exportedAt = exportedAt;
            return this;
        }

        public Builder titleResolver(@NotNull DisplayTitleResolver titleResolver) {
            this.titleResolver = titleResolver;
            return this;
        }

        public ExportConfig build() {
            return new ExportConfig(format, discussionUrlTemplate, zone,
                exportedAt != null ? exportedAt : Instant.now(), titleResolver);
        }
    }
}
