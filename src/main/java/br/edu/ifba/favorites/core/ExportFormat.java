package br.edu.ifba.favorites.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * Document formats a saved-items export can be written in.
 */
public enum ExportFormat {
    CSV("csv", "text/csv"),
    TXT("txt", "text/plain"),
    HTML("html", "text/html"),
    MARKDOWN("md", "text/markdown"),
    JSON("json", "application/json");

    private final String extension;
    private final String mimeType;

    ExportFormat(String extension, String mimeType) {
        this.extension = extension;
        this.mimeType = mimeType;
    }

    /**
     * @return file extension without dot (e.g. "csv")
     */
    public String getExtension() {
        return extension;
    }

    public String getMimeType() {
        return mimeType;
    }

    /**
     * Parses a format from its name or file extension, case-insensitive.
     *
     * @param value format name ("markdown") or extension ("md"); blank means CSV
     * @return matching ExportFormat
     * @throws IllegalArgumentException if value matches no format
     */
    @NotNull
    public static ExportFormat fromString(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return CSV;
        }

        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ExportFormat format : values()) {
            if (format.name().toLowerCase(Locale.ROOT).equals(normalized)
                    || format.extension.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException(
            "Invalid export format: '" + value + "'. Valid values: csv, txt, html, markdown, json");
    }
}
