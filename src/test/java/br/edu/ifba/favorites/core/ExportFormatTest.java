package br.edu.ifba.favorites.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExportFormatTest {

    @Test
    @DisplayName("Formats carry their extension and MIME type")
    void testExtensionsAndMimeTypes() {
        assertEquals("csv", ExportFormat.CSV.getExtension());
        assertEquals("text/csv", ExportFormat.CSV.getMimeType());
        assertEquals("txt", ExportFormat.TXT.getExtension());
        assertEquals("text/plain", ExportFormat.TXT.getMimeType());
        assertEquals("html", ExportFormat.HTML.getExtension());
        assertEquals("text/html", ExportFormat.HTML.getMimeType());
        assertEquals("md", ExportFormat.MARKDOWN.getExtension());
        assertEquals("text/markdown", ExportFormat.MARKDOWN.getMimeType());
        assertEquals("json", ExportFormat.JSON.getExtension());
        assertEquals("application/json", ExportFormat.JSON.getMimeType());
    }

    @Test
    @DisplayName("fromString accepts names and extensions in any case")
    void testFromString() {
        assertEquals(ExportFormat.MARKDOWN, ExportFormat.fromString("markdown"));
        assertEquals(ExportFormat.MARKDOWN, ExportFormat.fromString("MD"));
        assertEquals(ExportFormat.JSON, ExportFormat.fromString(" Json "));
        assertEquals(ExportFormat.TXT, ExportFormat.fromString("txt"));
    }

    @Test
    @DisplayName("fromString defaults to CSV for blank input and rejects unknown formats")
    void testFromStringDefaultsAndErrors() {
        assertEquals(ExportFormat.CSV, ExportFormat.fromString(null));
        assertEquals(ExportFormat.CSV, ExportFormat.fromString("  "));
        assertThrows(IllegalArgumentException.class, () -> ExportFormat.fromString("pdf"));
    }
}
