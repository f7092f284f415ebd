package br.edu.ifba.favorites.export;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.List;

import org.junit.jupiter.api.Test;

import br.edu.ifba.favorites.core.ExportFormat;

/**
 * Unit tests for FavoriteExporterFactory.
 */
class FavoriteExporterFactoryTest {

    /**
     * Test that every format has an exporter reporting the format's MIME type.
     */
    @Test
    void testBuiltInExportersCoverEveryFormat() {
        FavoriteExporterFactory factory = FavoriteExporterFactory.withBuiltInExporters();

        assertEquals(EnumSet.allOf(ExportFormat.class), factory.availableFormats());
        for (ExportFormat format : ExportFormat.values()) {
            FavoriteExporter exporter = factory.getExporter(format);
            assertEquals(format, exporter.getFormat());
            assertEquals(format.getMimeType(), exporter.getMimeType());
            assertEquals(format.getExtension(), exporter.getFileExtension());
        }
    }

    /**
     * Test lookup by config.
     */
    @Test
    void testLookupByConfig() {
        FavoriteExporterFactory factory = FavoriteExporterFactory.withBuiltInExporters();

        FavoriteExporter exporter = factory.getExporter(ExportConfig.defaultFor(ExportFormat.HTML));

        assertEquals(ExportFormat.HTML, exporter.getFormat());
    }

    /**
     * Test that a missing format is reported.
     */
    @Test
    void testMissingFormat() {
        FavoriteExporterFactory factory = new FavoriteExporterFactory(List.of(new CsvFavoriteExporter()));

        assertTrue(factory.hasExporter(ExportFormat.CSV));
        assertFalse(factory.hasExporter(ExportFormat.JSON));
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
            () -> factory.getExporter(ExportFormat.JSON));
        assertTrue(error.getMessage().contains("JSON"));
    }

    /**
     * Test that the discussion template must contain a placeholder.
     */
    @Test
    void testTemplateRequiresPlaceholder() {
        assertThrows(IllegalArgumentException.class, () -> ExportConfig.builder()
            .discussionUrlTemplate("https://example.org/item")
            .build());
    }
}
