package br.edu.ifba.favorites.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import br.edu.ifba.favorites.cache.FavoriteManager;
import br.edu.ifba.favorites.core.ExportFormat;
import br.edu.ifba.favorites.core.SavedItem;
import br.edu.ifba.favorites.export.ExportResult;
import br.edu.ifba.favorites.export.FavoriteExportService;
import br.edu.ifba.favorites.export.FavoriteExporterFactory;
import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.QuarkusTestProfile;
import io.quarkus.test.junit.TestProfile;
import jakarta.inject.Inject;

/**
 * Container test for the configuration mapping, the producers and exporter discovery.
 */
@QuarkusTest
@TestProfile(FavoritesWiringTest.TempDataProfile.class)
class FavoritesWiringTest {

    @Inject
    FavoriteManager manager;

    @Inject
    FavoriteExportService exportService;

    @Inject
    FavoriteExporterFactory exporterFactory;

    @Test
    @DisplayName("Every built-in exporter is discovered by the container")
    void testExportersDiscovered() {
        assertEquals(EnumSet.allOf(ExportFormat.class), exporterFactory.availableFormats());
    }

    @Test
    @DisplayName("A saved item is exported to the configured directory")
    void testAddThenExport() throws Exception {
        String id = UUID.randomUUID().toString();
        String title = "Wiring " + id;

        manager.add(SavedItem.of(id, "https://example.com/" + id, title, 1714588200L)).join();
        assertTrue(manager.isFavorite(id));

        ExportResult result = exportService.exportToShare(title, ExportFormat.CSV).join();

        assertTrue(result.success(), "Export should succeed");
        assertEquals(1, result.itemCount());
        Path file = result.referenceOptional().orElseThrow().file().orElseThrow();
        assertTrue(file.startsWith(TempDataProfile.ROOT), "Export should land under the configured directory");
        assertEquals("favorites-export.csv", file.getFileName().toString());
        String content = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(content.startsWith("Title,URL,Hacker News Link,Saved Date\n"));
        assertTrue(content.contains("\"" + title + "\""));
    }

    /**
     * Points the store, exports and Downloads at a throwaway directory.
     */
    public static class TempDataProfile implements QuarkusTestProfile {

        static final Path ROOT = createRoot();

        @Override
        public Map<String, String> getConfigOverrides() {
            return Map.of(
                "favorites.storage.sqlite.path", ROOT.resolve("favorites.db").toString(),
                "favorites.export.directory", ROOT.resolve("exports").toString(),
                "favorites.export.share-delay-ms", "0",
                "favorites.export.zone", "UTC",
                "favorites.downloads.era", "legacy",
                "favorites.downloads.directory", ROOT.resolve("Downloads").toString(),
                "favorites.downloads.shared-root", ROOT.resolve("shared").toString());
        }

        private static Path createRoot() {
            try {
                return Files.createTempDirectory("favorites-wiring").toAbsolutePath();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
