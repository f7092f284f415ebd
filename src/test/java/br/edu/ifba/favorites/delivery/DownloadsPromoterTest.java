package br.edu.ifba.favorites.delivery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import br.edu.ifba.favorites.core.ExportFormat;

class DownloadsPromoterTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T18:30:45Z"), ZoneOffset.UTC);
    private static final String BASE_NAME = "favorites-export";

    @TempDir
    Path tempDir;

    private Path exportFile;

    @BeforeEach
    void setUp() throws IOException {
        exportFile = tempDir.resolve("saved").resolve("favorites-export.csv");
        Files.createDirectories(exportFile.getParent());
        Files.writeString(exportFile, "Title,URL,Hacker News Link,Saved Date\n", StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Promoted files get a minute-precision timestamp")
    void testTimestampedName() {
        DownloadsPromoter promoter = new LegacyDownloadsPromoter(BASE_NAME, CLOCK,
            DownloadsDirectoryResolver.of(tempDir));

        assertEquals("favorites-export-2024-05-01_1830.md", promoter.timestampedName(ExportFormat.MARKDOWN));
    }

    @Test
    @DisplayName("forEra picks the promoter for the storage era")
    void testForEra() {
        SharedIndexRegistrar registrar = new DirectorySharedIndex(tempDir.resolve("shared"));
        DownloadsDirectoryResolver resolver = DownloadsDirectoryResolver.of(tempDir.resolve("Downloads"));

        assertInstanceOf(SharedIndexDownloadsPromoter.class,
            DownloadsPromoter.forEra(StorageEra.MODERN, BASE_NAME, CLOCK, registrar, resolver));
        assertInstanceOf(LegacyDownloadsPromoter.class,
            DownloadsPromoter.forEra(StorageEra.LEGACY, BASE_NAME, CLOCK, registrar, resolver));
    }

    @Nested
    @DisplayName("Legacy era")
    class Legacy {

        @Test
        @DisplayName("Copies the export into the Downloads directory")
        void testCopiesIntoDownloads() throws IOException {
            Path downloads = tempDir.resolve("Downloads");
            DownloadsPromoter promoter = new LegacyDownloadsPromoter(BASE_NAME, CLOCK,
                DownloadsDirectoryResolver.of(downloads));

            Optional<String> location = promoter.promote(exportFile, ExportFormat.CSV);

            Path copy = downloads.resolve("favorites-export-2024-05-01_1830.csv");
            assertTrue(location.isPresent());
            assertEquals(copy.toString(), location.get());
            assertEquals(Files.readString(exportFile), Files.readString(copy));
        }

        @Test
        @DisplayName("An unavailable Downloads directory yields an empty result")
        void testResolverFailure() {
            DownloadsPromoter promoter = new LegacyDownloadsPromoter(BASE_NAME, CLOCK, () -> {
                throw new IOException("external storage not mounted");
            });

            assertTrue(promoter.promote(exportFile, ExportFormat.CSV).isEmpty());
        }

        @Test
        @DisplayName("A missing source file yields an empty result")
        void testMissingSource() {
            DownloadsPromoter promoter = new LegacyDownloadsPromoter(BASE_NAME, CLOCK,
                DownloadsDirectoryResolver.of(tempDir.resolve("Downloads")));

            assertTrue(promoter.promote(tempDir.resolve("missing.csv"), ExportFormat.CSV).isEmpty());
        }
    }

    @Nested
    @DisplayName("Modern era")
    class Modern {

        @Test
        @DisplayName("Registers an entry in the shared index and streams the file into it")
        void testRegistersEntry() throws IOException {
            DirectorySharedIndex index = new DirectorySharedIndex(tempDir.resolve("shared"));
            DownloadsPromoter promoter = new SharedIndexDownloadsPromoter(BASE_NAME, CLOCK, index);

            Optional<String> location = promoter.promote(exportFile, ExportFormat.CSV);

            assertEquals(Optional.of("Downloads/favorites-export-2024-05-01_1830.csv"), location);
            Path copy = index.getRoot().resolve("Downloads").resolve("favorites-export-2024-05-01_1830.csv");
            assertEquals(Files.readString(exportFile), Files.readString(copy));
            assertEquals(List.of(new SharedIndexEntry("favorites-export-2024-05-01_1830.csv", "text/csv", "Downloads")),
                index.entries());
        }

        @Test
        @DisplayName("A taken name gets a numbered suffix")
        void testNameCollision() throws IOException {
            DirectorySharedIndex index = new DirectorySharedIndex(tempDir.resolve("shared"));
            DownloadsPromoter promoter = new SharedIndexDownloadsPromoter(BASE_NAME, CLOCK, index);

            promoter.promote(exportFile, ExportFormat.CSV);
            promoter.promote(exportFile, ExportFormat.CSV);

            assertEquals(2, index.entries().size());
            assertEquals("favorites-export-2024-05-01_1830 (1).csv", index.entries().get(1).displayName());
            assertTrue(Files.exists(index.getRoot().resolve("Downloads")
                .resolve("favorites-export-2024-05-01_1830 (1).csv")));
        }

        @Test
        @DisplayName("A refused registration yields an empty result")
        void testRegistrationFailure() {
            SharedIndexRegistrar refusing = new SharedIndexRegistrar() {
                @NotNull
                @Override
                public URI register(@NotNull SharedIndexEntry entry) throws IOException {
                    throw new IOException("media index unavailable");
                }

                @NotNull
                @Override
                public OutputStream openOutputStream(@NotNull URI location) throws IOException {
                    throw new IOException("media index unavailable");
                }
            };
            DownloadsPromoter promoter = new SharedIndexDownloadsPromoter(BASE_NAME, CLOCK, refusing);

            assertFalse(promoter.promote(exportFile, ExportFormat.JSON).isPresent());
        }

        @Test
        @DisplayName("Writing outside the index root is refused")
        void testOutsideRoot() {
            DirectorySharedIndex index = new DirectorySharedIndex(tempDir.resolve("shared"));

            assertThrowsIo(() -> index.openOutputStream(exportFile.toUri()));
        }
    }

    private static void assertThrowsIo(IoAction action) {
        try {
            action.run().close();
        } catch (IOException e) {
            return;
        }
        throw new AssertionError("Expected IOException");
    }

    @FunctionalInterface
    private interface IoAction {
        OutputStream run() throws IOException;
    }
}
