package br.edu.ifba.favorites.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import br.edu.ifba.favorites.core.MissingColumnException;
import br.edu.ifba.favorites.core.SavedItem;
import br.edu.ifba.favorites.storage.SavedItemColumn;
import br.edu.ifba.favorites.storage.impl.SnapshotRows;

class FavoriteCursorTest {

    private static Map<SavedItemColumn, String> row(String id, String url) {
        Map<SavedItemColumn, String> row = new EnumMap<>(SavedItemColumn.class);
        row.put(SavedItemColumn.ITEM_ID, id);
        row.put(SavedItemColumn.URL, url);
        return row;
    }

    @Nested
    @DisplayName("Positioned reads")
    class PositionedReads {

        @Test
        @DisplayName("itemAt returns items in order and empty outside the range")
        void testItemAt() {
            List<SavedItem> items = List.of(
                SavedItem.of("1", "http://a", "A", 20),
                SavedItem.of("2", "http://b", "B", 10));

            try (FavoriteCursor cursor = new FavoriteCursor(SnapshotRows.of(items))) {
                assertEquals(2, cursor.size());
                assertEquals(items.get(1), cursor.itemAt(1).orElseThrow());
                assertEquals(items.get(0), cursor.itemAt(0).orElseThrow());
                assertTrue(cursor.itemAt(2).isEmpty(), "Position past the end should be empty");
                assertTrue(cursor.itemAt(-1).isEmpty(), "Negative position should be empty");
            }
        }

        @Test
        @DisplayName("toList walks every row")
        void testToList() {
            List<SavedItem> items = List.of(
                SavedItem.of("1", "http://a", "A", 3),
                SavedItem.of("2", "http://b", "B", 2),
                SavedItem.of("3", "http://c", "C", 1));

            try (FavoriteCursor cursor = new FavoriteCursor(SnapshotRows.of(items))) {
                assertEquals(items, cursor.toList());
            }
        }

        @Test
        @DisplayName("Empty cursor has no first row")
        void testEmpty() {
            try (FavoriteCursor cursor = new FavoriteCursor(SnapshotRows.of(List.of()))) {
                assertEquals(0, cursor.size());
                assertFalse(cursor.moveToFirst());
                assertTrue(cursor.toList().isEmpty());
            }
        }
    }

    @Nested
    @DisplayName("Missing columns")
    class MissingColumns {

        @Test
        @DisplayName("Missing optional columns read as empty title and zero time")
        void testOptionalColumnsDefault() {
            SnapshotRows rows = new SnapshotRows(
                EnumSet.of(SavedItemColumn.ITEM_ID, SavedItemColumn.URL),
                List.of(row("1", "http://a")));

            try (FavoriteCursor cursor = new FavoriteCursor(rows)) {
                SavedItem item = cursor.itemAt(0).orElseThrow();
                assertEquals("", item.title());
                assertEquals(0L, item.savedAtEpochSeconds());
            }
        }

        @Test
        @DisplayName("Missing required column fails with the column name")
        void testRequiredColumnMissing() {
            Map<SavedItemColumn, String> row = new EnumMap<>(SavedItemColumn.class);
            row.put(SavedItemColumn.ITEM_ID, "1");
            SnapshotRows rows = new SnapshotRows(EnumSet.of(SavedItemColumn.ITEM_ID), List.of(row));

            try (FavoriteCursor cursor = new FavoriteCursor(rows)) {
                assertTrue(cursor.moveToFirst());
                MissingColumnException error = assertThrows(MissingColumnException.class, cursor::current);
                assertEquals("url", error.getColumn());
            }
        }
    }

    @Test
    @DisplayName("Closing the cursor closes its rows")
    void testCloseReleasesRows() {
        SnapshotRows rows = SnapshotRows.of(List.of(SavedItem.of("1", "http://a", "A", 1)));
        FavoriteCursor cursor = new FavoriteCursor(rows);

        cursor.close();

        assertTrue(rows.isClosed());
        assertThrows(IllegalStateException.class, cursor::size, "Closed rows should reject reads");
    }

    @Test
    @DisplayName("Reading before positioning fails")
    void testReadBeforePositioning() {
        SnapshotRows rows = SnapshotRows.of(List.of(SavedItem.of("1", "http://a", "A", 1)));
        assertThrows(IllegalStateException.class, () -> rows.getRequiredString(SavedItemColumn.ITEM_ID));
    }
}
