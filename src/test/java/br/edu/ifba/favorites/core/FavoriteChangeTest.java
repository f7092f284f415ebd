package br.edu.ifba.favorites.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for FavoriteChange and SavedItem.
 */
class FavoriteChangeTest {

    @Test
    void testPaths() {
        assertEquals("saved/add/42", FavoriteChange.added("42").path());
        assertEquals("saved/remove/42", FavoriteChange.removed("42", 1).path());
        assertEquals("saved/clear", FavoriteChange.cleared(3).path());
    }

    @Test
    void testPathPredicates() {
        String added = FavoriteChange.added("7").path();
        String removed = FavoriteChange.removed("7", 1).path();
        String cleared = FavoriteChange.cleared(0).path();

        assertTrue(FavoriteChange.isAdded(added));
        assertFalse(FavoriteChange.isAdded(removed));
        assertTrue(FavoriteChange.isRemoved(removed));
        assertFalse(FavoriteChange.isRemoved(cleared));
        assertTrue(FavoriteChange.isCleared(cleared));
        assertFalse(FavoriteChange.isCleared(null));
    }

    @Test
    void testClearedCarriesCountButNoId() {
        FavoriteChange change = FavoriteChange.cleared(5);
        assertEquals(FavoriteChange.Kind.CLEARED, change.kind());
        assertEquals(5, change.deletedCount());
        assertNull(change.itemId());
    }

    @Test
    void testItemChangesRequireId() {
        assertThrows(IllegalArgumentException.class,
            () -> new FavoriteChange(FavoriteChange.Kind.ADDED, "", 0));
        assertThrows(IllegalArgumentException.class,
            () -> new FavoriteChange(FavoriteChange.Kind.REMOVED, null, 1));
    }

    @Test
    void testSavedItemNormalizesAndFallsBack() {
        SavedItem noTitle = SavedItem.of("1", "http://a", null, 0);
        assertEquals("", noTitle.title(), "Null title should be normalized");
        assertEquals("http://a", noTitle.displayTitle(), "Display title should fall back to URL");

        SavedItem bare = SavedItem.of("2", null, " ", 0);
        assertEquals("2", bare.displayTitle(), "Display title should fall back to id");

        assertThrows(IllegalArgumentException.class, () -> SavedItem.of("", "http://a", "A", 0));
    }
}
