package br.edu.ifba.favorites.storage.impl;

import br.edu.ifba.favorites.core.SavedItem;
import br.edu.ifba.favorites.storage.SavedItemRows;
import br.edu.ifba.favorites.storage.SavedItemStore;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * In-memory implementation of SavedItemStore.
 * Data is not persisted - it only exists while the instance is alive.
 */
public class InMemorySavedItemStore implements SavedItemStore {

    private static final Logger LOG = Logger.getLogger(InMemorySavedItemStore.class);

    private static final Comparator<Entry> NEWEST_FIRST = Comparator
        .comparingLong((Entry e) -> e.item().savedAtEpochSeconds())
        .thenComparingLong(Entry::sequence)
        .reversed();

    private final Map<String, Entry> items = new LinkedHashMap<>();
    private long sequence = 0;

    @NotNull
    @Override
    public synchronized SavedItemRows queryAll() {
        return snapshot(entry -> true);
    }

    @NotNull
    @Override
    public synchronized SavedItemRows queryByTitle(@NotNull String titleSubstring) {
        return snapshot(titleContains(titleSubstring));
    }

    @Override
    public synchronized void insert(@NotNull SavedItem item) {
        items.put(item.id(), new Entry(item, ++sequence));
        LOG.debugf("Saved item %s", item.id());
    }

    @Override
    public synchronized int deleteById(@NotNull String itemId) {
        return items.remove(itemId) != null ? 1 : 0;
    }

    @Override
    public synchronized int deleteByTitle(@NotNull String titleSubstring) {
        Predicate<Entry> matches = titleContains(titleSubstring);
        int before = items.size();
        items.values().removeIf(matches);
        return before - items.size();
    }

    @Override
    public synchronized int deleteAll() {
        int deleted = items.size();
        items.clear();
        return deleted;
    }

    @Override
    public void close() {
        LOG.debug("Closed InMemorySavedItemStore");
    }

    private SnapshotRows snapshot(Predicate<Entry> filter) {
        List<SavedItem> result = new ArrayList<>();
        items.values().stream()
            .filter(filter)
            .sorted(NEWEST_FIRST)
            .forEach(entry -> result.add(entry.item()));
        return SnapshotRows.of(result);
    }

    private static Predicate<Entry> titleContains(String substring) {
        String needle = substring.toLowerCase(Locale.ROOT);
        return entry -> entry.item().title().toLowerCase(Locale.ROOT).contains(needle);
    }

    private record Entry(SavedItem item, long sequence) {
    }
}
