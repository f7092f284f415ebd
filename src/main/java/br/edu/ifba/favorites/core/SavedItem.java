package br.edu.ifba.favorites.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A saved item (favorite) as persisted by the saved-items store.
 *
 * <p>Only the fields needed for listing and export are kept: the stable item id,
 * the canonical URL, the title and the time the item was saved.</p>
 *
 * @param id stable identifier of the saved item, never empty
 * @param url canonical resource location
 * @param title item title, empty when unknown
 * @param savedAtEpochSeconds time the item was saved, in seconds since the epoch
 */
public record SavedItem(
    @NotNull String id,
    @NotNull String url,
    @NotNull String title,
    long savedAtEpochSeconds
) {

    /**
     * Compact constructor with validation.
     */
    public SavedItem {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isEmpty()) {
            throw new IllegalArgumentException("id must not be empty");
        }
        url = url != null ? url : "";
        title = title != null ? title : "";
    }

    /**
     * Creates a saved item, tolerating a missing url or title.
     *
     * @param id item id
     * @param url item url, may be null
     * @param title item title, may be null
     * @param savedAtEpochSeconds saved time in epoch seconds
     * @return new SavedItem
     */
    public static SavedItem of(@NotNull String id, @Nullable String url, @Nullable String title,
                               long savedAtEpochSeconds) {
        return new SavedItem(id, url, title, savedAtEpochSeconds);
    }

    /**
     * Title to show for this item: the title, or the URL, or the id when both are empty.
     *
     * @return non-empty display title
     */
    @NotNull
    public String displayTitle() {
        if (!title.isBlank()) {
            return title;
        }
        if (!url.isBlank()) {
            return url;
        }
        return id;
    }
}
