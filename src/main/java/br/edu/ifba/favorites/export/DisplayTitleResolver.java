package br.edu.ifba.favorites.export;

import br.edu.ifba.favorites.core.SavedItem;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Produces the title an item is displayed (and exported) with.
 */
@FunctionalInterface
public interface DisplayTitleResolver {

    /**
     * Uses the stored title as is.
     */
    DisplayTitleResolver STORED_TITLE = SavedItem::title;

    /**
     * @param item saved item
     * @return display title, may be null or empty when none can be derived
     */
    @Nullable
    String displayTitle(@NotNull SavedItem item);
}
