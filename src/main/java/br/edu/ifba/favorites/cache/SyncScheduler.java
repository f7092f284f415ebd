package br.edu.ifba.favorites.cache;

import org.jetbrains.annotations.NotNull;

/**
 * Schedules a background refresh of a saved item's content.
 *
 * <p>Fire-and-forget: callers never observe the outcome.</p>
 */
@FunctionalInterface
public interface SyncScheduler {

    void scheduleSync(@NotNull String itemId);
}
