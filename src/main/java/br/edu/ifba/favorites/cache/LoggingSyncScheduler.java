package br.edu.ifba.favorites.cache;

import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * SyncScheduler used when no content sync backend is configured.
 */
public class LoggingSyncScheduler implements SyncScheduler {

    private static final Logger LOG = Logger.getLogger(LoggingSyncScheduler.class);

    @Override
    public void scheduleSync(@NotNull String itemId) {
        LOG.infof("Content sync requested for saved item %s (no sync backend configured)", itemId);
    }
}
