package br.edu.ifba.favorites.delivery;

import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Share launcher for hosts without a share flow: logs where the export is.
 */
public class LoggingShareLauncher implements ShareLauncher {

    private static final Logger LOG = Logger.getLogger(LoggingShareLauncher.class);

    @Override
    public void share(@NotNull ExportReference reference) {
        LOG.infof("Export ready to share: %s (%s, %s)",
            reference.displayName(), reference.mimeType(), reference.location());
    }
}
