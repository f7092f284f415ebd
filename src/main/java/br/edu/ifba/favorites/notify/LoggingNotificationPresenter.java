package br.edu.ifba.favorites.notify;

import br.edu.ifba.favorites.delivery.ExportReference;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Presents export notifications as log lines.
 */
public class LoggingNotificationPresenter implements NotificationPresenter {

    private static final Logger LOG = Logger.getLogger(LoggingNotificationPresenter.class);

    @Override
    public void present(@NotNull ExportTicket ticket, @NotNull ExportStatus status,
                        @Nullable ExportReference reference) {
        switch (status) {
            case STARTED -> LOG.infof("Exporting saved stories as %s...", ticket.format());
            case SUCCEEDED -> LOG.infof("Export complete: %s",
                reference != null ? reference.displayName() : ticket.format());
            case FAILED -> LOG.warnf("Export as %s failed", ticket.format());
        }
    }

    @Override
    public void dismiss(@NotNull ExportTicket ticket) {
        LOG.debugf("Dismissed export notification %d", ticket.id());
    }
}
