package br.edu.ifba.favorites.notify;

import br.edu.ifba.favorites.delivery.ExportReference;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Notifier that tracks each ticket and rejects out-of-order transitions.
 *
 * <p>Allowed transitions are STARTED to SUCCEEDED and STARTED to FAILED. A
 * terminal notification replaces the progress one.</p>
 *
 * <p>Running exports are tracked until they finish. Finished tickets are only
 * remembered in a bounded window of the most recent ones.</p>
 */
public class StatefulExportNotifier implements ExportNotifier {

    private static final Logger LOG = Logger.getLogger(StatefulExportNotifier.class);

    public static final int DEFAULT_FINISHED_HISTORY = 32;

    private final NotificationPresenter presenter;
    private final Map<ExportTicket, ExportStatus> running = new HashMap<>();
    private final Map<ExportTicket, ExportStatus> finished;

    public StatefulExportNotifier(@NotNull NotificationPresenter presenter) {
        this(presenter, DEFAULT_FINISHED_HISTORY);
    }

    public StatefulExportNotifier(@NotNull NotificationPresenter presenter, int finishedHistory) {
        this.presenter = Objects.requireNonNull(presenter, "presenter must not be null");
        if (finishedHistory < 0) {
            throw new IllegalArgumentException("finishedHistory must not be negative");
        }
        this.finished = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<ExportTicket, ExportStatus> eldest) {
                return size() > finishedHistory;
            }
        };
    }

    @Override
    public void started(@NotNull ExportTicket ticket) {
        synchronized (this) {
            ExportStatus previous = currentStatus(ticket);
            if (previous != null) {
                throw new IllegalStateException("Export " + ticket.id() + " already " + previous);
            }
            running.put(ticket, ExportStatus.STARTED);
        }
        presenter.present(ticket, ExportStatus.STARTED, null);
    }

    @Override
    public void succeeded(@NotNull ExportTicket ticket, @NotNull ExportReference reference) {
        finish(ticket, ExportStatus.SUCCEEDED);
        presenter.dismiss(ticket);
        presenter.present(ticket, ExportStatus.SUCCEEDED, reference);
    }

    @Override
    public void failed(@NotNull ExportTicket ticket) {
        finish(ticket, ExportStatus.FAILED);
        presenter.dismiss(ticket);
        presenter.present(ticket, ExportStatus.FAILED, null);
    }

    /**
     * @return status of a running ticket or of a recently finished one, empty if
     *         the ticket was never started or has left the finished history
     */
    @NotNull
    public synchronized Optional<ExportStatus> statusOf(@NotNull ExportTicket ticket) {
        return Optional.ofNullable(currentStatus(ticket));
    }

    /**
     * @return number of tickets currently held, running and finished
     */
    public synchronized int trackedCount() {
        return running.size() + finished.size();
    }

    private ExportStatus currentStatus(ExportTicket ticket) {
        ExportStatus status = running.get(ticket);
        return status != null ? status : finished.get(ticket);
    }

    private synchronized void finish(ExportTicket ticket, ExportStatus terminal) {
        if (running.remove(ticket) == null) {
            ExportStatus current = finished.get(ticket);
            throw new IllegalStateException("Cannot mark export " + ticket.id() + " " + terminal
                + " from " + (current != null ? current : "not started"));
        }
        finished.put(ticket, terminal);
        LOG.debugf("Export %d %s", ticket.id(), terminal);
    }
}
