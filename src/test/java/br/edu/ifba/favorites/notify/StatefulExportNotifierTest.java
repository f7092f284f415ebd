package br.edu.ifba.favorites.notify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import br.edu.ifba.favorites.core.ExportFormat;
import br.edu.ifba.favorites.delivery.ExportReference;

class StatefulExportNotifierTest {

    private final ExportReference reference =
        new ExportReference(URI.create("file:///tmp/favorites-export.csv"), "favorites-export.csv", ExportFormat.CSV);

    private RecordingPresenter presenter;
    private StatefulExportNotifier notifier;

    @BeforeEach
    void setUp() {
        presenter = new RecordingPresenter();
        notifier = new StatefulExportNotifier(presenter);
    }

    @Test
    @DisplayName("Success replaces the progress notification")
    void testSuccess() {
        ExportTicket ticket = ExportTicket.next(ExportFormat.CSV);

        notifier.started(ticket);
        notifier.succeeded(ticket, reference);

        assertEquals(List.of("present STARTED", "dismiss", "present SUCCEEDED favorites-export.csv"), presenter.calls);
        assertEquals(ExportStatus.SUCCEEDED, notifier.statusOf(ticket).orElseThrow());
    }

    @Test
    @DisplayName("Failure replaces the progress notification")
    void testFailure() {
        ExportTicket ticket = ExportTicket.next(ExportFormat.JSON);

        notifier.started(ticket);
        notifier.failed(ticket);

        assertEquals(List.of("present STARTED", "dismiss", "present FAILED"), presenter.calls);
        assertEquals(ExportStatus.FAILED, notifier.statusOf(ticket).orElseThrow());
    }

    @Test
    @DisplayName("Terminal states require a started ticket")
    void testTerminalWithoutStart() {
        ExportTicket ticket = ExportTicket.next(ExportFormat.CSV);

        assertThrows(IllegalStateException.class, () -> notifier.succeeded(ticket, reference));
        assertThrows(IllegalStateException.class, () -> notifier.failed(ticket));
        assertTrue(notifier.statusOf(ticket).isEmpty());
        assertTrue(presenter.calls.isEmpty(), "Nothing should be presented");
    }

    @Test
    @DisplayName("A ticket finishes only once")
    void testSingleTerminalState() {
        ExportTicket ticket = ExportTicket.next(ExportFormat.CSV);
        notifier.started(ticket);
        notifier.succeeded(ticket, reference);

        assertThrows(IllegalStateException.class, () -> notifier.failed(ticket));
        assertThrows(IllegalStateException.class, () -> notifier.started(ticket));
        assertEquals(ExportStatus.SUCCEEDED, notifier.statusOf(ticket).orElseThrow());
    }

    @Test
    @DisplayName("Tickets are tracked independently")
    void testIndependentTickets() {
        ExportTicket csv = ExportTicket.next(ExportFormat.CSV);
        ExportTicket json = ExportTicket.next(ExportFormat.JSON);

        notifier.started(csv);
        notifier.started(json);
        notifier.failed(json);
        notifier.succeeded(csv, reference);

        assertEquals(ExportStatus.SUCCEEDED, notifier.statusOf(csv).orElseThrow());
        assertEquals(ExportStatus.FAILED, notifier.statusOf(json).orElseThrow());
    }

    @Test
    @DisplayName("Finished tickets are forgotten beyond the history window")
    void testFinishedHistoryIsBounded() {
        StatefulExportNotifier bounded = new StatefulExportNotifier(presenter, 4);
        ExportTicket first = ExportTicket.next(ExportFormat.CSV);
        bounded.started(first);
        bounded.succeeded(first, reference);

        ExportTicket last = first;
        for (int i = 0; i < 10_000; i++) {
            last = ExportTicket.next(ExportFormat.CSV);
            bounded.started(last);
            bounded.succeeded(last, reference);
        }

        assertEquals(4, bounded.trackedCount());
        assertTrue(bounded.statusOf(first).isEmpty());
        assertEquals(ExportStatus.SUCCEEDED, bounded.statusOf(last).orElseThrow());
    }

    @Test
    @DisplayName("Running tickets stay tracked regardless of the history window")
    void testRunningTicketsKept() {
        StatefulExportNotifier noHistory = new StatefulExportNotifier(presenter, 0);
        ExportTicket running = ExportTicket.next(ExportFormat.HTML);
        ExportTicket done = ExportTicket.next(ExportFormat.TXT);

        noHistory.started(running);
        noHistory.started(done);
        noHistory.failed(done);

        assertEquals(1, noHistory.trackedCount());
        assertEquals(ExportStatus.STARTED, noHistory.statusOf(running).orElseThrow());
        assertTrue(noHistory.statusOf(done).isEmpty());
        noHistory.succeeded(running, reference);
        assertEquals(0, noHistory.trackedCount());
    }

    private static final class RecordingPresenter implements NotificationPresenter {
        final List<String> calls = new ArrayList<>();

        @Override
        public void present(@NotNull ExportTicket ticket, @NotNull ExportStatus status,
                            @Nullable ExportReference reference) {
            calls.add("present " + status + (reference != null ? " " + reference.displayName() : ""));
        }

        @Override
        public void dismiss(@NotNull ExportTicket ticket) {
            calls.add("dismiss");
        }
    }
}
