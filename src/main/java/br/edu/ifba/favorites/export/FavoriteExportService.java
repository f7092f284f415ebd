package br.edu.ifba.favorites.export;

import br.edu.ifba.favorites.cache.FavoriteCursor;
import br.edu.ifba.favorites.core.ExportFormat;
import br.edu.ifba.favorites.core.SavedItem;
import br.edu.ifba.favorites.delivery.DownloadsPromoter;
import br.edu.ifba.favorites.delivery.ExportDestination;
import br.edu.ifba.favorites.delivery.ExportFileWriter;
import br.edu.ifba.favorites.delivery.ExportReference;
import br.edu.ifba.favorites.delivery.ShareLauncher;
import br.edu.ifba.favorites.notify.ExportNotifier;
import br.edu.ifba.favorites.notify.ExportTicket;
import br.edu.ifba.favorites.storage.SavedItemStore;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Exports saved items to a document.
 *
 * <p>An export runs in stages: notify started, acquire the items on the worker
 * executor, serialize them, deliver the document, then notify the outcome on the
 * main executor. Any stage failing turns the whole export into a single failure;
 * the stage is only logged.</p>
 *
 * <p>After a successful share export two follow-ups start independently: the
 * file is promoted to Downloads on the worker executor, and the share action runs
 * on the main executor after a short delay. Neither can change the outcome.</p>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * service.exportToShare("kotlin", ExportFormat.MARKDOWN)
 *     .thenAccept(result -> LOG.infof("Exported %d items", result.itemCount()));
 * }</pre>
 */
public class FavoriteExportService {

    private static final Logger LOG = Logger.getLogger(FavoriteExportService.class);

    private final SavedItemStore store;
    private final FavoriteExporterFactory exporterFactory;
    private final ExportFileWriter fileWriter;
    private final DownloadsPromoter promoter;
    private final ShareLauncher shareLauncher;
    private final ExportNotifier notifier;
    private final Options options;
    private final Executor ioExecutor;
    private final Executor mainExecutor;

    public FavoriteExportService(@NotNull SavedItemStore store,
                                 @NotNull FavoriteExporterFactory exporterFactory,
                                 @NotNull ExportFileWriter fileWriter,
                                 @NotNull DownloadsPromoter promoter,
                                 @NotNull ShareLauncher shareLauncher,
                                 @NotNull ExportNotifier notifier,
                                 @NotNull Options options,
                                 @NotNull Executor ioExecutor,
                                 @NotNull Executor mainExecutor) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.exporterFactory = Objects.requireNonNull(exporterFactory, "exporterFactory must not be null");
        this.fileWriter = Objects.requireNonNull(fileWriter, "fileWriter must not be null");
        this.promoter = Objects.requireNonNull(promoter, "promoter must not be null");
        this.shareLauncher = Objects.requireNonNull(shareLauncher, "shareLauncher must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor must not be null");
        this.mainExecutor = Objects.requireNonNull(mainExecutor, "mainExecutor must not be null");
    }

    /**
     * Exports matching items to the private export file, then promotes and shares it.
     *
     * @param filter title substring, null or blank for all items
     * @param format document format
     * @return future of the outcome; never completes exceptionally while the main
     *         executor accepts work
     */
    public CompletableFuture<ExportResult> exportToShare(@Nullable String filter, @NotNull ExportFormat format) {
        ExportConfig config = newConfig(format);
        ExportTicket ticket = ExportTicket.next(format);

        return CompletableFuture
            .runAsync(() -> notifier.started(ticket), mainExecutor)
            .thenApplyAsync(v -> writeExportFile(filter, config), ioExecutor)
            .handleAsync((result, e) -> {
                if (e != null) {
                    reportFailure(ticket, e);
                    return ExportResult.failed(format);
                }
                reportSuccess(ticket, result.reference());
                try {
                    startFollowUps(result.reference());
                } catch (RuntimeException followUpError) {
                    LOG.warnf(followUpError, "Failed to start follow-ups for export %d", ticket.id());
                }
                return result;
            }, mainExecutor);
    }

    /**
     * Exports matching items to a caller-chosen destination. No promotion and no
     * share follow.
     *
     * @param filter title substring, null or blank for all items
     * @param format document format
     * @param destination where the document is written
     * @return future of true on success; never completes exceptionally while the
     *         main executor accepts work
     */
    public CompletableFuture<Boolean> exportToDestination(@Nullable String filter,
                                                          @NotNull ExportFormat format,
                                                          @NotNull ExportDestination destination) {
        Objects.requireNonNull(destination, "destination must not be null");
        ExportConfig config = newConfig(format);
        ExportTicket ticket = ExportTicket.next(format);

        return CompletableFuture
            .runAsync(() -> notifier.started(ticket), mainExecutor)
            .thenApplyAsync(v -> writeToDestination(filter, config, destination), ioExecutor)
            .handleAsync((reference, e) -> {
                if (e != null) {
                    reportFailure(ticket, e);
                    return false;
                }
                reportSuccess(ticket, reference);
                return true;
            }, mainExecutor);
    }

    private ExportResult writeExportFile(String filter, ExportConfig config) {
        try {
            List<SavedItem> items = acquire(filter, config.format());
            byte[] document = serialize(items, config);
            Path file;
            try {
                file = fileWriter.write(config.format(), document);
            } catch (IOException | RuntimeException e) {
                throw new ExportException(ExportException.Stage.DELIVER, config.format(),
                    "Failed to write export file", e);
            }
            LOG.infof("Exported %d saved items as %s to %s", items.size(), config.format(), file);
            return ExportResult.delivered(ExportReference.ofFile(file, config.format()), items.size());
        } catch (ExportException e) {
            throw new CompletionException(e);
        }
    }

    private ExportReference writeToDestination(String filter, ExportConfig config, ExportDestination destination) {
        try {
            List<SavedItem> items = acquire(filter, config.format());
            byte[] document = serialize(items, config);
            try (OutputStream out = destination.open()) {
                out.write(document);
                out.flush();
            } catch (IOException | RuntimeException e) {
                throw new ExportException(ExportException.Stage.DELIVER, config.format(),
                    "Failed to write to " + destination.location(), e);
            }
            LOG.infof("Exported %d saved items as %s to %s", items.size(), config.format(), destination.location());
            return new ExportReference(destination.location(), destination.displayName(), config.format());
        } catch (ExportException e) {
            throw new CompletionException(e);
        }
    }

    private List<SavedItem> acquire(String filter, ExportFormat format) throws ExportException {
        FavoriteCursor cursor;
        try {
            cursor = new FavoriteCursor(store.query(filter));
        } catch (RuntimeException e) {
            throw new ExportException(ExportException.Stage.ACQUIRE, format, "Failed to query saved items", e);
        }

        try (cursor) {
            if (cursor.size() == 0) {
                throw new ExportException(ExportException.Stage.ACQUIRE, format,
                    "No saved items match filter: " + filter);
            }
            return cursor.toList();
        } catch (RuntimeException e) {
            throw new ExportException(ExportException.Stage.SERIALIZE, format, "Failed to read saved items", e);
        }
    }

    private byte[] serialize(List<SavedItem> items, ExportConfig config) throws ExportException {
        try {
            return exporterFactory.getExporter(config)
                .render(items, config)
                .getBytes(StandardCharsets.UTF_8);
        } catch (RuntimeException e) {
            throw new ExportException(ExportException.Stage.SERIALIZE, config.format(),
                "Failed to serialize saved items", e);
        }
    }

    private void reportFailure(ExportTicket ticket, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
            ? error.getCause()
            : error;
        if (cause instanceof ExportException exportError) {
            LOG.errorf(exportError, "Export %d as %s failed at %s", ticket.id(), ticket.format(),
                exportError.getStage());
        } else {
            LOG.errorf(cause, "Export %d as %s failed", ticket.id(), ticket.format());
        }
        try {
            notifier.failed(ticket);
        } catch (RuntimeException notifyError) {
            LOG.warnf(notifyError, "Failed to report export %d as failed", ticket.id());
        }
    }

    private void reportSuccess(ExportTicket ticket, ExportReference reference) {
        try {
            notifier.succeeded(ticket, reference);
        } catch (RuntimeException notifyError) {
            LOG.warnf(notifyError, "Failed to report export %d as succeeded", ticket.id());
        }
    }

    private void startFollowUps(ExportReference reference) {
        reference.file().ifPresent(file ->
            CompletableFuture.runAsync(() -> promoter.promote(file, reference.format()), ioExecutor)
                .exceptionally(e -> {
                    LOG.warnf(e, "Failed to promote %s", file);
                    return null;
                }));

        Executor delayed = CompletableFuture.delayedExecutor(
            options.shareDelay().toMillis(), TimeUnit.MILLISECONDS, mainExecutor);
        CompletableFuture.runAsync(() -> shareLauncher.share(reference), delayed)
            .exceptionally(e -> {
                LOG.warnf(e, "Failed to share %s", reference.displayName());
                return null;
            });
    }

    private ExportConfig newConfig(ExportFormat format) {
        Objects.requireNonNull(format, "format must not be null");
        return ExportConfig.builder()
            .format(format)
            .discussionUrlTemplate(options.discussionUrlTemplate())
            .zone(options.zone())
            .exportedAt(options.clock().instant())
            .titleResolver(options.titleResolver())
            .build();
    }

    /**
     * Settings shared by every export of this service.
     *
     * @param discussionUrlTemplate discussion link template, see {@link ExportConfig}
     * @param zone zone dates are rendered in
     * @param clock source of export timestamps
     * @param shareDelay delay between success and the share action
     * @param titleResolver display-title source
     */
    public record Options(
        @NotNull String discussionUrlTemplate,
        @NotNull ZoneId zone,
        @NotNull Clock clock,
        @NotNull Duration shareDelay,
        @NotNull DisplayTitleResolver titleResolver
    ) {

        public static final Duration DEFAULT_SHARE_DELAY = Duration.ofMillis(1500);

        public Options {
            Objects.requireNonNull(discussionUrlTemplate, "discussionUrlTemplate must not be null");
            Objects.requireNonNull(zone, "zone must not be null");
            Objects.requireNonNull(clock, "clock must not be null");
            Objects.requireNonNull(shareDelay, "shareDelay must not be null");
            Objects.requireNonNull(titleResolver, "titleResolver must not be null");
            if (shareDelay.isNegative()) {
                throw new IllegalArgumentException("shareDelay must not be negative, got: " + shareDelay);
            }
        }

        public static Options defaults() {
            return new Options(ExportConfig.DEFAULT_DISCUSSION_URL_TEMPLATE, ZoneId.systemDefault(),
                Clock.systemDefaultZone(), DEFAULT_SHARE_DELAY, DisplayTitleResolver.STORED_TITLE);
        }

        public Options withShareDelay(@NotNull Duration delay) {
            return new Options(discussionUrlTemplate, zone, clock, delay, titleResolver);
        }

        public Options withZone(@NotNull ZoneId newZone) {
            return new Options(discussionUrlTemplate, newZone, clock, shareDelay, titleResolver);
        }

        public Options withClock(@NotNull Clock newClock) {
            return new Options(discussionUrlTemplate, zone, newClock, shareDelay, titleResolver);
        }
    }
}
