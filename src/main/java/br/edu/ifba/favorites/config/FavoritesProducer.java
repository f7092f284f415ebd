package br.edu.ifba.favorites.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.jboss.logging.Logger;

import br.edu.ifba.favorites.cache.FavoriteManager;
import br.edu.ifba.favorites.cache.InMemoryFavoriteCache;
import br.edu.ifba.favorites.cache.LatestChangeSink;
import br.edu.ifba.favorites.cache.LoggingSyncScheduler;
import br.edu.ifba.favorites.delivery.DirectorySharedIndex;
import br.edu.ifba.favorites.delivery.DownloadsDirectoryResolver;
import br.edu.ifba.favorites.delivery.DownloadsPromoter;
import br.edu.ifba.favorites.delivery.ExportFileWriter;
import br.edu.ifba.favorites.delivery.LoggingShareLauncher;
import br.edu.ifba.favorites.delivery.StorageEra;
import br.edu.ifba.favorites.export.DisplayTitleResolver;
import br.edu.ifba.favorites.export.FavoriteExportService;
import br.edu.ifba.favorites.export.FavoriteExporterFactory;
import br.edu.ifba.favorites.notify.LoggingNotificationPresenter;
import br.edu.ifba.favorites.notify.StatefulExportNotifier;
import br.edu.ifba.favorites.storage.SavedItemStore;
import br.edu.ifba.favorites.storage.impl.SQLiteConnectionManager;
import br.edu.ifba.favorites.storage.impl.SQLiteSavedItemStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

/**
 * CDI producer that wires the saved-items repository and export service.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Opens the SQLite store and runs schema migrations on startup</li>
 *   <li>Owns the worker pool and the single-threaded main executor</li>
 *   <li>Produces {@link FavoriteManager} and {@link FavoriteExportService} for injection</li>
 * </ul>
 *
 * <p>Example configuration:</p>
 * <pre>
 * favorites.storage.sqlite.path=data/favorites.db
 * favorites.downloads.era=modern
 * </pre>
 */
@ApplicationScoped
public class FavoritesProducer {

    private static final Logger LOG = Logger.getLogger(FavoritesProducer.class);

    @Inject
    FavoritesConfig config;

    @Inject
    FavoriteExporterFactory exporterFactory;

    private SQLiteConnectionManager connectionManager;
    private SQLiteSavedItemStore store;
    private ExecutorService ioExecutor;
    private ExecutorService mainExecutor;
    private LatestChangeSink changeSink;
    private FavoriteManager favoriteManager;
    private FavoriteExportService exportService;

    /**
     * Opens the store and starts the executors on application startup.
     */
    @PostConstruct
    void initialize() {
        FavoritesConfig.StorageConfig.SqliteConfig sqlite = config.storage().sqlite();
        LOG.infof("Initializing saved-items store with database: %s", sqlite.path());

        createParentDirectories(Path.of(sqlite.path()));
        connectionManager = new SQLiteConnectionManager(
            sqlite.path(),
            Duration.ofMillis(sqlite.busyTimeout()),
            sqlite.walMode(),
            sqlite.readPoolSize()
        );
        store = new SQLiteSavedItemStore(connectionManager);
        store.initialize();

        ioExecutor = Executors.newFixedThreadPool(config.workers().ioThreads(), namedThreads("favorites-io"));
        mainExecutor = Executors.newSingleThreadExecutor(namedThreads("favorites-main"));
        changeSink = new LatestChangeSink();

        LOG.info("Saved-items store initialized successfully");
    }

    /**
     * Stops the executors and closes the store on application shutdown.
     */
    @PreDestroy
    void shutdown() {
        LOG.info("Shutting down saved-items store");

        if (favoriteManager != null) {
            favoriteManager.close();
        }
        shutdownExecutor(mainExecutor);
        shutdownExecutor(ioExecutor);
        if (store != null) {
            store.close();
        }
        if (connectionManager != null) {
            connectionManager.close();
        }
    }

    @Produces
    @ApplicationScoped
    public SavedItemStore produceSavedItemStore() {
        return store;
    }

    @Produces
    @ApplicationScoped
    public LatestChangeSink produceChangeSink() {
        return changeSink;
    }

    /**
     * Produces the manager, with its membership cache primed from the store.
     *
     * @return FavoriteManager instance
     */
    @Produces
    @ApplicationScoped
    public synchronized FavoriteManager produceFavoriteManager() {
        if (favoriteManager == null) {
            favoriteManager = new FavoriteManager(store, new InMemoryFavoriteCache(), new LoggingSyncScheduler(),
                changeSink, ioExecutor, mainExecutor);
            favoriteManager.primeCache().join();
            LOG.info("Created FavoriteManager instance");
        }
        return favoriteManager;
    }

    /**
     * Produces the export service.
     *
     * @return FavoriteExportService instance
     */
    @Produces
    @ApplicationScoped
    public synchronized FavoriteExportService produceExportService() {
        if (exportService == null) {
            FavoritesConfig.ExportConfig export = config.export();
            Path exportDir = Path.of(export.directory()).resolve("saved");
            Clock clock = Clock.systemDefaultZone();
            ZoneId zone = export.zone().map(ZoneId::of).orElse(ZoneId.systemDefault());

            FavoriteExportService.Options options = new FavoriteExportService.Options(
                export.discussionUrlTemplate(),
                zone,
                clock,
                Duration.ofMillis(export.shareDelayMs()),
                DisplayTitleResolver.STORED_TITLE);

            exportService = new FavoriteExportService(
                store,
                exporterFactory,
                new ExportFileWriter(exportDir, export.fileName()),
                createPromoter(export.fileName(), clock),
                new LoggingShareLauncher(),
                new StatefulExportNotifier(new LoggingNotificationPresenter()),
                options,
                ioExecutor,
                mainExecutor);
            LOG.infof("Created FavoriteExportService writing to %s", exportDir);
        }
        return exportService;
    }

    private DownloadsPromoter createPromoter(String baseName, Clock clock) {
        FavoritesConfig.DownloadsConfig downloads = config.downloads();
        StorageEra era = StorageEra.fromString(downloads.era());
        DownloadsDirectoryResolver resolver = downloads.directory()
            .map(dir -> DownloadsDirectoryResolver.of(Path.of(dir)))
            .orElseGet(DownloadsDirectoryResolver::userHome);
        LOG.infof("Exports are promoted to Downloads using the %s storage era", era);
        return DownloadsPromoter.forEra(era, baseName, clock,
            new DirectorySharedIndex(Path.of(downloads.sharedRoot())), resolver);
    }

    private static void createParentDirectories(Path file) {
        Path parent = file.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new RuntimeException("Failed to create database directory: " + parent, e);
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return task -> {
            Thread thread = new Thread(task, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static void shutdownExecutor(ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Executor did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
