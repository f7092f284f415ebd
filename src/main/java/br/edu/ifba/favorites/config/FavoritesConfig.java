package br.edu.ifba.favorites.config;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the saved-items repository and its exports.
 *
 * <p>Loaded from application.properties with the "favorites" prefix.
 *
 * <p>Example configuration:
 * <pre>
 * favorites.storage.sqlite.path=data/favorites.db
 * favorites.export.directory=data/exports
 * favorites.export.share-delay-ms=1500
 * favorites.downloads.era=legacy
 * favorites.downloads.directory=/home/me/Downloads
 * favorites.workers.io-threads=4
 * </pre>
 */
@ConfigMapping(prefix = "favorites")
public interface FavoritesConfig {

    StorageConfig storage();

    ExportConfig export();

    DownloadsConfig downloads();

    WorkersConfig workers();

    /**
     * SQLite store settings.
     */
    interface StorageConfig {

        SqliteConfig sqlite();

        interface SqliteConfig {

            @WithDefault("data/favorites.db")
            String path();

            @WithName("read-pool-size")
            @WithDefault("4")
            int readPoolSize();

            /**
             * @return lock wait in milliseconds
             */
            @WithName("busy-timeout")
            @WithDefault("30000")
            long busyTimeout();

            @WithName("wal-mode")
            @WithDefault("true")
            boolean walMode();
        }
    }

    /**
     * Export settings.
     */
    interface ExportConfig {

        /**
         * Private export root. Documents are written to its {@code saved} subdirectory.
         *
         * @return export root directory
         */
        @WithDefault("data/exports")
        String directory();

        /**
         * @return file name without extension, also the prefix of promoted copies
         */
        @WithName("file-name")
        @WithDefault("favorites-export")
        String fileName();

        /**
         * @return delay between a successful export and the share action, in milliseconds
         */
        @WithName("share-delay-ms")
        @WithDefault("1500")
        long shareDelayMs();

        /**
         * @return format string with one {@code %s} for the item id
         */
        @WithName("discussion-url-template")
        @WithDefault("https://news.ycombinator.com/item?id=%s")
        String discussionUrlTemplate();

        /**
         * Zone used for dates in exported documents.
         *
         * @return zone id, system default when absent
         */
        Optional<String> zone();
    }

    /**
     * Settings for promoting exports to the public Downloads collection.
     */
    interface DownloadsConfig {

        /**
         * @return modern (shared index) or legacy (direct directory)
         */
        @WithDefault("modern")
        String era();

        /**
         * Downloads directory for the legacy era.
         *
         * @return directory, {@code ~/Downloads} when absent
         */
        Optional<String> directory();

        /**
         * Root of the shared index for the modern era.
         *
         * @return shared index root directory
         */
        @WithName("shared-root")
        @WithDefault("data/shared")
        String sharedRoot();
    }

    /**
     * Background worker settings.
     */
    interface WorkersConfig {

        @WithName("io-threads")
        @WithDefault("4")
        int ioThreads();
    }
}
