package br.edu.ifba.favorites.storage.impl;

import br.edu.ifba.favorites.core.FavoriteStoreException;
import br.edu.ifba.favorites.core.SavedItem;
import br.edu.ifba.favorites.storage.SavedItemColumn;
import br.edu.ifba.favorites.storage.SavedItemRows;
import br.edu.ifba.favorites.storage.SavedItemStore;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * SQLite-based implementation of SavedItemStore.
 *
 * <p>Items live in the {@code saved_items} table, unique by {@code itemid}.
 * Query results are copied into a {@link SnapshotRows} before the connection is
 * released, so a row set never pins a pooled connection.</p>
 */
public final class SQLiteSavedItemStore implements SavedItemStore {

    private static final Logger LOG = Logger.getLogger(SQLiteSavedItemStore.class);

    private static final String SELECT_COLUMNS = "SELECT itemid, url, title, time FROM saved_items";
    private static final String ORDER_BY = " ORDER BY time DESC, id DESC";

    private final SQLiteConnectionManager connectionManager;

    /**
     * Creates a new SQLiteSavedItemStore.
     *
     * @param connectionManager the SQLite connection manager
     */
    public SQLiteSavedItemStore(SQLiteConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    /**
     * Applies pending schema migrations. Must be called before any other operation.
     */
    public void initialize() {
        Connection conn = connectionManager.getWriteConnection();
        try {
            new SQLiteSchemaMigrator().migrateToLatest(conn);
            LOG.infof("Initialized SQLiteSavedItemStore at %s", connectionManager.getDatabasePath());
        } catch (SQLException e) {
            throw new FavoriteStoreException("Failed to migrate saved-items schema", e);
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
    }

    @NotNull
    @Override
    public SavedItemRows queryAll() {
        return select(SELECT_COLUMNS + ORDER_BY, null);
    }

    @NotNull
    @Override
    public SavedItemRows queryByTitle(@NotNull String titleSubstring) {
        return select(SELECT_COLUMNS + " WHERE title LIKE ? ESCAPE '\\'" + ORDER_BY, likePattern(titleSubstring));
    }

    @Override
    public void insert(@NotNull SavedItem item) {
        String sql = """
            INSERT INTO saved_items (itemid, url, title, time)
            VALUES (?, ?, ?, ?)
            ON CONFLICT(itemid) DO UPDATE SET
                url = excluded.url,
                title = excluded.title,
                time = excluded.time
            """;

        Connection conn = connectionManager.getWriteConnection();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, item.id());
            stmt.setString(2, item.url());
            stmt.setString(3, item.title());
            stmt.setLong(4, item.savedAtEpochSeconds());
            stmt.executeUpdate();
            LOG.debugf("Saved item %s", item.id());
        } catch (SQLException e) {
            throw new FavoriteStoreException("Failed to save item: " + item.id(), e);
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
    }

    @Override
    public int deleteById(@NotNull String itemId) {
        return update("DELETE FROM saved_items WHERE itemid = ?", itemId);
    }

    @Override
    public int deleteByTitle(@NotNull String titleSubstring) {
        return update("DELETE FROM saved_items WHERE title LIKE ? ESCAPE '\\'", likePattern(titleSubstring));
    }

    @Override
    public int deleteAll() {
        int deleted = update("DELETE FROM saved_items", null);
        LOG.infof("Cleared saved items: %d deleted", deleted);
        return deleted;
    }

    @Override
    public void close() {
        LOG.info("Closed SQLiteSavedItemStore");
    }

    private SavedItemRows select(String sql, String parameter) {
        Connection conn = connectionManager.getReadConnection();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (parameter != null) {
                stmt.setString(1, parameter);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                Set<SavedItemColumn> columns = presentColumns(rs.getMetaData());
                List<Map<SavedItemColumn, String>> rows = new ArrayList<>();
                while (rs.next()) {
                    Map<SavedItemColumn, String> row = new EnumMap<>(SavedItemColumn.class);
                    for (SavedItemColumn column : columns) {
                        String value = rs.getString(column.columnName());
                        if (value != null) {
                            row.put(column, value);
                        }
                    }
                    rows.add(row);
                }
                LOG.debugf("Queried %d saved items", rows.size());
                return new SnapshotRows(columns, rows);
            }
        } catch (SQLException e) {
            throw new FavoriteStoreException("Failed to query saved items", e);
        } finally {
            connectionManager.releaseReadConnection(conn);
        }
    }

    private int update(String sql, String parameter) {
        Connection conn = connectionManager.getWriteConnection();
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (parameter != null) {
                stmt.setString(1, parameter);
            }
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new FavoriteStoreException("Failed to delete saved items", e);
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
    }

    private static Set<SavedItemColumn> presentColumns(ResultSetMetaData metaData) throws SQLException {
        Set<SavedItemColumn> columns = EnumSet.noneOf(SavedItemColumn.class);
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            String name = metaData.getColumnName(i).toLowerCase(Locale.ROOT);
            for (SavedItemColumn column : SavedItemColumn.values()) {
                if (column.columnName().equals(name)) {
                    columns.add(column);
                }
            }
        }
        return columns;
    }

    private static String likePattern(String substring) {
        String escaped = substring
            .replace("\\", "\\\\")
            .replace("%", "\\%")
            .replace("_", "\\_");
        return "%" + escaped + "%";
    }
}
