package br.edu.ifba.favorites.storage.impl;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

/**
 * Applies the saved-items schema migrations.
 *
 * <p>Migrations are SQL files on the classpath under {@code /db/migrations/},
 * named {@code V{version}__{description}.sql}, applied in version order. The
 * applied version is recorded in the {@code schema_version} table.</p>
 */
public final class SQLiteSchemaMigrator {

    private static final Logger LOG = Logger.getLogger(SQLiteSchemaMigrator.class);

    private static final String MIGRATION_PATH = "/db/migrations/";

    private final List<Migration> migrations;

    public SQLiteSchemaMigrator() {
        this.migrations = List.of(
            new Migration(1, "Saved items table", MIGRATION_PATH + "V001__saved_items.sql"));
    }

    /**
     * Gets the current schema version.
     *
     * @param conn database connection
     * @return current version number, 0 if the schema was never migrated
     * @throws SQLException if the version cannot be read
     */
    public int getCurrentVersion(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS schema_version (
                    version INTEGER PRIMARY KEY,
                    description TEXT NOT NULL,
                    applied_at TEXT NOT NULL DEFAULT (datetime('now'))
                )
                """);
            try (ResultSet rs = stmt.executeQuery("SELECT MAX(version) FROM schema_version")) {
                if (rs.next()) {
                    int version = rs.getInt(1);
                    return rs.wasNull() ? 0 : version;
                }
                return 0;
            }
        }
    }

    /**
     * Applies all pending migrations in one transaction.
     *
     * @param conn database connection
     * @throws SQLException if a migration fails; nothing is applied in that case
     */
    public void migrateToLatest(Connection conn) throws SQLException {
        int currentVersion = getCurrentVersion(conn);
        LOG.infof("Current saved-items schema version: %d", currentVersion);

        boolean autoCommit = conn.getAutoCommit();
        try {
            conn.setAutoCommit(false);

            for (Migration migration : migrations) {
                if (migration.version() > currentVersion) {
                    LOG.infof("Applying migration V%03d: %s", migration.version(), migration.description());
                    migration.apply(conn);
                }
            }

            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    public int getLatestVersion() {
        return migrations.get(migrations.size() - 1).version();
    }

    /**
     * A migration backed by a classpath SQL resource.
     */
    private record Migration(int version, String description, String resourcePath) {

        void apply(Connection conn) throws SQLException {
            try (Statement stmt = conn.createStatement()) {
                for (String statement : splitStatements(loadResource())) {
                    LOG.tracef("Executing: %s", statement);
                    stmt.execute(statement);
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement(
                    "INSERT INTO schema_version (version, description) VALUES (?, ?)")) {
                stmt.setInt(1, version);
                stmt.setString(2, description);
                stmt.executeUpdate();
            }
        }

        private String loadResource() {
            InputStream is = SQLiteSchemaMigrator.class.getResourceAsStream(resourcePath);
            if (is == null) {
                throw new IllegalStateException("Migration resource not found: " + resourcePath);
            }

            try (BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return reader.lines()
                    .filter(line -> !line.trim().startsWith("--"))
                    .collect(Collectors.joining("\n"));
            } catch (Exception e) {
                throw new IllegalStateException("Failed to load migration: " + resourcePath, e);
            }
        }

        private static List<String> splitStatements(String sql) {
            List<String> statements = new ArrayList<>();
            for (String part : sql.split(";")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    statements.add(trimmed);
                }
            }
            return statements;
        }
    }
}
