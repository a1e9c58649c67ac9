package ai.storefront.translator.store;

import ai.storefront.translator.job.StoreException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One SQLite connection shared by the JDBC stores. Access is serialized by a lock; other processes
 * using the same file are handled by WAL mode and the busy timeout.
 */
public class SqliteDatabase implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(SqliteDatabase.class);
    private static final int BUSY_TIMEOUT_MILLIS = 5000;

    private static final List<String> SCHEMA = List.of(
            "CREATE TABLE IF NOT EXISTS translation_jobs ("
                    + "id TEXT PRIMARY KEY, "
                    + "type TEXT NOT NULL, "
                    + "status TEXT NOT NULL, "
                    + "priority INTEGER NOT NULL DEFAULT 0, "
                    + "source_locale TEXT NOT NULL, "
                    + "target_locales TEXT NOT NULL, "
                    + "resource_id TEXT, "
                    + "total_items INTEGER NOT NULL DEFAULT 0, "
                    + "completed_items INTEGER NOT NULL DEFAULT 0, "
                    + "failed_items INTEGER NOT NULL DEFAULT 0, "
                    + "progress INTEGER NOT NULL DEFAULT 0, "
                    + "error_message TEXT, "
                    + "created_at INTEGER NOT NULL, "
                    + "updated_at INTEGER NOT NULL, "
                    + "started_at INTEGER, "
                    + "completed_at INTEGER, "
                    + "cancel_requested INTEGER NOT NULL DEFAULT 0)",
            "CREATE INDEX IF NOT EXISTS idx_jobs_claim ON translation_jobs (status, priority DESC, created_at, id)",
            "CREATE TABLE IF NOT EXISTS translation_job_items ("
                    + "id TEXT PRIMARY KEY, "
                    + "job_id TEXT NOT NULL REFERENCES translation_jobs(id), "
                    + "resource_id TEXT NOT NULL, "
                    + "target_locale TEXT NOT NULL, "
                    + "status TEXT NOT NULL, "
                    + "retry_count INTEGER NOT NULL DEFAULT 0, "
                    + "max_retries INTEGER NOT NULL DEFAULT 3, "
                    + "error_message TEXT, "
                    + "translated_content TEXT, "
                    + "provider TEXT, "
                    + "sequence INTEGER NOT NULL, "
                    + "created_at INTEGER NOT NULL, "
                    + "updated_at INTEGER NOT NULL)",
            "CREATE INDEX IF NOT EXISTS idx_items_job ON translation_job_items (job_id, sequence)",
            "CREATE TABLE IF NOT EXISTS translations ("
                    + "source_hash TEXT NOT NULL, "
                    + "target_locale TEXT NOT NULL, "
                    + "translated_text TEXT NOT NULL, "
                    + "provider TEXT NOT NULL, "
                    + "model TEXT, "
                    + "resource_id TEXT, "
                    + "source_locale TEXT, "
                    + "created_at INTEGER NOT NULL, "
                    + "UNIQUE (source_hash, target_locale))",
            "CREATE TABLE IF NOT EXISTS resources ("
                    + "id TEXT PRIMARY KEY, "
                    + "locale TEXT NOT NULL, "
                    + "title TEXT, "
                    + "content TEXT NOT NULL, "
                    + "content_hash TEXT NOT NULL, "
                    + "updated_at INTEGER NOT NULL)",
            "CREATE INDEX IF NOT EXISTS idx_resources_locale ON resources (locale, id)");

    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection connection) throws SQLException;
    }

    private final Path path;
    private final Connection connection;
    private final ReentrantLock lock = new ReentrantLock();

    private SqliteDatabase(Path path, Connection connection) {
        this.path = path;
        this.connection = connection;
    }

    /**
     * Opens (creating if needed) the database file and applies the schema.
     */
    public static SqliteDatabase open(Path path) {
        Objects.requireNonNull(path, "path");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException ex) {
            throw new StoreException("Cannot create directory for " + path, ex);
        }
        try {
            Connection connection = DriverManager.getConnection("jdbc:sqlite:" + path.toAbsolutePath());
            try (Statement statement = connection.createStatement()) {
                statement.execute("PRAGMA journal_mode=WAL");
                statement.execute("PRAGMA foreign_keys=ON");
                statement.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MILLIS);
                for (String ddl : SCHEMA) {
                    statement.executeUpdate(ddl);
                }
                addColumnIfMissing(statement, "translation_jobs", "cancel_requested", "INTEGER NOT NULL DEFAULT 0");
            }
            LOGGER.debug("Opened SQLite database {}", path.toAbsolutePath());
            return new SqliteDatabase(path, connection);
        } catch (SQLException ex) {
            throw new StoreException("Cannot open SQLite database " + path, ex);
        }
    }

    public <T> T withConnection(SqlWork<T> work) {
        lock.lock();
        try {
            return work.apply(connection);
        } catch (SQLException ex) {
            throw new StoreException("SQLite operation failed on " + path, ex);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code work} in one transaction, rolling back when it throws.
     */
    public <T> T inTransaction(SqlWork<T> work) {
        return withConnection(conn -> {
            conn.setAutoCommit(false);
            try {
                T result = work.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException ex) {
                conn.rollback();
                throw ex;
            } finally {
                conn.setAutoCommit(true);
            }
        });
    }

    // files created before the column existed
    private static void addColumnIfMissing(Statement statement, String table, String column, String definition)
            throws SQLException {
        try (ResultSet rs = statement.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                if (column.equalsIgnoreCase(rs.getString("name"))) {
                    return;
                }
            }
        }
        statement.executeUpdate("ALTER TABLE " + table + " ADD COLUMN " + column + " " + definition);
    }

    public Path path() {
        return path;
    }

    @Override
    public void close() {
        lock.lock();
        try {
            connection.close();
        } catch (SQLException ex) {
            throw new StoreException("Cannot close SQLite database " + path, ex);
        } finally {
            lock.unlock();
        }
    }
}
