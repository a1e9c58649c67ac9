package ai.storefront.translator.store;

import ai.storefront.translator.job.Job;
import ai.storefront.translator.job.JobCounts;
import ai.storefront.translator.job.JobItem;
import ai.storefront.translator.job.JobItemStatus;
import ai.storefront.translator.job.JobStatus;
import ai.storefront.translator.job.JobStore;
import ai.storefront.translator.job.JobType;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JobStore on SQLite. Status changes are {@code UPDATE ... WHERE status = ?} so they stay atomic across
 * processes sharing the database file.
 */
public class JdbcJobStore implements JobStore {

    private static final String JOB_COLUMNS = "id, type, status, priority, source_locale, target_locales, resource_id, "
            + "total_items, completed_items, failed_items, progress, error_message, created_at, updated_at, started_at, completed_at";
    private static final String ITEM_COLUMNS = "id, job_id, resource_id, target_locale, status, retry_count, max_retries, "
            + "error_message, translated_content, provider, sequence, created_at, updated_at";
    private static final int CLAIM_ATTEMPTS = 20;

    private final SqliteDatabase database;

    public JdbcJobStore(SqliteDatabase database) {
        this.database = Objects.requireNonNull(database, "database");
    }

    @Override
    public void createJob(Job job, List<JobItem> items) {
        database.inTransaction(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO translation_jobs (" + JOB_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)")) {
                ps.setString(1, job.id());
                ps.setString(2, job.type().name());
                ps.setString(3, job.status().name());
                ps.setInt(4, job.priority());
                ps.setString(5, job.sourceLocale());
                ps.setString(6, String.join(",", job.targetLocales()));
                setNullableString(ps, 7, job.resourceId());
                ps.setInt(8, job.totalItems());
                ps.setInt(9, job.completedItems());
                ps.setInt(10, job.failedItems());
                ps.setInt(11, job.progress());
                setNullableString(ps, 12, job.errorMessage());
                ps.setLong(13, job.createdAt().toEpochMilli());
                ps.setLong(14, job.updatedAt().toEpochMilli());
                setNullableInstant(ps, 15, job.startedAt());
                setNullableInstant(ps, 16, job.completedAt());
                ps.executeUpdate();
            }
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO translation_job_items (" + ITEM_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?)")) {
                for (JobItem item : items) {
                    ps.setString(1, item.id());
                    ps.setString(2, item.jobId());
                    ps.setString(3, item.resourceId());
                    ps.setString(4, item.targetLocale());
                    ps.setString(5, item.status().name());
                    ps.setInt(6, item.retryCount());
                    ps.setInt(7, item.maxRetries());
                    setNullableString(ps, 8, item.errorMessage());
                    setNullableString(ps, 9, item.translatedContent());
                    setNullableString(ps, 10, item.provider());
                    ps.setInt(11, item.sequence());
                    ps.setLong(12, item.createdAt().toEpochMilli());
                    ps.setLong(13, item.updatedAt().toEpochMilli());
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            return null;
        });
    }

    @Override
    public Optional<Job> findJob(String jobId) {
        return database.withConnection(conn -> findJob(conn, jobId));
    }

    @Override
    public List<Job> listJobs() {
        return database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT " + JOB_COLUMNS + " FROM translation_jobs ORDER BY created_at DESC, id");
                 ResultSet rs = ps.executeQuery()) {
                List<Job> jobs = new ArrayList<>();
                while (rs.next()) {
                    jobs.add(mapJob(rs));
                }
                return jobs;
            }
        });
    }

    @Override
    public List<JobItem> findItems(String jobId) {
        return queryItems("SELECT " + ITEM_COLUMNS + " FROM translation_job_items WHERE job_id = ? ORDER BY sequence",
                jobId, null);
    }

    @Override
    public List<JobItem> findItems(String jobId, JobItemStatus status) {
        return queryItems("SELECT " + ITEM_COLUMNS
                + " FROM translation_job_items WHERE job_id = ? AND status = ? ORDER BY sequence", jobId, status);
    }

    @Override
    public Optional<JobItem> findItem(String itemId) {
        return database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT " + ITEM_COLUMNS + " FROM translation_job_items WHERE id = ?")) {
                ps.setString(1, itemId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapItem(rs)) : Optional.<JobItem>empty();
                }
            }
        });
    }

    @Override
    public Optional<Job> claimNextPendingJob(Instant now) {
        return database.withConnection(conn -> {
            for (int attempt = 0; attempt < CLAIM_ATTEMPTS; attempt++) {
                String id;
                try (PreparedStatement select = conn.prepareStatement(
                        "SELECT id FROM translation_jobs WHERE status = 'PENDING' "
                                + "ORDER BY priority DESC, created_at ASC, id ASC LIMIT 1");
                     ResultSet rs = select.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.<Job>empty();
                    }
                    id = rs.getString(1);
                }
                int updated;
                try (PreparedStatement update = conn.prepareStatement(
                        "UPDATE translation_jobs SET status = 'RUNNING', started_at = ?, updated_at = ? "
                                + "WHERE id = ? AND status = 'PENDING'")) {
                    update.setLong(1, now.toEpochMilli());
                    update.setLong(2, now.toEpochMilli());
                    update.setString(3, id);
                    updated = update.executeUpdate();
                }
                if (updated == 1) {
                    return findJob(conn, id);
                }
                // another process claimed it first
            }
            return Optional.<Job>empty();
        });
    }

    @Override
    public boolean transitionJob(String jobId, JobStatus expected, JobStatus next, Optional<String> errorMessage, Instant now) {
        String sql;
        if (next == JobStatus.RUNNING) {
            sql = "UPDATE translation_jobs SET status = ?, updated_at = ?, started_at = ?, "
                    + "error_message = COALESCE(?, error_message) WHERE id = ? AND status = ?";
        } else if (next.isTerminal()) {
            sql = "UPDATE translation_jobs SET status = ?, updated_at = ?, completed_at = ?, "
                    + "error_message = COALESCE(?, error_message) WHERE id = ? AND status = ?";
        } else {
            sql = "UPDATE translation_jobs SET status = ?, updated_at = ?, started_at = NULL, completed_at = NULL, "
                    + "cancel_requested = 0, error_message = ? WHERE id = ? AND status = ?";
        }
        boolean pending = next == JobStatus.PENDING;
        return database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                int index = 1;
                ps.setString(index++, next.name());
                ps.setLong(index++, now.toEpochMilli());
                if (!pending) {
                    ps.setLong(index++, now.toEpochMilli());
                }
                setNullableString(ps, index++, pending ? Optional.empty() : errorMessage);
                ps.setString(index++, jobId);
                ps.setString(index, expected.name());
                return ps.executeUpdate() == 1;
            }
        });
    }

    @Override
    public boolean requestCancellation(String jobId, Instant now) {
        return database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE translation_jobs SET cancel_requested = 1, updated_at = ? "
                            + "WHERE id = ? AND status IN ('PENDING', 'RUNNING')")) {
                ps.setLong(1, now.toEpochMilli());
                ps.setString(2, jobId);
                return ps.executeUpdate() == 1;
            }
        });
    }

    @Override
    public boolean isCancellationRequested(String jobId) {
        return database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT cancel_requested FROM translation_jobs WHERE id = ?")) {
                ps.setString(1, jobId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() && rs.getInt(1) == 1;
                }
            }
        });
    }

    @Override
    public boolean compareAndSetItemStatus(String itemId, JobItemStatus expected, JobItemStatus next, Instant now) {
        return database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE translation_job_items SET status = ?, updated_at = ? WHERE id = ? AND status = ?")) {
                ps.setString(1, next.name());
                ps.setLong(2, now.toEpochMilli());
                ps.setString(3, itemId);
                ps.setString(4, expected.name());
                return ps.executeUpdate() == 1;
            }
        });
    }

    @Override
    public boolean completeItem(String itemId, String translatedContent, String provider, Instant now) {
        return database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE translation_job_items SET status = 'COMPLETED', translated_content = ?, provider = ?, "
                            + "error_message = NULL, updated_at = ? WHERE id = ? AND status = 'PROCESSING'")) {
                ps.setString(1, translatedContent);
                ps.setString(2, provider);
                ps.setLong(3, now.toEpochMilli());
                ps.setString(4, itemId);
                return ps.executeUpdate() == 1;
            }
        });
    }

    @Override
    public boolean scheduleItemRetry(String itemId, int retryCount, String errorMessage, Instant now) {
        return recordFailedAttempt(itemId, JobItemStatus.PENDING, retryCount, errorMessage, now);
    }

    @Override
    public boolean failItem(String itemId, int retryCount, String errorMessage, Instant now) {
        return recordFailedAttempt(itemId, JobItemStatus.FAILED, retryCount, errorMessage, now);
    }

    @Override
    public int resetFailedItems(String jobId, Instant now) {
        return database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE translation_job_items SET status = 'PENDING', retry_count = 0, error_message = NULL, "
                            + "updated_at = ? WHERE job_id = ? AND status = 'FAILED'")) {
                ps.setLong(1, now.toEpochMilli());
                ps.setString(2, jobId);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public JobCounts countItems(String jobId) {
        return database.withConnection(conn -> countItems(conn, jobId));
    }

    @Override
    public int requeueInterruptedJobs(Instant now) {
        return database.inTransaction(conn -> {
            try (PreparedStatement items = conn.prepareStatement(
                    "UPDATE translation_job_items SET status = 'PENDING', updated_at = ? WHERE status = 'PROCESSING' "
                            + "AND job_id IN (SELECT id FROM translation_jobs WHERE status = 'RUNNING')")) {
                items.setLong(1, now.toEpochMilli());
                items.executeUpdate();
            }
            try (PreparedStatement jobs = conn.prepareStatement(
                    "UPDATE translation_jobs SET status = 'PENDING', started_at = NULL, updated_at = ? WHERE status = 'RUNNING'")) {
                jobs.setLong(1, now.toEpochMilli());
                return jobs.executeUpdate();
            }
        });
    }

    @Override
    public void updateProgress(String jobId, JobCounts counts, Instant now) {
        database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE translation_jobs SET total_items = ?, completed_items = ?, failed_items = ?, progress = ?, "
                            + "updated_at = ? WHERE id = ?")) {
                ps.setInt(1, counts.total());
                ps.setInt(2, counts.completed());
                ps.setInt(3, counts.failed());
                ps.setInt(4, counts.progress());
                ps.setLong(5, now.toEpochMilli());
                ps.setString(6, jobId);
                return ps.executeUpdate();
            }
        });
    }

    private boolean recordFailedAttempt(String itemId, JobItemStatus next, int retryCount, String errorMessage, Instant now) {
        return database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "UPDATE translation_job_items SET status = ?, retry_count = ?, error_message = ?, updated_at = ? "
                            + "WHERE id = ? AND status = 'PROCESSING'")) {
                ps.setString(1, next.name());
                ps.setInt(2, retryCount);
                ps.setString(3, errorMessage);
                ps.setLong(4, now.toEpochMilli());
                ps.setString(5, itemId);
                return ps.executeUpdate() == 1;
            }
        });
    }

    private List<JobItem> queryItems(String sql, String jobId, JobItemStatus status) {
        return database.withConnection(conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, jobId);
                if (status != null) {
                    ps.setString(2, status.name());
                }
                try (ResultSet rs = ps.executeQuery()) {
                    List<JobItem> items = new ArrayList<>();
                    while (rs.next()) {
                        items.add(mapItem(rs));
                    }
                    return items;
                }
            }
        });
    }

    private static Optional<Job> findJob(Connection conn, String jobId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT " + JOB_COLUMNS + " FROM translation_jobs WHERE id = ?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapJob(rs)) : Optional.empty();
            }
        }
    }

    private static JobCounts countItems(Connection conn, String jobId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT COUNT(*), "
                        + "COALESCE(SUM(CASE WHEN status = 'COMPLETED' THEN 1 ELSE 0 END), 0), "
                        + "COALESCE(SUM(CASE WHEN status = 'FAILED' THEN 1 ELSE 0 END), 0) "
                        + "FROM translation_job_items WHERE job_id = ?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return new JobCounts(rs.getInt(1), rs.getInt(2), rs.getInt(3));
            }
        }
    }

    private static Job mapJob(ResultSet rs) throws SQLException {
        String locales = rs.getString("target_locales");
        List<String> targetLocales = locales == null || locales.isBlank()
                ? List.of()
                : Arrays.asList(locales.split(","));
        return new Job(
                rs.getString("id"),
                JobType.valueOf(rs.getString("type")),
                JobStatus.valueOf(rs.getString("status")),
                rs.getInt("priority"),
                rs.getString("source_locale"),
                targetLocales,
                Optional.ofNullable(rs.getString("resource_id")),
                rs.getInt("total_items"),
                rs.getInt("completed_items"),
                rs.getInt("failed_items"),
                rs.getInt("progress"),
                Optional.ofNullable(rs.getString("error_message")),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                Instant.ofEpochMilli(rs.getLong("updated_at")),
                nullableInstant(rs, "started_at"),
                nullableInstant(rs, "completed_at"));
    }

    private static JobItem mapItem(ResultSet rs) throws SQLException {
        return new JobItem(
                rs.getString("id"),
                rs.getString("job_id"),
                rs.getString("resource_id"),
                rs.getString("target_locale"),
                JobItemStatus.valueOf(rs.getString("status")),
                rs.getInt("retry_count"),
                rs.getInt("max_retries"),
                Optional.ofNullable(rs.getString("error_message")),
                Optional.ofNullable(rs.getString("translated_content")),
                Optional.ofNullable(rs.getString("provider")),
                rs.getInt("sequence"),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                Instant.ofEpochMilli(rs.getLong("updated_at")));
    }

    private static Optional<Instant> nullableInstant(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? Optional.empty() : Optional.of(Instant.ofEpochMilli(value));
    }

    private static void setNullableString(PreparedStatement ps, int index, Optional<String> value) throws SQLException {
        if (value.isPresent()) {
            ps.setString(index, value.get());
        } else {
            ps.setNull(index, Types.VARCHAR);
        }
    }

    private static void setNullableInstant(PreparedStatement ps, int index, Optional<Instant> value) throws SQLException {
        if (value.isPresent()) {
            ps.setLong(index, value.get().toEpochMilli());
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }
}
