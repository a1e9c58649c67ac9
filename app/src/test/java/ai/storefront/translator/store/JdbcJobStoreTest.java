package ai.storefront.translator.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.storefront.translator.job.Job;
import ai.storefront.translator.job.JobItem;
import ai.storefront.translator.job.JobStatus;
import ai.storefront.translator.job.JobStore;
import ai.storefront.translator.job.JobStoreContract;
import ai.storefront.translator.job.JobType;
import ai.storefront.translator.job.StoreException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JdbcJobStoreTest extends JobStoreContract {

    @TempDir
    Path tempDir;

    private SqliteDatabase database;

    @Override
    protected JobStore createStore() {
        database = SqliteDatabase.open(tempDir.resolve("jobs.db"));
        return new JdbcJobStore(database);
    }

    @AfterEach
    void closeDatabase() {
        database.close();
    }

    @Test
    void jobsSurviveReopen() {
        Job job = insertJob("job_a", 3, T0, List.of("fr", "ja"), "res1");
        store.claimNextPendingJob(T0.plusSeconds(1));
        database.close();

        database = SqliteDatabase.open(tempDir.resolve("jobs.db"));
        JdbcJobStore reopened = new JdbcJobStore(database);

        Job loaded = reopened.findJob("job_a").orElseThrow();
        assertThat(loaded.status()).isEqualTo(JobStatus.RUNNING);
        assertThat(loaded.targetLocales()).containsExactly("fr", "ja");
        assertThat(loaded.priority()).isEqualTo(3);
        assertThat(loaded.createdAt()).isEqualTo(job.createdAt());
        assertThat(loaded.startedAt()).contains(T0.plusSeconds(1));
        assertThat(reopened.findItems("job_a")).hasSize(2);
    }

    @Test
    void failedInsertLeavesNothingBehind() {
        JobItem item = JobItem.pending("item_dup", "job_b", "res1", "fr", 3, 0, T0);
        JobItem duplicate = JobItem.pending("item_dup", "job_b", "res2", "fr", 3, 1, T0);
        Job job = new Job("job_b", JobType.FULL, JobStatus.PENDING, 0, "en", List.of("fr"), Optional.empty(),
                2, 0, 0, 0, Optional.empty(), T0, T0, Optional.empty(), Optional.empty());

        assertThatThrownBy(() -> store.createJob(job, List.of(item, duplicate))).isInstanceOf(StoreException.class);

        assertThat(store.findJob("job_b")).isEmpty();
        assertThat(store.findItem("item_dup")).isEmpty();
    }

    @Test
    void singleJobKeepsResourceId() {
        Job job = new Job("job_s", JobType.SINGLE, JobStatus.PENDING, 0, "en", List.of("fr"), Optional.of("res9"),
                1, 0, 0, 0, Optional.empty(), T0, T0, Optional.empty(), Optional.empty());
        store.createJob(job, List.of(JobItem.pending("item_s", "job_s", "res9", "fr", 3, 0, T0)));

        assertThat(store.findJob("job_s").orElseThrow().resourceId()).contains("res9");
        assertThat(store.findJob("job_s")).contains(job);
    }
}
