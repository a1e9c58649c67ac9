package ai.storefront.translator.job;

import java.util.Objects;

public record JobProgress(String jobId, int total, int completed, int failed, int progress) {

    public JobProgress {
        Objects.requireNonNull(jobId, "jobId");
    }

    static JobProgress of(Job job) {
        return new JobProgress(job.id(), job.totalItems(), job.completedItems(), job.failedItems(), job.progress());
    }
}
