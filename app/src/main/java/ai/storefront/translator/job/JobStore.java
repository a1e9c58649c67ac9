package ai.storefront.translator.job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persisted jobs and items. Every status change is a compare-and-set against the expected current status,
 * so concurrent workers never both own an item or a job.
 */
public interface JobStore {

    /**
     * Inserts the job and all of its items atomically.
     */
    void createJob(Job job, List<JobItem> items);

    Optional<Job> findJob(String jobId);

    /**
     * All jobs, newest first.
     */
    List<Job> listJobs();

    /**
     * Items of the job in creation order.
     */
    List<JobItem> findItems(String jobId);

    List<JobItem> findItems(String jobId, JobItemStatus status);

    Optional<JobItem> findItem(String itemId);

    /**
     * Atomically moves the highest priority PENDING job (priority desc, createdAt asc, id asc) to RUNNING.
     */
    Optional<Job> claimNextPendingJob(Instant now);

    /**
     * Moves the job from {@code expected} to {@code next}. Moving back to PENDING also clears a pending
     * cancellation request.
     */
    boolean transitionJob(String jobId, JobStatus expected, JobStatus next, Optional<String> errorMessage, Instant now);

    /**
     * Flags a PENDING or RUNNING job for cancellation. The flag is persisted so an executor in another
     * process sharing the store observes it.
     *
     * @return false when the job is unknown or already terminal
     */
    boolean requestCancellation(String jobId, Instant now);

    boolean isCancellationRequested(String jobId);

    boolean compareAndSetItemStatus(String itemId, JobItemStatus expected, JobItemStatus next, Instant now);

    /**
     * PROCESSING to COMPLETED with the translated text.
     */
    boolean completeItem(String itemId, String translatedContent, String provider, Instant now);

    /**
     * PROCESSING to PENDING, recording the attempt count and error.
     */
    boolean scheduleItemRetry(String itemId, int retryCount, String errorMessage, Instant now);

    /**
     * PROCESSING to FAILED, recording the attempt count and error.
     */
    boolean failItem(String itemId, int retryCount, String errorMessage, Instant now);

    /**
     * FAILED items of the job back to PENDING with retry count 0 and no error.
     *
     * @return number of items reset
     */
    int resetFailedItems(String jobId, Instant now);

    JobCounts countItems(String jobId);

    /**
     * Puts jobs left RUNNING by a previous process back to PENDING, and their PROCESSING items back to PENDING.
     *
     * @return number of jobs requeued
     */
    int requeueInterruptedJobs(Instant now);

    void updateProgress(String jobId, JobCounts counts, Instant now);
}
