package ai.storefront.translator.job;

import ai.storefront.translator.concurrent.TimeSource;
import ai.storefront.translator.event.EventBus;
import ai.storefront.translator.event.JobEvent;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Public operations on translation jobs.
 */
public class JobService {

    private static final Logger LOGGER = LoggerFactory.getLogger(JobService.class);

    private final JobStore jobStore;
    private final JobCreator jobCreator;
    private final JobScheduler scheduler;
    private final EventBus events;
    private final TimeSource timeSource;

    public JobService(JobStore jobStore,
                      JobCreator jobCreator,
                      JobScheduler scheduler,
                      EventBus events,
                      TimeSource timeSource) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
        this.jobCreator = Objects.requireNonNull(jobCreator, "jobCreator");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.events = Objects.requireNonNull(events, "events");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
    }

    /**
     * Creates a PENDING job with its items and wakes the scheduler.
     *
     * @throws IllegalArgumentException when the request is invalid
     */
    public String createJob(CreateJobRequest request) {
        Job job = jobCreator.create(request);
        scheduler.wakeUp();
        return job.id();
    }

    /**
     * Cancels a pending job at once, or asks a running job to stop at its next item boundary.
     *
     * @return false when the job had already finished
     * @throws JobNotFoundException when no job has this id
     */
    public boolean cancelJob(String jobId) {
        Job job = requireJob(jobId);
        if (job.status().isTerminal()) {
            return false;
        }
        if (!jobStore.requestCancellation(jobId, timeSource.now())) {
            return false;
        }
        if (jobStore.transitionJob(jobId, JobStatus.PENDING, JobStatus.CANCELLED, Optional.empty(), timeSource.now())) {
            LOGGER.info("Cancelled pending job {}", jobId);
            events.publish(JobEvent.jobCancelled(timeSource.now(), jobId));
            return true;
        }
        JobStatus current = requireJob(jobId).status();
        if (current.isTerminal()) {
            return current == JobStatus.CANCELLED;
        }
        LOGGER.info("Cancellation requested for running job {}", jobId);
        return true;
    }

    /**
     * Resets the FAILED items of a job to PENDING; a COMPLETED or FAILED job becomes PENDING again.
     *
     * @return number of items reset
     * @throws JobNotFoundException when no job has this id
     * @throws IllegalStateException when the job is running
     */
    public int retryFailedItems(String jobId) {
        Job job = requireJob(jobId);
        if (job.status() == JobStatus.RUNNING) {
            throw new IllegalStateException("Job " + jobId + " is running; retry it after it finishes");
        }
        int reset = jobStore.resetFailedItems(jobId, timeSource.now());
        if (job.status() == JobStatus.COMPLETED || job.status() == JobStatus.FAILED) {
            jobStore.transitionJob(jobId, job.status(), JobStatus.PENDING, Optional.empty(), timeSource.now());
        }
        jobStore.updateProgress(jobId, jobStore.countItems(jobId), timeSource.now());
        LOGGER.info("Reset {} failed item(s) of job {}", reset, jobId);
        events.publish(JobEvent.jobRetry(timeSource.now(), jobId));
        scheduler.wakeUp();
        return reset;
    }

    public Optional<JobProgress> getJobProgress(String jobId) {
        return jobStore.findJob(jobId).map(JobProgress::of);
    }

    public Optional<Job> getJob(String jobId) {
        return jobStore.findJob(jobId);
    }

    public List<JobItem> listItems(String jobId) {
        return jobStore.findItems(jobId);
    }

    public List<Job> listJobs() {
        return jobStore.listJobs();
    }

    private Job requireJob(String jobId) {
        return jobStore.findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }
}
