package ai.storefront.translator.job;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Heap-backed JobStore. Compound updates are serialized on the instance monitor.
 */
public class InMemoryJobStore implements JobStore {

    private static final Comparator<Job> CLAIM_ORDER = Comparator.comparingInt(Job::priority).reversed()
            .thenComparing(Job::createdAt)
            .thenComparing(Job::id);

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final Map<String, JobItem> items = new ConcurrentHashMap<>();
    private final Map<String, List<String>> itemIdsByJob = new ConcurrentHashMap<>();
    private final Set<String> cancelRequested = ConcurrentHashMap.newKeySet();

    @Override
    public synchronized void createJob(Job job, List<JobItem> newItems) {
        if (jobs.containsKey(job.id())) {
            throw new StoreException("Duplicate job id " + job.id(), null);
        }
        List<String> ids = new ArrayList<>(newItems.size());
        for (JobItem item : newItems) {
            if (!item.jobId().equals(job.id())) {
                throw new IllegalArgumentException("Item " + item.id() + " belongs to another job");
            }
            ids.add(item.id());
        }
        jobs.put(job.id(), job);
        newItems.forEach(item -> items.put(item.id(), item));
        itemIdsByJob.put(job.id(), List.copyOf(ids));
    }

    @Override
    public Optional<Job> findJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public List<Job> listJobs() {
        return jobs.values().stream()
                .sorted(Comparator.comparing(Job::createdAt).reversed().thenComparing(Job::id))
                .toList();
    }

    @Override
    public synchronized List<JobItem> findItems(String jobId) {
        return itemIdsByJob.getOrDefault(jobId, List.of()).stream()
                .map(items::get)
                .sorted(Comparator.comparingInt(JobItem::sequence))
                .toList();
    }

    @Override
    public List<JobItem> findItems(String jobId, JobItemStatus status) {
        return findItems(jobId).stream().filter(item -> item.status() == status).toList();
    }

    @Override
    public Optional<JobItem> findItem(String itemId) {
        return Optional.ofNullable(items.get(itemId));
    }

    @Override
    public synchronized Optional<Job> claimNextPendingJob(Instant now) {
        Optional<Job> next = jobs.values().stream()
                .filter(job -> job.status() == JobStatus.PENDING)
                .min(CLAIM_ORDER);
        next.ifPresent(job -> jobs.put(job.id(), job.withStatus(JobStatus.RUNNING, Optional.empty(), now)));
        return next.map(job -> jobs.get(job.id()));
    }

    @Override
    public synchronized boolean transitionJob(String jobId, JobStatus expected, JobStatus next,
                                              Optional<String> errorMessage, Instant now) {
        Job job = jobs.get(jobId);
        if (job == null || job.status() != expected) {
            return false;
        }
        jobs.put(jobId, job.withStatus(next, errorMessage, now));
        if (next == JobStatus.PENDING) {
            cancelRequested.remove(jobId);
        }
        return true;
    }

    @Override
    public synchronized boolean requestCancellation(String jobId, Instant now) {
        Job job = jobs.get(jobId);
        if (job == null || job.status().isTerminal()) {
            return false;
        }
        cancelRequested.add(jobId);
        return true;
    }

    @Override
    public boolean isCancellationRequested(String jobId) {
        return cancelRequested.contains(jobId);
    }

    @Override
    public boolean compareAndSetItemStatus(String itemId, JobItemStatus expected, JobItemStatus next, Instant now) {
        return updateItem(itemId, expected, item -> item.withStatus(next, now));
    }

    @Override
    public boolean completeItem(String itemId, String translatedContent, String provider, Instant now) {
        return updateItem(itemId, JobItemStatus.PROCESSING, item -> item.completed(translatedContent, provider, now));
    }

    @Override
    public boolean scheduleItemRetry(String itemId, int retryCount, String errorMessage, Instant now) {
        return updateItem(itemId, JobItemStatus.PROCESSING,
                item -> item.failedAttempt(JobItemStatus.PENDING, retryCount, errorMessage, now));
    }

    @Override
    public boolean failItem(String itemId, int retryCount, String errorMessage, Instant now) {
        return updateItem(itemId, JobItemStatus.PROCESSING,
                item -> item.failedAttempt(JobItemStatus.FAILED, retryCount, errorMessage, now));
    }

    @Override
    public synchronized int resetFailedItems(String jobId, Instant now) {
        int reset = 0;
        for (String itemId : itemIdsByJob.getOrDefault(jobId, List.of())) {
            JobItem item = items.get(itemId);
            if (item.status() == JobItemStatus.FAILED) {
                items.put(itemId, item.reset(now));
                reset++;
            }
        }
        return reset;
    }

    @Override
    public synchronized JobCounts countItems(String jobId) {
        int total = 0;
        int completed = 0;
        int failed = 0;
        for (String itemId : itemIdsByJob.getOrDefault(jobId, List.of())) {
            total++;
            switch (items.get(itemId).status()) {
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                default -> {
                }
            }
        }
        return new JobCounts(total, completed, failed);
    }

    @Override
    public synchronized int requeueInterruptedJobs(Instant now) {
        int requeued = 0;
        for (Job job : List.copyOf(jobs.values())) {
            if (job.status() != JobStatus.RUNNING) {
                continue;
            }
            for (String itemId : itemIdsByJob.getOrDefault(job.id(), List.of())) {
                JobItem item = items.get(itemId);
                if (item.status() == JobItemStatus.PROCESSING) {
                    items.put(itemId, item.withStatus(JobItemStatus.PENDING, now));
                }
            }
            jobs.put(job.id(), job.withStatus(JobStatus.PENDING, Optional.empty(), now));
            requeued++;
        }
        return requeued;
    }

    @Override
    public synchronized void updateProgress(String jobId, JobCounts counts, Instant now) {
        Job job = jobs.get(jobId);
        if (job != null) {
            jobs.put(jobId, job.withCounts(counts, now));
        }
    }

    private synchronized boolean updateItem(String itemId, JobItemStatus expected, Function<JobItem, JobItem> change) {
        JobItem item = items.get(itemId);
        if (item == null || item.status() != expected) {
            return false;
        }
        items.put(itemId, change.apply(item));
        return true;
    }
}
