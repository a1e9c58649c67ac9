package ai.storefront.translator.job;

import ai.storefront.translator.cache.CacheEntry;
import ai.storefront.translator.cache.CacheKey;
import ai.storefront.translator.cache.TranslationCache;
import ai.storefront.translator.concurrent.CancellationSignal;
import ai.storefront.translator.concurrent.OperationCancelledException;
import ai.storefront.translator.concurrent.TimeSource;
import ai.storefront.translator.content.Resource;
import ai.storefront.translator.content.ResourceNotFoundException;
import ai.storefront.translator.content.ResourceRepository;
import ai.storefront.translator.event.EventBus;
import ai.storefront.translator.event.JobEvent;
import ai.storefront.translator.retry.RetryLayering;
import ai.storefront.translator.retry.RetryPolicy;
import ai.storefront.translator.translate.TranslationRequest;
import ai.storefront.translator.translate.TranslationResult;
import ai.storefront.translator.translate.Translator;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Drives the pending items of one running job through the cache and the translator, then finalizes the job.
 *
 * <p>Items run serially in creation order. Cancellation is checked before each item and inside rate limit
 * waits and backoff sleeps; an interrupted item goes back to PENDING and does not count as a failure.
 * Every status is persisted before the matching event is published.
 */
public class JobExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(JobExecutor.class);
    static final String MDC_JOB_ID = "jobId";
    static final String MDC_ITEM_ID = "itemId";

    private final JobStore jobStore;
    private final ResourceRepository resources;
    private final TranslationCache cache;
    private final Translator translator;
    private final EventBus events;
    private final RetryPolicy itemRetryPolicy;
    private final ExecutorSettings settings;
    private final TimeSource timeSource;

    public JobExecutor(JobStore jobStore,
                       ResourceRepository resources,
                       TranslationCache cache,
                       Translator translator,
                       EventBus events,
                       RetryPolicy itemRetryPolicy,
                       ExecutorSettings settings,
                       TimeSource timeSource) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
        this.resources = Objects.requireNonNull(resources, "resources");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.events = Objects.requireNonNull(events, "events");
        this.itemRetryPolicy = Objects.requireNonNull(itemRetryPolicy, "itemRetryPolicy");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
    }

    /**
     * Runs a job that is already RUNNING and returns the status it was finalized with.
     */
    public JobStatus execute(Job job, CancellationSignal cancellation) {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(cancellation, "cancellation");
        MDC.put(MDC_JOB_ID, job.id());
        try {
            LOGGER.info("Executing job {} ({}, {} -> {})", job.id(), job.type(), job.sourceLocale(), job.targetLocales());
            boolean cancelled = false;
            try {
                for (JobItem item : jobStore.findItems(job.id(), JobItemStatus.PENDING)) {
                    if (cancellation.isCancelled()) {
                        cancelled = true;
                        break;
                    }
                    processItem(job, item, cancellation);
                    publishProgress(job.id());
                }
            } catch (OperationCancelledException ex) {
                cancelled = true;
                publishProgress(job.id());
            }
            if (cancelled) {
                finish(job.id(), JobStatus.CANCELLED, Optional.empty());
                events.publish(JobEvent.jobCancelled(timeSource.now(), job.id()));
                return JobStatus.CANCELLED;
            }
            finish(job.id(), JobStatus.COMPLETED, Optional.empty());
            events.publish(JobEvent.jobCompleted(timeSource.now(), job.id()));
            return JobStatus.COMPLETED;
        } catch (RuntimeException ex) {
            String error = describe(ex);
            LOGGER.error("Job {} failed", job.id(), ex);
            finish(job.id(), JobStatus.FAILED, Optional.of(error));
            events.publish(JobEvent.jobFailed(timeSource.now(), job.id(), error));
            return JobStatus.FAILED;
        } finally {
            MDC.remove(MDC_JOB_ID);
        }
    }

    private void processItem(Job job, JobItem item, CancellationSignal cancellation) {
        MDC.put(MDC_ITEM_ID, item.id());
        try {
            if (!jobStore.compareAndSetItemStatus(item.id(), JobItemStatus.PENDING, JobItemStatus.PROCESSING, timeSource.now())) {
                LOGGER.debug("Item {} is no longer pending; skipping", item.id());
                return;
            }
            Resource resource;
            try {
                resource = resources.findById(item.resourceId())
                        .orElseThrow(() -> new ResourceNotFoundException(item.resourceId()));
            } catch (ResourceNotFoundException ex) {
                fail(item, item.retryCount(), ex.getMessage());
                return;
            }

            CacheKey key = new CacheKey(resource.contentHash(), item.targetLocale());
            Optional<CacheEntry> cached = cache.lookup(key);
            if (cached.isPresent()) {
                jobStore.completeItem(item.id(), cached.get().translatedText(), cached.get().provider(), timeSource.now());
                events.publish(JobEvent.itemCacheHit(timeSource.now(), item.jobId(), item.id()));
                return;
            }

            translateWithRetries(job, item, resource, key, cancellation);
        } finally {
            MDC.remove(MDC_ITEM_ID);
        }
    }

    private void translateWithRetries(Job job, JobItem item, Resource resource, CacheKey key,
                                      CancellationSignal cancellation) {
        TranslationRequest request = new TranslationRequest(resource.content(), job.sourceLocale(), item.targetLocale(),
                resource.title(), settings.preserveHtml(), settings.preserveLiquid(), cancellation);
        int retryCount = item.retryCount();
        while (true) {
            TranslationResult result;
            try {
                result = translator.translate(request);
            } catch (OperationCancelledException ex) {
                jobStore.compareAndSetItemStatus(item.id(), JobItemStatus.PROCESSING, JobItemStatus.PENDING, timeSource.now());
                throw ex;
            } catch (RuntimeException ex) {
                retryCount++;
                String error = describe(ex);
                boolean retryable = settings.retryLayering() == RetryLayering.LAYERED && itemRetryPolicy.isRetryable(ex);
                if (!retryable || retryCount >= item.maxRetries()) {
                    LOGGER.warn("Item {} failed after {} attempt(s): {}", item.id(), retryCount, error);
                    fail(item, retryCount, error);
                    return;
                }
                jobStore.scheduleItemRetry(item.id(), retryCount, error, timeSource.now());
                events.publish(JobEvent.itemRetry(timeSource.now(), item.jobId(), item.id(), retryCount));
                Duration delay = itemRetryPolicy.backoffFor(retryCount - 1, ex);
                LOGGER.info("Item {} attempt {} failed ({}); retrying in {} ms", item.id(), retryCount, error, delay.toMillis());
                itemRetryPolicy.sleep(delay, cancellation);
                cancellation.throwIfCancelled();
                if (!jobStore.compareAndSetItemStatus(item.id(), JobItemStatus.PENDING, JobItemStatus.PROCESSING, timeSource.now())) {
                    LOGGER.debug("Item {} was taken over while waiting to retry", item.id());
                    return;
                }
                continue;
            }
            cache.store(new CacheEntry(key, result.translatedText(), result.provider(), result.model(),
                    resource.id(), job.sourceLocale(), timeSource.now()));
            jobStore.completeItem(item.id(), result.translatedText(), result.provider(), timeSource.now());
            events.publish(JobEvent.itemCompleted(timeSource.now(), item.jobId(), item.id()));
            return;
        }
    }

    private void fail(JobItem item, int retryCount, String error) {
        jobStore.failItem(item.id(), retryCount, error, timeSource.now());
        events.publish(JobEvent.itemFailed(timeSource.now(), item.jobId(), item.id(), error));
    }

    private void publishProgress(String jobId) {
        JobCounts counts = jobStore.countItems(jobId);
        jobStore.updateProgress(jobId, counts, timeSource.now());
        events.publish(JobEvent.progress(timeSource.now(), jobId, counts.total(), counts.completed(),
                counts.failed(), counts.progress()));
    }

    private void finish(String jobId, JobStatus status, Optional<String> error) {
        jobStore.updateProgress(jobId, jobStore.countItems(jobId), timeSource.now());
        if (!jobStore.transitionJob(jobId, JobStatus.RUNNING, status, error, timeSource.now())) {
            LOGGER.warn("Job {} was not RUNNING when finalizing as {}", jobId, status);
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
