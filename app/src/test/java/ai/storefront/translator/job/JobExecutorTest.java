package ai.storefront.translator.job;

import static org.assertj.core.api.Assertions.assertThat;

import ai.storefront.translator.cache.CacheEntry;
import ai.storefront.translator.cache.CacheKey;
import ai.storefront.translator.cache.InMemoryTranslationCache;
import ai.storefront.translator.concurrent.CancellationSignal;
import ai.storefront.translator.concurrent.ManualTimeSource;
import ai.storefront.translator.concurrent.OperationCancelledException;
import ai.storefront.translator.content.InMemoryResourceRepository;
import ai.storefront.translator.content.Resource;
import ai.storefront.translator.event.EventBus;
import ai.storefront.translator.event.EventType;
import ai.storefront.translator.event.JobEvent;
import ai.storefront.translator.event.RecordingEventListener;
import ai.storefront.translator.retry.RetryConfig;
import ai.storefront.translator.retry.RetryLayering;
import ai.storefront.translator.retry.RetryPolicy;
import ai.storefront.translator.translate.PermanentProviderException;
import ai.storefront.translator.translate.RateLimitedException;
import ai.storefront.translator.translate.ScriptedTranslator;
import ai.storefront.translator.translate.TransientProviderException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class JobExecutorTest {

    private final ManualTimeSource clock = new ManualTimeSource();
    private final InMemoryJobStore store = new InMemoryJobStore();
    private final InMemoryTranslationCache cache = new InMemoryTranslationCache();
    private final InMemoryResourceRepository resources = new InMemoryResourceRepository()
            .put(Resource.of("res1", "en", "Shirt", "Blue shirt"))
            .put(Resource.of("res2", "en", "Mug", "Ceramic mug"));
    private final EventBus events = new EventBus();
    private final RecordingEventListener listener = new RecordingEventListener();
    private final RetryPolicy itemRetryPolicy = new RetryPolicy(
            new RetryConfig(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, 0.0), clock);

    JobExecutorTest() {
        events.subscribe(listener);
    }

    @AfterEach
    void closeBus() {
        events.close();
    }

    @Test
    void translatesEveryItemAndCachesResults() {
        ScriptedTranslator translator = ScriptedTranslator.echo("mock");
        Job job = runningJob(CreateJobRequest.full("en", List.of("fr", "de")));

        JobStatus status = executor(translator, RetryLayering.LAYERED).execute(job, CancellationSignal.NONE);

        assertThat(status).isEqualTo(JobStatus.COMPLETED);
        assertThat(store.findItems(job.id())).allSatisfy(item -> {
            assertThat(item.status()).isEqualTo(JobItemStatus.COMPLETED);
            assertThat(item.provider()).contains("mock");
        });
        assertThat(store.findItems(job.id()).get(0).translatedContent()).contains("[fr] Blue shirt");
        assertThat(translator.requests().get(0).context()).contains("Shirt");
        assertThat(cache.size()).isEqualTo(4);

        Job finished = store.findJob(job.id()).orElseThrow();
        assertThat(finished.completedItems() + finished.failedItems()).isEqualTo(finished.totalItems());
        assertThat(finished.progress()).isEqualTo(100);
        assertThat(finished.completedAt()).isPresent();

        flush();
        assertThat(listener.ofType(EventType.ITEM_COMPLETED)).hasSize(4);
        assertThat(listener.ofType(EventType.PROGRESS)).hasSize(4);
        assertThat(listener.types()).last().isEqualTo(EventType.JOB_COMPLETED);
    }

    @Test
    void cacheHitSkipsTheProvider() {
        cache.store(new CacheEntry(new CacheKey(resources.findById("res1").orElseThrow().contentHash(), "fr"),
                "Chemise bleue", "openai", "gpt-4o", "res1", "en", clock.now()));
        ScriptedTranslator translator = ScriptedTranslator.echo("mock");
        Job job = runningJob(CreateJobRequest.single("en", List.of("fr"), "res1"));

        executor(translator, RetryLayering.LAYERED).execute(job, CancellationSignal.NONE);

        assertThat(translator.calls()).isZero();
        JobItem item = store.findItems(job.id()).get(0);
        assertThat(item.translatedContent()).contains("Chemise bleue");
        assertThat(item.provider()).contains("openai");
        flush();
        assertThat(listener.types()).contains(EventType.ITEM_CACHE_HIT).doesNotContain(EventType.ITEM_COMPLETED);
    }

    @Test
    void identicalContentIsTranslatedOncePerLocale() {
        resources.put(Resource.of("res3", "en", "Shirt copy", "Blue   shirt"));
        ScriptedTranslator translator = ScriptedTranslator.echo("mock");
        JobExecutor executor = executor(translator, RetryLayering.LAYERED);

        executor.execute(runningJob(CreateJobRequest.single("en", List.of("fr"), "res1")), CancellationSignal.NONE);
        executor.execute(runningJob(CreateJobRequest.single("en", List.of("fr"), "res3")), CancellationSignal.NONE);
        executor.execute(runningJob(CreateJobRequest.single("en", List.of("fr"), "res1")), CancellationSignal.NONE);

        assertThat(translator.calls()).isEqualTo(1);
    }

    @Test
    void transientFailuresAreRetriedUpToTheItemBudget() {
        ScriptedTranslator translator = ScriptedTranslator.failing("openai",
                new TransientProviderException("503 Service Unavailable", "openai", 503, null));
        Job job = runningJob(CreateJobRequest.single("en", List.of("fr"), "res1"));

        JobStatus status = executor(translator, RetryLayering.LAYERED).execute(job, CancellationSignal.NONE);

        assertThat(status).isEqualTo(JobStatus.COMPLETED);
        assertThat(translator.calls()).isEqualTo(3);
        JobItem item = store.findItems(job.id()).get(0);
        assertThat(item.status()).isEqualTo(JobItemStatus.FAILED);
        assertThat(item.retryCount()).isEqualTo(3);
        assertThat(item.errorMessage()).contains("503 Service Unavailable");
        assertThat(clock.sleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));

        Job finished = store.findJob(job.id()).orElseThrow();
        assertThat(finished.failedItems()).isEqualTo(1);
        assertThat(finished.completedItems() + finished.failedItems()).isEqualTo(finished.totalItems());
        flush();
        assertThat(listener.ofType(EventType.ITEM_RETRY))
                .extracting(event -> event.intAttribute(JobEvent.RETRY_COUNT))
                .containsExactly(1, 2);
        assertThat(listener.ofType(EventType.ITEM_FAILED)).hasSize(1);
    }

    @Test
    void recoversWhenARetrySucceeds() {
        AtomicInteger attempts = new AtomicInteger();
        ScriptedTranslator translator = new ScriptedTranslator("openai", request -> {
            if (attempts.incrementAndGet() == 1) {
                throw new RateLimitedException("429", "openai", Duration.ofSeconds(5), null);
            }
            return "Chemise bleue";
        });
        Job job = runningJob(CreateJobRequest.single("en", List.of("fr"), "res1"));

        executor(translator, RetryLayering.LAYERED).execute(job, CancellationSignal.NONE);

        JobItem item = store.findItems(job.id()).get(0);
        assertThat(item.status()).isEqualTo(JobItemStatus.COMPLETED);
        assertThat(item.retryCount()).isEqualTo(1);
        assertThat(item.errorMessage()).isEmpty();
        assertThat(clock.sleeps()).containsExactly(Duration.ofSeconds(5));
    }

    @Test
    void permanentFailureIsNotRetried() {
        ScriptedTranslator translator = ScriptedTranslator.failing("openai",
                new PermanentProviderException("invalid request", "openai", 400, null));
        Job job = runningJob(CreateJobRequest.single("en", List.of("fr"), "res1"));

        executor(translator, RetryLayering.LAYERED).execute(job, CancellationSignal.NONE);

        assertThat(translator.calls()).isEqualTo(1);
        assertThat(store.findItems(job.id()).get(0).status()).isEqualTo(JobItemStatus.FAILED);
        assertThat(clock.sleeps()).isEmpty();
        flush();
        assertThat(listener.types()).doesNotContain(EventType.ITEM_RETRY);
    }

    @Test
    void collapsedLayeringGivesEachItemOneChainPass() {
        ScriptedTranslator translator = ScriptedTranslator.failing("openai",
                new TransientProviderException("timeout", "openai", null, null));
        Job job = runningJob(CreateJobRequest.single("en", List.of("fr"), "res1"));

        executor(translator, RetryLayering.COLLAPSED).execute(job, CancellationSignal.NONE);

        assertThat(translator.calls()).isEqualTo(1);
        assertThat(store.findItems(job.id()).get(0).status()).isEqualTo(JobItemStatus.FAILED);
    }

    @Test
    void missingResourceFailsItemWithoutProviderCall() {
        ScriptedTranslator translator = ScriptedTranslator.echo("mock");
        Job job = runningJob(CreateJobRequest.single("en", List.of("fr", "de"), "ghost"));

        JobStatus status = executor(translator, RetryLayering.LAYERED).execute(job, CancellationSignal.NONE);

        assertThat(status).isEqualTo(JobStatus.COMPLETED);
        assertThat(translator.calls()).isZero();
        assertThat(store.findItems(job.id())).allSatisfy(item -> {
            assertThat(item.status()).isEqualTo(JobItemStatus.FAILED);
            assertThat(item.errorMessage()).hasValueSatisfying(error -> assertThat(error).contains("ghost"));
        });
    }

    @Test
    void cancellationBeforeFirstItemLeavesItemsPending() {
        ScriptedTranslator translator = ScriptedTranslator.echo("mock");
        Job job = runningJob(CreateJobRequest.full("en", List.of("fr")));

        JobStatus status = executor(translator, RetryLayering.LAYERED).execute(job, () -> true);

        assertThat(status).isEqualTo(JobStatus.CANCELLED);
        assertThat(translator.calls()).isZero();
        assertThat(store.findItems(job.id())).extracting(JobItem::status).containsOnly(JobItemStatus.PENDING);
        flush();
        assertThat(listener.types()).containsExactly(EventType.JOB_CANCELLED);
    }

    @Test
    void cancellationDuringTranslationIsNotAFailure() {
        AtomicInteger calls = new AtomicInteger();
        ScriptedTranslator translator = new ScriptedTranslator("openai", request -> {
            if (calls.incrementAndGet() == 2) {
                throw new OperationCancelledException("cancelled while waiting for capacity");
            }
            return "ok";
        });
        Job job = runningJob(CreateJobRequest.full("en", List.of("fr")));

        JobStatus status = executor(translator, RetryLayering.LAYERED).execute(job, CancellationSignal.NONE);

        assertThat(status).isEqualTo(JobStatus.CANCELLED);
        assertThat(store.findItems(job.id())).extracting(JobItem::status)
                .containsExactly(JobItemStatus.COMPLETED, JobItemStatus.PENDING);
        Job cancelled = store.findJob(job.id()).orElseThrow();
        assertThat(cancelled.failedItems()).isZero();
        assertThat(cancelled.completedItems()).isEqualTo(1);
        assertThat(cancelled.status()).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    void itemsRunWithJobAndItemInMdc() {
        AtomicReference<String> jobId = new AtomicReference<>();
        AtomicReference<String> itemId = new AtomicReference<>();
        ScriptedTranslator translator = new ScriptedTranslator("mock", request -> {
            jobId.set(MDC.get("jobId"));
            itemId.set(MDC.get("itemId"));
            return "ok";
        });
        Job job = runningJob(CreateJobRequest.single("en", List.of("fr"), "res1"));

        executor(translator, RetryLayering.LAYERED).execute(job, CancellationSignal.NONE);

        assertThat(jobId.get()).isEqualTo(job.id());
        assertThat(itemId.get()).isEqualTo(store.findItems(job.id()).get(0).id());
        assertThat(MDC.get("jobId")).isNull();
    }

    private JobExecutor executor(ScriptedTranslator translator, RetryLayering layering) {
        return new JobExecutor(store, resources, cache, translator, events, itemRetryPolicy,
                new ExecutorSettings(layering, true, true), clock);
    }

    private Job runningJob(CreateJobRequest request) {
        Job created = new JobCreator(store, resources, cache, clock, 3).create(request);
        assertThat(store.transitionJob(created.id(), JobStatus.PENDING, JobStatus.RUNNING, Optional.empty(),
                clock.now())).isTrue();
        return store.findJob(created.id()).orElseThrow();
    }

    private void flush() {
        assertThat(events.flush(Duration.ofSeconds(5))).isTrue();
    }
}
