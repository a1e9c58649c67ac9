package ai.storefront.translator.job;

import ai.storefront.translator.cache.CacheKey;
import ai.storefront.translator.cache.TranslationCache;
import ai.storefront.translator.concurrent.TimeSource;
import ai.storefront.translator.content.Resource;
import ai.storefront.translator.content.ResourceRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans a job request out into items: one per selected resource and target locale.
 */
public class JobCreator {

    private static final Logger LOGGER = LoggerFactory.getLogger(JobCreator.class);

    private final JobStore jobStore;
    private final ResourceRepository resources;
    private final TranslationCache cache;
    private final TimeSource timeSource;
    private final int itemMaxRetries;

    public JobCreator(JobStore jobStore,
                      ResourceRepository resources,
                      TranslationCache cache,
                      TimeSource timeSource,
                      int itemMaxRetries) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
        this.resources = Objects.requireNonNull(resources, "resources");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
        if (itemMaxRetries < 0) {
            throw new IllegalArgumentException("itemMaxRetries must be zero or greater");
        }
        this.itemMaxRetries = itemMaxRetries;
    }

    public Job create(CreateJobRequest request) {
        Objects.requireNonNull(request, "request");
        Instant now = timeSource.now();
        String jobId = newId("job_");
        List<String> resourceIds = selectResources(request);

        List<JobItem> items = new ArrayList<>(resourceIds.size() * request.targetLocales().size());
        int sequence = 0;
        for (String resourceId : resourceIds) {
            for (String locale : request.targetLocales()) {
                items.add(JobItem.pending(newId("item_"), jobId, resourceId, locale, itemMaxRetries, sequence++, now));
            }
        }

        Job job = new Job(jobId, request.type(), JobStatus.PENDING, request.priority(), request.sourceLocale(),
                request.targetLocales(), request.resourceId(), items.size(), 0, 0, 0, Optional.empty(),
                now, now, Optional.empty(), Optional.empty());
        jobStore.createJob(job, items);
        LOGGER.info("Created {} job {} with {} items ({} resources x {} locales)", request.type(), jobId,
                items.size(), resourceIds.size(), request.targetLocales().size());
        return job;
    }

    private List<String> selectResources(CreateJobRequest request) {
        return switch (request.type()) {
            case FULL -> resources.findByLocale(request.sourceLocale()).stream()
                    .map(Resource::id)
                    .toList();
            case INCREMENTAL -> resources.findByLocale(request.sourceLocale()).stream()
                    .filter(resource -> needsTranslation(resource, request.targetLocales()))
                    .map(Resource::id)
                    .toList();
            // Existence is checked when the item runs; a missing resource fails its items.
            case SINGLE -> List.of(request.resourceId().orElseThrow());
        };
    }

    private boolean needsTranslation(Resource resource, List<String> targetLocales) {
        for (String locale : targetLocales) {
            if (!cache.contains(new CacheKey(resource.contentHash(), locale))) {
                return true;
            }
        }
        return false;
    }

    private static String newId(String prefix) {
        return prefix + UUID.randomUUID().toString().replace("-", "");
    }
}
