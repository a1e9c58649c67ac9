package ai.storefront.translator.engine;

import ai.storefront.translator.cache.InMemoryTranslationCache;
import ai.storefront.translator.cache.TranslationCache;
import ai.storefront.translator.concurrent.TimeSource;
import ai.storefront.translator.config.Config;
import ai.storefront.translator.content.InMemoryResourceRepository;
import ai.storefront.translator.content.ResourceRepository;
import ai.storefront.translator.event.EventBus;
import ai.storefront.translator.event.EventListener;
import ai.storefront.translator.event.LoggingEventListener;
import ai.storefront.translator.job.ExecutorSettings;
import ai.storefront.translator.job.InMemoryJobStore;
import ai.storefront.translator.job.JobCreator;
import ai.storefront.translator.job.JobExecutor;
import ai.storefront.translator.job.JobScheduler;
import ai.storefront.translator.job.JobService;
import ai.storefront.translator.job.JobStore;
import ai.storefront.translator.job.SchedulerSettings;
import ai.storefront.translator.retry.RetryConfig;
import ai.storefront.translator.retry.RetryLayering;
import ai.storefront.translator.retry.RetryPolicy;
import ai.storefront.translator.store.JdbcJobStore;
import ai.storefront.translator.store.JdbcResourceRepository;
import ai.storefront.translator.store.JdbcTranslationCache;
import ai.storefront.translator.store.SqliteDatabase;
import ai.storefront.translator.translate.Translator;
import ai.storefront.translator.translate.provider.ProviderTranslatorFactory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires stores, translator chain, event bus, scheduler and job service together.
 */
public final class TranslationEngine implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationEngine.class);
    private static final Duration MAX_ITEM_BACKOFF = Duration.ofSeconds(30);
    private static final Duration EVENT_FLUSH_TIMEOUT = Duration.ofSeconds(10);

    private final JobService jobService;
    private final JobScheduler scheduler;
    private final EventBus events;
    private final JobStore jobStore;
    private final ResourceRepository resources;
    private final TranslationCache cache;
    private final AutoCloseable resource;
    private final Translator translator;

    private TranslationEngine(Builder builder) {
        this.jobStore = builder.jobStore;
        this.resources = builder.resources;
        this.cache = builder.cache;
        this.resource = builder.resource;
        this.translator = builder.translator;
        this.events = new EventBus(builder.eventCapacity);
        builder.listeners.forEach(events::subscribe);

        Duration itemRetryDelay = builder.itemRetryDelay;
        RetryConfig itemRetry = new RetryConfig(builder.itemMaxRetries, itemRetryDelay,
                itemRetryDelay.compareTo(MAX_ITEM_BACKOFF) > 0 ? itemRetryDelay : MAX_ITEM_BACKOFF,
                2.0, builder.itemRetryJitter);
        JobExecutor executor = new JobExecutor(jobStore, resources, cache, builder.translator, events,
                new RetryPolicy(itemRetry, builder.timeSource),
                new ExecutorSettings(builder.retryLayering, builder.preserveHtml, builder.preserveLiquid),
                builder.timeSource);
        this.scheduler = new JobScheduler(jobStore, executor, events,
                SchedulerSettings.of(builder.maxConcurrency, builder.pollInterval), builder.timeSource);
        JobCreator creator = new JobCreator(jobStore, resources, cache, builder.timeSource, builder.itemMaxRetries);
        this.jobService = new JobService(jobStore, creator, scheduler, events, builder.timeSource);
    }

    /**
     * Engine backed by the SQLite file and the provider chain named in {@code config}.
     */
    public static TranslationEngine fromConfig(Config config) {
        Objects.requireNonNull(config, "config");
        TimeSource timeSource = TimeSource.system();
        RetryConfig providerRetry = config.retryLayering().providerRetry(config.providerRetry(), config.itemMaxRetries());
        Translator chain = new DeferredTranslator(() -> new ProviderTranslatorFactory(timeSource)
                .createChain(config.providers(), config.secrets(), providerRetry));
        SqliteDatabase database = SqliteDatabase.open(config.databasePath());
        LOGGER.info("Using database {}", config.databasePath().toAbsolutePath());
        return builder()
                .jobStore(new JdbcJobStore(database))
                .resources(new JdbcResourceRepository(database))
                .cache(new JdbcTranslationCache(database))
                .translator(chain)
                .timeSource(timeSource)
                .maxConcurrency(config.maxConcurrency())
                .pollInterval(config.pollInterval())
                .itemMaxRetries(config.itemMaxRetries())
                .itemRetryDelay(config.itemRetryDelay())
                .retryLayering(config.retryLayering())
                .preserveMarkup(config.preserveHtml(), config.preserveLiquid())
                .listener(new LoggingEventListener())
                .closeWith(database)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the scheduler. The provider chain is built here at the latest, so missing credentials fail fast.
     *
     * @throws IllegalStateException when no provider can be configured
     */
    public void start() {
        LOGGER.info("Translating with {} ({})", translator.name(), translator.model());
        scheduler.start();
    }

    public void stop() {
        scheduler.stop();
    }

    public JobService jobService() {
        return jobService;
    }

    public JobScheduler scheduler() {
        return scheduler;
    }

    public EventBus events() {
        return events;
    }

    public JobStore jobStore() {
        return jobStore;
    }

    public ResourceRepository resources() {
        return resources;
    }

    public TranslationCache cache() {
        return cache;
    }

    @Override
    public void close() {
        scheduler.stop();
        if (!events.flush(EVENT_FLUSH_TIMEOUT)) {
            LOGGER.warn("Pending events not delivered within {} s", EVENT_FLUSH_TIMEOUT.toSeconds());
        }
        events.close();
        if (resource != null) {
            try {
                resource.close();
            } catch (Exception ex) {
                LOGGER.warn("Failed to close engine resource", ex);
            }
        }
    }

    public static final class Builder {
        private JobStore jobStore = new InMemoryJobStore();
        private ResourceRepository resources = new InMemoryResourceRepository();
        private TranslationCache cache = new InMemoryTranslationCache();
        private Translator translator;
        private TimeSource timeSource = TimeSource.system();
        private int maxConcurrency = 5;
        private Duration pollInterval = Duration.ofSeconds(5);
        private int itemMaxRetries = 3;
        private Duration itemRetryDelay = Duration.ofSeconds(1);
        private double itemRetryJitter = RetryConfig.MAX_JITTER_FACTOR;
        private RetryLayering retryLayering = RetryLayering.LAYERED;
        private boolean preserveHtml = true;
        private boolean preserveLiquid = true;
        private int eventCapacity = EventBus.DEFAULT_CAPACITY;
        private final List<EventListener> listeners = new ArrayList<>();
        private AutoCloseable resource;

        private Builder() {
        }

        public Builder jobStore(JobStore value) {
            this.jobStore = Objects.requireNonNull(value, "jobStore");
            return this;
        }

        public Builder resources(ResourceRepository value) {
            this.resources = Objects.requireNonNull(value, "resources");
            return this;
        }

        public Builder cache(TranslationCache value) {
            this.cache = Objects.requireNonNull(value, "cache");
            return this;
        }

        public Builder translator(Translator value) {
            this.translator = Objects.requireNonNull(value, "translator");
            return this;
        }

        public Builder timeSource(TimeSource value) {
            this.timeSource = Objects.requireNonNull(value, "timeSource");
            return this;
        }

        public Builder maxConcurrency(int value) {
            this.maxConcurrency = value;
            return this;
        }

        public Builder pollInterval(Duration value) {
            this.pollInterval = Objects.requireNonNull(value, "pollInterval");
            return this;
        }

        public Builder itemMaxRetries(int value) {
            this.itemMaxRetries = value;
            return this;
        }

        public Builder itemRetryDelay(Duration value) {
            this.itemRetryDelay = Objects.requireNonNull(value, "itemRetryDelay");
            return this;
        }

        public Builder itemRetryJitter(double value) {
            this.itemRetryJitter = value;
            return this;
        }

        public Builder retryLayering(RetryLayering value) {
            this.retryLayering = Objects.requireNonNull(value, "retryLayering");
            return this;
        }

        public Builder preserveMarkup(boolean html, boolean liquid) {
            this.preserveHtml = html;
            this.preserveLiquid = liquid;
            return this;
        }

        public Builder eventCapacity(int value) {
            this.eventCapacity = value;
            return this;
        }

        public Builder listener(EventListener value) {
            this.listeners.add(Objects.requireNonNull(value, "listener"));
            return this;
        }

        /**
         * Resource closed together with the engine, such as the database connection.
         */
        public Builder closeWith(AutoCloseable value) {
            this.resource = value;
            return this;
        }

        public TranslationEngine build() {
            if (translator == null) {
                throw new IllegalStateException("translator must be set");
            }
            return new TranslationEngine(this);
        }
    }
}
