package ai.storefront.translator.job;

import ai.storefront.translator.concurrent.CancellationSignal;
import ai.storefront.translator.concurrent.TimeSource;
import ai.storefront.translator.event.EventBus;
import ai.storefront.translator.event.JobEvent;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Claims pending jobs and runs them on a fixed worker pool, at most {@code maxConcurrency} at a time.
 *
 * <p>A single dispatch thread claims jobs until the pool is full, then sleeps for the poll interval or until
 * {@link #wakeUp()} is called. Workers wake the dispatcher when they finish so freed slots are reused at once.
 */
public class JobScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(JobScheduler.class);

    private enum State { NEW, RUNNING, STOPPED }

    private final JobStore jobStore;
    private final JobExecutor executor;
    private final EventBus events;
    private final SchedulerSettings settings;
    private final TimeSource timeSource;

    private final Set<String> activeJobs = ConcurrentHashMap.newKeySet();
    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeUp = lock.newCondition();
    private boolean wakeRequested;

    private ExecutorService workers;
    private Thread dispatchThread;

    public JobScheduler(JobStore jobStore,
                        JobExecutor executor,
                        EventBus events,
                        SchedulerSettings settings,
                        TimeSource timeSource) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.events = Objects.requireNonNull(events, "events");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
    }

    public void start() {
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            throw new IllegalStateException("Scheduler already started");
        }
        int requeued = jobStore.requeueInterruptedJobs(timeSource.now());
        if (requeued > 0) {
            LOGGER.warn("Requeued {} job(s) left running by a previous process", requeued);
        }
        AtomicInteger counter = new AtomicInteger();
        workers = Executors.newFixedThreadPool(settings.maxConcurrency(), runnable -> {
            Thread thread = new Thread(runnable, "job-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        dispatchThread = new Thread(this::dispatchLoop, "job-dispatcher");
        dispatchThread.setDaemon(true);
        dispatchThread.start();
        LOGGER.info("Scheduler started (maxConcurrency={}, pollInterval={} ms)",
                settings.maxConcurrency(), settings.pollInterval().toMillis());
        events.publish(JobEvent.started(timeSource.now()));
    }

    /**
     * Stops claiming jobs and waits, without a time limit, for running executors to finish. Calling it again
     * has no effect.
     */
    public void stop() {
        if (!state.compareAndSet(State.RUNNING, State.STOPPED)) {
            state.compareAndSet(State.NEW, State.STOPPED);
            return;
        }
        wakeUp();
        try {
            dispatchThread.join();
            workers.shutdown();
            while (!workers.awaitTermination(settings.drainLogInterval().toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.info("Waiting for {} running job(s) to finish: {}", activeJobs.size(), activeJobs);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for running jobs; {} still active", activeJobs.size());
            workers.shutdownNow();
        }
        LOGGER.info("Scheduler stopped");
        events.publish(JobEvent.stopped(timeSource.now()));
    }

    public void wakeUp() {
        lock.lock();
        try {
            wakeRequested = true;
            wakeUp.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int activeJobCount() {
        return activeJobs.size();
    }

    public boolean isActive(String jobId) {
        return activeJobs.contains(jobId);
    }

    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    /**
     * True when no job is executing and none is waiting to be claimed.
     */
    public boolean isIdle() {
        return activeJobs.isEmpty()
                && jobStore.listJobs().stream()
                        .noneMatch(job -> job.status() == JobStatus.PENDING || job.status() == JobStatus.RUNNING);
    }

    private void dispatchLoop() {
        while (state.get() == State.RUNNING) {
            try {
                dispatchAvailable();
            } catch (RuntimeException ex) {
                LOGGER.error("Dispatch iteration failed", ex);
            }
            awaitWakeUp(settings.pollInterval());
        }
    }

    private void dispatchAvailable() {
        while (state.get() == State.RUNNING && activeJobs.size() < settings.maxConcurrency()) {
            Optional<Job> claimed = jobStore.claimNextPendingJob(timeSource.now());
            if (claimed.isEmpty()) {
                return;
            }
            Job job = claimed.get();
            activeJobs.add(job.id());
            LOGGER.info("Dispatching job {} (priority {})", job.id(), job.priority());
            workers.submit(() -> runJob(job));
        }
    }

    private void runJob(Job job) {
        CancellationSignal cancellation = () -> Thread.currentThread().isInterrupted()
                || jobStore.isCancellationRequested(job.id());
        try {
            executor.execute(job, cancellation);
        } catch (RuntimeException ex) {
            LOGGER.error("Executor for job {} failed", job.id(), ex);
            jobStore.transitionJob(job.id(), JobStatus.RUNNING, JobStatus.FAILED,
                    Optional.of(String.valueOf(ex.getMessage())), timeSource.now());
        } finally {
            activeJobs.remove(job.id());
            wakeUp();
        }
    }

    private void awaitWakeUp(Duration timeout) {
        lock.lock();
        try {
            long remaining = timeout.toNanos();
            while (!wakeRequested && remaining > 0 && state.get() == State.RUNNING) {
                remaining = wakeUp.awaitNanos(remaining);
            }
            wakeRequested = false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            state.set(State.STOPPED);
        } finally {
            lock.unlock();
        }
    }
}
