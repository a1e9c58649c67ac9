package ai.storefront.translator.job;

import java.time.Duration;
import java.util.Objects;

/**
 * @param drainLogInterval how often {@link JobScheduler#stop()} logs while it waits for running jobs
 */
public record SchedulerSettings(int maxConcurrency, Duration pollInterval, Duration drainLogInterval) {

    public SchedulerSettings {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
        Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        Objects.requireNonNull(drainLogInterval, "drainLogInterval");
        if (drainLogInterval.isZero() || drainLogInterval.isNegative()) {
            throw new IllegalArgumentException("drainLogInterval must be positive");
        }
    }

    public static SchedulerSettings of(int maxConcurrency, Duration pollInterval) {
        return new SchedulerSettings(maxConcurrency, pollInterval, Duration.ofSeconds(30));
    }
}
