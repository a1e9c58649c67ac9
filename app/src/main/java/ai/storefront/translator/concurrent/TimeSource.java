package ai.storefront.translator.concurrent;

import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock reads and cancellable sleeps. Swapped for a simulated clock in tests.
 */
public interface TimeSource {

    long currentTimeMillis();

    /**
     * Sleeps for the given duration, returning early with {@link OperationCancelledException}
     * once the signal fires.
     */
    void sleep(Duration duration, CancellationSignal cancellation);

    default Instant now() {
        return Instant.ofEpochMilli(currentTimeMillis());
    }

    static TimeSource system() {
        return SystemTimeSource.INSTANCE;
    }
}
