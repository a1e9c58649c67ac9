package ai.storefront.translator.concurrent;

import java.time.Duration;
import java.util.Objects;

/**
 * {@link TimeSource} backed by the system clock. Sleeps in short slices so cancellation is noticed quickly.
 */
final class SystemTimeSource implements TimeSource {

    static final SystemTimeSource INSTANCE = new SystemTimeSource();

    private static final long SLICE_MILLIS = 50;

    private SystemTimeSource() {
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    @Override
    public void sleep(Duration duration, CancellationSignal cancellation) {
        Objects.requireNonNull(duration, "duration");
        Objects.requireNonNull(cancellation, "cancellation");
        long deadline = System.nanoTime() + duration.toNanos();
        while (true) {
            cancellation.throwIfCancelled();
            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0) {
                return;
            }
            long sliceMillis = Math.min(SLICE_MILLIS, Math.max(1, remainingNanos / 1_000_000));
            try {
                Thread.sleep(sliceMillis);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledException("Sleep interrupted", ex);
            }
        }
    }
}
