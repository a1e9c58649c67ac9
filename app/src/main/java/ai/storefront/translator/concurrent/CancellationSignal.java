package ai.storefront.translator.concurrent;

/**
 * Cooperative cancellation flag observed at waits, backoff sleeps and item boundaries.
 */
@FunctionalInterface
public interface CancellationSignal {

    CancellationSignal NONE = () -> false;

    boolean isCancelled();

    default void throwIfCancelled() {
        if (isCancelled()) {
            throw new OperationCancelledException("Operation cancelled");
        }
    }
}
