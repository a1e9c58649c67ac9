package ai.storefront.translator.concurrent;

/**
 * Raised when a wait or sleep is aborted by a {@link CancellationSignal}. Never counted as an item failure.
 */
public class OperationCancelledException extends RuntimeException {

    public OperationCancelledException(String message) {
        super(message);
    }

    public OperationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
