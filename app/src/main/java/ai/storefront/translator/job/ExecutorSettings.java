package ai.storefront.translator.job;

import ai.storefront.translator.retry.RetryLayering;
import java.util.Objects;

/**
 * Per-item behaviour of {@link JobExecutor}.
 */
public record ExecutorSettings(RetryLayering retryLayering, boolean preserveHtml, boolean preserveLiquid) {

    public ExecutorSettings {
        Objects.requireNonNull(retryLayering, "retryLayering");
    }

    public static ExecutorSettings defaults() {
        return new ExecutorSettings(RetryLayering.LAYERED, true, true);
    }
}
