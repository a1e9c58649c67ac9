package ai.storefront.translator.job;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One (resource, target locale) unit of work. {@code sequence} is the creation order within the job.
 */
public record JobItem(String id,
                      String jobId,
                      String resourceId,
                      String targetLocale,
                      JobItemStatus status,
                      int retryCount,
                      int maxRetries,
                      Optional<String> errorMessage,
                      Optional<String> translatedContent,
                      Optional<String> provider,
                      int sequence,
                      Instant createdAt,
                      Instant updatedAt) {

    public JobItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(targetLocale, "targetLocale");
        Objects.requireNonNull(status, "status");
        if (retryCount < 0 || maxRetries < 0) {
            throw new IllegalArgumentException("retry counters must not be negative");
        }
        errorMessage = errorMessage == null ? Optional.empty() : errorMessage;
        translatedContent = translatedContent == null ? Optional.empty() : translatedContent;
        provider = provider == null ? Optional.empty() : provider;
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
    }

    public static JobItem pending(String id, String jobId, String resourceId, String targetLocale,
                                  int maxRetries, int sequence, Instant now) {
        return new JobItem(id, jobId, resourceId, targetLocale, JobItemStatus.PENDING, 0, maxRetries,
                Optional.empty(), Optional.empty(), Optional.empty(), sequence, now, now);
    }

    public JobItem withStatus(JobItemStatus next, Instant now) {
        return new JobItem(id, jobId, resourceId, targetLocale, next, retryCount, maxRetries,
                errorMessage, translatedContent, provider, sequence, createdAt, now);
    }

    public JobItem completed(String content, String providerName, Instant now) {
        return new JobItem(id, jobId, resourceId, targetLocale, JobItemStatus.COMPLETED, retryCount, maxRetries,
                Optional.empty(), Optional.of(content), Optional.ofNullable(providerName), sequence, createdAt, now);
    }

    public JobItem failedAttempt(JobItemStatus next, int retries, String error, Instant now) {
        return new JobItem(id, jobId, resourceId, targetLocale, next, retries, maxRetries,
                Optional.ofNullable(error), translatedContent, provider, sequence, createdAt, now);
    }

    public JobItem reset(Instant now) {
        return new JobItem(id, jobId, resourceId, targetLocale, JobItemStatus.PENDING, 0, maxRetries,
                Optional.empty(), translatedContent, provider, sequence, createdAt, now);
    }
}
