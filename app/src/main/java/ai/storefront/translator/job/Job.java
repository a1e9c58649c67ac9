package ai.storefront.translator.job;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Persisted state of one translation job.
 */
public record Job(String id,
                  JobType type,
                  JobStatus status,
                  int priority,
                  String sourceLocale,
                  List<String> targetLocales,
                  Optional<String> resourceId,
                  int totalItems,
                  int completedItems,
                  int failedItems,
                  int progress,
                  Optional<String> errorMessage,
                  Instant createdAt,
                  Instant updatedAt,
                  Optional<Instant> startedAt,
                  Optional<Instant> completedAt) {

    public Job {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(sourceLocale, "sourceLocale");
        targetLocales = List.copyOf(targetLocales);
        resourceId = resourceId == null ? Optional.empty() : resourceId;
        errorMessage = errorMessage == null ? Optional.empty() : errorMessage;
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        startedAt = startedAt == null ? Optional.empty() : startedAt;
        completedAt = completedAt == null ? Optional.empty() : completedAt;
    }

    public JobCounts counts() {
        return new JobCounts(totalItems, completedItems, failedItems);
    }

    public Job withCounts(JobCounts counts, Instant now) {
        return new Job(id, type, status, priority, sourceLocale, targetLocales, resourceId,
                counts.total(), counts.completed(), counts.failed(), counts.progress(),
                errorMessage, createdAt, now, startedAt, completedAt);
    }

    /**
     * Moves to {@code next}, stamping {@code startedAt} on RUNNING and {@code completedAt} on terminal
     * states. Going back to PENDING clears the error and both stamps.
     */
    public Job withStatus(JobStatus next, Optional<String> error, Instant now) {
        Optional<Instant> started = startedAt;
        Optional<Instant> completed = completedAt;
        Optional<String> message = error.isPresent() ? error : errorMessage;
        if (next == JobStatus.RUNNING) {
            started = Optional.of(now);
        } else if (next.isTerminal()) {
            completed = Optional.of(now);
        } else {
            started = Optional.empty();
            completed = Optional.empty();
            message = Optional.empty();
        }
        return new Job(id, type, next, priority, sourceLocale, targetLocales, resourceId,
                totalItems, completedItems, failedItems, progress, message, createdAt, now, started, completed);
    }
}
