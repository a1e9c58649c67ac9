package ai.storefront.translator.job;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Input of {@link JobService#createJob(CreateJobRequest)}. Duplicate target locales are dropped, keeping
 * the first occurrence.
 */
public record CreateJobRequest(JobType type,
                               String sourceLocale,
                               List<String> targetLocales,
                               int priority,
                               Optional<String> resourceId) {

    public CreateJobRequest {
        Objects.requireNonNull(type, "type");
        if (sourceLocale == null || sourceLocale.isBlank()) {
            throw new IllegalArgumentException("sourceLocale must not be blank");
        }
        sourceLocale = sourceLocale.trim();
        if (targetLocales == null || targetLocales.isEmpty()) {
            throw new IllegalArgumentException("targetLocales must not be empty");
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String locale : targetLocales) {
            if (locale == null || locale.isBlank()) {
                throw new IllegalArgumentException("targetLocales must not contain blank values");
            }
            unique.add(locale.trim());
        }
        if (unique.contains(sourceLocale)) {
            throw new IllegalArgumentException("targetLocales must not contain the source locale " + sourceLocale);
        }
        targetLocales = List.copyOf(new ArrayList<>(unique));
        resourceId = resourceId == null ? Optional.empty() : resourceId.filter(value -> !value.isBlank());
        if (type == JobType.SINGLE && resourceId.isEmpty()) {
            throw new IllegalArgumentException("resourceId is required for SINGLE jobs");
        }
        if (type != JobType.SINGLE && resourceId.isPresent()) {
            throw new IllegalArgumentException("resourceId is only allowed for SINGLE jobs");
        }
    }

    public static CreateJobRequest full(String sourceLocale, List<String> targetLocales) {
        return new CreateJobRequest(JobType.FULL, sourceLocale, targetLocales, 0, Optional.empty());
    }

    public static CreateJobRequest incremental(String sourceLocale, List<String> targetLocales) {
        return new CreateJobRequest(JobType.INCREMENTAL, sourceLocale, targetLocales, 0, Optional.empty());
    }

    public static CreateJobRequest single(String sourceLocale, List<String> targetLocales, String resourceId) {
        return new CreateJobRequest(JobType.SINGLE, sourceLocale, targetLocales, 0, Optional.ofNullable(resourceId));
    }

    public CreateJobRequest withPriority(int value) {
        return new CreateJobRequest(type, sourceLocale, targetLocales, value, resourceId);
    }
}
