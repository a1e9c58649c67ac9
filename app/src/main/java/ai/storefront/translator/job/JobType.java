package ai.storefront.translator.job;

import java.util.Locale;

/**
 * How a job selects the resources it translates.
 */
public enum JobType {
    /** Every resource in the source locale. */
    FULL,
    /** Resources whose current content is not yet cached for at least one target locale. */
    INCREMENTAL,
    /** Exactly one resource. */
    SINGLE;

    public static JobType from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Job type must be provided");
        }
        return JobType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
