package ai.storefront.translator.job;

/**
 * Item totals of one job.
 */
public record JobCounts(int total, int completed, int failed) {

    public static final JobCounts EMPTY = new JobCounts(0, 0, 0);

    public JobCounts {
        if (total < 0 || completed < 0 || failed < 0) {
            throw new IllegalArgumentException("counts must not be negative");
        }
        if (completed + failed > total) {
            throw new IllegalArgumentException("completed + failed must not exceed total");
        }
    }

    /**
     * Completed share in whole percent, rounded down; 0 for an empty job.
     */
    public int progress() {
        return total == 0 ? 0 : (int) ((long) completed * 100 / total);
    }

    public int pending() {
        return total - completed - failed;
    }
}
