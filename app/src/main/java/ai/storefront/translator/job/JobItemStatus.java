package ai.storefront.translator.job;

public enum JobItemStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
