package ai.storefront.translator.event;

/**
 * Kinds of engine events, with their wire names.
 */
public enum EventType {
    STARTED("started"),
    STOPPED("stopped"),
    PROGRESS("progress"),
    JOB_COMPLETED("job:completed"),
    JOB_FAILED("job:failed"),
    JOB_CANCELLED("job:cancelled"),
    JOB_RETRY("job:retry"),
    ITEM_COMPLETED("item:completed"),
    ITEM_CACHE_HIT("item:cache-hit"),
    ITEM_FAILED("item:failed"),
    ITEM_RETRY("item:retry");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static EventType fromWireName(String value) {
        for (EventType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + value);
    }
}
