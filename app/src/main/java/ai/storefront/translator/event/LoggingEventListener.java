package ai.storefront.translator.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every event to the log. Job outcomes at INFO, item chatter at DEBUG, failures at WARN.
 */
public class LoggingEventListener implements EventListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingEventListener.class);

    @Override
    public void onEvent(JobEvent event) {
        switch (event.type()) {
            case STARTED, STOPPED -> LOGGER.info("Scheduler {}", event.type().wireName());
            case PROGRESS -> LOGGER.info("Job {} progress {}% ({} completed, {} failed of {})",
                    event.jobId(),
                    event.intAttribute(JobEvent.PROGRESS),
                    event.intAttribute(JobEvent.COMPLETED),
                    event.intAttribute(JobEvent.FAILED),
                    event.intAttribute(JobEvent.TOTAL));
            case JOB_COMPLETED, JOB_CANCELLED, JOB_RETRY -> LOGGER.info("{} {}", event.type().wireName(), event.jobId());
            case JOB_FAILED -> LOGGER.warn("job:failed {}: {}", event.jobId(), event.error().orElse(""));
            case ITEM_COMPLETED, ITEM_CACHE_HIT -> LOGGER.debug("{} {}/{}", event.type().wireName(), event.jobId(), event.itemId());
            case ITEM_RETRY -> LOGGER.debug("item:retry {}/{} (retry {})", event.jobId(), event.itemId(),
                    event.intAttribute(JobEvent.RETRY_COUNT));
            case ITEM_FAILED -> LOGGER.warn("item:failed {}/{}: {}", event.jobId(), event.itemId(), event.error().orElse(""));
        }
    }
}
