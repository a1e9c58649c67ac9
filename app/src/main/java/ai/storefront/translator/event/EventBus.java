package ai.storefront.translator.event;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers events to listeners on a single dispatcher thread, in publication order.
 *
 * <p>The queue is bounded: {@link #publish(JobEvent)} blocks while it is full, which slows producers down
 * instead of dropping events. A failing listener is logged and does not affect the others.
 */
public class EventBus implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventBus.class);
    public static final int DEFAULT_CAPACITY = 1024;
    private static final long POLL_MILLIS = 100;

    private final BlockingQueue<JobEvent> queue;
    private final List<EventListener> listeners = new CopyOnWriteArrayList<>();
    private final Object idleMonitor = new Object();
    private final Thread dispatcher;
    private volatile boolean closed;
    private long inFlight;

    public EventBus() {
        this(DEFAULT_CAPACITY);
    }

    public EventBus(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.dispatcher = new Thread(this::dispatchLoop, "event-bus");
        this.dispatcher.setDaemon(true);
        this.dispatcher.start();
    }

    public void subscribe(EventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void unsubscribe(EventListener listener) {
        listeners.remove(listener);
    }

    public void publish(JobEvent event) {
        Objects.requireNonNull(event, "event");
        if (closed) {
            LOGGER.debug("Event bus closed; dropping {}", event.type().wireName());
            return;
        }
        synchronized (idleMonitor) {
            inFlight++;
        }
        try {
            queue.put(event);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            markDelivered();
            LOGGER.warn("Interrupted while publishing {}", event.type().wireName());
        }
    }

    /**
     * Waits until every event published so far has been delivered.
     *
     * @return false when the timeout elapsed first
     */
    public boolean flush(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (inFlight > 0) {
                long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remaining <= 0) {
                    return false;
                }
                try {
                    idleMonitor.wait(remaining);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return true;
        }
    }

    /**
     * Delivers the queued events, then stops the dispatcher. Later publications are dropped.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            dispatcher.join(TimeUnit.SECONDS.toMillis(10));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        if (dispatcher.isAlive()) {
            LOGGER.warn("Event dispatcher did not finish within 10 seconds; {} events pending", queue.size());
        }
    }

    private void dispatchLoop() {
        while (true) {
            JobEvent event;
            try {
                event = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            }
            if (event == null) {
                if (closed) {
                    return;
                }
                continue;
            }
            deliver(event);
            markDelivered();
        }
    }

    private void deliver(JobEvent event) {
        for (EventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException ex) {
                LOGGER.error("Event listener failed on {}", event.type().wireName(), ex);
            }
        }
    }

    private void markDelivered() {
        synchronized (idleMonitor) {
            inFlight--;
            if (inFlight == 0) {
                idleMonitor.notifyAll();
            }
        }
    }
}
