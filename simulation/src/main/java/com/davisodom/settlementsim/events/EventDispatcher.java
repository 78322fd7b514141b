package com.davisodom.settlementsim.events;

import com.davisodom.settlementsim.obs.Metrics;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Fire-and-forget delivery of simulation events.
 *
 * Events are handed to a single background thread so a slow publisher never holds up the tick
 * loop or a command. Delivery failures are logged and counted, never retried or rethrown: the
 * state change they describe has already been committed.
 */
public class EventDispatcher {

    private final Logger logger;
    private final EventPublisher publisher;
    private final Metrics metrics;
    private final ExecutorService executor;

    public EventDispatcher(Logger logger, EventPublisher publisher, Metrics metrics) {
        this(logger, publisher, metrics, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "settlement-sim-events");
            t.setDaemon(true);
            return t;
        }));
    }

    public EventDispatcher(Logger logger, EventPublisher publisher, Metrics metrics, ExecutorService executor) {
        this.logger = logger;
        this.publisher = publisher;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * Queue events for delivery and return immediately.
     */
    public void dispatch(List<SimulationEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        List<SimulationEvent> batch = new ArrayList<>(events);
        try {
            executor.execute(() -> deliver(batch));
        } catch (RejectedExecutionException e) {
            metrics.increment("events.dropped", batch.size());
            logger.warning(String.format("Event dispatcher rejected %d event(s): %s", batch.size(), e.getMessage()));
        }
    }

    private void deliver(List<SimulationEvent> batch) {
        for (SimulationEvent event : batch) {
            try {
                publisher.publish(event);
                metrics.increment("events.published");
            } catch (RuntimeException e) {
                metrics.increment("events.publish_failed");
                logger.warning(String.format("Failed to publish %s for %s %s: %s",
                        event.type().getWireName(), event.scope(), event.scopeId(), e.getMessage()));
            }
        }
    }

    /**
     * Stop accepting events and wait briefly for queued deliveries.
     */
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warning("Event dispatcher did not drain within 5s; dropping remaining events");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
