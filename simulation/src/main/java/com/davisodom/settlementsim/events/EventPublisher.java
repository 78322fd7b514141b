package com.davisodom.settlementsim.events;

/**
 * Outbound notification adapter. Delivery and fan-out are the implementation's concern.
 */
public interface EventPublisher {

    /**
     * Deliver one event. May block on I/O; may throw on delivery failure.
     */
    void publish(SimulationEvent event);
}
