package com.davisodom.settlementsim.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.logging.Logger;

/**
 * Publisher that writes each event as one JSON log line. Used when no transport is wired.
 */
public class LoggingEventPublisher implements EventPublisher {

    private final Logger logger;
    private final ObjectMapper mapper = new ObjectMapper();

    public LoggingEventPublisher(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void publish(SimulationEvent event) {
        ObjectNode node = mapper.createObjectNode();
        node.put("event", event.type().getWireName());
        node.put("scope", event.scope().name().toLowerCase());
        node.put("scopeId", event.scopeId());
        node.put("timestamp", event.timestamp());
        node.set("payload", mapper.valueToTree(event.payload()));
        try {
            logger.info("[EVENT] " + mapper.writeValueAsString(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize event " + event.type(), e);
        }
    }
}
