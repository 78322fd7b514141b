package com.davisodom.settlementsim.events;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * An event to publish after a state transition.
 *
 * @param type event name
 * @param scope whether {@code scopeId} is a settlement id or a world name
 * @param scopeId settlement id or world name
 * @param timestamp simulation time in epoch millis
 * @param payload event detail, in insertion order
 */
public record SimulationEvent(EventType type, Scope scope, String scopeId, long timestamp,
                              Map<String, Object> payload) {

    public enum Scope {
        SETTLEMENT,
        WORLD
    }

    public SimulationEvent {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(scope, "scope cannot be null");
        Objects.requireNonNull(scopeId, "scopeId cannot be null");
        payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static SimulationEvent settlement(EventType type, UUID settlementId, long timestamp,
                                             Map<String, ?> payload) {
        return new SimulationEvent(type, Scope.SETTLEMENT, settlementId.toString(), timestamp,
                new LinkedHashMap<>(payload));
    }

    public static SimulationEvent world(EventType type, String worldName, long timestamp,
                                        Map<String, ?> payload) {
        return new SimulationEvent(type, Scope.WORLD, worldName, timestamp, new LinkedHashMap<>(payload));
    }
}
