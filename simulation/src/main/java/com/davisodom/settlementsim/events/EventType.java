package com.davisodom.settlementsim.events;

/**
 * Named events emitted by the simulation core.
 */
public enum EventType {
    CONSTRUCTION_STARTED("construction.started"),
    CONSTRUCTION_QUEUED("construction.queued"),
    CONSTRUCTION_CANCELLED("construction.cancelled"),
    STRUCTURE_BUILT("structure.built"),
    STRUCTURE_UPGRADED("structure.upgraded"),
    STRUCTURE_DEMOLISHED("structure.demolished"),
    STRUCTURE_REPAIRED("structure.repaired"),
    PASSIVE_REPAIR_APPLIED("structure.passive-repair"),
    CONSTRUCTION_FAILED("construction.failed"),
    RESOURCES_UPDATED("resources.updated"),
    POPULATION_CHANGED("population.changed"),
    STAFFING_UPDATED("staffing.updated"),
    DISASTER_WARNING("disaster.warning"),
    DISASTER_IMMINENT("disaster.imminent"),
    DISASTER_IMPACT_STARTED("disaster.impact-start"),
    STRUCTURE_DAMAGED("disaster.structure-damaged"),
    DISASTER_AFTERMATH("disaster.aftermath"),
    DISASTER_RESOLVED("disaster.resolved"),
    TRANSFER_STARTED("transfer.started"),
    TRANSFER_COMPLETED("transfer.completed");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
