package com.davisodom.settlementsim.disasters;

/**
 * Disaster lifecycle phases, in order. Transitions never skip a phase.
 */
public enum DisasterStatus {
    SCHEDULED,
    WARNING,
    IMPACT,
    AFTERMATH,
    RESOLVED;

    public boolean isTerminal() {
        return this == RESOLVED;
    }

    /**
     * @throws IllegalStateException from RESOLVED
     */
    public DisasterStatus next() {
        if (isTerminal()) {
            throw new IllegalStateException("RESOLVED has no next phase");
        }
        return values()[ordinal() + 1];
    }
}
