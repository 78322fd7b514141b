package com.davisodom.settlementsim.catalog;

/**
 * A requirement that must hold before a structure can be queued: either an existing
 * structure at a minimum level, or a completed research id.
 */
public record Prerequisite(String structureId, int minLevel, String researchId) {

    public static Prerequisite structure(String structureId, int minLevel) {
        return new Prerequisite(structureId, Math.max(1, minLevel), null);
    }

    public static Prerequisite research(String researchId) {
        return new Prerequisite(null, 0, researchId);
    }

    public boolean isResearch() {
        return researchId != null;
    }

    public String describe() {
        return isResearch()
                ? "research:" + researchId
                : String.format("%s (level %d)", structureId, minLevel);
    }
}
