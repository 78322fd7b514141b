package com.davisodom.settlementsim.construction;

import java.util.UUID;

/**
 * A submit-construction command.
 *
 * @param existingStructureId set for upgrades; the definition must match the structure's
 * @param tileId extractor placement tile
 * @param slotPosition extractor placement slot
 * @param emergency build faster at a higher cost
 */
public record ConstructionRequest(UUID settlementId, String definitionId, UUID existingStructureId,
                                  UUID tileId, Integer slotPosition, boolean emergency) {

    public static ConstructionRequest building(UUID settlementId, String definitionId) {
        return new ConstructionRequest(settlementId, definitionId, null, null, null, false);
    }

    public static ConstructionRequest extractor(UUID settlementId, String definitionId, UUID tileId, int slot) {
        return new ConstructionRequest(settlementId, definitionId, null, tileId, slot, false);
    }

    public static ConstructionRequest upgrade(UUID settlementId, String definitionId, UUID structureId) {
        return new ConstructionRequest(settlementId, definitionId, structureId, null, null, false);
    }

    public ConstructionRequest asEmergency() {
        return new ConstructionRequest(settlementId, definitionId, existingStructureId, tileId, slotPosition, true);
    }

    public boolean isUpgrade() {
        return existingStructureId != null;
    }
}
