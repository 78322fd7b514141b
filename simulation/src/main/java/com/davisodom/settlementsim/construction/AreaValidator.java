package com.davisodom.settlementsim.construction;

import com.davisodom.settlementsim.catalog.StructureDefinition;
import com.davisodom.settlementsim.errors.SimulationException;
import com.davisodom.settlementsim.settlements.Settlement;

/**
 * Area, tier and uniqueness accounting for new buildings.
 */
public interface AreaValidator {

    /**
     * @throws SimulationException with a PRECONDITION code when the building does not fit
     */
    void check(Settlement settlement, StructureDefinition definition);
}
