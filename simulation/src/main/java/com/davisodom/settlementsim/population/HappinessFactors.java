package com.davisodom.settlementsim.population;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Individual happiness inputs (each 0-100) and their weighted blend.
 */
public record HappinessFactors(double resourceSufficiency,
                               double housingQuality,
                               double disasterPreparedness,
                               double recentTrauma,
                               double baselineMorale,
                               double externalRelations,
                               double happiness) {

    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put("resourceSufficiency", resourceSufficiency);
        map.put("housingQuality", housingQuality);
        map.put("disasterPreparedness", disasterPreparedness);
        map.put("recentTrauma", recentTrauma);
        map.put("baselineMorale", baselineMorale);
        map.put("externalRelations", externalRelations);
        map.put("happiness", happiness);
        return map;
    }
}
