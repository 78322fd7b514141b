package com.davisodom.settlementsim.catalog;

/**
 * Worker needs of one structure type.
 *
 * @param structureId definition id
 * @param required workers needed before any staffing bonus applies
 * @param optional extra workers that raise the bonus
 * @param bonusPerWorker production bonus per worker above {@code required}
 * @param priority higher is staffed first
 */
public record StaffingRequirement(String structureId, int required, int optional,
                                  double bonusPerWorker, int priority) {

    public int maxWorkers() {
        return required + optional;
    }
}
