package com.davisodom.settlementsim.persistence;

import com.davisodom.settlementsim.disasters.DisasterEvent;
import com.davisodom.settlementsim.economy.ResourceAmounts;
import com.davisodom.settlementsim.economy.ResourceTransfer;
import com.davisodom.settlementsim.settlements.Settlement;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * Durable storage for settlement aggregates, disaster events and in-transit transfers.
 */
public interface SettlementRepository {

    /**
     * Save a settlement together with its ledger balances. Caller holds the settlement lock.
     */
    void saveSettlement(Settlement settlement, ResourceAmounts balances) throws IOException;

    List<StoredSettlement> loadSettlements() throws IOException;

    void saveDisasters(Collection<DisasterEvent> events) throws IOException;

    List<DisasterEvent> loadDisasters() throws IOException;

    void saveTransfers(Collection<ResourceTransfer> transfers) throws IOException;

    List<ResourceTransfer> loadTransfers() throws IOException;

    /**
     * A loaded settlement and the balances to restore into the ledger.
     */
    record StoredSettlement(Settlement settlement, ResourceAmounts balances) {
    }
}
