package com.davisodom.settlementsim.persistence;

import com.davisodom.settlementsim.disasters.DisasterEvent;
import com.davisodom.settlementsim.economy.ResourceAmounts;
import com.davisodom.settlementsim.economy.ResourceTransfer;
import com.davisodom.settlementsim.settlements.Settlement;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * {@link SettlementRepository} over a {@link JsonStore}.
 *
 * Layout under the data folder:
 * - settlements/&lt;id&gt;.json, one file per settlement
 * - disasters.json
 * - transfers.json
 */
public class JsonSettlementRepository implements SettlementRepository {

    static final String SETTLEMENTS_FOLDER = "settlements";
    static final String DISASTERS_FILE = "disasters.json";
    static final String TRANSFERS_FILE = "transfers.json";

    private final JsonStore store;
    private final Logger logger;

    public JsonSettlementRepository(JsonStore store, Logger logger) {
        this.store = store;
        this.logger = logger;
    }

    @Override
    public void saveSettlement(Settlement settlement, ResourceAmounts balances) throws IOException {
        store.saveJson(SETTLEMENTS_FOLDER + "/" + settlement.getId() + ".json",
                PersistenceMapper.toData(settlement, balances));
    }

    @Override
    public List<StoredSettlement> loadSettlements() throws IOException {
        List<StoredSettlement> loaded = new ArrayList<>();
        for (String file : store.list(SETTLEMENTS_FOLDER, ".json")) {
            SettlementData data = store.loadJson(file, SettlementData.class);
            if (data == null) continue;
            try {
                loaded.add(new StoredSettlement(PersistenceMapper.fromData(data), PersistenceMapper.balancesOf(data)));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new IOException("Corrupt settlement file " + file + ": " + e.getMessage(), e);
            }
        }
        logger.info(String.format("Loaded %d settlement(s)", loaded.size()));
        return loaded;
    }

    @Override
    public void saveDisasters(Collection<DisasterEvent> events) throws IOException {
        store.saveJson(DISASTERS_FILE, events.stream().map(PersistenceMapper::toData).collect(Collectors.toList()));
    }

    @Override
    public List<DisasterEvent> loadDisasters() throws IOException {
        return store.loadJsonList(DISASTERS_FILE, DisasterData.class).stream()
                .map(PersistenceMapper::fromData)
                .collect(Collectors.toList());
    }

    @Override
    public void saveTransfers(Collection<ResourceTransfer> transfers) throws IOException {
        store.saveJson(TRANSFERS_FILE, transfers.stream().map(PersistenceMapper::toData).collect(Collectors.toList()));
    }

    @Override
    public List<ResourceTransfer> loadTransfers() throws IOException {
        return store.loadJsonList(TRANSFERS_FILE, TransferData.class).stream()
                .map(PersistenceMapper::fromData)
                .collect(Collectors.toList());
    }
}
