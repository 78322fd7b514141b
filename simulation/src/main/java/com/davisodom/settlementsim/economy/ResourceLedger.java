package com.davisodom.settlementsim.economy;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Authoritative store of settlement resource balances.
 *
 * Every balance change in the simulation goes through this service:
 * - credit adds resources, clamped to the account's storage capacity when one is set
 * - debit is all-or-nothing and reports the per-resource shortage on failure
 * - consume applies upkeep, flooring at zero and reporting what could not be paid
 *
 * All arithmetic is in milli-units (see {@link ResourceAmounts}). Accounts synchronize
 * individually, so work on different settlements never contends.
 */
public class ResourceLedger {

    private final Logger logger;
    private final Map<UUID, Account> accounts;

    public ResourceLedger(Logger logger) {
        this.logger = logger;
        this.accounts = new ConcurrentHashMap<>();
    }

    /**
     * Get or create the account for a settlement.
     */
    public Account getAccount(UUID settlementId) {
        Objects.requireNonNull(settlementId, "settlementId cannot be null");
        return accounts.computeIfAbsent(settlementId, Account::new);
    }

    /**
     * Credit resources to a settlement.
     *
     * @return the amounts actually credited after the capacity clamp
     */
    public ResourceAmounts credit(UUID settlementId, ResourceAmounts amounts, String reason) {
        Objects.requireNonNull(amounts, "amounts cannot be null");
        return getAccount(settlementId).credit(amounts, reason, true);
    }

    /**
     * Return previously debited resources in full, ignoring the storage ceiling.
     */
    public void refund(UUID settlementId, ResourceAmounts amounts, String reason) {
        Objects.requireNonNull(amounts, "amounts cannot be null");
        getAccount(settlementId).credit(amounts, reason, false);
    }

    /**
     * Debit resources, all-or-nothing.
     *
     * @return success, or the per-resource shortage with no balance changed
     */
    public LedgerResult debit(UUID settlementId, ResourceAmounts amounts, String reason) {
        Objects.requireNonNull(amounts, "amounts cannot be null");
        LedgerResult result = getAccount(settlementId).debit(amounts, reason);
        if (!result.isSuccess()) {
            logger.fine(String.format("Debit rejected for %s (%s): %s", settlementId, reason, result));
        }
        return result;
    }

    /**
     * Whether the settlement currently holds at least the given amounts.
     */
    public boolean sufficiency(UUID settlementId, ResourceAmounts amounts) {
        return getAccount(settlementId).covers(amounts);
    }

    /**
     * Subtract upkeep, flooring each balance at zero.
     *
     * @return the portion of the upkeep the settlement could not pay
     */
    public ResourceAmounts consume(UUID settlementId, ResourceAmounts amounts, String reason) {
        Objects.requireNonNull(amounts, "amounts cannot be null");
        return getAccount(settlementId).consume(amounts, reason);
    }

    public ResourceAmounts getBalances(UUID settlementId) {
        return getAccount(settlementId).getBalances();
    }

    /**
     * Set the per-resource storage ceiling; {@code null} removes it.
     */
    public void setCapacity(UUID settlementId, ResourceAmounts capacity) {
        getAccount(settlementId).setCapacity(capacity);
    }

    /**
     * Overwrite balances (persistence load and command rollback).
     */
    public void restore(UUID settlementId, ResourceAmounts balances) {
        getAccount(settlementId).restore(balances);
    }

    public Map<UUID, Account> getAllAccounts() {
        return new HashMap<>(accounts);
    }

    /**
     * One settlement's balances.
     */
    public static class Account {
        private static final int MAX_ENTRIES = 1000;

        private final UUID settlementId;
        private final EnumMap<ResourceType, Long> balances;
        private final List<LedgerEntry> entries;
        private ResourceAmounts capacity;

        public Account(UUID settlementId) {
            this.settlementId = settlementId;
            this.balances = new EnumMap<>(ResourceType.class);
            this.entries = new ArrayList<>();
        }

        public synchronized ResourceAmounts credit(ResourceAmounts amounts, String reason, boolean clamp) {
            ResourceAmounts.Builder credited = ResourceAmounts.builder();
            for (ResourceType type : ResourceType.values()) {
                long add = amounts.getMillis(type);
                if (add == 0) continue;
                long current = balance(type);
                long target = add > Long.MAX_VALUE - current ? Long.MAX_VALUE : current + add;
                if (clamp && capacity != null) {
                    target = Math.max(current, Math.min(target, capacity.getMillis(type)));
                }
                balances.put(type, target);
                credited.millis(type, target - current);
            }
            ResourceAmounts result = credited.build();
            if (!result.isEmpty()) {
                log(new LedgerEntry(System.currentTimeMillis(), result.asMillisMap(), true, reason));
            }
            return result;
        }

        public synchronized LedgerResult debit(ResourceAmounts amounts, String reason) {
            EnumMap<ResourceType, Long> shortages = new EnumMap<>(ResourceType.class);
            for (ResourceType type : ResourceType.values()) {
                long need = amounts.getMillis(type);
                long have = balance(type);
                if (need > have) {
                    shortages.put(type, need - have);
                }
            }
            if (!shortages.isEmpty()) {
                return LedgerResult.insufficient(shortages);
            }
            for (ResourceType type : ResourceType.values()) {
                long need = amounts.getMillis(type);
                if (need > 0) {
                    balances.put(type, balance(type) - need);
                }
            }
            if (!amounts.isEmpty()) {
                log(new LedgerEntry(System.currentTimeMillis(), amounts.asMillisMap(), false, reason));
            }
            return LedgerResult.ok();
        }

        public synchronized ResourceAmounts consume(ResourceAmounts amounts, String reason) {
            ResourceAmounts.Builder unmet = ResourceAmounts.builder();
            ResourceAmounts.Builder paid = ResourceAmounts.builder();
            for (ResourceType type : ResourceType.values()) {
                long need = amounts.getMillis(type);
                if (need == 0) continue;
                long have = balance(type);
                long taken = Math.min(have, need);
                balances.put(type, have - taken);
                paid.millis(type, taken);
                unmet.millis(type, need - taken);
            }
            ResourceAmounts paidAmounts = paid.build();
            if (!paidAmounts.isEmpty()) {
                log(new LedgerEntry(System.currentTimeMillis(), paidAmounts.asMillisMap(), false, reason));
            }
            return unmet.build();
        }

        public synchronized boolean covers(ResourceAmounts amounts) {
            for (ResourceType type : ResourceType.values()) {
                if (amounts.getMillis(type) > balance(type)) {
                    return false;
                }
            }
            return true;
        }

        public synchronized ResourceAmounts getBalances() {
            return ResourceAmounts.ofMillis(balances);
        }

        public synchronized ResourceAmounts getCapacity() {
            return capacity;
        }

        public synchronized void setCapacity(ResourceAmounts capacity) {
            this.capacity = capacity;
        }

        public synchronized void restore(ResourceAmounts snapshot) {
            balances.clear();
            balances.putAll(snapshot.asMillisMap());
        }

        public synchronized List<LedgerEntry> getEntries() {
            return new ArrayList<>(entries);
        }

        public UUID getSettlementId() {
            return settlementId;
        }

        private long balance(ResourceType type) {
            return balances.getOrDefault(type, 0L);
        }

        private void log(LedgerEntry entry) {
            entries.add(entry);
            // Keep the last 1000 entries
            if (entries.size() > MAX_ENTRIES) {
                entries.remove(0);
            }
        }
    }

    /**
     * Audit entry for a balance change.
     */
    public static class LedgerEntry {
        public final long timestamp;
        public final Map<ResourceType, Long> millis;
        public final boolean credit;
        public final String reason;

        public LedgerEntry(long timestamp, Map<ResourceType, Long> millis, boolean credit, String reason) {
            this.timestamp = timestamp;
            this.millis = millis;
            this.credit = credit;
            this.reason = reason;
        }
    }
}
