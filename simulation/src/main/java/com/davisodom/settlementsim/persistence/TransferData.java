package com.davisodom.settlementsim.persistence;

/**
 * Serialized in-transit resource transfer.
 */
public class TransferData {
    public String id;
    public String fromSettlementId;
    public String toSettlementId;
    public String resource;
    public long sentUnits;
    public long receivedUnits;
    public double lossPercent;
    public int distance;
    public long startedAt;
    public long arrivesAt;
    public String status;

    public TransferData() {} // For Jackson
}
