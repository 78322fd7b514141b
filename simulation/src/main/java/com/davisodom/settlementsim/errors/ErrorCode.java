package com.davisodom.settlementsim.errors;

/**
 * Machine-readable rejection codes, each bound to its {@link ErrorKind}.
 */
public enum ErrorCode {
    INVALID_REQUEST(ErrorKind.VALIDATION),
    INVALID_AMOUNT(ErrorKind.VALIDATION),
    UNKNOWN_STRUCTURE_TYPE(ErrorKind.VALIDATION),
    TILE_REQUIRED(ErrorKind.VALIDATION),
    TILE_NOT_IN_SETTLEMENT(ErrorKind.VALIDATION),
    SLOT_OUT_OF_RANGE(ErrorKind.VALIDATION),

    PREREQUISITES_NOT_MET(ErrorKind.PRECONDITION),
    SLOT_OCCUPIED(ErrorKind.PRECONDITION),
    SLOT_RESERVED(ErrorKind.PRECONDITION),
    AREA_EXCEEDED(ErrorKind.PRECONDITION),
    TIER_TOO_LOW(ErrorKind.PRECONDITION),
    UNIQUE_STRUCTURE_EXISTS(ErrorKind.PRECONDITION),
    MAX_LEVEL_REACHED(ErrorKind.PRECONDITION),
    QUEUE_FULL(ErrorKind.PRECONDITION),
    INSUFFICIENT_RESOURCES(ErrorKind.PRECONDITION),
    ITEM_NOT_CANCELLABLE(ErrorKind.PRECONDITION),
    STRUCTURE_DESTROYED(ErrorKind.PRECONDITION),
    NOTHING_TO_REPAIR(ErrorKind.PRECONDITION),
    SAME_SETTLEMENT(ErrorKind.PRECONDITION),
    UPGRADE_PENDING(ErrorKind.PRECONDITION),
    DISASTER_ALREADY_RESOLVED(ErrorKind.PRECONDITION),

    SETTLEMENT_NOT_FOUND(ErrorKind.NOT_FOUND),
    STRUCTURE_NOT_FOUND(ErrorKind.NOT_FOUND),
    QUEUE_ITEM_NOT_FOUND(ErrorKind.NOT_FOUND),
    DISASTER_NOT_FOUND(ErrorKind.NOT_FOUND),

    NOT_OWNER(ErrorKind.CONFLICT),
    DISASTER_ALREADY_ACTIVE(ErrorKind.CONFLICT),

    PERSISTENCE_FAILED(ErrorKind.INTERNAL);

    private final ErrorKind kind;

    ErrorCode(ErrorKind kind) {
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
