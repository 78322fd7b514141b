package com.davisodom.settlementsim.errors;

/**
 * Error taxonomy for simulation commands.
 */
public enum ErrorKind {
    VALIDATION,    // Missing or malformed input, rejected before any mutation
    PRECONDITION,  // State does not allow the operation yet, safe to retry
    NOT_FOUND,     // Referenced settlement, structure or item is absent
    CONFLICT,      // Actor does not own the settlement
    INTERNAL       // Persistence or notification failure
}
