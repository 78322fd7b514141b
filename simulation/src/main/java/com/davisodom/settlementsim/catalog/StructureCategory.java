package com.davisodom.settlementsim.catalog;

public enum StructureCategory {
    EXTRACTOR,  // Occupies a tile slot and produces one resource
    BUILDING    // Occupies settlement area
}
