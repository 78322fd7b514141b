package com.davisodom.settlementsim.production;

import com.davisodom.settlementsim.economy.ResourceType;

import java.util.UUID;

/**
 * What the calculator needs to know about one extractor.
 */
public record ExtractorSnapshot(UUID structureId, ResourceType resource, int level, double health,
                                long createdAt, double staffingMultiplier) {
}
