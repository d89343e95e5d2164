package com.interaction.clustering.duplication;

/**
 * Outcome of bridge detection and duplication.
 *
 * @param entitiesScanned    entities whose neighbour votes were recomputed
 * @param bridgeEntities     entities whose votes spread over two or more clusters
 * @param duplicatedEntities entities that received at least one duplicate membership
 * @param duplicatesAdded    duplicate memberships added in total
 */
public record DuplicationResult(long entitiesScanned, long bridgeEntities, long duplicatedEntities,
                                long duplicatesAdded) {

    public static DuplicationResult empty() {
        return new DuplicationResult(0, 0, 0, 0);
    }

    DuplicationResult plus(DuplicationResult other) {
        return new DuplicationResult(
                entitiesScanned + other.entitiesScanned,
                bridgeEntities + other.bridgeEntities,
                duplicatedEntities + other.duplicatedEntities,
                duplicatesAdded + other.duplicatesAdded);
    }
}
