package com.interaction.clustering.propagation;

/**
 * Outcome of one committed propagation iteration.
 *
 * @param iteration           iteration number, equal to the snapshot it committed
 * @param cardholdersChanged  cardholders whose primary cluster changed
 * @param merchantsChanged    merchants whose primary cluster changed
 * @param churn               changed entities divided by all entities
 * @param durationMillis      wall-clock time of the iteration
 */
public record IterationStats(int iteration, long cardholdersChanged, long merchantsChanged,
                             double churn, long durationMillis) {

    public long changed() {
        return cardholdersChanged + merchantsChanged;
    }
}
