package com.interaction.clustering.seed;

/**
 * Outcome of the seed stage.
 *
 * @param mode     the concrete mode that ran (never {@link SeedMode#AUTO})
 * @param entities entities written to snapshot 0
 * @param clusters distinct initial clusters
 */
public record SeedResult(SeedMode mode, long entities, long clusters) {

    public SeedResult {
        if (mode == SeedMode.AUTO) {
            throw new IllegalArgumentException("a seed result must name a concrete mode");
        }
    }
}
