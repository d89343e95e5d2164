package com.interaction.clustering.propagation;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Weighted votes of one entity's neighbours, keyed by the cluster each neighbour belongs to.
 * Scoped to a single entity within a single iteration; not thread-safe.
 */
public class VoteTally {

    private final Map<String, Long> votes = new HashMap<>();
    private long total;

    public void add(String clusterId, long weight) {
        votes.merge(clusterId, weight, Long::sum);
        total += weight;
    }

    public long total() {
        return total;
    }

    public boolean isEmpty() {
        return votes.isEmpty();
    }

    public int distinctClusters() {
        return votes.size();
    }

    public long weightOf(String clusterId) {
        return votes.getOrDefault(clusterId, 0L);
    }

    /**
     * Returns the cluster with the highest accumulated weight. Ties go to the lowest cluster id.
     */
    public Optional<Vote> winner() {
        String best = null;
        long bestWeight = -1;
        for (Map.Entry<String, Long> e : votes.entrySet()) {
            long w = e.getValue();
            if (w > bestWeight || (w == bestWeight && e.getKey().compareTo(best) < 0)) {
                best = e.getKey();
                bestWeight = w;
            }
        }
        return best == null ? Optional.empty() : Optional.of(new Vote(best, bestWeight));
    }

    /**
     * Returns the votes ordered by cluster id.
     */
    public Map<String, Long> votes() {
        return Collections.unmodifiableMap(new TreeMap<>(votes));
    }

    /**
     * Accumulated weight for one cluster.
     */
    public record Vote(String clusterId, long weight) {}
}
