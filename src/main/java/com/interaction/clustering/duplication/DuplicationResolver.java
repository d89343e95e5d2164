package com.interaction.clustering.duplication;

import com.interaction.clustering.api.ClusteringOptions;
import com.interaction.clustering.cache.CachingSnapshotReader;
import com.interaction.clustering.core.model.AdjacencyEntry;
import com.interaction.clustering.core.model.ClusterAssignment;
import com.interaction.clustering.core.model.ClusterMembership;
import com.interaction.clustering.core.model.EntityNamespace;
import com.interaction.clustering.metrics.MetricsService;
import com.interaction.clustering.propagation.LabelPropagationEngine;
import com.interaction.clustering.propagation.PageDispatcher;
import com.interaction.clustering.propagation.VoteTally;
import com.interaction.clustering.store.AdjacencyStore;
import com.interaction.clustering.store.AssignmentStore;
import com.interaction.clustering.store.SnapshotReader;
import com.interaction.clustering.store.SnapshotWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Detects bridge entities on the final propagation snapshot and duplicates them into the
 * clusters that hold a large enough share of their interaction weight.
 *
 * <p>For an entity with primary cluster P and neighbour vote total T, every other cluster Q
 * with {@code V_Q / T >= duplication_threshold} becomes a duplicate membership weighted V_Q.
 * This runs once; the duplicates do not feed back into propagation. The result is committed
 * as the {@link AssignmentStore#RESOLVED} snapshot.</p>
 */
public class DuplicationResolver {
    private static final Logger log = LoggerFactory.getLogger(DuplicationResolver.class);

    private final ClusteringOptions options;
    private final PageDispatcher dispatcher;
    private final MetricsService metricsService;

    public DuplicationResolver(ClusteringOptions options, PageDispatcher dispatcher, MetricsService metricsService) {
        this.options = options;
        this.dispatcher = dispatcher;
        this.metricsService = metricsService;
    }

    public DuplicationResult resolve(AdjacencyStore adjacency, AssignmentStore assignments, int finalSnapshot) {
        long start = System.nanoTime();
        if (assignments.isCommitted(AssignmentStore.RESOLVED)) {
            assignments.discard(AssignmentStore.RESOLVED);
        }
        DuplicationResult total = DuplicationResult.empty();
        try (SnapshotReader labels = CachingSnapshotReader.wrap(
                     assignments.openSnapshot(finalSnapshot), options.getLabelCacheSize(), metricsService);
             SnapshotWriter writer = assignments.beginSnapshot(AssignmentStore.RESOLVED)) {
            for (EntityNamespace ns : EntityNamespace.values()) {
                List<DuplicationResult> pages = dispatcher.dispatch(adjacency, ns, options.getBatchSize(),
                        entries -> resolvePage(entries, labels, writer));
                for (DuplicationResult page : pages) {
                    total = total.plus(page);
                }
                writer.seal(ns);
            }
            writer.commit();
        }
        metricsService.incrementDuplicatesAdded(total.duplicatesAdded());
        metricsService.recordStageDuration("resolve", Duration.ofNanos(System.nanoTime() - start));
        log.info("duplication.completed snapshot={} scanned={} bridges={} duplicated={} duplicates={}",
                finalSnapshot, total.entitiesScanned(), total.bridgeEntities(),
                total.duplicatedEntities(), total.duplicatesAdded());
        return total;
    }

    private DuplicationResult resolvePage(List<AdjacencyEntry> entries, SnapshotReader labels, SnapshotWriter writer) {
        List<ClusterAssignment> resolved = new ArrayList<>(entries.size());
        long bridges = 0;
        long duplicated = 0;
        long added = 0;
        for (AdjacencyEntry entry : entries) {
            ClusterAssignment current = labels.get(entry.entityId())
                    .orElseThrow(() -> new IllegalStateException(
                            "Entity " + entry.entityId() + " has no assignment in the final snapshot"));
            VoteTally tally = LabelPropagationEngine.tally(entry, labels);
            if (tally.distinctClusters() >= 2) {
                bridges++;
            }
            List<ClusterMembership> duplicates = duplicatesFor(current.primaryClusterId(), tally,
                    options.getDuplicationThreshold());
            if (!duplicates.isEmpty()) {
                duplicated++;
                added += duplicates.size();
                log.debug("duplication.entity entityId={} primary={} duplicates={}",
                        entry.entityId(), current.primaryClusterId(), duplicates);
            }
            resolved.add(current.withDuplicates(duplicates));
        }
        writer.write(resolved);
        return new DuplicationResult(entries.size(), bridges, duplicated, added);
    }

    /**
     * Clusters other than the primary whose share of the vote total reaches the threshold.
     */
    static List<ClusterMembership> duplicatesFor(String primaryClusterId, VoteTally tally, double threshold) {
        List<ClusterMembership> duplicates = new ArrayList<>();
        long total = tally.total();
        if (total == 0) {
            return duplicates;
        }
        for (Map.Entry<String, Long> vote : tally.votes().entrySet()) {
            if (vote.getKey().equals(primaryClusterId)) {
                continue;
            }
            if ((double) vote.getValue() / total >= threshold) {
                duplicates.add(ClusterMembership.duplicate(vote.getKey(), vote.getValue()));
            }
        }
        return duplicates;
    }
}
