package com.interaction.clustering.api;

import com.interaction.clustering.bulk.CsvAssignmentExporter;
import com.interaction.clustering.bulk.ExportResult;
import com.interaction.clustering.bulk.JsonReportWriter;
import com.interaction.clustering.bulk.ProgressCallback;
import com.interaction.clustering.core.model.ClusterAssignment;
import com.interaction.clustering.report.AssignmentRows;
import com.interaction.clustering.report.ClusteringReport;
import com.interaction.clustering.report.OutputCollector;
import com.interaction.clustering.store.AssignmentStore;
import com.interaction.clustering.store.SnapshotReader;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Result of a clustering run: the report plus access to the final overlapping assignment.
 *
 * <p>The assignment is read lazily from the {@link AssignmentStore#RESOLVED} snapshot, so the
 * rows and lookups are only available while the {@link InteractionClusterer} that produced this
 * result is open.</p>
 */
public class ClusteringResult {

    private final ClusteringReport report;
    private final AssignmentStore assignments;
    private final OutputCollector collector;

    ClusteringResult(ClusteringReport report, AssignmentStore assignments, OutputCollector collector) {
        this.report = report;
        this.assignments = assignments;
        this.collector = collector;
    }

    public ClusteringReport getReport() {
        return report;
    }

    public boolean isConverged() {
        return report.converged();
    }

    public double getChattiness() {
        return report.chattiness();
    }

    /**
     * Final mapping rows in ascending entity id order.
     */
    public AssignmentRows rows() {
        return action -> {
            try (SnapshotReader reader = assignments.openSnapshot(AssignmentStore.RESOLVED)) {
                collector.forEachRow(reader, action);
            }
        };
    }

    /**
     * Looks up the final assignment of a namespaced entity id such as {@code "C:1234"}.
     */
    public Optional<ClusterAssignment> assignmentOf(String entityId) {
        try (SnapshotReader reader = assignments.openSnapshot(AssignmentStore.RESOLVED)) {
            return reader.get(entityId);
        }
    }

    public ExportResult exportCsv(Path path, ProgressCallback callback) {
        return new CsvAssignmentExporter().export(rows(), path, callback);
    }

    public void writeReport(Path path) {
        new JsonReportWriter().write(report, path);
    }

    @Override
    public String toString() {
        return "ClusteringResult{runId=" + report.runId() +
                ", converged=" + report.converged() +
                ", iterations=" + report.iterations() +
                ", clusters=" + report.clusterCount() +
                ", chattiness=" + report.chattiness() + '}';
    }
}
