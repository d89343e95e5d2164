package com.interaction.clustering.bulk;

import com.interaction.clustering.core.exception.ClusteringException;
import com.interaction.clustering.core.model.ClusterRole;
import com.interaction.clustering.report.AssignmentRow;
import com.interaction.clustering.report.AssignmentRows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CSV exporter of the final mapping, streamed row by row.
 *
 * <p>Output format:</p>
 * <pre>
 * entity_id,cluster_id,role,vote_weight
 * C:C1,M:M1,primary,2
 * M:M1,M:M1,primary,1
 * M:M1,M:M3,duplicate,1
 * </pre>
 */
public class CsvAssignmentExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvAssignmentExporter.class);
    private static final int PROGRESS_INTERVAL = 10_000;

    static final String HEADER = "entity_id,cluster_id,role,vote_weight";

    public ExportResult export(AssignmentRows rows, Path path, ProgressCallback callback) {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            return export(rows, writer, callback);
        } catch (IOException e) {
            throw new ClusteringException("Cannot write " + path, e);
        }
    }

    /**
     * Writes the header and every row. The writer is flushed but not closed.
     */
    public ExportResult export(AssignmentRows rows, Writer writer, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        BufferedWriter out = writer instanceof BufferedWriter b ? b : new BufferedWriter(writer);
        long[] counts = new long[2];
        try {
            out.write(HEADER);
            out.newLine();
            rows.forEach(row -> {
                writeRow(out, row);
                counts[row.role() == ClusterRole.PRIMARY ? 0 : 1]++;
                long written = counts[0] + counts[1];
                if (written % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(written, -1, "Exported " + written + " rows");
                }
            });
            out.flush();
        } catch (IOException | UncheckedIOException e) {
            log.error("export.failed error={}", e.getMessage());
            throw new ClusteringException("Failed to export assignments", e);
        }
        ExportResult result = new ExportResult(counts[0] + counts[1], counts[0], counts[1]);
        cb.onProgress(result.totalRows(), result.totalRows(), "Export completed");
        log.info("export.completed result={}", result);
        return result;
    }

    private static void writeRow(BufferedWriter out, AssignmentRow row) {
        try {
            out.write(csvEscape(row.entityId()));
            out.write(',');
            out.write(csvEscape(row.clusterId()));
            out.write(',');
            out.write(row.role().getLabel());
            out.write(',');
            out.write(Long.toString(row.voteWeight()));
            out.newLine();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
