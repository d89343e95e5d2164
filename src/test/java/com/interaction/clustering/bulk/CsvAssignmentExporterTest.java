package com.interaction.clustering.bulk;

import com.interaction.clustering.core.model.ClusterRole;
import com.interaction.clustering.report.AssignmentRow;
import com.interaction.clustering.report.AssignmentRows;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvAssignmentExporterTest {

    private final CsvAssignmentExporter exporter = new CsvAssignmentExporter();

    private final AssignmentRows rows = action -> List.of(
            new AssignmentRow("C:C1", "M:M1", ClusterRole.PRIMARY, 2),
            new AssignmentRow("M:M1", "M:M1", ClusterRole.PRIMARY, 1),
            new AssignmentRow("M:M1", "M:M3", ClusterRole.DUPLICATE, 1),
            new AssignmentRow("M:a,b", "M:M3", ClusterRole.PRIMARY, 5)
    ).forEach(action);

    @Test
    @DisplayName("Should write header and one line per row")
    void testExportToWriter() {
        StringWriter out = new StringWriter();
        List<Long> finalProgress = new ArrayList<>();

        ExportResult result = exporter.export(rows, out, (processed, total, message) -> {
            if (processed == total) {
                finalProgress.add(processed);
            }
        });

        String[] lines = out.toString().split("\\R");
        assertEquals(CsvAssignmentExporter.HEADER, lines[0]);
        assertEquals("C:C1,M:M1,primary,2", lines[1]);
        assertEquals("M:M1,M:M3,duplicate,1", lines[3]);
        assertEquals("\"M:a,b\",M:M3,primary,5", lines[4]);
        assertEquals(5, lines.length);

        assertEquals(4, result.totalRows());
        assertEquals(3, result.primaryRows());
        assertEquals(1, result.duplicateRows());
        assertEquals(List.of(4L), finalProgress);
    }

    @Test
    @DisplayName("Should write to a file and accept a null callback")
    void testExportToFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("assignments.csv");

        ExportResult result = exporter.export(rows, file, null);

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(5, lines.size());
        assertEquals(4, result.totalRows());
    }

    @Test
    @DisplayName("Should write only the header for an empty mapping")
    void testEmptyExport() {
        StringWriter out = new StringWriter();

        ExportResult result = exporter.export(action -> {}, out, ProgressCallback.NOOP);

        assertEquals(CsvAssignmentExporter.HEADER, out.toString().trim());
        assertEquals(0, result.totalRows());
    }
}
