package com.interaction.clustering.bulk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.interaction.clustering.core.exception.ClusteringException;
import com.interaction.clustering.report.ClusteringReport;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link ClusteringReport} as pretty-printed JSON with snake_case field names.
 */
public class JsonReportWriter {

    private final ObjectMapper objectMapper;

    public JsonReportWriter() {
        this(new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(SerializationFeature.INDENT_OUTPUT));
    }

    public JsonReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(ClusteringReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new ClusteringException("Failed to serialize report", e);
        }
    }

    public void write(ClusteringReport report, Writer writer) {
        try {
            objectMapper.writeValue(writer, report);
        } catch (IOException e) {
            throw new ClusteringException("Failed to write report", e);
        }
    }

    public void write(ClusteringReport report, Path path) {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(report, writer);
        } catch (IOException e) {
            throw new ClusteringException("Failed to write report to " + path, e);
        }
    }
}
